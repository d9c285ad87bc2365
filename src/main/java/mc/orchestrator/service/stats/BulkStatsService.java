package mc.orchestrator.service.stats;

import lombok.extern.slf4j.Slf4j;
import mc.orchestrator.config.RuntimeProperties;
import mc.orchestrator.exception.BackendUnavailableException;
import mc.orchestrator.exception.InstanceNotFoundException;
import mc.orchestrator.model.InstanceStatus;
import mc.orchestrator.model.ResourceStats;
import mc.orchestrator.model.ServerInstance;
import mc.orchestrator.runtime.RuntimeBackend;
import mc.orchestrator.service.TtlCache;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resource stats for one or all instances. Cached reads serve repeated dashboard polling from memory
 * until the entry's TTL passes.
 */
@Slf4j
@Service
public class BulkStatsService {
    private final RuntimeBackend backend;
    private final ResourceStatsSampler sampler;
    private final TtlCache<String, ResourceStats> cache;

    public BulkStatsService(RuntimeBackend backend, ResourceStatsSampler sampler, RuntimeProperties properties,
                            Clock clock) {
        this.backend = backend;
        this.sampler = sampler;
        this.cache = new TtlCache<>(properties.getCache().getStatsTtl(), clock);
    }

    public ResourceStats stats(String id) {
        ServerInstance instance = backend.get(id);
        if (instance.getStatus() == InstanceStatus.NOT_FOUND) {
            throw new InstanceNotFoundException(id);
        }
        return sampleSafely(instance);
    }

    public ResourceStats cachedStats(String id) {
        return cache.get(id, () -> stats(id));
    }

    public Map<String, ResourceStats> bulkStats() {
        List<ServerInstance> instances = backend.list();
        cache.retainKeys(instances.stream().map(ServerInstance::getId).toList());
        Map<String, ResourceStats> result = new LinkedHashMap<>();
        for (ServerInstance instance : instances) {
            result.put(instance.getId(), cache.get(instance.getId(), () -> sampleSafely(instance)));
        }
        return result;
    }

    private ResourceStats sampleSafely(ServerInstance instance) {
        try {
            return sampler.sample(instance);
        } catch (BackendUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Could not sample stats for {}: {}", instance.getName(), e.getMessage());
            return ResourceStats.unavailable(instance.getId(), e.getMessage());
        }
    }
}
