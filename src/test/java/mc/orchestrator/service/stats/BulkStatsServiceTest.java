package mc.orchestrator.service.stats;

import mc.orchestrator.config.RuntimeProperties;
import mc.orchestrator.exception.BackendUnavailableException;
import mc.orchestrator.exception.InstanceNotFoundException;
import mc.orchestrator.model.BackendKind;
import mc.orchestrator.model.InstanceStatus;
import mc.orchestrator.model.ResourceStats;
import mc.orchestrator.model.ServerInstance;
import mc.orchestrator.runtime.RuntimeBackend;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class BulkStatsServiceTest {

    private final RuntimeBackend backend = mock(RuntimeBackend.class);
    private final RuntimeProperties properties = new RuntimeProperties();
    private final Clock clock = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);

    private static ServerInstance running(String id) {
        return ServerInstance.builder().id(id).name(id).backendKind(BackendKind.PROCESS)
                .status(InstanceStatus.RUNNING).build();
    }

    @Test
    void bulkStatsAreCachedPerInstance() {
        AtomicInteger samples = new AtomicInteger();
        BulkStatsService service = new BulkStatsService(backend, instance -> ResourceStats.builder()
                .id(instance.getId()).cpuPercent(samples.incrementAndGet()).build(), properties, clock);
        when(backend.list()).thenReturn(List.of(running("a"), running("b")));

        Map<String, ResourceStats> first = service.bulkStats();
        Map<String, ResourceStats> second = service.bulkStats();

        assertThat(first).containsOnlyKeys("a", "b");
        assertThat(second).isEqualTo(first);
        assertThat(samples).hasValue(2);
    }

    @Test
    void statsOfInstancesGoneFromListAreDropped() {
        AtomicInteger samples = new AtomicInteger();
        BulkStatsService service = new BulkStatsService(backend, instance -> ResourceStats.builder()
                .id(instance.getId()).cpuPercent(samples.incrementAndGet()).build(), properties, clock);
        when(backend.list()).thenReturn(List.of(running("a"), running("b")), List.of(running("b")),
                List.of(running("a"), running("b")));

        service.bulkStats();
        assertThat(service.bulkStats()).containsOnlyKeys("b");
        Map<String, ResourceStats> third = service.bulkStats();

        assertThat(samples).hasValue(3);
        assertThat(third.get("a").getCpuPercent()).isEqualTo(3.0);
    }

    @Test
    void samplerFailureBecomesUnavailableEntry() {
        BulkStatsService service = new BulkStatsService(backend, instance -> {
            throw new IllegalStateException("no such process");
        }, properties, clock);
        when(backend.list()).thenReturn(List.of(running("a")));

        assertThat(service.bulkStats().get("a").getError()).isEqualTo("no such process");
    }

    @Test
    void unavailableBackendPropagates() {
        BulkStatsService service = new BulkStatsService(backend, instance -> {
            throw new BackendUnavailableException("Docker daemon is unavailable", null);
        }, properties, clock);
        when(backend.get("a")).thenReturn(running("a"));

        assertThatThrownBy(() -> service.stats("a")).isInstanceOf(BackendUnavailableException.class);
    }

    @Test
    void statsOfUnknownInstanceIsNotFound() {
        BulkStatsService service = new BulkStatsService(backend, instance -> ResourceStats.builder().build(),
                properties, clock);
        when(backend.get("ghost")).thenReturn(ServerInstance.notFound("ghost", BackendKind.PROCESS));

        assertThatThrownBy(() -> service.cachedStats("ghost")).isInstanceOf(InstanceNotFoundException.class);
    }
}
