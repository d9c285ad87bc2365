package mc.orchestrator.service.stats;

import mc.orchestrator.model.ResourceStats;
import mc.orchestrator.model.ServerInstance;

@FunctionalInterface
public interface ResourceStatsSampler {

    /**
     * Samples one instance. Instances that are not running yield zeroed stats with an explanatory error.
     */
    ResourceStats sample(ServerInstance instance);
}
