package mc.orchestrator.runtime.docker;

import lombok.RequiredArgsConstructor;
import mc.orchestrator.model.InstanceStatus;
import mc.orchestrator.model.ResourceStats;
import mc.orchestrator.model.ServerInstance;
import mc.orchestrator.service.stats.CpuMath;
import mc.orchestrator.service.stats.ResourceStatsSampler;

import static mc.orchestrator.model.ResourceStats.round2;

@RequiredArgsConstructor
public class ContainerStatsSampler implements ResourceStatsSampler {
    private static final double MB = 1024.0 * 1024.0;

    private final DockerRuntimeClient client;

    @Override
    public ResourceStats sample(ServerInstance instance) {
        if (instance.getStatus() != InstanceStatus.RUNNING) {
            return ResourceStats.unavailable(instance.getId(), "Container is not running");
        }
        return fromSnapshot(instance.getId(), client.stats(instance.getId()));
    }

    static ResourceStats fromSnapshot(String id, ContainerStatsSnapshot s) {
        double cpu = CpuMath.containerPercent(s.cpuTotal() - s.preCpuTotal(), s.systemCpu() - s.preSystemCpu(),
                s.onlineCpus());
        long usage = s.memoryUsage();
        if (s.memoryCache() != null) {
            usage = Math.max(0L, usage - s.memoryCache());
        }
        double memoryPercent = s.memoryLimit() > 0 ? (double) usage / s.memoryLimit() * 100.0 : 0.0;
        return ResourceStats.builder()
                .id(id)
                .cpuPercent(round2(cpu))
                .memoryUsageMb(round2(usage / MB))
                .memoryLimitMb(round2(s.memoryLimit() / MB))
                .memoryPercent(round2(memoryPercent))
                .networkRxMb(round2(s.rxBytes() / MB))
                .networkTxMb(round2(s.txBytes() / MB))
                .build();
    }
}
