package mc.orchestrator.runtime.docker;

/**
 * Raw counters from a single non-streaming stats call: the current and the preceding CPU sample.
 */
public record ContainerStatsSnapshot(long cpuTotal,
                                     long preCpuTotal,
                                     long systemCpu,
                                     long preSystemCpu,
                                     int onlineCpus,
                                     long memoryUsage,
                                     Long memoryCache,
                                     long memoryLimit,
                                     long rxBytes,
                                     long txBytes) {
}
