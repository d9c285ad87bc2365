package mc.orchestrator.service.stats;

public final class CpuMath {

    private CpuMath() {
    }

    /**
     * Container CPU usage from two cumulative samples. Zero when either delta is not positive.
     */
    public static double containerPercent(long cpuDelta, long systemDelta, int onlineCpus) {
        if (cpuDelta <= 0 || systemDelta <= 0 || onlineCpus <= 0) {
            return 0.0;
        }
        return finiteOrZero(((double) cpuDelta / (double) systemDelta) * onlineCpus * 100.0);
    }

    /**
     * CPU time consumed over a wall-clock window, as a percentage of one core.
     */
    public static double processPercent(long cpuNanosDelta, long wallNanos) {
        if (cpuNanosDelta <= 0 || wallNanos <= 0) {
            return 0.0;
        }
        return finiteOrZero((double) cpuNanosDelta / (double) wallNanos * 100.0);
    }

    private static double finiteOrZero(double value) {
        return Double.isFinite(value) && value > 0 ? value : 0.0;
    }
}
