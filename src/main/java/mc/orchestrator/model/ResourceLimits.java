package mc.orchestrator.model;

public record ResourceLimits(int minRamMb, int maxRamMb) {

    public long maxRamBytes() {
        return (long) maxRamMb * 1024L * 1024L;
    }
}
