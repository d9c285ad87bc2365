package mc.orchestrator.runtime.docker;

public record ExecResult(long exitCode, String output) {

    public boolean succeeded() {
        return exitCode == 0;
    }
}
