package mc.orchestrator.model;

public record CommandResult(int exitCode, String output, String method) {

    public static CommandResult ok(String output, String method) {
        return new CommandResult(0, output == null ? "" : output, method);
    }
}
