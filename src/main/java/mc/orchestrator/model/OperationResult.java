package mc.orchestrator.model;

/**
 * Outcome of a lifecycle call. {@code method} names how the transition was achieved,
 * e.g. {@code noop}, {@code rcon}, {@code docker-stop} or {@code signal}.
 */
public record OperationResult(String id, InstanceStatus status, String method) {

    public static OperationResult of(String id, InstanceStatus status) {
        return new OperationResult(id, status, null);
    }
}
