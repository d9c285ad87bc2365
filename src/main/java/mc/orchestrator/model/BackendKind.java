package mc.orchestrator.model;

public enum BackendKind {
    CONTAINER,
    PROCESS
}
