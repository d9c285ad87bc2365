package mc.orchestrator.model;

public record DeleteResult(String id, boolean deleted, boolean dirRemoved) {
}
