package mc.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum InstanceStatus {
    CREATED,
    RUNNING,
    STOPPING,
    STOPPED,
    ERROR,
    NOT_FOUND; // handle no longer resolves

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isRunning() {
        return this == RUNNING;
    }

    public static InstanceStatus fromDockerState(String state) {
        if (state == null) {
            return ERROR;
        }
        return switch (state.toLowerCase(Locale.ROOT)) {
            case "created" -> CREATED;
            case "running", "restarting" -> RUNNING;
            case "removing" -> STOPPING;
            case "exited", "paused" -> STOPPED;
            default -> ERROR;
        };
    }
}
