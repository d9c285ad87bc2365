package mc.orchestrator.exception;

import lombok.Getter;

@Getter
public class InstanceNotFoundException extends ServerRuntimeException {
    private final String instanceId;

    public InstanceNotFoundException(String instanceId) {
        super("Server instance not found: " + instanceId);
        this.instanceId = instanceId;
    }

    public InstanceNotFoundException(String instanceId, Throwable cause) {
        super("Server instance not found: " + instanceId, cause);
        this.instanceId = instanceId;
    }
}
