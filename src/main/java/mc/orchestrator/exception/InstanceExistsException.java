package mc.orchestrator.exception;

import lombok.Getter;

@Getter
public class InstanceExistsException extends ServerRuntimeException {
    private final String name;

    public InstanceExistsException(String name, String reason) {
        super("Server " + name + " already exists: " + reason);
        this.name = name;
    }
}
