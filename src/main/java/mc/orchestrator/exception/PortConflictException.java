package mc.orchestrator.exception;

import lombok.Getter;

@Getter
public class PortConflictException extends ServerRuntimeException {
    private final Integer port;

    public PortConflictException(String message, Integer port) {
        super(message);
        this.port = port;
    }

    public PortConflictException(String message, Integer port, Throwable cause) {
        super(message, cause);
        this.port = port;
    }
}
