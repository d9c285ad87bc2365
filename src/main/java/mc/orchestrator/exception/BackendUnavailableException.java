package mc.orchestrator.exception;

public class BackendUnavailableException extends ServerRuntimeException {

    public BackendUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
