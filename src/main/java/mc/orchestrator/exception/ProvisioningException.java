package mc.orchestrator.exception;

/**
 * The provisioning artifact is missing or corrupt and the repair attempt did not fix it.
 */
public class ProvisioningException extends ServerRuntimeException {

    public ProvisioningException(String message) {
        super(message);
    }

    public ProvisioningException(String message, Throwable cause) {
        super(message, cause);
    }
}
