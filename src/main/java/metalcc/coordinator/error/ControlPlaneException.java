package metalcc.coordinator.error;

/**
 * Base class for failures reported back to the caller of a control plane operation.
 * None of these are fatal to the process.
 */
public abstract class ControlPlaneException extends RuntimeException {

    protected ControlPlaneException(String message) {
        super(message);
    }

    protected ControlPlaneException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind kind();
}
