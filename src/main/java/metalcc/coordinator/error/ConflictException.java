package metalcc.coordinator.error;

/**
 * Duplicate name, token or shape on create.
 */
public class ConflictException extends ControlPlaneException {

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.CONFLICT;
    }
}
