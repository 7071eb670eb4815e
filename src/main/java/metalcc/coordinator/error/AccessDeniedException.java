package metalcc.coordinator.error;

/**
 * Caller is authenticated but does not own the resource.
 */
public class AccessDeniedException extends ControlPlaneException {

    public AccessDeniedException(String message) {
        super(message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.ACCESS_DENIED;
    }
}
