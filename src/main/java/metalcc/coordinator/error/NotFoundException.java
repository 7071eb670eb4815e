package metalcc.coordinator.error;

public class NotFoundException extends ControlPlaneException {

    public NotFoundException(String entity, String id) {
        super(entity + " not found: " + id);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.NOT_FOUND;
    }
}
