package metalcc.coordinator.error;

import metalcc.coordinator.model.ResourceShape;

public class InvalidTierException extends ControlPlaneException {

    public InvalidTierException(ResourceShape shape) {
        super("no tier matches shape " + shape);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.INVALID_TIER;
    }
}
