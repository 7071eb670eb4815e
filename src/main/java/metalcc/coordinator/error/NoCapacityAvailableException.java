package metalcc.coordinator.error;

import metalcc.coordinator.model.ResourceShape;

public class NoCapacityAvailableException extends ControlPlaneException {

    public NoCapacityAvailableException(ResourceShape request) {
        super("no nodes are available to host a workload of shape " + request);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.NO_CAPACITY_AVAILABLE;
    }
}
