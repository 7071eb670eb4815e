package metalcc.coordinator.error;

public class NodeBusyException extends ControlPlaneException {

    public NodeBusyException(String nodeId, int workloads) {
        super("node " + nodeId + " still owns " + workloads + " workload(s)");
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.NODE_BUSY;
    }
}
