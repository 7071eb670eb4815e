package metalcc.coordinator.error;

/**
 * The node agent refused a workload for a reason the tenant can fix
 * (malformed compose file, domain already in use, resource limit).
 */
public class WorkloadRejectedException extends ControlPlaneException {

    private final String agentErrorKind;

    public WorkloadRejectedException(String agentErrorKind, String message, Throwable cause) {
        super(message, cause);
        this.agentErrorKind = agentErrorKind;
    }

    public String agentErrorKind() {
        return agentErrorKind;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.WORKLOAD_REJECTED;
    }
}
