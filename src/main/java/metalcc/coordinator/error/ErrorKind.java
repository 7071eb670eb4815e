package metalcc.coordinator.error;

/**
 * Machine-readable error codes returned to API callers.
 */
public enum ErrorKind {
    NOT_FOUND(404),
    CONFLICT(409),
    NO_CAPACITY_AVAILABLE(503),
    INSUFFICIENT_CREDITS(412),
    INVALID_TIER(400),
    NODE_BUSY(409),
    ACCESS_DENIED(401),
    WORKLOAD_REJECTED(400),
    UPSTREAM_AGENT_ERROR(502),
    VALIDATION_ERROR(400);

    private final int httpStatus;

    ErrorKind(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
