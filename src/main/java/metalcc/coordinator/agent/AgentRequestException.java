package metalcc.coordinator.agent;

/**
 * A failed call to a node agent, carrying the agent's machine-readable error kind.
 */
public class AgentRequestException extends RuntimeException {

    /** Kind used when the agent could not be reached or returned no error body */
    public static final String UNAVAILABLE = "Unavailable";

    private final String errorKind;
    private final int statusCode;

    public AgentRequestException(String errorKind, int statusCode, String message) {
        this(errorKind, statusCode, message, null);
    }

    public AgentRequestException(String errorKind, int statusCode, String message, Throwable cause) {
        super("agent request failed code = " + errorKind + ", message = " + message, cause);
        this.errorKind = errorKind;
        this.statusCode = statusCode;
    }

    public String errorKind() {
        return errorKind;
    }

    /** HTTP status returned by the agent, 0 if none */
    public int statusCode() {
        return statusCode;
    }
}
