package metalcc.coordinator.error;

public class UpstreamAgentException extends ControlPlaneException {

    private final String agentErrorKind;

    public UpstreamAgentException(String agentErrorKind, String message, Throwable cause) {
        super("agent request failed code = " + agentErrorKind + ", message = " + message, cause);
        this.agentErrorKind = agentErrorKind;
    }

    public String agentErrorKind() {
        return agentErrorKind;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.UPSTREAM_AGENT_ERROR;
    }
}
