package metalcc.coordinator.agent;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Log lines to fetch from a system service inside the workload VM.
 */
public record SystemLogsRequest(
        @JsonProperty("source") Source source,
        @JsonProperty("tail") boolean tail,
        @JsonProperty("maxLines") int maxLines) {

    public enum Source {
        @JsonProperty("cvm-agent")
        CVM_AGENT
    }

    public void validate() {
        if (source == null) {
            throw new IllegalArgumentException("source is required");
        }
        if (maxLines <= 0 || maxLines > ContainerLogsRequest.MAX_LINES) {
            throw new IllegalArgumentException("maxLines must be between 1 and " + ContainerLogsRequest.MAX_LINES);
        }
    }
}
