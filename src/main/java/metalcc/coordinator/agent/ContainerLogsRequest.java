package metalcc.coordinator.agent;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Log lines to fetch from one container.
 */
public record ContainerLogsRequest(
        @JsonProperty("container") String container,
        @JsonProperty("tail") boolean tail,
        @JsonProperty("stream") OutputStream stream,
        @JsonProperty("maxLines") int maxLines) {

    public static final int MAX_LINES = 1000;

    public enum OutputStream {
        @JsonProperty("stdout")
        STDOUT,
        @JsonProperty("stderr")
        STDERR
    }

    public void validate() {
        if (container == null || container.isBlank()) {
            throw new IllegalArgumentException("container is required");
        }
        if (stream == null) {
            throw new IllegalArgumentException("stream must be stdout or stderr");
        }
        if (maxLines <= 0 || maxLines > MAX_LINES) {
            throw new IllegalArgumentException("maxLines must be between 1 and " + MAX_LINES);
        }
    }
}
