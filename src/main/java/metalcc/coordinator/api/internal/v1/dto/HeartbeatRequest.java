package metalcc.coordinator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for node heartbeat.
 * POST /internal/v1/nodes/heartbeat
 */
public record HeartbeatRequest(@JsonProperty("nodeId") String nodeId) {

    public void validate() {
        if (nodeId == null || nodeId.isBlank()) {
            throw new IllegalArgumentException("nodeId is required");
        }
    }
}
