package metalcc.coordinator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import metalcc.coordinator.model.WorkloadEventKind;

import java.time.Instant;

/**
 * Request DTO for a workload event reported by a node.
 * POST /internal/v1/workloads/events
 *
 * {@code error} goes with {@code failedToStart}, {@code message} with {@code warning}.
 */
public record SubmitEventRequest(
        @JsonProperty("nodeId") String nodeId,
        @JsonProperty("workloadId") String workloadId,
        @JsonProperty("kind") String kind,
        @JsonProperty("error") String error,
        @JsonProperty("message") String message,
        @JsonProperty("timestamp") Instant timestamp) {

    public void validate() {
        if (nodeId == null || nodeId.isBlank()) {
            throw new IllegalArgumentException("nodeId is required");
        }
        if (workloadId == null || workloadId.isBlank()) {
            throw new IllegalArgumentException("workloadId is required");
        }
        WorkloadEventKind parsed = eventKind();
        if (parsed == WorkloadEventKind.FAILED_TO_START && error == null) {
            throw new IllegalArgumentException("failedToStart requires an error");
        }
        if (parsed == WorkloadEventKind.WARNING && message == null) {
            throw new IllegalArgumentException("warning requires a message");
        }
    }

    public WorkloadEventKind eventKind() {
        if (kind == null) {
            throw new IllegalArgumentException("kind is required");
        }
        return WorkloadEventKind.fromWireName(kind);
    }

    public String detail() {
        return switch (eventKind()) {
            case FAILED_TO_START -> error;
            case WARNING -> message;
            default -> null;
        };
    }
}
