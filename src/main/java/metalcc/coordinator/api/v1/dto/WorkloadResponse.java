package metalcc.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import metalcc.coordinator.model.Workload;

import java.time.Instant;

/**
 * Response DTO for a workload.
 */
public record WorkloadResponse(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("accountId") String accountId,
        @JsonProperty("nodeId") String nodeId,
        @JsonProperty("nodeDomain") String nodeDomain,
        @JsonProperty("domain") String domain,
        @JsonProperty("cpus") int cpus,
        @JsonProperty("memoryMb") int memoryMb,
        @JsonProperty("diskGb") int diskGb,
        @JsonProperty("gpus") int gpus,
        @JsonProperty("creditRate") long creditRate,
        @JsonProperty("status") String status,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("updatedAt") Instant updatedAt) {

    public static WorkloadResponse from(Workload w, String nodeDomain) {
        return new WorkloadResponse(
                w.id(),
                w.name(),
                w.accountId(),
                w.nodeId(),
                nodeDomain,
                w.domain(),
                w.shape().cpus(),
                w.shape().memoryMb(),
                w.shape().diskGb(),
                w.shape().gpus(),
                w.creditRate(),
                w.status().wireName(),
                w.createdAt(),
                w.updatedAt());
    }
}
