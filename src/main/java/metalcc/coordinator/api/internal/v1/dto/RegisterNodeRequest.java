package metalcc.coordinator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import metalcc.coordinator.model.ResourceShape;
import metalcc.coordinator.service.NodeRegistration;

import java.util.regex.Pattern;

/**
 * Request DTO for node registration.
 * POST /internal/v1/nodes/register
 */
public record RegisterNodeRequest(
        @JsonProperty("nodeId") String nodeId,
        @JsonProperty("hostname") String hostname,
        @JsonProperty("publicIp") String publicIp,
        @JsonProperty("token") String token,
        @JsonProperty("agentVersion") String agentVersion,
        @JsonProperty("cpus") Amount cpus,
        @JsonProperty("memoryMb") Amount memoryMb,
        @JsonProperty("diskGb") Amount diskGb,
        @JsonProperty("gpus") int gpus,
        @JsonProperty("gpuModel") String gpuModel) {

    /** The node id becomes the agent's hostname label in the nodes zone */
    private static final Pattern DNS_LABEL = Pattern.compile("[a-z0-9]([a-z0-9-]{0,61}[a-z0-9])?");

    /** Declared total and the part kept back for the host OS */
    public record Amount(
            @JsonProperty("total") int total,
            @JsonProperty("reserved") int reserved) {

        void validate(String field) {
            if (total <= 0) {
                throw new IllegalArgumentException(field + ".total must be positive");
            }
            if (reserved < 0 || reserved > total) {
                throw new IllegalArgumentException(field + ".reserved must be between 0 and total");
            }
        }
    }

    public void validate() {
        if (nodeId == null || nodeId.isBlank()) {
            throw new IllegalArgumentException("nodeId is required");
        }
        if (!DNS_LABEL.matcher(nodeId).matches()) {
            throw new IllegalArgumentException("nodeId must be a lowercase DNS label: " + nodeId);
        }
        if (hostname == null || hostname.isBlank()) {
            throw new IllegalArgumentException("hostname is required");
        }
        if (publicIp == null || publicIp.isBlank()) {
            throw new IllegalArgumentException("publicIp is required");
        }
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("token is required");
        }
        if (cpus == null || memoryMb == null || diskGb == null) {
            throw new IllegalArgumentException("cpus, memoryMb and diskGb are required");
        }
        cpus.validate("cpus");
        memoryMb.validate("memoryMb");
        diskGb.validate("diskGb");
        if (gpus < 0) {
            throw new IllegalArgumentException("gpus must be non-negative");
        }
    }

    public NodeRegistration toRegistration() {
        return new NodeRegistration(
                nodeId,
                hostname,
                publicIp,
                token,
                agentVersion,
                new ResourceShape(cpus.total(), memoryMb.total(), diskGb.total(), gpus),
                new ResourceShape(cpus.reserved(), memoryMb.reserved(), diskGb.reserved(), 0),
                gpuModel);
    }
}
