package metalcc.coordinator.service;

import metalcc.coordinator.model.ResourceShape;

import java.util.Objects;

/**
 * What a node agent reports about itself when it registers.
 * {@code total} carries the gpu count; reserved gpus are ignored.
 */
public record NodeRegistration(
        String nodeId,
        String hostname,
        String publicIp,
        String token,
        String agentVersion,
        ResourceShape total,
        ResourceShape reserved,
        String gpuModel) {

    public NodeRegistration {
        Objects.requireNonNull(nodeId, "nodeId is required");
        Objects.requireNonNull(total, "total is required");
        if (reserved == null) {
            reserved = ResourceShape.ZERO;
        }
    }
}
