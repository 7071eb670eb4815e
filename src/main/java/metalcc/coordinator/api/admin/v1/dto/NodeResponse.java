package metalcc.coordinator.api.admin.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import metalcc.coordinator.model.Node;
import metalcc.coordinator.model.NodeUsage;
import metalcc.coordinator.model.ResourceShape;

import java.time.Instant;

/**
 * Operator view of a node and its capacity.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NodeResponse(
        @JsonProperty("id") String id,
        @JsonProperty("hostname") String hostname,
        @JsonProperty("publicIp") String publicIp,
        @JsonProperty("domain") String domain,
        @JsonProperty("agentVersion") String agentVersion,
        @JsonProperty("gpuModel") String gpuModel,
        @JsonProperty("total") ResourceShape total,
        @JsonProperty("reserved") ResourceShape reserved,
        @JsonProperty("used") ResourceShape used,
        @JsonProperty("free") ResourceShape free,
        @JsonProperty("alive") boolean alive,
        @JsonProperty("lastSeenAt") Instant lastSeenAt,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("updatedAt") Instant updatedAt) {

    public static NodeResponse from(NodeUsage usage, String domain, boolean alive) {
        Node node = usage.node();
        return new NodeResponse(
                node.id(),
                node.hostname(),
                node.publicIp(),
                domain,
                node.agentVersion(),
                node.gpuModel(),
                node.total(),
                node.reserved(),
                usage.used(),
                usage.free(),
                alive,
                node.lastSeenAt(),
                node.createdAt(),
                node.updatedAt());
    }
}
