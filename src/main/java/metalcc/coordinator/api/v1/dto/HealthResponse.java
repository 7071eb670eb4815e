package metalcc.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("database") String database,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("nodes") Integer nodes,
        @JsonProperty("aliveNodes") Integer aliveNodes) {

    public static HealthResponse healthy(String uptime, int nodes, int aliveNodes) {
        return new HealthResponse("healthy", "ok", uptime, nodes, aliveNodes);
    }

    public static HealthResponse unhealthy(String database) {
        return new HealthResponse("unhealthy", database, null, null, null);
    }
}
