package metalcc.coordinator.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import metalcc.coordinator.api.Controller;
import metalcc.coordinator.api.v1.dto.HealthResponse;
import metalcc.coordinator.model.NodeUsage;
import metalcc.coordinator.server.RouterHandler;
import metalcc.coordinator.service.NodeCapacityRegistry;
import metalcc.coordinator.store.Database;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Health check endpoint.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private final Database database;
    private final NodeCapacityRegistry registry;
    private final Instant startTime;

    public HealthController(Database database, NodeCapacityRegistry registry) {
        this.database = database;
        this.registry = registry;
        this.startTime = Instant.now();
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        if (!database.isHealthy()) {
            return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                    RouterHandler.mapper().writeValueAsString(HealthResponse.unhealthy("unavailable")));
        }

        List<NodeUsage> nodes = registry.list();
        int alive = (int) nodes.stream().filter(n -> registry.isAlive(n.node())).count();
        return ControllerResponse.ok(HealthResponse.healthy(formatUptime(), nodes.size(), alive));
    }

    private String formatUptime() {
        Duration uptime = Duration.between(startTime, Instant.now());
        long hours = uptime.toHours();
        long minutes = uptime.toMinutesPart();
        long seconds = uptime.toSecondsPart();
        return String.format("%dh %dm %ds", hours, minutes, seconds);
    }
}
