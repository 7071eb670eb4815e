package metalcc.coordinator.api.internal.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import metalcc.coordinator.api.Controller;
import metalcc.coordinator.api.internal.v1.dto.HeartbeatRequest;
import metalcc.coordinator.api.internal.v1.dto.OperationResponse;
import metalcc.coordinator.api.internal.v1.dto.RegisterNodeRequest;
import metalcc.coordinator.service.NodeCapacityRegistry;

/**
 * Controller for node registration and heartbeat (internal API).
 * POST /internal/v1/nodes/register - Register or update a node
 * POST /internal/v1/nodes/heartbeat - Node heartbeat
 */
public class NodeController implements Controller {

    private final NodeCapacityRegistry registry;

    public NodeController(NodeCapacityRegistry registry) {
        this.registry = registry;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (!method.equals(HttpMethod.POST)) {
            return false;
        }
        return "/internal/v1/nodes/register".equals(path) || "/internal/v1/nodes/heartbeat".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        if (path.equals("/internal/v1/nodes/register")) {
            RegisterNodeRequest request = readBody(req, RegisterNodeRequest.class);
            request.validate();
            registry.register(request.toRegistration());
        } else {
            HeartbeatRequest request = readBody(req, HeartbeatRequest.class);
            request.validate();
            registry.heartbeat(request.nodeId());
        }
        return ControllerResponse.ok(OperationResponse.success());
    }
}
