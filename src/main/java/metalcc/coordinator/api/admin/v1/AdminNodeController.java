package metalcc.coordinator.api.admin.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import metalcc.coordinator.api.Controller;
import metalcc.coordinator.api.admin.v1.dto.NodeResponse;
import metalcc.coordinator.api.internal.v1.dto.OperationResponse;
import metalcc.coordinator.model.NodeUsage;
import metalcc.coordinator.service.NodeCapacityRegistry;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Node administration.
 * GET    /admin/v1/nodes       - List nodes with capacity
 * GET    /admin/v1/nodes/{id}  - Read a node
 * DELETE /admin/v1/nodes/{id}  - Remove an idle node
 */
public class AdminNodeController implements Controller {

    private static final Pattern NODES_PATTERN = Pattern.compile("^/admin/v1/nodes$");
    private static final Pattern NODE_BY_ID_PATTERN = Pattern.compile("^/admin/v1/nodes/([^/]+)$");

    private final NodeCapacityRegistry registry;

    public AdminNodeController(NodeCapacityRegistry registry) {
        this.registry = registry;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.GET)) {
            return NODES_PATTERN.matcher(path).matches() || NODE_BY_ID_PATTERN.matcher(path).matches();
        }
        return method.equals(HttpMethod.DELETE) && NODE_BY_ID_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        if (NODES_PATTERN.matcher(path).matches()) {
            return ControllerResponse.ok(registry.list().stream().map(this::toResponse).toList());
        }

        Matcher matcher = NODE_BY_ID_PATTERN.matcher(path);
        matcher.matches();
        String nodeId = matcher.group(1);
        if (req.method().equals(HttpMethod.DELETE)) {
            registry.remove(nodeId);
            return ControllerResponse.ok(OperationResponse.success());
        }
        return ControllerResponse.ok(toResponse(registry.read(nodeId)));
    }

    private NodeResponse toResponse(NodeUsage usage) {
        return NodeResponse.from(usage, registry.nodeDomain(usage.node().id()), registry.isAlive(usage.node()));
    }
}
