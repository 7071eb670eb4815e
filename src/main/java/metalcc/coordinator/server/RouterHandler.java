package metalcc.coordinator.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.*;
import metalcc.coordinator.api.Controller;
import metalcc.coordinator.api.Controller.ControllerResponse;
import metalcc.coordinator.config.CoordinatorConfig;
import metalcc.coordinator.error.ControlPlaneException;
import metalcc.coordinator.error.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpResponseStatus.*;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Central router that dispatches HTTP requests to registered controllers.
 *
 * Only handles versioned API endpoints:
 * - /api/v1/* (public API, tenant API key checked by the controllers)
 * - /internal/v1/* (node agents, X-Node-Key)
 * - /admin/v1/* (operators, X-Admin-Key)
 *
 * All other endpoints return 404. Errors are written as
 * {@code {"error": <kind>, "message": <text>}}.
 *
 * This handler is @Sharable because it has no per-channel state.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .findAndRegisterModules();

    public static final String NODE_KEY_HEADER = "X-Node-Key";
    public static final String ADMIN_KEY_HEADER = "X-Admin-Key";

    private final List<Controller> controllers = new ArrayList<>();
    private final CoordinatorConfig config;

    public RouterHandler(CoordinatorConfig config) {
        this.config = config;
    }

    /**
     * Register a controller to handle requests.
     * Controllers are checked in order of registration.
     */
    public RouterHandler registerController(Controller controller) {
        controllers.add(controller);
        log.debug("Registered controller: {}", controller.getClass().getSimpleName());
        return this;
    }

    public int controllerCount() {
        return controllers.size();
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        String uri = req.uri();
        HttpMethod method = req.method();

        // Extract path without query string
        String path = uri.contains("?") ? uri.substring(0, uri.indexOf("?")) : uri;

        try {
            if (!checkAuth(req, path)) {
                log.warn("Auth failed for {} {}", method, path);
                writeError(ctx, FORBIDDEN, "FORBIDDEN", "missing or invalid key");
                return;
            }

            for (Controller controller : controllers) {
                if (controller.matches(method, path)) {
                    ControllerResponse response = controller.handle(ctx, req, path);
                    writeSafe(ctx, response.status(), response.contentType(), response.body());
                    return;
                }
            }

            log.debug("No handler for: {} {}", method, path);
            writeError(ctx, NOT_FOUND, ErrorKind.NOT_FOUND.name(), "no such endpoint: " + method + " " + path);

        } catch (ControlPlaneException e) {
            ErrorKind kind = e.kind();
            if (kind.httpStatus() >= 500) {
                log.error("{} {} failed: {}", method, path, e.getMessage(), e);
            } else {
                log.info("{} {} rejected ({}): {}", method, path, kind, e.getMessage());
            }
            writeError(ctx, HttpResponseStatus.valueOf(kind.httpStatus()), kind.name(), e.getMessage());
        } catch (IllegalArgumentException | JsonProcessingException e) {
            log.warn("Validation error on {} {}: {}", method, path, e.getMessage());
            writeError(ctx, BAD_REQUEST, ErrorKind.VALIDATION_ERROR.name(), validationMessage(e));
        } catch (Throwable t) {
            log.error("Handler error: {} {}", method, path, t);
            writeError(ctx, INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "internal error");
        }
    }

    /**
     * Internal and admin endpoints need their shared key when one is configured.
     * Public endpoints authenticate tenants in the controllers.
     */
    private boolean checkAuth(FullHttpRequest req, String path) {
        if (path.startsWith("/internal/")) {
            return !config.hasNodeApiKey() || config.nodeApiKey().equals(req.headers().get(NODE_KEY_HEADER));
        }
        if (path.startsWith("/admin/")) {
            return !config.hasAdminApiKey() || config.adminApiKey().equals(req.headers().get(ADMIN_KEY_HEADER));
        }
        return true;
    }

    private static String validationMessage(Exception e) {
        if (e instanceof JsonProcessingException json) {
            return "malformed request body: " + json.getOriginalMessage();
        }
        return e.getMessage();
    }

    private void writeError(ChannelHandlerContext ctx, HttpResponseStatus status, String kind, String message) {
        ObjectNode body = MAPPER.createObjectNode();
        body.put("error", kind);
        body.put("message", message);
        writeSafe(ctx, status, "application/json", body.toString());
    }

    /**
     * Safe write that catches any exceptions during response writing.
     * Ensures we never silently close the connection.
     */
    private void writeSafe(ChannelHandlerContext ctx, HttpResponseStatus status, String contentType, String body) {
        try {
            if (body == null) {
                body = "";
            }
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            FullHttpResponse response = new DefaultFullHttpResponse(HTTP_1_1, status, Unpooled.wrappedBuffer(bytes));
            response.headers().set(CONTENT_TYPE, contentType + "; charset=utf-8");
            response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
            ctx.writeAndFlush(response);
        } catch (Throwable t) {
            log.error("Failed to write response: {}", t.getMessage(), t);
            ctx.close();
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Unhandled exception in channel: {}", cause.getMessage(), cause);
        ctx.close();
    }

    /**
     * Get the shared ObjectMapper for JSON serialization.
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
