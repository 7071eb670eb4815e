package metalcc.coordinator.api;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import metalcc.coordinator.server.RouterHandler;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Base interface for HTTP controllers.
 * Controllers handle specific URL patterns and HTTP methods.
 *
 * <p>
 * Controllers let failures propagate; {@link RouterHandler} turns them into
 * error responses.
 */
public interface Controller {

    /**
     * Check if this controller can handle the given request.
     *
     * @param method HTTP method
     * @param path   Request path (without query string)
     * @return true if this controller handles this request
     */
    boolean matches(HttpMethod method, String path);

    /**
     * Handle the request.
     *
     * @param ctx  Netty channel context
     * @param req  Full HTTP request
     * @param path Request path (without query string)
     * @return Response to send back
     */
    ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception;

    /**
     * Deserialize the request body.
     */
    default <T> T readBody(FullHttpRequest req, Class<T> type) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        if (body.isBlank()) {
            throw new IllegalArgumentException("request body is required");
        }
        return RouterHandler.mapper().readValue(body, type);
    }

    /**
     * First value of a query parameter, or {@code defaultValue}.
     */
    default String queryParam(FullHttpRequest req, String name, String defaultValue) {
        List<String> values = new QueryStringDecoder(req.uri()).parameters().get(name);
        return values == null || values.isEmpty() ? defaultValue : values.get(0);
    }

    /**
     * Response from a controller.
     */
    record ControllerResponse(
            HttpResponseStatus status,
            String contentType,
            String body) {

        public static ControllerResponse json(String body) {
            return new ControllerResponse(HttpResponseStatus.OK, "application/json", body);
        }

        public static ControllerResponse json(HttpResponseStatus status, String body) {
            return new ControllerResponse(status, "application/json", body);
        }

        public static ControllerResponse ok(Object value) throws Exception {
            return json(RouterHandler.mapper().writeValueAsString(value));
        }

        public static ControllerResponse created(Object value) throws Exception {
            return json(HttpResponseStatus.CREATED, RouterHandler.mapper().writeValueAsString(value));
        }

        public static ControllerResponse text(String body) {
            return new ControllerResponse(HttpResponseStatus.OK, "text/plain", body);
        }
    }
}
