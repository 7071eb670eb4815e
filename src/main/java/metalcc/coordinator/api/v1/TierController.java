package metalcc.coordinator.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import metalcc.coordinator.api.Controller;
import metalcc.coordinator.api.v1.dto.TierResponse;
import metalcc.coordinator.service.TierCatalog;

/**
 * Tier catalog as seen by tenants.
 * GET /api/v1/tiers
 */
public class TierController implements Controller {

    private final ApiKeyAuthenticator authenticator;
    private final TierCatalog tierCatalog;

    public TierController(ApiKeyAuthenticator authenticator, TierCatalog tierCatalog) {
        this.authenticator = authenticator;
        this.tierCatalog = tierCatalog;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/tiers".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        authenticator.authenticate(req);
        return ControllerResponse.ok(tierCatalog.list().stream().map(TierResponse::from).toList());
    }
}
