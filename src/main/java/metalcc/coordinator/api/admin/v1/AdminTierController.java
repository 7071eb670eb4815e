package metalcc.coordinator.api.admin.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import metalcc.coordinator.api.Controller;
import metalcc.coordinator.api.admin.v1.dto.CreateTierRequest;
import metalcc.coordinator.api.internal.v1.dto.OperationResponse;
import metalcc.coordinator.api.v1.dto.TierResponse;
import metalcc.coordinator.model.Tier;
import metalcc.coordinator.service.TierCatalog;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tier administration.
 * POST   /admin/v1/tiers       - Create a tier
 * GET    /admin/v1/tiers       - List tiers
 * DELETE /admin/v1/tiers/{id}  - Delete a tier
 */
public class AdminTierController implements Controller {

    private static final Pattern TIERS_PATTERN = Pattern.compile("^/admin/v1/tiers$");
    private static final Pattern TIER_BY_ID_PATTERN = Pattern.compile("^/admin/v1/tiers/([^/]+)$");

    private final TierCatalog tierCatalog;

    public AdminTierController(TierCatalog tierCatalog) {
        this.tierCatalog = tierCatalog;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST) || method.equals(HttpMethod.GET)) {
            return TIERS_PATTERN.matcher(path).matches();
        }
        return method.equals(HttpMethod.DELETE) && TIER_BY_ID_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        if (req.method().equals(HttpMethod.POST)) {
            CreateTierRequest request = readBody(req, CreateTierRequest.class);
            request.validate();
            Tier tier = tierCatalog.create(request.name(), request.shape(), request.cost());
            return ControllerResponse.created(TierResponse.from(tier));
        }
        if (req.method().equals(HttpMethod.GET)) {
            return ControllerResponse.ok(tierCatalog.list().stream().map(TierResponse::from).toList());
        }

        Matcher matcher = TIER_BY_ID_PATTERN.matcher(path);
        matcher.matches();
        tierCatalog.delete(matcher.group(1));
        return ControllerResponse.ok(OperationResponse.success());
    }
}
