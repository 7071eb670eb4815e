package metalcc.coordinator.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import metalcc.coordinator.api.Controller;
import metalcc.coordinator.api.v1.dto.AccountResponse;
import metalcc.coordinator.model.Account;
import metalcc.coordinator.service.AccountService;

/**
 * The calling tenant's own account.
 * GET /api/v1/account
 */
public class AccountController implements Controller {

    private final ApiKeyAuthenticator authenticator;
    private final AccountService accountService;

    public AccountController(ApiKeyAuthenticator authenticator, AccountService accountService) {
        this.authenticator = authenticator;
        this.accountService = accountService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/account".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        Account account = authenticator.authenticate(req);
        return ControllerResponse.ok(AccountResponse.from(account, accountService.spendRate(account.id())));
    }
}
