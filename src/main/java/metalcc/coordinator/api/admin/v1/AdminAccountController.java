package metalcc.coordinator.api.admin.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import metalcc.coordinator.api.Controller;
import metalcc.coordinator.api.admin.v1.dto.AddCreditsRequest;
import metalcc.coordinator.api.admin.v1.dto.CreateAccountRequest;
import metalcc.coordinator.api.v1.dto.AccountResponse;
import metalcc.coordinator.model.Account;
import metalcc.coordinator.service.AccountService;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Account administration.
 *
 * POST /admin/v1/accounts               - Create an account (returns its API token)
 * GET  /admin/v1/accounts               - List accounts
 * GET  /admin/v1/accounts/{id}          - Read an account
 * POST /admin/v1/accounts/{id}/credits  - Top up credits
 */
public class AdminAccountController implements Controller {

    private static final Pattern ACCOUNTS_PATTERN = Pattern.compile("^/admin/v1/accounts$");
    private static final Pattern ACCOUNT_BY_ID_PATTERN = Pattern.compile("^/admin/v1/accounts/([^/]+)$");
    private static final Pattern CREDITS_PATTERN = Pattern.compile("^/admin/v1/accounts/([^/]+)/credits$");

    private final AccountService accountService;

    public AdminAccountController(AccountService accountService) {
        this.accountService = accountService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return ACCOUNTS_PATTERN.matcher(path).matches() || CREDITS_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.GET)) {
            return ACCOUNTS_PATTERN.matcher(path).matches() || ACCOUNT_BY_ID_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        if (ACCOUNTS_PATTERN.matcher(path).matches()) {
            if (req.method().equals(HttpMethod.POST)) {
                CreateAccountRequest request = readBody(req, CreateAccountRequest.class);
                request.validate();
                Account account = accountService.create(request.name(), request.credits());
                return ControllerResponse.created(AccountResponse.withToken(account));
            }
            return ControllerResponse.ok(accountService.list().stream().map(this::toResponse).toList());
        }

        Matcher creditsMatcher = CREDITS_PATTERN.matcher(path);
        if (creditsMatcher.matches()) {
            AddCreditsRequest request = readBody(req, AddCreditsRequest.class);
            request.validate();
            Account account = accountService.addCredits(creditsMatcher.group(1), request.amount());
            return ControllerResponse.ok(toResponse(account));
        }

        Matcher idMatcher = ACCOUNT_BY_ID_PATTERN.matcher(path);
        idMatcher.matches();
        return ControllerResponse.ok(toResponse(accountService.read(idMatcher.group(1))));
    }

    private AccountResponse toResponse(Account account) {
        return AccountResponse.from(account, accountService.spendRate(account.id()));
    }
}
