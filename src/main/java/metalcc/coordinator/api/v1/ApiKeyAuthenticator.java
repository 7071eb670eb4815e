package metalcc.coordinator.api.v1;

import io.netty.handler.codec.http.FullHttpRequest;
import metalcc.coordinator.error.AccessDeniedException;
import metalcc.coordinator.model.Account;
import metalcc.coordinator.service.AccountService;

/**
 * Resolves the calling tenant from the {@code X-Api-Key} header.
 */
public class ApiKeyAuthenticator {

    public static final String HEADER = "X-Api-Key";

    private final AccountService accountService;

    public ApiKeyAuthenticator(AccountService accountService) {
        this.accountService = accountService;
    }

    /**
     * @throws AccessDeniedException if the key is missing or unknown
     */
    public Account authenticate(FullHttpRequest req) {
        return accountService.findByToken(req.headers().get(HEADER))
                .orElseThrow(() -> new AccessDeniedException("missing or invalid API key"));
    }
}
