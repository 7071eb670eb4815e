package metalcc.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import metalcc.coordinator.model.Account;

import java.time.Instant;

/**
 * Account view. The API token is only included right after creation.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AccountResponse(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("credits") long credits,
        @JsonProperty("creditRate") Long creditRate,
        @JsonProperty("apiToken") String apiToken,
        @JsonProperty("createdAt") Instant createdAt) {

    public static AccountResponse from(Account account, long creditRate) {
        return new AccountResponse(account.id(), account.name(), account.credits(), creditRate, null,
                account.createdAt());
    }

    public static AccountResponse withToken(Account account) {
        return new AccountResponse(account.id(), account.name(), account.credits(), null, account.apiToken(),
                account.createdAt());
    }
}
