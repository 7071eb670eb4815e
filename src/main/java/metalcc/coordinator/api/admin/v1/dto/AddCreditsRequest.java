package metalcc.coordinator.api.admin.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * POST /admin/v1/accounts/{id}/credits
 */
public record AddCreditsRequest(@JsonProperty("amount") long amount) {

    public void validate() {
        if (amount <= 0) {
            throw new IllegalArgumentException("amount must be positive");
        }
    }
}
