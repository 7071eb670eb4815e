package metalcc.coordinator.api.admin.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for creating an account.
 * POST /admin/v1/accounts
 */
public record CreateAccountRequest(
        @JsonProperty("name") String name,
        @JsonProperty("credits") long credits) {

    public void validate() {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
        if (credits < 0) {
            throw new IllegalArgumentException("credits must be non-negative");
        }
    }
}
