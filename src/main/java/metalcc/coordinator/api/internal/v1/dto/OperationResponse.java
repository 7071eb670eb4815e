package metalcc.coordinator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Generic response for operations without a resource body.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationResponse(
        @JsonProperty("ok") boolean ok,
        @JsonProperty("status") String status) {

    public static OperationResponse success() {
        return new OperationResponse(true, null);
    }

    /** Success carrying the resulting workload status */
    public static OperationResponse withStatus(String status) {
        return new OperationResponse(true, status);
    }
}
