package metalcc.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import metalcc.coordinator.model.WorkloadEvent;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkloadEventResponse(
        @JsonProperty("id") String id,
        @JsonProperty("kind") String kind,
        @JsonProperty("detail") String detail,
        @JsonProperty("timestamp") Instant timestamp) {

    public static WorkloadEventResponse from(WorkloadEvent event) {
        return new WorkloadEventResponse(event.id(), event.kind().wireName(), event.detail(), event.timestamp());
    }
}
