package metalcc.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import metalcc.coordinator.model.Tier;

public record TierResponse(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("cpus") int cpus,
        @JsonProperty("memoryMb") int memoryMb,
        @JsonProperty("diskGb") int diskGb,
        @JsonProperty("gpus") int gpus,
        @JsonProperty("cost") long cost) {

    public static TierResponse from(Tier tier) {
        return new TierResponse(tier.id(), tier.name(), tier.shape().cpus(), tier.shape().memoryMb(),
                tier.shape().diskGb(), tier.shape().gpus(), tier.cost());
    }
}
