package metalcc.coordinator.api.admin.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import metalcc.coordinator.model.ResourceShape;

/**
 * Request DTO for creating a tier.
 * POST /admin/v1/tiers
 */
public record CreateTierRequest(
        @JsonProperty("name") String name,
        @JsonProperty("cpus") int cpus,
        @JsonProperty("memoryMb") int memoryMb,
        @JsonProperty("diskGb") int diskGb,
        @JsonProperty("gpus") int gpus,
        @JsonProperty("cost") long cost) {

    public void validate() {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
        if (cpus <= 0 || memoryMb <= 0 || diskGb <= 0) {
            throw new IllegalArgumentException("cpus, memoryMb and diskGb must be positive");
        }
        if (gpus < 0) {
            throw new IllegalArgumentException("gpus must be non-negative");
        }
        if (cost < 0) {
            throw new IllegalArgumentException("cost must be non-negative");
        }
    }

    public ResourceShape shape() {
        return new ResourceShape(cpus, memoryMb, diskGb, gpus);
    }
}
