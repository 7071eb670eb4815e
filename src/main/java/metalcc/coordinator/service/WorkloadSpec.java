package metalcc.coordinator.service;

import metalcc.coordinator.model.ResourceShape;

import java.util.Objects;

/**
 * A validated request to run a workload.
 *
 * @param customDomain tenant-managed domain, or null to get one under the workloads zone
 * @param payload      JSON document handed to the agent untouched
 */
public record WorkloadSpec(String name, ResourceShape shape, String customDomain, String payload) {

    public WorkloadSpec {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(shape, "shape is required");
        if (payload == null) {
            payload = "{}";
        }
    }
}
