package metalcc.coordinator.model;

/**
 * A node together with the resources claimed by its non-stopped workloads.
 */
public record NodeUsage(Node node, ResourceShape used) {

    /** declared - reserved - used */
    public ResourceShape free() {
        return node.allocatable().minus(used);
    }

    public boolean canHost(ResourceShape request) {
        return free().canHost(request);
    }
}
