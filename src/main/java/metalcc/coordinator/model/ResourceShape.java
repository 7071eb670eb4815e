package metalcc.coordinator.model;

/**
 * A (cpu, memory, disk, gpu) resource vector.
 * Used for tier shapes, workload requests and node capacity.
 */
public record ResourceShape(int cpus, int memoryMb, int diskGb, int gpus) {

    public static final ResourceShape ZERO = new ResourceShape(0, 0, 0, 0);

    public ResourceShape minus(ResourceShape other) {
        return new ResourceShape(
                cpus - other.cpus,
                memoryMb - other.memoryMb,
                diskGb - other.diskGb,
                gpus - other.gpus);
    }

    public ResourceShape plus(ResourceShape other) {
        return new ResourceShape(
                cpus + other.cpus,
                memoryMb + other.memoryMb,
                diskGb + other.diskGb,
                gpus + other.gpus);
    }

    /**
     * Placement rule: cpu, memory and disk must be strictly greater than the request,
     * gpu count greater or equal.
     */
    public boolean canHost(ResourceShape request) {
        return cpus > request.cpus
                && memoryMb > request.memoryMb
                && diskGb > request.diskGb
                && gpus >= request.gpus;
    }

    @Override
    public String toString() {
        return cpus + "cpu/" + memoryMb + "MB/" + diskGb + "GB/" + gpus + "gpu";
    }
}
