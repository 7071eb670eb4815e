package metalcc.coordinator.model;

import java.util.Arrays;

/**
 * Coarse workload status, derived from the latest non-warning event.
 */
public enum WorkloadStatus {
    /** Placed on a node, agent has not reported yet */
    SCHEDULED("scheduled"),
    /** VM is booting or restarting */
    STARTING("starting"),
    /** Containers are up, TLS certificate not issued yet */
    AWAITING_CERT("awaitingCert"),
    RUNNING("running"),
    STOPPED("stopped"),
    /** Workload failed to start */
    ERROR("error");

    private final String wireName;

    WorkloadStatus(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isActive() {
        return this != STOPPED;
    }

    public static WorkloadStatus fromWireName(String name) {
        return Arrays.stream(values())
                .filter(s -> s.wireName.equals(name))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("unknown workload status: " + name));
    }
}
