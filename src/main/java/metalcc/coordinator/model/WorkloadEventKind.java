package metalcc.coordinator.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Kinds of events reported for a workload and the status each one leads to.
 */
public enum WorkloadEventKind {
    CREATED("created", WorkloadStatus.SCHEDULED),
    STARTING("starting", WorkloadStatus.STARTING),
    VM_RESTARTED("vmRestarted", WorkloadStatus.STARTING),
    FORCED_RESTART("forcedRestart", WorkloadStatus.STARTING),
    AWAITING_CERT("awaitingCert", WorkloadStatus.AWAITING_CERT),
    RUNNING("running", WorkloadStatus.RUNNING),
    STOPPED("stopped", WorkloadStatus.STOPPED),
    /** Carries an error detail */
    FAILED_TO_START("failedToStart", WorkloadStatus.ERROR),
    /** Carries a message detail; never changes status */
    WARNING("warning", null);

    private final String wireName;
    private final WorkloadStatus resultingStatus;

    WorkloadEventKind(String wireName, WorkloadStatus resultingStatus) {
        this.wireName = wireName;
        this.resultingStatus = resultingStatus;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Status a workload ends up in when this is its latest status-bearing event.
     * Empty for warnings.
     */
    public Optional<WorkloadStatus> resultingStatus() {
        return Optional.ofNullable(resultingStatus);
    }

    public boolean changesStatus() {
        return resultingStatus != null;
    }

    public boolean requiresDetail() {
        return this == FAILED_TO_START || this == WARNING;
    }

    public static WorkloadEventKind fromWireName(String name) {
        return Arrays.stream(values())
                .filter(k -> k.wireName.equals(name))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("unknown event kind: " + name));
    }
}
