package metalcc.coordinator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Append-only entry in a workload's audit trail.
 *
 * @param detail error text for {@code failedToStart}, message for {@code warning}, otherwise null
 */
public record WorkloadEvent(String id, String workloadId, WorkloadEventKind kind, String detail, Instant timestamp) {

    public WorkloadEvent {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(workloadId, "workloadId is required");
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        if (kind.requiresDetail() && detail == null) {
            throw new IllegalArgumentException(kind.wireName() + " event requires a detail");
        }
        if (!kind.requiresDetail()) {
            detail = null;
        }
    }

    /**
     * Status derived from this event, if it is the latest status-bearing one.
     */
    public static WorkloadStatus deriveStatus(WorkloadEventKind latestNonWarning) {
        return latestNonWarning.resultingStatus()
                .orElseThrow(() -> new IllegalArgumentException("warning events don't carry a status"));
    }
}
