package metalcc.coordinator.repository;

import metalcc.coordinator.model.WorkloadEvent;
import metalcc.coordinator.store.UnitOfWork;

import java.util.List;
import java.util.Optional;

/**
 * Append-only store of workload events.
 */
public interface WorkloadEventRepository {

    void append(UnitOfWork tx, WorkloadEvent event);

    /**
     * True if an event with the same workload, kind, detail and timestamp was already stored.
     */
    boolean exists(UnitOfWork tx, WorkloadEvent event);

    /**
     * Events of a workload ordered by timestamp, ties broken by arrival.
     */
    List<WorkloadEvent> findByWorkload(UnitOfWork tx, String workloadId);

    /**
     * Latest event whose kind changes status.
     */
    Optional<WorkloadEvent> findLatestStatusEvent(UnitOfWork tx, String workloadId);
}
