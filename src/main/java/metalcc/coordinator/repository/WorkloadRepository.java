package metalcc.coordinator.repository;

import metalcc.coordinator.model.Workload;
import metalcc.coordinator.model.WorkloadStatus;
import metalcc.coordinator.store.UnitOfWork;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for workload persistence.
 */
public interface WorkloadRepository {

    void insert(UnitOfWork tx, Workload workload);

    Optional<Workload> findById(UnitOfWork tx, String workloadId);

    /**
     * Find a workload and lock its row.
     */
    Optional<Workload> findByIdForUpdate(UnitOfWork tx, String workloadId);

    List<Workload> findByAccount(UnitOfWork tx, String accountId);

    /**
     * All workloads whose status is not STOPPED, for every account.
     */
    List<Workload> findActive(UnitOfWork tx);

    List<Workload> findActiveByAccount(UnitOfWork tx, String accountId);

    /**
     * Sum of credit rates over the account's non-stopped workloads.
     */
    long sumActiveCreditRate(UnitOfWork tx, String accountId);

    int countByNode(UnitOfWork tx, String nodeId);

    boolean updateStatus(UnitOfWork tx, String workloadId, WorkloadStatus status, Instant updatedAt);

    /**
     * Remove the workload together with its event log.
     */
    boolean delete(UnitOfWork tx, String workloadId);
}
