package metalcc.coordinator.scheduler;

import metalcc.coordinator.model.Workload;
import metalcc.coordinator.repository.WorkloadRepository;
import metalcc.coordinator.service.MeteringService;
import metalcc.coordinator.service.WorkloadService;
import metalcc.coordinator.store.TransactionManager;
import metalcc.coordinator.store.UnitOfWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * One metering period: charge every active workload, then stop the workloads of
 * accounts that hit zero.
 *
 * The debits commit as one unit before any workload is stopped. An offender that
 * can't be stopped stays active and is picked up again next period.
 */
public class MeteringTask implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(MeteringTask.class);

    private final TransactionManager transactions;
    private final WorkloadRepository workloadRepository;
    private final MeteringService meteringService;
    private final WorkloadService workloadService;

    public MeteringTask(TransactionManager transactions, WorkloadRepository workloadRepository,
            MeteringService meteringService, WorkloadService workloadService) {
        this.transactions = transactions;
        this.workloadRepository = workloadRepository;
        this.meteringService = meteringService;
        this.workloadService = workloadService;
    }

    @Override
    public void run() {
        try {
            runOnce();
        } catch (Exception e) {
            log.error("Metering error", e);
        }
    }

    /**
     * @return number of workloads force-stopped
     */
    public int runOnce() {
        List<Workload> offenders;
        int metered;
        try (UnitOfWork tx = transactions.begin()) {
            List<Workload> batch = workloadRepository.findActive(tx);
            metered = batch.size();
            offenders = meteringService.meter(tx, batch);
            tx.commit();
        }

        if (metered == 0) {
            log.debug("No active workloads to meter");
            return 0;
        }

        int stopped = 0;
        for (Workload offender : offenders) {
            try {
                workloadService.forceStop(offender);
                stopped++;
            } catch (Exception e) {
                log.error("Failed to stop workload {} of account {}", offender.id(), offender.accountId(), e);
            }
        }

        log.info("Metering: {} workload(s) charged, {} offender(s), {} stopped",
                metered, offenders.size(), stopped);
        return stopped;
    }
}
