package metalcc.coordinator.service;

import metalcc.coordinator.error.InsufficientCreditsException;
import metalcc.coordinator.model.Account;
import metalcc.coordinator.model.Tier;
import metalcc.coordinator.repository.WorkloadRepository;
import metalcc.coordinator.store.UnitOfWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Credit check run before a workload is placed.
 *
 * <p>
 * A tenant is admitted only if its balance covers {@link #MIN_RUNTIME_MINUTES} of
 * its whole spend rate, counting the new workload. The account row should be
 * locked in {@code tx} so concurrent requests can't spend the same headroom.
 */
public class AdmissionController {

    private static final Logger log = LoggerFactory.getLogger(AdmissionController.class);

    public static final long MIN_RUNTIME_MINUTES = 5;

    private final WorkloadRepository workloadRepository;

    public AdmissionController(WorkloadRepository workloadRepository) {
        this.workloadRepository = workloadRepository;
    }

    /**
     * Credits burned per minute by the account's non-stopped workloads.
     */
    public long currentSpendRate(UnitOfWork tx, String accountId) {
        return workloadRepository.sumActiveCreditRate(tx, accountId);
    }

    /**
     * @throws InsufficientCreditsException if the account can't afford the tier
     */
    public void checkAdmission(UnitOfWork tx, Account account, Tier tier) {
        long spendRate = currentSpendRate(tx, account.id());
        long required = requiredCredits(spendRate, tier.cost());
        if (required > account.credits()) {
            log.warn("Rejecting {} for account {}: needs {} credits, has {}",
                    tier.name(), account.id(), required, account.credits());
            throw new InsufficientCreditsException(required, account.credits());
        }
    }

    public static boolean admits(long spendRate, long tierCost, long credits) {
        return requiredCredits(spendRate, tierCost) <= credits;
    }

    static long requiredCredits(long spendRate, long tierCost) {
        return Math.multiplyExact(spendRate + tierCost, MIN_RUNTIME_MINUTES);
    }
}
