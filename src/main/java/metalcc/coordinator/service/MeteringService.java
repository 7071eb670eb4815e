package metalcc.coordinator.service;

import metalcc.coordinator.model.Account;
import metalcc.coordinator.model.Workload;
import metalcc.coordinator.repository.AccountRepository;
import metalcc.coordinator.store.UnitOfWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Debits running workloads from their accounts.
 *
 * <p>
 * One call handles one batch, inside the caller's unit of work: either every
 * debit is persisted or none is. Balances are floored at zero, and an account
 * that ends at zero has its still-active workloads from the batch returned as
 * offenders. This never stops or deletes anything itself.
 */
public class MeteringService {

    private static final Logger log = LoggerFactory.getLogger(MeteringService.class);

    private final AccountRepository accountRepository;

    public MeteringService(AccountRepository accountRepository) {
        this.accountRepository = accountRepository;
    }

    /**
     * @param batch workloads to charge for one period; stopped ones are ignored
     * @return workloads of accounts that ran out of credits
     */
    public List<Workload> meter(UnitOfWork tx, List<Workload> batch) {
        Map<String, Long> debits = batch.stream()
                .filter(Workload::isActive)
                .collect(Collectors.groupingBy(Workload::accountId, LinkedHashMap::new,
                        Collectors.summingLong(Workload::creditRate)));

        List<Workload> offenders = new ArrayList<>();
        for (Map.Entry<String, Long> entry : debits.entrySet()) {
            String accountId = entry.getKey();
            long delta = entry.getValue();

            Optional<Account> found = accountRepository.findByIdForUpdate(tx, accountId);
            if (found.isEmpty()) {
                log.error("Account {} of metered workloads not found, skipping", accountId);
                continue;
            }
            Account account = found.get();

            long remaining = Math.max(0, account.credits() - delta);
            accountRepository.updateCredits(tx, accountId, remaining);
            log.info("Deducted {} credits from account {} ({} -> {})", delta, accountId, account.credits(), remaining);

            if (remaining == 0) {
                List<Workload> accountWorkloads = batch.stream()
                        .filter(w -> w.accountId().equals(accountId) && w.isActive())
                        .toList();
                if (!accountWorkloads.isEmpty()) {
                    log.warn("Account {} ran out of credits, {} workload(s) will be stopped",
                            accountId, accountWorkloads.size());
                    offenders.addAll(accountWorkloads);
                }
            }
        }
        return offenders;
    }
}
