package metalcc.coordinator.service;

import metalcc.coordinator.error.NotFoundException;
import metalcc.coordinator.model.Account;
import metalcc.coordinator.repository.AccountRepository;
import metalcc.coordinator.repository.WorkloadRepository;
import metalcc.coordinator.store.TransactionManager;
import metalcc.coordinator.store.UnitOfWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Service layer for tenant accounts and their credit balance.
 */
public class AccountService {

    private static final Logger log = LoggerFactory.getLogger(AccountService.class);

    private static final int TOKEN_BYTES = 16;

    private final AccountRepository accountRepository;
    private final WorkloadRepository workloadRepository;
    private final TransactionManager transactions;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public AccountService(AccountRepository accountRepository, WorkloadRepository workloadRepository,
            TransactionManager transactions, Clock clock) {
        this.accountRepository = accountRepository;
        this.workloadRepository = workloadRepository;
        this.transactions = transactions;
        this.clock = clock;
    }

    /**
     * Create an account with a fresh API token.
     *
     * @throws metalcc.coordinator.error.ConflictException if the name is taken
     */
    public Account create(String name, long credits) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
        Account account = Account.builder()
                .id(UUID.randomUUID().toString())
                .name(name)
                .apiToken(generateToken())
                .credits(credits)
                .createdAt(clock.instant().truncatedTo(ChronoUnit.MILLIS))
                .build();

        try (UnitOfWork tx = transactions.begin()) {
            accountRepository.insert(tx, account);
            tx.commit();
        }
        log.info("Created account {} ({}) with {} credits", account.id(), name, credits);
        return account;
    }

    public Account read(String accountId) {
        try (UnitOfWork tx = transactions.begin()) {
            return accountRepository.findById(tx, accountId)
                    .orElseThrow(() -> new NotFoundException("account", accountId));
        }
    }

    public List<Account> list() {
        try (UnitOfWork tx = transactions.begin()) {
            return accountRepository.findAll(tx);
        }
    }

    public Optional<Account> findByToken(String apiToken) {
        if (apiToken == null || apiToken.isBlank()) {
            return Optional.empty();
        }
        try (UnitOfWork tx = transactions.begin()) {
            return accountRepository.findByApiToken(tx, apiToken);
        }
    }

    /**
     * Top up an account.
     *
     * @return the updated account
     */
    public Account addCredits(String accountId, long amount) {
        if (amount <= 0) {
            throw new IllegalArgumentException("amount must be positive");
        }
        try (UnitOfWork tx = transactions.begin()) {
            Account account = accountRepository.findByIdForUpdate(tx, accountId)
                    .orElseThrow(() -> new NotFoundException("account", accountId));
            Account updated = account.toBuilder()
                    .credits(Math.addExact(account.credits(), amount))
                    .build();
            accountRepository.updateCredits(tx, accountId, updated.credits());
            tx.commit();

            log.info("Added {} credits to account {} (balance={})", amount, accountId, updated.credits());
            return updated;
        }
    }

    /**
     * Credits per minute the account currently burns.
     */
    public long spendRate(String accountId) {
        try (UnitOfWork tx = transactions.begin()) {
            return workloadRepository.sumActiveCreditRate(tx, accountId);
        }
    }

    private String generateToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }
}
