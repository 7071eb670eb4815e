package metalcc.coordinator.repository;

import metalcc.coordinator.model.Account;
import metalcc.coordinator.store.UnitOfWork;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for tenant accounts.
 */
public interface AccountRepository {

    /**
     * Insert a new account.
     *
     * @throws metalcc.coordinator.error.ConflictException if the name or token is taken
     */
    void insert(UnitOfWork tx, Account account);

    Optional<Account> findById(UnitOfWork tx, String accountId);

    /**
     * Find an account and hold its row lock until the unit of work ends.
     * Serializes admission and debits for the same account.
     */
    Optional<Account> findByIdForUpdate(UnitOfWork tx, String accountId);

    Optional<Account> findByApiToken(UnitOfWork tx, String apiToken);

    List<Account> findAll(UnitOfWork tx);

    /**
     * Overwrite the credit balance.
     *
     * @return true if the account exists
     */
    boolean updateCredits(UnitOfWork tx, String accountId, long credits);
}
