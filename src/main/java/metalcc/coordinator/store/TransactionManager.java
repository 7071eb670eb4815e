package metalcc.coordinator.store;

/**
 * Opens units of work against the relational store.
 */
public interface TransactionManager {

    /**
     * Begin a new unit of work. The caller owns it and must close it;
     * anything not committed by then is rolled back.
     */
    UnitOfWork begin();
}
