package metalcc.coordinator.repository;

import metalcc.coordinator.model.ResourceShape;
import metalcc.coordinator.model.Tier;
import metalcc.coordinator.store.UnitOfWork;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for the tier catalog.
 */
public interface TierRepository {

    /**
     * @throws metalcc.coordinator.error.ConflictException on duplicate name or shape
     */
    void insert(UnitOfWork tx, Tier tier);

    Optional<Tier> findById(UnitOfWork tx, String tierId);

    Optional<Tier> findByShape(UnitOfWork tx, ResourceShape shape);

    List<Tier> findAll(UnitOfWork tx);

    boolean delete(UnitOfWork tx, String tierId);
}
