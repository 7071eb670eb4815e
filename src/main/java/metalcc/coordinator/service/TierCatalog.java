package metalcc.coordinator.service;

import metalcc.coordinator.error.InvalidTierException;
import metalcc.coordinator.error.NotFoundException;
import metalcc.coordinator.model.ResourceShape;
import metalcc.coordinator.model.Tier;
import metalcc.coordinator.repository.TierRepository;
import metalcc.coordinator.store.TransactionManager;
import metalcc.coordinator.store.UnitOfWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.UUID;

/**
 * Fixed resource shapes a workload may request, and what each one costs.
 */
public class TierCatalog {

    private static final Logger log = LoggerFactory.getLogger(TierCatalog.class);

    private final TierRepository tierRepository;
    private final TransactionManager transactions;

    public TierCatalog(TierRepository tierRepository, TransactionManager transactions) {
        this.tierRepository = tierRepository;
        this.transactions = transactions;
    }

    /**
     * Exact shape match, no best fit.
     *
     * @throws InvalidTierException if no tier has this shape
     */
    public Tier matchTier(UnitOfWork tx, ResourceShape shape) {
        return tierRepository.findByShape(tx, shape)
                .orElseThrow(() -> new InvalidTierException(shape));
    }

    public Tier create(String name, ResourceShape shape, long cost) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
        if (shape.cpus() <= 0 || shape.memoryMb() <= 0 || shape.diskGb() <= 0 || shape.gpus() < 0) {
            throw new IllegalArgumentException("tier shape must be positive: " + shape);
        }
        if (cost < 0) {
            throw new IllegalArgumentException("cost can't be negative");
        }

        Tier tier = new Tier(UUID.randomUUID().toString(), name, shape, cost);
        try (UnitOfWork tx = transactions.begin()) {
            tierRepository.insert(tx, tier);
            tx.commit();
        }
        log.info("Created tier {} ({}, cost={})", name, shape, cost);
        return tier;
    }

    public List<Tier> list() {
        try (UnitOfWork tx = transactions.begin()) {
            return tierRepository.findAll(tx);
        }
    }

    /**
     * Placed workloads keep the credit rate they were created with.
     */
    public void delete(String tierId) {
        try (UnitOfWork tx = transactions.begin()) {
            if (!tierRepository.delete(tx, tierId)) {
                throw new NotFoundException("tier", tierId);
            }
            tx.commit();
        }
        log.info("Deleted tier {}", tierId);
    }
}
