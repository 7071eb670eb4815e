package metalcc.coordinator.placement;

import metalcc.coordinator.model.NodeUsage;

import java.util.List;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Uniform random choice among candidates.
 * Spreads workloads across the fleet instead of filling the lowest id first.
 */
public class RandomSelectionStrategy implements NodeSelectionStrategy {

    private final Random random;

    public RandomSelectionStrategy() {
        this(null);
    }

    /**
     * @param random source of randomness, or null for {@link ThreadLocalRandom}
     */
    public RandomSelectionStrategy(Random random) {
        this.random = random;
    }

    @Override
    public NodeUsage select(List<NodeUsage> candidates) {
        if (candidates.isEmpty()) {
            throw new IllegalArgumentException("no candidates to select from");
        }
        Random source = random != null ? random : ThreadLocalRandom.current();
        return candidates.get(source.nextInt(candidates.size()));
    }

    @Override
    public String name() {
        return "RANDOM";
    }
}
