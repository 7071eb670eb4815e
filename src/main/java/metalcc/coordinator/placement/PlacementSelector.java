package metalcc.coordinator.placement;

import metalcc.coordinator.error.NoCapacityAvailableException;
import metalcc.coordinator.model.Node;
import metalcc.coordinator.model.NodeUsage;
import metalcc.coordinator.model.ResourceShape;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Picks exactly one node for a new workload.
 *
 * <p>
 * The strategy proposes a candidate and {@code claim} confirms it, normally by locking
 * the node row and re-checking its free capacity. A candidate that fails the claim is
 * dropped and the strategy is asked again until the list runs out.
 */
public class PlacementSelector {

    private static final Logger log = LoggerFactory.getLogger(PlacementSelector.class);

    private final NodeSelectionStrategy strategy;

    public PlacementSelector(NodeSelectionStrategy strategy) {
        this.strategy = strategy;
    }

    /**
     * @throws NoCapacityAvailableException if no candidate can be claimed
     */
    public Node place(List<NodeUsage> candidates, ResourceShape request, Predicate<NodeUsage> claim) {
        List<NodeUsage> remaining = new ArrayList<>(candidates);
        while (!remaining.isEmpty()) {
            NodeUsage chosen = strategy.select(remaining);
            if (claim.test(chosen)) {
                log.debug("Placed {} on node {} ({} of {} candidates, strategy={})",
                        request, chosen.node().id(), remaining.size(), candidates.size(), strategy.name());
                return chosen.node();
            }
            log.debug("Node {} lost capacity for {} before it could be claimed", chosen.node().id(), request);
            remaining.remove(chosen);
        }
        throw new NoCapacityAvailableException(request);
    }

    public NodeSelectionStrategy strategy() {
        return strategy;
    }
}
