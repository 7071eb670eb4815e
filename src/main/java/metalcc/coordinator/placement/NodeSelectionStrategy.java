package metalcc.coordinator.placement;

import metalcc.coordinator.model.NodeUsage;

import java.util.List;

/**
 * Chooses one node out of a non-empty list of placement candidates.
 */
public interface NodeSelectionStrategy {

    /**
     * Select a node for the workload.
     *
     * @param candidates nodes with enough free capacity, never empty
     * @return one element of {@code candidates}
     */
    NodeUsage select(List<NodeUsage> candidates);

    /**
     * Get the name of this strategy
     */
    String name();
}
