package metalcc.coordinator.repository;

import metalcc.coordinator.model.Node;
import metalcc.coordinator.model.NodeUsage;
import metalcc.coordinator.model.ResourceShape;
import metalcc.coordinator.store.UnitOfWork;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for registered nodes and their capacity.
 */
public interface NodeRepository {

    /**
     * Insert the node or overwrite every stored attribute of an existing one.
     */
    void upsert(UnitOfWork tx, Node node);

    Optional<Node> findById(UnitOfWork tx, String nodeId);

    /**
     * Lock a node row. Placement takes this lock before re-checking free capacity.
     */
    Optional<Node> lockById(UnitOfWork tx, String nodeId);

    List<Node> findAll(UnitOfWork tx);

    /**
     * Refresh liveness.
     *
     * @return false if the node is unknown
     */
    boolean touch(UnitOfWork tx, String nodeId, Instant seenAt);

    boolean delete(UnitOfWork tx, String nodeId);

    /**
     * Usage of one node, summed over its non-stopped workloads.
     */
    Optional<NodeUsage> findUsage(UnitOfWork tx, String nodeId);

    /**
     * Usage of every node.
     */
    List<NodeUsage> findAllUsage(UnitOfWork tx);

    /**
     * Nodes seen at or after {@code aliveSince} whose free capacity can host the request
     * (strictly more cpu, memory and disk; at least as many gpus).
     */
    List<NodeUsage> findWithFreeResources(UnitOfWork tx, ResourceShape request, Instant aliveSince);
}
