package metalcc.coordinator.service;

import metalcc.coordinator.dns.DnsZone;
import metalcc.coordinator.dns.RecordType;
import metalcc.coordinator.error.NodeBusyException;
import metalcc.coordinator.error.NotFoundException;
import metalcc.coordinator.model.Node;
import metalcc.coordinator.model.NodeUsage;
import metalcc.coordinator.model.ResourceShape;
import metalcc.coordinator.repository.NodeRepository;
import metalcc.coordinator.repository.WorkloadRepository;
import metalcc.coordinator.store.TransactionManager;
import metalcc.coordinator.store.UnitOfWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * Catalog of registered nodes, their liveness and their free capacity.
 *
 * <p>
 * Free capacity is always read from the store's per-node usage aggregate, never
 * from a cached copy.
 */
public class NodeCapacityRegistry {

    private static final Logger log = LoggerFactory.getLogger(NodeCapacityRegistry.class);

    private final NodeRepository nodeRepository;
    private final WorkloadRepository workloadRepository;
    private final TransactionManager transactions;
    private final DnsZone nodesZone;
    private final Clock clock;
    private final Duration livenessThreshold;

    public NodeCapacityRegistry(NodeRepository nodeRepository, WorkloadRepository workloadRepository,
            TransactionManager transactions, DnsZone nodesZone, Clock clock, Duration livenessThreshold) {
        this.nodeRepository = nodeRepository;
        this.workloadRepository = workloadRepository;
        this.transactions = transactions;
        this.nodesZone = nodesZone;
        this.clock = clock;
        this.livenessThreshold = livenessThreshold;
    }

    /**
     * Create the node or update its declared attributes, and refresh liveness.
     * The node's DNS name is pointed at its public address once the row is committed.
     */
    public Node register(NodeRegistration registration) {
        Instant now = now();
        try (UnitOfWork tx = transactions.begin()) {
            Optional<Node> existing = nodeRepository.lockById(tx, registration.nodeId());

            Node node = Node.builder()
                    .id(registration.nodeId())
                    .hostname(registration.hostname())
                    .publicIp(registration.publicIp())
                    .token(registration.token())
                    .agentVersion(registration.agentVersion())
                    .total(registration.total())
                    .reserved(registration.reserved())
                    .gpuModel(registration.gpuModel())
                    .lastSeenAt(now)
                    .createdAt(existing.map(Node::createdAt).orElse(now))
                    .updatedAt(now)
                    .build();
            nodeRepository.upsert(tx, node);
            tx.commit();

            if (existing.isPresent()) {
                log.info("Node {} re-registered (version={}, total={})", node.id(), node.agentVersion(), node.total());
            } else {
                log.info("Registered new node {} at {} (total={}, reserved={})",
                        node.id(), node.publicIp(), node.total(), node.reserved());
            }

            // written on every registration so a retry repairs a record that failed last time
            try {
                nodesZone.createRecord(node.id(), node.publicIp(), RecordType.A);
            } catch (RuntimeException e) {
                log.error("Failed to publish address {} for node {}", node.publicIp(), node.id(), e);
                throw e;
            }
            return node;
        }
    }

    /**
     * Refresh liveness only.
     *
     * @throws NotFoundException if the node never registered
     */
    public void heartbeat(String nodeId) {
        try (UnitOfWork tx = transactions.begin()) {
            if (!nodeRepository.touch(tx, nodeId, now())) {
                throw new NotFoundException("node", nodeId);
            }
            tx.commit();
        }
        log.debug("Heartbeat from node {}", nodeId);
    }

    /**
     * Nodes alive within the configured threshold that can host {@code request}.
     */
    public List<NodeUsage> findCandidates(UnitOfWork tx, ResourceShape request) {
        return findCandidates(tx, request, livenessThreshold);
    }

    public List<NodeUsage> findCandidates(UnitOfWork tx, ResourceShape request, Duration threshold) {
        Instant aliveSince = now().minus(threshold);
        List<NodeUsage> candidates = nodeRepository.findWithFreeResources(tx, request, aliveSince);
        log.debug("{} candidate node(s) for {}", candidates.size(), request);
        return candidates;
    }

    /**
     * Lock the node row and re-check, under that lock, that it is still alive and
     * can host the request. The lock is held until {@code tx} ends, so a workload
     * inserted in the same unit of work claims the capacity atomically.
     */
    public boolean claim(UnitOfWork tx, String nodeId, ResourceShape request) {
        if (nodeRepository.lockById(tx, nodeId).isEmpty()) {
            return false;
        }
        return nodeRepository.findUsage(tx, nodeId)
                .filter(usage -> usage.node().isAlive(now(), livenessThreshold))
                .map(usage -> usage.canHost(request))
                .orElse(false);
    }

    /**
     * @throws NodeBusyException if any workload still references the node
     */
    public void remove(String nodeId) {
        try (UnitOfWork tx = transactions.begin()) {
            if (nodeRepository.lockById(tx, nodeId).isEmpty()) {
                throw new NotFoundException("node", nodeId);
            }
            int workloads = workloadRepository.countByNode(tx, nodeId);
            if (workloads > 0) {
                throw new NodeBusyException(nodeId, workloads);
            }
            nodeRepository.delete(tx, nodeId);
            nodesZone.deleteRecord(nodeId, RecordType.A);
            tx.commit();
        }
        log.info("Removed node {}", nodeId);
    }

    public Node get(UnitOfWork tx, String nodeId) {
        return nodeRepository.findById(tx, nodeId)
                .orElseThrow(() -> new NotFoundException("node", nodeId));
    }

    public NodeUsage read(String nodeId) {
        try (UnitOfWork tx = transactions.begin()) {
            return nodeRepository.findUsage(tx, nodeId)
                    .orElseThrow(() -> new NotFoundException("node", nodeId));
        }
    }

    public List<NodeUsage> list() {
        try (UnitOfWork tx = transactions.begin()) {
            return nodeRepository.findAllUsage(tx);
        }
    }

    public boolean isAlive(Node node) {
        return node.isAlive(now(), livenessThreshold);
    }

    /**
     * Fully qualified name agents are reached at.
     */
    public String nodeDomain(String nodeId) {
        return nodesZone.qualify(nodeId);
    }

    public Duration livenessThreshold() {
        return livenessThreshold;
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }
}
