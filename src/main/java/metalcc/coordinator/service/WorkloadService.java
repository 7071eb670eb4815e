package metalcc.coordinator.service;

import metalcc.coordinator.agent.AgentClient;
import metalcc.coordinator.agent.AgentRequestException;
import metalcc.coordinator.agent.Container;
import metalcc.coordinator.agent.ContainerLogsRequest;
import metalcc.coordinator.agent.SystemLogsRequest;
import metalcc.coordinator.agent.SystemStats;
import metalcc.coordinator.dns.DnsZone;
import metalcc.coordinator.dns.RecordType;
import metalcc.coordinator.error.AccessDeniedException;
import metalcc.coordinator.error.ControlPlaneException;
import metalcc.coordinator.error.NotFoundException;
import metalcc.coordinator.error.UpstreamAgentException;
import metalcc.coordinator.error.WorkloadRejectedException;
import metalcc.coordinator.model.Account;
import metalcc.coordinator.model.Node;
import metalcc.coordinator.model.Tier;
import metalcc.coordinator.model.Workload;
import metalcc.coordinator.model.WorkloadEvent;
import metalcc.coordinator.model.WorkloadEventKind;
import metalcc.coordinator.model.WorkloadStatus;
import metalcc.coordinator.placement.PlacementSelector;
import metalcc.coordinator.repository.AccountRepository;
import metalcc.coordinator.repository.WorkloadEventRepository;
import metalcc.coordinator.repository.WorkloadRepository;
import metalcc.coordinator.store.TransactionManager;
import metalcc.coordinator.store.UnitOfWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.function.BiFunction;

/**
 * Workload lifecycle: admission, placement, provisioning handoff, the event log
 * and the status derived from it.
 *
 * <p>
 * Status only ever changes through an appended event, except at creation
 * ({@code scheduled}) and on a forced stop.
 */
public class WorkloadService {

    private static final Logger log = LoggerFactory.getLogger(WorkloadService.class);

    /** Agent error kinds that mean the tenant's request was at fault */
    static final Set<String> REJECTION_KINDS = Set.of("DockerCompose", "DomainExists", "ResourceLimit", "InvalidDomain");

    private final TransactionManager transactions;
    private final AccountRepository accountRepository;
    private final WorkloadRepository workloadRepository;
    private final WorkloadEventRepository eventRepository;
    private final NodeCapacityRegistry registry;
    private final TierCatalog tierCatalog;
    private final AdmissionController admission;
    private final PlacementSelector placement;
    private final AgentClient agent;
    private final DnsZone workloadsZone;
    private final Clock clock;

    public WorkloadService(TransactionManager transactions,
            AccountRepository accountRepository,
            WorkloadRepository workloadRepository,
            WorkloadEventRepository eventRepository,
            NodeCapacityRegistry registry,
            TierCatalog tierCatalog,
            AdmissionController admission,
            PlacementSelector placement,
            AgentClient agent,
            DnsZone workloadsZone,
            Clock clock) {
        this.transactions = transactions;
        this.accountRepository = accountRepository;
        this.workloadRepository = workloadRepository;
        this.eventRepository = eventRepository;
        this.registry = registry;
        this.tierCatalog = tierCatalog;
        this.admission = admission;
        this.placement = placement;
        this.agent = agent;
        this.workloadsZone = workloadsZone;
        this.clock = clock;
    }

    // ==================== Create ====================

    /**
     * Admit, place and persist a workload, then hand it to the node agent.
     *
     * <p>
     * Tier match, admission, candidate search, the node claim and the insert all
     * run in one unit of work with the account and node rows locked. The agent is
     * called only after that commits; if it or the DNS binding fails, the row is
     * removed again before the error is reported.
     */
    public Workload create(Account account, WorkloadSpec spec) {
        Workload workload;
        Node node;

        try (UnitOfWork tx = transactions.begin()) {
            Account locked = accountRepository.findByIdForUpdate(tx, account.id())
                    .orElseThrow(() -> new NotFoundException("account", account.id()));

            Tier tier = tierCatalog.matchTier(tx, spec.shape());
            admission.checkAdmission(tx, locked, tier);

            node = placement.place(
                    registry.findCandidates(tx, spec.shape()),
                    spec.shape(),
                    candidate -> registry.claim(tx, candidate.node().id(), spec.shape()));

            String id = UUID.randomUUID().toString();
            boolean managedDomain = spec.customDomain() == null;
            Instant now = now();
            workload = Workload.builder()
                    .id(id)
                    .name(spec.name())
                    .accountId(locked.id())
                    .nodeId(node.id())
                    .shape(spec.shape())
                    .creditRate(tier.cost())
                    .status(WorkloadStatus.SCHEDULED)
                    .domain(managedDomain ? workloadsZone.qualify(id) : spec.customDomain())
                    .managedDomain(managedDomain)
                    .payload(spec.payload())
                    .createdAt(now)
                    .updatedAt(now)
                    .build();

            workloadRepository.insert(tx, workload);
            eventRepository.append(tx, new WorkloadEvent(
                    UUID.randomUUID().toString(), id, WorkloadEventKind.CREATED, null, now));
            tx.commit();
        }

        log.info("Scheduled workload {} ({}) for account {} on node {}, tier rate {}",
                workload.id(), workload.shape(), workload.accountId(), workload.nodeId(), workload.creditRate());

        try {
            agent.createWorkload(node, workload);
        } catch (AgentRequestException e) {
            log.warn("Node {} refused workload {}: {}", node.id(), workload.id(), e.getMessage());
            compensate(workload);
            throw translate(e);
        } catch (RuntimeException e) {
            log.error("Failed to hand workload {} to node {}", workload.id(), node.id(), e);
            compensate(workload);
            throw new UpstreamAgentException(AgentRequestException.UNAVAILABLE, e.getMessage(), e);
        }

        if (workload.managedDomain()) {
            try {
                workloadsZone.createRecord(workload.id(), registry.nodeDomain(node.id()), RecordType.CNAME);
            } catch (RuntimeException e) {
                log.error("Failed to bind domain {} for workload {}", workload.domain(), workload.id(), e);
                compensate(workload);
                try {
                    agent.deleteWorkload(node, workload.id());
                } catch (AgentRequestException deleteError) {
                    log.error("Failed to remove workload {} from node {} after DNS failure",
                            workload.id(), node.id(), deleteError);
                }
                throw e;
            }
        }
        return workload;
    }

    /**
     * Undo a committed insert whose remote provisioning failed.
     */
    private void compensate(Workload workload) {
        try (UnitOfWork tx = transactions.begin()) {
            workloadRepository.delete(tx, workload.id());
            tx.commit();
        }
        log.warn("Rolled back workload {}", workload.id());
    }

    static ControlPlaneException translate(AgentRequestException e) {
        if (REJECTION_KINDS.contains(e.errorKind())) {
            return new WorkloadRejectedException(e.errorKind(), e.getMessage(), e);
        }
        return new UpstreamAgentException(e.errorKind(), e.getMessage(), e);
    }

    // ==================== Read ====================

    public Workload read(Account account, String workloadId) {
        try (UnitOfWork tx = transactions.begin()) {
            return findOwned(tx, account, workloadId);
        }
    }

    public List<Workload> list(Account account) {
        try (UnitOfWork tx = transactions.begin()) {
            return workloadRepository.findByAccount(tx, account.id());
        }
    }

    public List<WorkloadEvent> listEvents(Account account, String workloadId) {
        try (UnitOfWork tx = transactions.begin()) {
            findOwned(tx, account, workloadId);
            return eventRepository.findByWorkload(tx, workloadId);
        }
    }

    // ==================== Delete ====================

    /**
     * Delete the row, tell the agent, and drop the DNS binding. The unit of work
     * commits only if all three succeed.
     *
     * @throws NotFoundException if the workload is already gone
     */
    public void delete(Account account, String workloadId) {
        try (UnitOfWork tx = transactions.begin()) {
            Workload workload = workloadRepository.findByIdForUpdate(tx, workloadId)
                    .orElseThrow(() -> new NotFoundException("workload", workloadId));
            checkOwner(account, workload);
            Node node = registry.get(tx, workload.nodeId());

            workloadRepository.delete(tx, workloadId);
            try {
                agent.deleteWorkload(node, workloadId);
            } catch (AgentRequestException e) {
                throw translate(e);
            }
            if (workload.managedDomain()) {
                workloadsZone.deleteRecord(workloadId, RecordType.CNAME);
            }
            tx.commit();
        }
        log.info("Deleted workload {} of account {}", workloadId, account.id());
    }

    // ==================== Remote pass-through ====================

    public void start(Account account, String workloadId) {
        callAgent(account, workloadId, (node, id) -> {
            agent.startWorkload(node, id);
            return null;
        });
        log.info("Start requested for workload {}", workloadId);
    }

    public void stop(Account account, String workloadId) {
        callAgent(account, workloadId, (node, id) -> {
            agent.stopWorkload(node, id);
            return null;
        });
        log.info("Stop requested for workload {}", workloadId);
    }

    public void restart(Account account, String workloadId) {
        callAgent(account, workloadId, (node, id) -> {
            agent.restartWorkload(node, id);
            return null;
        });
        log.info("Restart requested for workload {}", workloadId);
    }

    public List<Container> containers(Account account, String workloadId) {
        return callAgent(account, workloadId, agent::listContainers);
    }

    public List<String> containerLogs(Account account, String workloadId, ContainerLogsRequest request) {
        request.validate();
        return callAgent(account, workloadId, (node, id) -> agent.containerLogs(node, id, request));
    }

    public List<String> systemLogs(Account account, String workloadId, SystemLogsRequest request) {
        request.validate();
        return callAgent(account, workloadId, (node, id) -> agent.systemLogs(node, id, request));
    }

    public SystemStats systemStats(Account account, String workloadId) {
        return callAgent(account, workloadId, agent::systemStats);
    }

    /**
     * Ownership check in a short read, then the remote call with no transaction open.
     */
    private <T> T callAgent(Account account, String workloadId, BiFunction<Node, String, T> call) {
        Node node;
        try (UnitOfWork tx = transactions.begin()) {
            Workload workload = findOwned(tx, account, workloadId);
            node = registry.get(tx, workload.nodeId());
        }
        try {
            return call.apply(node, workloadId);
        } catch (AgentRequestException e) {
            throw new UpstreamAgentException(e.errorKind(), e.getMessage(), e);
        }
    }

    // ==================== Events ====================

    /**
     * Record an event reported by a node and recompute the workload's status.
     *
     * @param timestamp when the event happened, or null for now
     * @return the workload's status afterwards
     */
    public WorkloadStatus submitEvent(String nodeId, String workloadId, WorkloadEventKind kind, String detail,
            Instant timestamp) {
        Instant at = timestamp != null ? timestamp.truncatedTo(ChronoUnit.MILLIS) : now();
        WorkloadEvent event = new WorkloadEvent(UUID.randomUUID().toString(), workloadId, kind, detail, at);

        try (UnitOfWork tx = transactions.begin()) {
            WorkloadStatus status = applyEvent(tx, nodeId, event);
            tx.commit();
            return status;
        }
    }

    /**
     * Append {@code event} unless an identical one is already stored, then set status
     * from the latest non-warning event. The workload row is locked so concurrent
     * events for it apply one at a time.
     *
     * @throws NotFoundException if the workload doesn't exist or isn't placed on {@code nodeId}
     */
    public WorkloadStatus applyEvent(UnitOfWork tx, String nodeId, WorkloadEvent event) {
        Workload workload = workloadRepository.findByIdForUpdate(tx, event.workloadId())
                .filter(w -> w.nodeId().equals(nodeId))
                .orElseThrow(() -> new NotFoundException("workload", event.workloadId()));

        if (eventRepository.exists(tx, event)) {
            log.debug("Ignoring duplicate {} event for workload {}", event.kind().wireName(), workload.id());
            return workload.status();
        }
        eventRepository.append(tx, event);

        if (event.kind() == WorkloadEventKind.WARNING) {
            log.warn("Workload {} warning: {}", workload.id(), event.detail());
            return workload.status();
        }

        WorkloadStatus status = eventRepository.findLatestStatusEvent(tx, workload.id())
                .map(latest -> WorkloadEvent.deriveStatus(latest.kind()))
                .orElse(workload.status());
        if (status != workload.status()) {
            workloadRepository.updateStatus(tx, workload.id(), status, now());
            log.info("Workload {} is now {} (event {})", workload.id(), status.wireName(), event.kind().wireName());
        }
        if (event.kind() == WorkloadEventKind.FAILED_TO_START) {
            log.warn("Workload {} failed to start: {}", workload.id(), event.detail());
        }
        return status;
    }

    // ==================== Forced stop ====================

    /**
     * Stop a workload whose account ran out of credits: stop it on the node, then
     * record a {@code stopped} event and the status in one unit of work.
     *
     * @throws UpstreamAgentException if the agent couldn't stop it; nothing is recorded then
     */
    public void forceStop(Workload workload) {
        Node node;
        try (UnitOfWork tx = transactions.begin()) {
            node = registry.get(tx, workload.nodeId());
        }
        try {
            agent.stopWorkload(node, workload.id());
        } catch (AgentRequestException e) {
            throw new UpstreamAgentException(e.errorKind(), e.getMessage(), e);
        }

        try (UnitOfWork tx = transactions.begin()) {
            Workload current = workloadRepository.findByIdForUpdate(tx, workload.id()).orElse(null);
            if (current == null || !current.isActive()) {
                return;
            }
            Instant now = now();
            eventRepository.append(tx, new WorkloadEvent(
                    UUID.randomUUID().toString(), workload.id(), WorkloadEventKind.STOPPED, null, now));
            workloadRepository.updateStatus(tx, workload.id(), WorkloadStatus.STOPPED, now);
            tx.commit();
        }
        log.info("Force-stopped workload {} of account {}", workload.id(), workload.accountId());
    }

    // ==================== Helpers ====================

    private Workload findOwned(UnitOfWork tx, Account account, String workloadId) {
        Workload workload = workloadRepository.findById(tx, workloadId)
                .orElseThrow(() -> new NotFoundException("workload", workloadId));
        checkOwner(account, workload);
        return workload;
    }

    private static void checkOwner(Account account, Workload workload) {
        if (!workload.isOwnedBy(account)) {
            throw new AccessDeniedException("workload " + workload.id() + " belongs to another account");
        }
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }
}
