package metalcc.coordinator.config;

import metalcc.coordinator.agent.AgentClient;
import metalcc.coordinator.agent.HttpAgentClient;
import metalcc.coordinator.api.admin.v1.AdminAccountController;
import metalcc.coordinator.api.admin.v1.AdminNodeController;
import metalcc.coordinator.api.admin.v1.AdminTierController;
import metalcc.coordinator.api.internal.v1.NodeController;
import metalcc.coordinator.api.internal.v1.WorkloadEventController;
import metalcc.coordinator.api.v1.AccountController;
import metalcc.coordinator.api.v1.ApiKeyAuthenticator;
import metalcc.coordinator.api.v1.HealthController;
import metalcc.coordinator.api.v1.TierController;
import metalcc.coordinator.api.v1.WorkloadController;
import metalcc.coordinator.dns.DnsZone;
import metalcc.coordinator.dns.InMemoryDnsZone;
import metalcc.coordinator.placement.NodeSelectionStrategy;
import metalcc.coordinator.placement.PlacementSelector;
import metalcc.coordinator.placement.RandomSelectionStrategy;
import metalcc.coordinator.repository.AccountRepository;
import metalcc.coordinator.repository.NodeRepository;
import metalcc.coordinator.repository.TierRepository;
import metalcc.coordinator.repository.WorkloadEventRepository;
import metalcc.coordinator.repository.WorkloadRepository;
import metalcc.coordinator.scheduler.MeteringTask;
import metalcc.coordinator.scheduler.Scheduler;
import metalcc.coordinator.server.CoordinatorServer;
import metalcc.coordinator.server.RouterHandler;
import metalcc.coordinator.service.AccountService;
import metalcc.coordinator.service.AdmissionController;
import metalcc.coordinator.service.MeteringService;
import metalcc.coordinator.service.NodeCapacityRegistry;
import metalcc.coordinator.service.TierCatalog;
import metalcc.coordinator.service.WorkloadService;
import metalcc.coordinator.store.Database;
import metalcc.coordinator.store.JdbcAccountRepository;
import metalcc.coordinator.store.JdbcNodeRepository;
import metalcc.coordinator.store.JdbcTierRepository;
import metalcc.coordinator.store.JdbcWorkloadEventRepository;
import metalcc.coordinator.store.JdbcWorkloadRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(CoordinatorConfig.fromEnv());
 * deps.server().start();
 * deps.startScheduler(); // start metering
 * // ... serve ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final CoordinatorConfig config;
    private final Database database;

    // Collaborators that tests replace
    private final AgentClient agentClient;
    private final DnsZone workloadsZone;
    private final DnsZone nodesZone;
    private final Clock clock;

    // Repositories
    private final AccountRepository accountRepository;
    private final NodeRepository nodeRepository;
    private final TierRepository tierRepository;
    private final WorkloadRepository workloadRepository;
    private final WorkloadEventRepository workloadEventRepository;

    // Services
    private final NodeCapacityRegistry nodeRegistry;
    private final TierCatalog tierCatalog;
    private final AdmissionController admissionController;
    private final PlacementSelector placementSelector;
    private final AccountService accountService;
    private final WorkloadService workloadService;
    private final MeteringService meteringService;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    // Server (lazy-initialized)
    private CoordinatorServer server;

    // Scheduler (lazy-initialized)
    private Scheduler scheduler;

    private Dependencies(CoordinatorConfig config, AgentClient agentClient, DnsZone workloadsZone,
            DnsZone nodesZone, NodeSelectionStrategy selectionStrategy, Clock clock) {
        this.config = config;
        this.agentClient = agentClient;
        this.workloadsZone = workloadsZone;
        this.nodesZone = nodesZone;
        this.clock = clock;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);

        // Repositories
        this.accountRepository = new JdbcAccountRepository();
        this.nodeRepository = new JdbcNodeRepository();
        this.tierRepository = new JdbcTierRepository();
        this.workloadRepository = new JdbcWorkloadRepository();
        this.workloadEventRepository = new JdbcWorkloadEventRepository();

        // Services
        this.nodeRegistry = new NodeCapacityRegistry(nodeRepository, workloadRepository, database, nodesZone,
                clock, config.nodeLivenessThreshold());
        this.tierCatalog = new TierCatalog(tierRepository, database);
        this.admissionController = new AdmissionController(workloadRepository);
        this.placementSelector = new PlacementSelector(selectionStrategy);
        this.accountService = new AccountService(accountRepository, workloadRepository, database, clock);
        this.workloadService = new WorkloadService(database, accountRepository, workloadRepository,
                workloadEventRepository, nodeRegistry, tierCatalog, admissionController, placementSelector,
                agentClient, workloadsZone, clock);
        this.meteringService = new MeteringService(accountRepository);

        if (!config.hasAdminApiKey()) {
            log.warn("No admin API key configured, /admin endpoints are open");
        }
        if (!config.hasNodeApiKey()) {
            log.warn("No node API key configured, /internal endpoints are open");
        }

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config, an HTTP agent client and in-process DNS zones.
     */
    public static Dependencies create(CoordinatorConfig config) {
        AgentClient agent = new HttpAgentClient(RouterHandler.mapper(), config.agentScheme(),
                config.nodesDnsZone(), config.agentPort(), config.agentRequestTimeout());
        return create(config, agent,
                new InMemoryDnsZone(config.workloadsDnsZone()),
                new InMemoryDnsZone(config.nodesDnsZone()),
                new RandomSelectionStrategy(),
                Clock.systemUTC());
    }

    /**
     * Create dependencies with explicit collaborators.
     */
    public static Dependencies create(CoordinatorConfig config, AgentClient agentClient, DnsZone workloadsZone,
            DnsZone nodesZone, NodeSelectionStrategy selectionStrategy, Clock clock) {
        return new Dependencies(config, agentClient, workloadsZone, nodesZone, selectionStrategy, clock);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(CoordinatorConfig.fromEnv());
    }

    // Getters
    public CoordinatorConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public AgentClient agentClient() {
        return agentClient;
    }

    public DnsZone workloadsZone() {
        return workloadsZone;
    }

    public DnsZone nodesZone() {
        return nodesZone;
    }

    public Clock clock() {
        return clock;
    }

    public AccountRepository accountRepository() {
        return accountRepository;
    }

    public NodeRepository nodeRepository() {
        return nodeRepository;
    }

    public TierRepository tierRepository() {
        return tierRepository;
    }

    public WorkloadRepository workloadRepository() {
        return workloadRepository;
    }

    public WorkloadEventRepository workloadEventRepository() {
        return workloadEventRepository;
    }

    public NodeCapacityRegistry nodeRegistry() {
        return nodeRegistry;
    }

    public TierCatalog tierCatalog() {
        return tierCatalog;
    }

    public AdmissionController admissionController() {
        return admissionController;
    }

    public PlacementSelector placementSelector() {
        return placementSelector;
    }

    public AccountService accountService() {
        return accountService;
    }

    public WorkloadService workloadService() {
        return workloadService;
    }

    public MeteringService meteringService() {
        return meteringService;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     * This is the main entry point for serving HTTP requests.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            ApiKeyAuthenticator authenticator = new ApiKeyAuthenticator(accountService);
            routerHandler = new RouterHandler(config)
                    // public API
                    .registerController(new HealthController(database, nodeRegistry))
                    .registerController(new AccountController(authenticator, accountService))
                    .registerController(new TierController(authenticator, tierCatalog))
                    .registerController(new WorkloadController(authenticator, workloadService, nodeRegistry))
                    // internal API
                    .registerController(new NodeController(nodeRegistry))
                    .registerController(new WorkloadEventController(workloadService))
                    // admin API
                    .registerController(new AdminAccountController(accountService))
                    .registerController(new AdminTierController(tierCatalog))
                    .registerController(new AdminNodeController(nodeRegistry));
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    /**
     * Get the HTTP server (creates it if not yet created). Not started.
     */
    public synchronized CoordinatorServer server() {
        if (server == null) {
            server = new CoordinatorServer(routerHandler(), config.serverHost(), config.serverPort());
        }
        return server;
    }

    /**
     * Get the scheduler (creates it if not yet created).
     */
    public synchronized Scheduler scheduler() {
        if (scheduler == null) {
            MeteringTask meteringTask = new MeteringTask(database, workloadRepository, meteringService,
                    workloadService);
            scheduler = new Scheduler(meteringTask, config);
        }
        return scheduler;
    }

    /**
     * Start the background scheduler for metering.
     * Should be called after server startup.
     */
    public void startScheduler() {
        scheduler().start();
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop scheduler first
        if (scheduler != null) {
            try {
                scheduler.stop();
            } catch (Exception e) {
                log.warn("Error stopping scheduler: {}", e.getMessage());
            }
        }

        if (server != null) {
            try {
                server.stop();
            } catch (Exception e) {
                log.warn("Error stopping server: {}", e.getMessage());
            }
        }

        // Close database
        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
