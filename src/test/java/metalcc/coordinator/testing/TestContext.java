package metalcc.coordinator.testing;

import metalcc.coordinator.config.CoordinatorConfig;
import metalcc.coordinator.config.Dependencies;
import metalcc.coordinator.dns.InMemoryDnsZone;
import metalcc.coordinator.model.ResourceShape;
import metalcc.coordinator.placement.NodeSelectionStrategy;
import metalcc.coordinator.placement.RandomSelectionStrategy;
import metalcc.coordinator.service.NodeRegistration;

import java.time.Duration;
import java.time.Instant;
import java.util.Random;

/**
 * Fully wired control plane over a fresh in-memory H2 database, with a fake
 * agent, in-memory DNS and a controllable clock.
 */
public final class TestContext implements AutoCloseable {

    public static final Instant START = Instant.parse("2026-01-01T00:00:00Z");
    public static final ResourceShape BIG_NODE = new ResourceShape(8, 16384, 200, 0);
    public static final ResourceShape SMALL = new ResourceShape(1, 1024, 10, 0);

    public final MutableClock clock = new MutableClock(START);
    public final FakeAgentClient agent = new FakeAgentClient();
    public final InMemoryDnsZone workloadsZone = new InMemoryDnsZone("workloads.test");
    public final InMemoryDnsZone nodesZone = new InMemoryDnsZone("nodes.test");
    public final Dependencies deps;

    private TestContext(CoordinatorConfig config, NodeSelectionStrategy strategy) {
        this.deps = Dependencies.create(config, agent, workloadsZone, nodesZone, strategy, clock);
    }

    public static TestContext create() {
        return create(baseConfig());
    }

    public static TestContext create(CoordinatorConfig config) {
        return create(config, new RandomSelectionStrategy(new Random(42)));
    }

    public static TestContext create(CoordinatorConfig config, NodeSelectionStrategy strategy) {
        return new TestContext(config, strategy);
    }

    public static CoordinatorConfig baseConfig() {
        return CoordinatorConfig.defaults()
                .withDatabaseUrl(memoryUrl("ctx"))
                .withServerPort(0)
                .withNodeLivenessThreshold(Duration.ofMinutes(1))
                .withMetering(false, Duration.ofMinutes(1))
                .withDnsZones("workloads.test", "nodes.test");
    }

    public static String memoryUrl(String name) {
        return "jdbc:h2:mem:test-" + name + "-" + System.nanoTime()
                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE;LOCK_TIMEOUT=10000";
    }

    public static NodeRegistration registration(String nodeId, ResourceShape total) {
        return new NodeRegistration(nodeId, nodeId + ".local", "10.0.0." + Math.abs(nodeId.hashCode() % 250),
                "token-" + nodeId, "1.0.0", total, ResourceShape.ZERO, null);
    }

    @Override
    public void close() {
        deps.close();
    }
}
