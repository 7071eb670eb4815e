package metalcc.coordinator.service;

import metalcc.coordinator.config.Dependencies;
import metalcc.coordinator.dns.InMemoryDnsZone;
import metalcc.coordinator.dns.RecordType;
import metalcc.coordinator.error.NodeBusyException;
import metalcc.coordinator.error.NotFoundException;
import metalcc.coordinator.model.Account;
import metalcc.coordinator.model.Node;
import metalcc.coordinator.model.NodeUsage;
import metalcc.coordinator.model.ResourceShape;
import metalcc.coordinator.placement.RandomSelectionStrategy;
import metalcc.coordinator.store.UnitOfWork;
import metalcc.coordinator.testing.FakeAgentClient;
import metalcc.coordinator.testing.TestContext;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static metalcc.coordinator.testing.TestContext.BIG_NODE;
import static metalcc.coordinator.testing.TestContext.SMALL;
import static metalcc.coordinator.testing.TestContext.registration;
import static org.junit.jupiter.api.Assertions.*;

class NodeCapacityRegistryTest {

    private TestContext ctx;
    private NodeCapacityRegistry registry;

    @BeforeEach
    void setUp() {
        ctx = TestContext.create();
        registry = ctx.deps.nodeRegistry();
    }

    @AfterEach
    void tearDown() {
        ctx.close();
    }

    @Test
    void registerCreatesNodeAndDnsRecord() {
        Node node = registry.register(registration("node-1", BIG_NODE));

        assertEquals("node-1", node.id());
        assertEquals(TestContext.START, node.lastSeenAt());
        assertEquals(Optional.of(node.publicIp()), ctx.nodesZone.lookup("node-1", RecordType.A));
        assertEquals("node-1.nodes.test", registry.nodeDomain("node-1"));
    }

    @Test
    void reRegisterUpdatesAttributesAndKeepsCreation() {
        registry.register(registration("node-1", BIG_NODE));
        ctx.clock.advance(Duration.ofSeconds(30));

        NodeRegistration update = new NodeRegistration("node-1", "renamed", "10.9.9.9", "t2", "2.0.0",
                new ResourceShape(16, 32768, 400, 1), new ResourceShape(2, 2048, 20, 0), "H100");
        Node updated = registry.register(update);

        assertEquals(TestContext.START, updated.createdAt());
        NodeUsage stored = registry.read("node-1");
        assertEquals("renamed", stored.node().hostname());
        assertEquals("2.0.0", stored.node().agentVersion());
        assertEquals(new ResourceShape(16, 32768, 400, 1), stored.node().total());
        assertEquals(new ResourceShape(14, 30720, 380, 1), stored.free());
        assertEquals(Optional.of("10.9.9.9"), ctx.nodesZone.lookup("node-1", RecordType.A));
    }

    @Test
    void addressIsPublishedOnlyAfterNodeIsStored() {
        List<Boolean> storedWhenPublished = new CopyOnWriteArrayList<>();
        AtomicBoolean dnsDown = new AtomicBoolean(true);
        AtomicReference<Dependencies> deps = new AtomicReference<>();
        InMemoryDnsZone nodesZone = new InMemoryDnsZone("nodes.test") {
            @Override
            public void createRecord(String name, String target, RecordType type) {
                storedWhenPublished.add(deps.get().nodeRegistry().list().stream()
                        .anyMatch(usage -> usage.node().id().equals(name)));
                if (dnsDown.get()) {
                    throw new IllegalStateException("dns provider unavailable");
                }
                super.createRecord(name, target, type);
            }
        };
        deps.set(Dependencies.create(TestContext.baseConfig(), new FakeAgentClient(),
                new InMemoryDnsZone("workloads.test"), nodesZone, new RandomSelectionStrategy(), ctx.clock));
        try {
            NodeCapacityRegistry isolated = deps.get().nodeRegistry();

            assertThrows(IllegalStateException.class, () -> isolated.register(registration("node-1", BIG_NODE)));
            assertTrue(nodesZone.lookup("node-1", RecordType.A).isEmpty());

            // the agent retries with the same address and the record is repaired
            dnsDown.set(false);
            Node node = isolated.register(registration("node-1", BIG_NODE));
            assertEquals(Optional.of(node.publicIp()), nodesZone.lookup("node-1", RecordType.A));
            assertEquals(List.of(true, true), storedWhenPublished);
        } finally {
            deps.get().close();
        }
    }

    @Test
    void heartbeatUnknownNode() {
        assertThrows(NotFoundException.class, () -> registry.heartbeat("ghost"));
    }

    @Test
    void heartbeatKeepsNodeAlive() {
        registry.register(registration("node-1", BIG_NODE));
        ctx.clock.advance(Duration.ofSeconds(50));
        registry.heartbeat("node-1");
        ctx.clock.advance(Duration.ofSeconds(50));

        assertEquals(1, candidates(SMALL).size());
        assertTrue(registry.isAlive(registry.read("node-1").node()));
    }

    @Test
    void staleNodesAreNotCandidates() {
        registry.register(registration("node-1", BIG_NODE));
        ctx.clock.advance(Duration.ofSeconds(61));

        assertTrue(candidates(SMALL).isEmpty());
        try (UnitOfWork tx = ctx.deps.database().begin()) {
            assertEquals(1, registry.findCandidates(tx, SMALL, Duration.ofMinutes(5)).size());
        }
    }

    @Test
    void candidatesNeedStrictlyMoreCpuMemoryAndDisk() {
        registry.register(registration("exact", new ResourceShape(1, 1024, 10, 0)));
        registry.register(registration("roomy", new ResourceShape(2, 2048, 20, 0)));

        List<NodeUsage> found = candidates(SMALL);
        assertEquals(1, found.size());
        assertEquals("roomy", found.get(0).node().id());
    }

    @Test
    void gpuRequestsMatchGpuNodes() {
        registry.register(registration("cpu-only", BIG_NODE));
        registry.register(registration("gpu", new ResourceShape(8, 16384, 200, 1)));

        List<NodeUsage> found = candidates(new ResourceShape(1, 1024, 10, 1));
        assertEquals(1, found.size());
        assertEquals("gpu", found.get(0).node().id());
    }

    @Test
    void reservedCapacityIsNotOffered() {
        registry.register(new NodeRegistration("node-1", "h", "10.0.0.1", "t", "1",
                new ResourceShape(4, 4096, 50, 0), new ResourceShape(3, 0, 0, 0), null));

        assertTrue(candidates(SMALL).isEmpty());
    }

    @Test
    void claimRejectsStaleOrUnknownNode() {
        registry.register(registration("node-1", BIG_NODE));
        try (UnitOfWork tx = ctx.deps.database().begin()) {
            assertTrue(registry.claim(tx, "node-1", SMALL));
            assertFalse(registry.claim(tx, "ghost", SMALL));
        }
        ctx.clock.advance(Duration.ofMinutes(2));
        try (UnitOfWork tx = ctx.deps.database().begin()) {
            assertFalse(registry.claim(tx, "node-1", SMALL));
        }
    }

    @Test
    void removeNode() {
        registry.register(registration("node-1", BIG_NODE));
        registry.remove("node-1");

        assertThrows(NotFoundException.class, () -> registry.read("node-1"));
        assertTrue(ctx.nodesZone.lookup("node-1", RecordType.A).isEmpty());
        assertThrows(NotFoundException.class, () -> registry.remove("node-1"));
    }

    @Test
    void removeNodeWithWorkloads() {
        registry.register(registration("node-1", BIG_NODE));
        ctx.deps.tierCatalog().create("small", SMALL, 1);
        Account account = ctx.deps.accountService().create("acme", 100);
        ctx.deps.workloadService().create(account, new WorkloadSpec("web", SMALL, null, null));

        assertThrows(NodeBusyException.class, () -> registry.remove("node-1"));
        assertEquals(1, registry.list().size());
    }

    @Test
    void usageCountsActiveWorkloads() {
        registry.register(registration("node-1", BIG_NODE));
        ctx.deps.tierCatalog().create("small", SMALL, 1);
        Account account = ctx.deps.accountService().create("acme", 100);
        ctx.deps.workloadService().create(account, new WorkloadSpec("a", SMALL, null, null));
        ctx.deps.workloadService().create(account, new WorkloadSpec("b", SMALL, null, null));

        NodeUsage usage = registry.read("node-1");
        assertEquals(new ResourceShape(2, 2048, 20, 0), usage.used());
        assertEquals(BIG_NODE.minus(usage.used()), usage.free());
    }

    private List<NodeUsage> candidates(ResourceShape request) {
        try (UnitOfWork tx = ctx.deps.database().begin()) {
            return registry.findCandidates(tx, request);
        }
    }
}
