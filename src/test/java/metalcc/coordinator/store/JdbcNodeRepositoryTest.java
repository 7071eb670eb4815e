package metalcc.coordinator.store;

import metalcc.coordinator.model.Account;
import metalcc.coordinator.model.Node;
import metalcc.coordinator.model.NodeUsage;
import metalcc.coordinator.model.ResourceShape;
import metalcc.coordinator.model.Workload;
import metalcc.coordinator.model.WorkloadStatus;
import org.junit.jupiter.api.*;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JdbcNodeRepositoryTest {

    private static final Instant NOW = Instant.parse("2026-01-01T12:00:00Z");

    private static Database db;
    private static JdbcNodeRepository nodes;
    private static JdbcWorkloadRepository workloads;
    private static JdbcAccountRepository accounts;

    @BeforeAll
    static void setup() {
        // Use in-memory H2 for tests
        db = new Database("jdbc:h2:mem:test-nodes;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 4);
        nodes = new JdbcNodeRepository();
        workloads = new JdbcWorkloadRepository();
        accounts = new JdbcAccountRepository();
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void clean() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM workload_events");
            st.execute("DELETE FROM workloads");
            st.execute("DELETE FROM nodes");
            st.execute("DELETE FROM accounts");
            conn.commit();
        }
        try (UnitOfWork tx = db.begin()) {
            accounts.insert(tx, Account.builder().id("acc").name("acme").apiToken("tok").credits(10).createdAt(NOW).build());
            tx.commit();
        }
    }

    @Test
    void upsertInsertsThenUpdates() {
        try (UnitOfWork tx = db.begin()) {
            nodes.upsert(tx, node("n1", new ResourceShape(8, 8192, 100, 0), NOW));
            nodes.upsert(tx, node("n1", new ResourceShape(16, 8192, 100, 2), NOW).toBuilder().hostname("renamed").build());
            tx.commit();
        }

        try (UnitOfWork tx = db.begin()) {
            List<Node> all = nodes.findAll(tx);
            assertEquals(1, all.size());
            assertEquals("renamed", all.get(0).hostname());
            assertEquals(new ResourceShape(16, 8192, 100, 2), all.get(0).total());
            assertEquals(NOW, all.get(0).lastSeenAt());
        }
    }

    @Test
    void usageIgnoresStoppedWorkloads() {
        try (UnitOfWork tx = db.begin()) {
            nodes.upsert(tx, node("n1", new ResourceShape(8, 8192, 100, 0), NOW));
            workloads.insert(tx, workload("w1", "n1", WorkloadStatus.RUNNING));
            workloads.insert(tx, workload("w2", "n1", WorkloadStatus.STARTING));
            workloads.insert(tx, workload("w3", "n1", WorkloadStatus.STOPPED));
            tx.commit();
        }

        try (UnitOfWork tx = db.begin()) {
            NodeUsage usage = nodes.findUsage(tx, "n1").orElseThrow();
            assertEquals(new ResourceShape(4, 4096, 40, 0), usage.used());
            assertEquals(new ResourceShape(4, 4096, 60, 0), usage.free());
        }
    }

    @Test
    void freeResourceQuery() {
        try (UnitOfWork tx = db.begin()) {
            nodes.upsert(tx, node("full", new ResourceShape(4, 4096, 100, 0), NOW));
            nodes.upsert(tx, node("roomy", new ResourceShape(8, 8192, 100, 0), NOW));
            nodes.upsert(tx, node("stale", new ResourceShape(64, 65536, 1000, 0), NOW.minusSeconds(600)));
            workloads.insert(tx, workload("w1", "full", WorkloadStatus.RUNNING));
            tx.commit();
        }

        try (UnitOfWork tx = db.begin()) {
            List<NodeUsage> found = nodes.findWithFreeResources(tx, new ResourceShape(2, 2048, 20, 0),
                    NOW.minusSeconds(60));
            assertEquals(List.of("roomy"), found.stream().map(u -> u.node().id()).toList());
        }
    }

    @Test
    void touchAndDelete() {
        try (UnitOfWork tx = db.begin()) {
            nodes.upsert(tx, node("n1", new ResourceShape(8, 8192, 100, 0), NOW));
            assertTrue(nodes.touch(tx, "n1", NOW.plusSeconds(30)));
            assertFalse(nodes.touch(tx, "ghost", NOW));
            assertEquals(NOW.plusSeconds(30), nodes.findById(tx, "n1").orElseThrow().lastSeenAt());

            assertTrue(nodes.delete(tx, "n1"));
            assertTrue(nodes.lockById(tx, "n1").isEmpty());
        }
    }

    private static Node node(String id, ResourceShape total, Instant lastSeen) {
        return Node.builder()
                .id(id)
                .hostname(id + ".local")
                .publicIp("10.0.0.1")
                .token("t")
                .agentVersion("1.0")
                .total(total)
                .reserved(ResourceShape.ZERO)
                .lastSeenAt(lastSeen)
                .createdAt(NOW)
                .updatedAt(NOW)
                .build();
    }

    private static Workload workload(String id, String nodeId, WorkloadStatus status) {
        return Workload.builder()
                .id(id)
                .name(id)
                .accountId("acc")
                .nodeId(nodeId)
                .shape(new ResourceShape(2, 2048, 20, 0))
                .creditRate(1)
                .status(status)
                .domain(id + ".workloads.test")
                .managedDomain(true)
                .payload("{}")
                .createdAt(NOW)
                .updatedAt(NOW)
                .build();
    }
}
