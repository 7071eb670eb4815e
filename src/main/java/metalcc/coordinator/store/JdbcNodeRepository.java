package metalcc.coordinator.store;

import metalcc.coordinator.model.Node;
import metalcc.coordinator.model.NodeUsage;
import metalcc.coordinator.model.ResourceShape;
import metalcc.coordinator.repository.NodeRepository;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static metalcc.coordinator.store.JdbcSupport.*;

/**
 * JDBC implementation of NodeRepository.
 *
 * <p>
 * All capacity reads go through one aggregate: every node joined with the
 * resources of its non-stopped workloads.
 */
public class JdbcNodeRepository implements NodeRepository {

    private static final String USAGE_SELECT = """
                SELECT n.*,
                       COALESCE(u.used_cpus, 0)      AS used_cpus,
                       COALESCE(u.used_memory_mb, 0) AS used_memory_mb,
                       COALESCE(u.used_disk_gb, 0)   AS used_disk_gb,
                       COALESCE(u.used_gpus, 0)      AS used_gpus
                FROM nodes n
                LEFT JOIN (
                    SELECT node_id,
                           SUM(cpus)      AS used_cpus,
                           SUM(memory_mb) AS used_memory_mb,
                           SUM(disk_gb)   AS used_disk_gb,
                           SUM(gpus)      AS used_gpus
                    FROM workloads
                    WHERE status <> 'STOPPED'
                    GROUP BY node_id
                ) u ON u.node_id = n.id
            """;

    @Override
    public void upsert(UnitOfWork tx, Node node) {
        String updateSql = """
                    UPDATE nodes
                    SET hostname = ?, public_ip = ?, token = ?, agent_version = ?,
                        total_cpus = ?, reserved_cpus = ?, total_memory_mb = ?, reserved_memory_mb = ?,
                        total_disk_gb = ?, reserved_disk_gb = ?, gpus = ?, gpu_model = ?,
                        last_seen_at = ?, updated_at = ?
                    WHERE id = ?
                """;

        String insertSql = """
                    INSERT INTO nodes (hostname, public_ip, token, agent_version,
                        total_cpus, reserved_cpus, total_memory_mb, reserved_memory_mb,
                        total_disk_gb, reserved_disk_gb, gpus, gpu_model,
                        last_seen_at, updated_at, id, created_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        Connection conn = tx.connection();
        try {
            // Try UPDATE first
            try (PreparedStatement ps = conn.prepareStatement(updateSql)) {
                bindAttributes(ps, node);
                if (ps.executeUpdate() > 0) {
                    return;
                }
            }

            try (PreparedStatement ps = conn.prepareStatement(insertSql)) {
                bindAttributes(ps, node);
                setTimestamp(ps, 16, node.createdAt());
                ps.executeUpdate();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save node: " + node.id(), e);
        }
    }

    /** Binds parameters 1..15, shared by the update and insert statements. */
    private void bindAttributes(PreparedStatement ps, Node node) throws SQLException {
        ps.setString(1, node.hostname());
        ps.setString(2, node.publicIp());
        ps.setString(3, node.token());
        ps.setString(4, node.agentVersion());
        ps.setInt(5, node.total().cpus());
        ps.setInt(6, node.reserved().cpus());
        ps.setInt(7, node.total().memoryMb());
        ps.setInt(8, node.reserved().memoryMb());
        ps.setInt(9, node.total().diskGb());
        ps.setInt(10, node.reserved().diskGb());
        ps.setInt(11, node.total().gpus());
        ps.setString(12, node.gpuModel());
        setTimestamp(ps, 13, node.lastSeenAt());
        setTimestamp(ps, 14, node.updatedAt());
        ps.setString(15, node.id());
    }

    @Override
    public Optional<Node> findById(UnitOfWork tx, String nodeId) {
        return findOne(tx, "SELECT * FROM nodes WHERE id = ?", nodeId);
    }

    @Override
    public Optional<Node> lockById(UnitOfWork tx, String nodeId) {
        return findOne(tx, "SELECT * FROM nodes WHERE id = ? FOR UPDATE", nodeId);
    }

    @Override
    public List<Node> findAll(UnitOfWork tx) {
        String sql = "SELECT * FROM nodes ORDER BY id";

        try (Statement st = tx.connection().createStatement();
                ResultSet rs = st.executeQuery(sql)) {
            List<Node> nodes = new ArrayList<>();
            while (rs.next()) {
                nodes.add(mapNode(rs));
            }
            return nodes;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find all nodes", e);
        }
    }

    @Override
    public boolean touch(UnitOfWork tx, String nodeId, Instant seenAt) {
        String sql = "UPDATE nodes SET last_seen_at = ? WHERE id = ?";

        try (PreparedStatement ps = tx.connection().prepareStatement(sql)) {
            setTimestamp(ps, 1, seenAt);
            ps.setString(2, nodeId);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update heartbeat for node: " + nodeId, e);
        }
    }

    @Override
    public boolean delete(UnitOfWork tx, String nodeId) {
        try (PreparedStatement ps = tx.connection().prepareStatement("DELETE FROM nodes WHERE id = ?")) {
            ps.setString(1, nodeId);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete node: " + nodeId, e);
        }
    }

    @Override
    public Optional<NodeUsage> findUsage(UnitOfWork tx, String nodeId) {
        String sql = USAGE_SELECT + " WHERE n.id = ?";

        try (PreparedStatement ps = tx.connection().prepareStatement(sql)) {
            ps.setString(1, nodeId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapUsage(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to compute usage for node: " + nodeId, e);
        }
    }

    @Override
    public List<NodeUsage> findAllUsage(UnitOfWork tx) {
        String sql = USAGE_SELECT + " ORDER BY n.id";

        try (Statement st = tx.connection().createStatement();
                ResultSet rs = st.executeQuery(sql)) {
            return mapUsages(rs);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to compute node usage", e);
        }
    }

    @Override
    public List<NodeUsage> findWithFreeResources(UnitOfWork tx, ResourceShape request, Instant aliveSince) {
        String sql = USAGE_SELECT + """
                 WHERE n.last_seen_at >= ?
                   AND n.total_cpus - n.reserved_cpus - COALESCE(u.used_cpus, 0) > ?
                   AND n.total_memory_mb - n.reserved_memory_mb - COALESCE(u.used_memory_mb, 0) > ?
                   AND n.total_disk_gb - n.reserved_disk_gb - COALESCE(u.used_disk_gb, 0) > ?
                   AND n.gpus - COALESCE(u.used_gpus, 0) >= ?
                 ORDER BY n.id
                """;

        try (PreparedStatement ps = tx.connection().prepareStatement(sql)) {
            setTimestamp(ps, 1, aliveSince);
            ps.setInt(2, request.cpus());
            ps.setInt(3, request.memoryMb());
            ps.setInt(4, request.diskGb());
            ps.setInt(5, request.gpus());
            try (ResultSet rs = ps.executeQuery()) {
                return mapUsages(rs);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find nodes with free resources for " + request, e);
        }
    }

    private Optional<Node> findOne(UnitOfWork tx, String sql, String nodeId) {
        try (PreparedStatement ps = tx.connection().prepareStatement(sql)) {
            ps.setString(1, nodeId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapNode(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find node: " + nodeId, e);
        }
    }

    private List<NodeUsage> mapUsages(ResultSet rs) throws SQLException {
        List<NodeUsage> usages = new ArrayList<>();
        while (rs.next()) {
            usages.add(mapUsage(rs));
        }
        return usages;
    }

    private NodeUsage mapUsage(ResultSet rs) throws SQLException {
        ResourceShape used = new ResourceShape(
                rs.getInt("used_cpus"),
                rs.getInt("used_memory_mb"),
                rs.getInt("used_disk_gb"),
                rs.getInt("used_gpus"));
        return new NodeUsage(mapNode(rs), used);
    }

    private Node mapNode(ResultSet rs) throws SQLException {
        int gpus = rs.getInt("gpus");
        return Node.builder()
                .id(rs.getString("id"))
                .hostname(rs.getString("hostname"))
                .publicIp(rs.getString("public_ip"))
                .token(rs.getString("token"))
                .agentVersion(rs.getString("agent_version"))
                .total(new ResourceShape(
                        rs.getInt("total_cpus"),
                        rs.getInt("total_memory_mb"),
                        rs.getInt("total_disk_gb"),
                        gpus))
                .reserved(new ResourceShape(
                        rs.getInt("reserved_cpus"),
                        rs.getInt("reserved_memory_mb"),
                        rs.getInt("reserved_disk_gb"),
                        0))
                .gpuModel(rs.getString("gpu_model"))
                .lastSeenAt(toInstant(rs.getTimestamp("last_seen_at")))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .build();
    }
}
