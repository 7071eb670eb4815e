package metalcc.coordinator.store;

import metalcc.coordinator.error.ConflictException;
import metalcc.coordinator.model.ResourceShape;
import metalcc.coordinator.model.Workload;
import metalcc.coordinator.model.WorkloadStatus;
import metalcc.coordinator.repository.WorkloadRepository;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static metalcc.coordinator.store.JdbcSupport.*;

/**
 * JDBC implementation of WorkloadRepository.
 */
public class JdbcWorkloadRepository implements WorkloadRepository {

    @Override
    public void insert(UnitOfWork tx, Workload workload) {
        String sql = """
                    INSERT INTO workloads (id, name, account_id, node_id, cpus, memory_mb, disk_gb, gpus,
                        credit_rate, status, domain, managed_domain, payload, created_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (PreparedStatement ps = tx.connection().prepareStatement(sql)) {
            ps.setString(1, workload.id());
            ps.setString(2, workload.name());
            ps.setString(3, workload.accountId());
            ps.setString(4, workload.nodeId());
            ps.setInt(5, workload.shape().cpus());
            ps.setInt(6, workload.shape().memoryMb());
            ps.setInt(7, workload.shape().diskGb());
            ps.setInt(8, workload.shape().gpus());
            ps.setLong(9, workload.creditRate());
            ps.setString(10, workload.status().name());
            ps.setString(11, workload.domain());
            ps.setBoolean(12, workload.managedDomain());
            ps.setString(13, workload.payload());
            setTimestamp(ps, 14, workload.createdAt());
            setTimestamp(ps, 15, workload.updatedAt());
            ps.executeUpdate();
        } catch (SQLException e) {
            if (isUniqueViolation(e)) {
                throw new ConflictException("domain already in use: " + workload.domain(), e);
            }
            throw new RuntimeException("Failed to insert workload: " + workload.id(), e);
        }
    }

    @Override
    public Optional<Workload> findById(UnitOfWork tx, String workloadId) {
        return findOne(tx, "SELECT * FROM workloads WHERE id = ?", workloadId);
    }

    @Override
    public Optional<Workload> findByIdForUpdate(UnitOfWork tx, String workloadId) {
        return findOne(tx, "SELECT * FROM workloads WHERE id = ? FOR UPDATE", workloadId);
    }

    @Override
    public List<Workload> findByAccount(UnitOfWork tx, String accountId) {
        return findMany(tx, "SELECT * FROM workloads WHERE account_id = ? ORDER BY created_at", accountId);
    }

    @Override
    public List<Workload> findActive(UnitOfWork tx) {
        String sql = "SELECT * FROM workloads WHERE status <> 'STOPPED' ORDER BY account_id, created_at";

        try (Statement st = tx.connection().createStatement();
                ResultSet rs = st.executeQuery(sql)) {
            return mapRows(rs);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find active workloads", e);
        }
    }

    @Override
    public List<Workload> findActiveByAccount(UnitOfWork tx, String accountId) {
        return findMany(tx,
                "SELECT * FROM workloads WHERE account_id = ? AND status <> 'STOPPED' ORDER BY created_at",
                accountId);
    }

    @Override
    public long sumActiveCreditRate(UnitOfWork tx, String accountId) {
        String sql = "SELECT COALESCE(SUM(credit_rate), 0) FROM workloads WHERE account_id = ? AND status <> 'STOPPED'";

        try (PreparedStatement ps = tx.connection().prepareStatement(sql)) {
            ps.setString(1, accountId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to sum credit rate for account: " + accountId, e);
        }
    }

    @Override
    public int countByNode(UnitOfWork tx, String nodeId) {
        try (PreparedStatement ps = tx.connection().prepareStatement(
                "SELECT COUNT(*) FROM workloads WHERE node_id = ?")) {
            ps.setString(1, nodeId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count workloads on node: " + nodeId, e);
        }
    }

    @Override
    public boolean updateStatus(UnitOfWork tx, String workloadId, WorkloadStatus status, Instant updatedAt) {
        String sql = "UPDATE workloads SET status = ?, updated_at = ? WHERE id = ?";

        try (PreparedStatement ps = tx.connection().prepareStatement(sql)) {
            ps.setString(1, status.name());
            setTimestamp(ps, 2, updatedAt);
            ps.setString(3, workloadId);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update status of workload: " + workloadId, e);
        }
    }

    @Override
    public boolean delete(UnitOfWork tx, String workloadId) {
        try (PreparedStatement ps = tx.connection().prepareStatement("DELETE FROM workloads WHERE id = ?")) {
            ps.setString(1, workloadId);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete workload: " + workloadId, e);
        }
    }

    private Optional<Workload> findOne(UnitOfWork tx, String sql, String key) {
        List<Workload> rows = findMany(tx, sql, key);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    private List<Workload> findMany(UnitOfWork tx, String sql, String key) {
        try (PreparedStatement ps = tx.connection().prepareStatement(sql)) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                return mapRows(rs);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to query workloads by " + key, e);
        }
    }

    private List<Workload> mapRows(ResultSet rs) throws SQLException {
        List<Workload> workloads = new ArrayList<>();
        while (rs.next()) {
            workloads.add(mapRow(rs));
        }
        return workloads;
    }

    private Workload mapRow(ResultSet rs) throws SQLException {
        return Workload.builder()
                .id(rs.getString("id"))
                .name(rs.getString("name"))
                .accountId(rs.getString("account_id"))
                .nodeId(rs.getString("node_id"))
                .shape(new ResourceShape(
                        rs.getInt("cpus"),
                        rs.getInt("memory_mb"),
                        rs.getInt("disk_gb"),
                        rs.getInt("gpus")))
                .creditRate(rs.getLong("credit_rate"))
                .status(WorkloadStatus.valueOf(rs.getString("status")))
                .domain(rs.getString("domain"))
                .managedDomain(rs.getBoolean("managed_domain"))
                .payload(rs.getString("payload"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .build();
    }
}
