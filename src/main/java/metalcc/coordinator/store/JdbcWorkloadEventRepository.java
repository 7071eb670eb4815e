package metalcc.coordinator.store;

import metalcc.coordinator.model.WorkloadEvent;
import metalcc.coordinator.model.WorkloadEventKind;
import metalcc.coordinator.repository.WorkloadEventRepository;

import java.sql.*;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static metalcc.coordinator.store.JdbcSupport.*;

/**
 * JDBC implementation of WorkloadEventRepository.
 * Ordering is by event timestamp, then by insertion sequence.
 */
public class JdbcWorkloadEventRepository implements WorkloadEventRepository {

    @Override
    public void append(UnitOfWork tx, WorkloadEvent event) {
        String sql = """
                    INSERT INTO workload_events (id, workload_id, kind, detail, occurred_at)
                    VALUES (?, ?, ?, ?, ?)
                """;

        try (PreparedStatement ps = tx.connection().prepareStatement(sql)) {
            ps.setString(1, event.id());
            ps.setString(2, event.workloadId());
            ps.setString(3, event.kind().name());
            ps.setString(4, event.detail());
            setTimestamp(ps, 5, event.timestamp());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to append event for workload: " + event.workloadId(), e);
        }
    }

    @Override
    public boolean exists(UnitOfWork tx, WorkloadEvent event) {
        String sql = "SELECT 1 FROM workload_events WHERE workload_id = ? AND kind = ? AND occurred_at = ?"
                + (event.detail() == null ? " AND detail IS NULL" : " AND detail = ?");

        try (PreparedStatement ps = tx.connection().prepareStatement(sql)) {
            ps.setString(1, event.workloadId());
            ps.setString(2, event.kind().name());
            setTimestamp(ps, 3, event.timestamp());
            if (event.detail() != null) {
                ps.setString(4, event.detail());
            }
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to look up event for workload: " + event.workloadId(), e);
        }
    }

    @Override
    public List<WorkloadEvent> findByWorkload(UnitOfWork tx, String workloadId) {
        String sql = "SELECT * FROM workload_events WHERE workload_id = ? ORDER BY occurred_at, seq";

        try (PreparedStatement ps = tx.connection().prepareStatement(sql)) {
            ps.setString(1, workloadId);
            try (ResultSet rs = ps.executeQuery()) {
                List<WorkloadEvent> events = new ArrayList<>();
                while (rs.next()) {
                    events.add(mapRow(rs));
                }
                return events;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find events for workload: " + workloadId, e);
        }
    }

    @Override
    public Optional<WorkloadEvent> findLatestStatusEvent(UnitOfWork tx, String workloadId) {
        String sql = """
                    SELECT * FROM workload_events
                    WHERE workload_id = ? AND kind <> 'WARNING'
                    ORDER BY occurred_at DESC, seq DESC
                    LIMIT 1
                """;

        try (PreparedStatement ps = tx.connection().prepareStatement(sql)) {
            ps.setString(1, workloadId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find latest event for workload: " + workloadId, e);
        }
    }

    private WorkloadEvent mapRow(ResultSet rs) throws SQLException {
        return new WorkloadEvent(
                rs.getString("id"),
                rs.getString("workload_id"),
                WorkloadEventKind.valueOf(rs.getString("kind")),
                rs.getString("detail"),
                toInstant(rs.getTimestamp("occurred_at")));
    }
}
