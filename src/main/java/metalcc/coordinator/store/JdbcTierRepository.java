package metalcc.coordinator.store;

import metalcc.coordinator.error.ConflictException;
import metalcc.coordinator.model.ResourceShape;
import metalcc.coordinator.model.Tier;
import metalcc.coordinator.repository.TierRepository;

import java.sql.*;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static metalcc.coordinator.store.JdbcSupport.isUniqueViolation;

/**
 * JDBC implementation of TierRepository.
 */
public class JdbcTierRepository implements TierRepository {

    @Override
    public void insert(UnitOfWork tx, Tier tier) {
        String sql = """
                    INSERT INTO tiers (id, name, cpus, memory_mb, disk_gb, gpus, cost)
                    VALUES (?, ?, ?, ?, ?, ?, ?)
                """;

        try (PreparedStatement ps = tx.connection().prepareStatement(sql)) {
            ps.setString(1, tier.id());
            ps.setString(2, tier.name());
            ps.setInt(3, tier.shape().cpus());
            ps.setInt(4, tier.shape().memoryMb());
            ps.setInt(5, tier.shape().diskGb());
            ps.setInt(6, tier.shape().gpus());
            ps.setLong(7, tier.cost());
            ps.executeUpdate();
        } catch (SQLException e) {
            if (isUniqueViolation(e)) {
                throw new ConflictException("tier name or shape already exists: " + tier.name(), e);
            }
            throw new RuntimeException("Failed to insert tier: " + tier.id(), e);
        }
    }

    @Override
    public Optional<Tier> findById(UnitOfWork tx, String tierId) {
        String sql = "SELECT * FROM tiers WHERE id = ?";

        try (PreparedStatement ps = tx.connection().prepareStatement(sql)) {
            ps.setString(1, tierId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find tier: " + tierId, e);
        }
    }

    @Override
    public Optional<Tier> findByShape(UnitOfWork tx, ResourceShape shape) {
        String sql = "SELECT * FROM tiers WHERE cpus = ? AND memory_mb = ? AND disk_gb = ? AND gpus = ?";

        try (PreparedStatement ps = tx.connection().prepareStatement(sql)) {
            ps.setInt(1, shape.cpus());
            ps.setInt(2, shape.memoryMb());
            ps.setInt(3, shape.diskGb());
            ps.setInt(4, shape.gpus());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find tier for shape: " + shape, e);
        }
    }

    @Override
    public List<Tier> findAll(UnitOfWork tx) {
        String sql = "SELECT * FROM tiers ORDER BY cost, name";

        try (Statement st = tx.connection().createStatement();
                ResultSet rs = st.executeQuery(sql)) {
            List<Tier> tiers = new ArrayList<>();
            while (rs.next()) {
                tiers.add(mapRow(rs));
            }
            return tiers;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find all tiers", e);
        }
    }

    @Override
    public boolean delete(UnitOfWork tx, String tierId) {
        try (PreparedStatement ps = tx.connection().prepareStatement("DELETE FROM tiers WHERE id = ?")) {
            ps.setString(1, tierId);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete tier: " + tierId, e);
        }
    }

    private Tier mapRow(ResultSet rs) throws SQLException {
        ResourceShape shape = new ResourceShape(
                rs.getInt("cpus"),
                rs.getInt("memory_mb"),
                rs.getInt("disk_gb"),
                rs.getInt("gpus"));
        return new Tier(rs.getString("id"), rs.getString("name"), shape, rs.getLong("cost"));
    }
}
