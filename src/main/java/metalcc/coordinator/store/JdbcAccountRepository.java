package metalcc.coordinator.store;

import metalcc.coordinator.error.ConflictException;
import metalcc.coordinator.model.Account;
import metalcc.coordinator.repository.AccountRepository;

import java.sql.*;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static metalcc.coordinator.store.JdbcSupport.*;

/**
 * JDBC implementation of AccountRepository.
 */
public class JdbcAccountRepository implements AccountRepository {

    @Override
    public void insert(UnitOfWork tx, Account account) {
        String sql = """
                    INSERT INTO accounts (id, name, api_token, credits, created_at)
                    VALUES (?, ?, ?, ?, ?)
                """;

        try (PreparedStatement ps = tx.connection().prepareStatement(sql)) {
            ps.setString(1, account.id());
            ps.setString(2, account.name());
            ps.setString(3, account.apiToken());
            ps.setLong(4, account.credits());
            setTimestamp(ps, 5, account.createdAt());
            ps.executeUpdate();
        } catch (SQLException e) {
            if (isUniqueViolation(e)) {
                throw new ConflictException("account already exists: " + account.name(), e);
            }
            throw new RuntimeException("Failed to insert account: " + account.id(), e);
        }
    }

    @Override
    public Optional<Account> findById(UnitOfWork tx, String accountId) {
        return findOne(tx, "SELECT * FROM accounts WHERE id = ?", accountId);
    }

    @Override
    public Optional<Account> findByIdForUpdate(UnitOfWork tx, String accountId) {
        return findOne(tx, "SELECT * FROM accounts WHERE id = ? FOR UPDATE", accountId);
    }

    @Override
    public Optional<Account> findByApiToken(UnitOfWork tx, String apiToken) {
        return findOne(tx, "SELECT * FROM accounts WHERE api_token = ?", apiToken);
    }

    @Override
    public List<Account> findAll(UnitOfWork tx) {
        String sql = "SELECT * FROM accounts ORDER BY created_at, name";

        try (Statement st = tx.connection().createStatement();
                ResultSet rs = st.executeQuery(sql)) {
            List<Account> accounts = new ArrayList<>();
            while (rs.next()) {
                accounts.add(mapRow(rs));
            }
            return accounts;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find all accounts", e);
        }
    }

    @Override
    public boolean updateCredits(UnitOfWork tx, String accountId, long credits) {
        String sql = "UPDATE accounts SET credits = ? WHERE id = ?";

        try (PreparedStatement ps = tx.connection().prepareStatement(sql)) {
            ps.setLong(1, credits);
            ps.setString(2, accountId);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update credits for account: " + accountId, e);
        }
    }

    private Optional<Account> findOne(UnitOfWork tx, String sql, String key) {
        try (PreparedStatement ps = tx.connection().prepareStatement(sql)) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find account", e);
        }
    }

    private Account mapRow(ResultSet rs) throws SQLException {
        return Account.builder()
                .id(rs.getString("id"))
                .name(rs.getString("name"))
                .apiToken(rs.getString("api_token"))
                .credits(rs.getLong("credits"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .build();
    }
}
