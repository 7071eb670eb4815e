package metalcc.coordinator.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import metalcc.coordinator.config.CoordinatorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling.
 */
public final class Database implements TransactionManager, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(CoordinatorConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(2);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("metalcc-db-pool");
        hikariConfig.setAutoCommit(false);
        // Capacity and credit checks re-read under row locks, so they need to see
        // everything committed before the lock was granted.
        hikariConfig.setTransactionIsolation("TRANSACTION_READ_COMMITTED");

        // H2 specific settings
        if (jdbcUrl.contains("h2:")) {
            hikariConfig.addDataSourceProperty("MODE", "PostgreSQL");
        }

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool initialized: {}", jdbcUrl);

        initSchema();
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    @Override
    public UnitOfWork begin() {
        try {
            return new UnitOfWork(getConnection());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to begin transaction", e);
        }
    }

    /**
     * Check if database is healthy.
     */
    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- ACCOUNTS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS accounts (
                            id              VARCHAR(64) PRIMARY KEY,
                            name            VARCHAR(256) NOT NULL,
                            api_token       VARCHAR(128) NOT NULL,
                            credits         BIGINT NOT NULL DEFAULT 0,
                            created_at      TIMESTAMP NOT NULL,
                            CONSTRAINT uq_accounts_name UNIQUE (name),
                            CONSTRAINT uq_accounts_token UNIQUE (api_token),
                            CONSTRAINT ck_accounts_credits CHECK (credits >= 0)
                        );
                    """);

            // ---------- NODES ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS nodes (
                            id                  VARCHAR(64) PRIMARY KEY,
                            hostname            VARCHAR(256) NOT NULL,
                            public_ip           VARCHAR(64) NOT NULL,
                            token               VARCHAR(256) NOT NULL,
                            agent_version       VARCHAR(64),
                            total_cpus          INT NOT NULL,
                            reserved_cpus       INT NOT NULL DEFAULT 0,
                            total_memory_mb     INT NOT NULL,
                            reserved_memory_mb  INT NOT NULL DEFAULT 0,
                            total_disk_gb       INT NOT NULL,
                            reserved_disk_gb    INT NOT NULL DEFAULT 0,
                            gpus                INT NOT NULL DEFAULT 0,
                            gpu_model           VARCHAR(128),
                            last_seen_at        TIMESTAMP NOT NULL,
                            created_at          TIMESTAMP NOT NULL,
                            updated_at          TIMESTAMP NOT NULL
                        );
                    """);

            // ---------- TIERS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS tiers (
                            id              VARCHAR(64) PRIMARY KEY,
                            name            VARCHAR(128) NOT NULL,
                            cpus            INT NOT NULL,
                            memory_mb       INT NOT NULL,
                            disk_gb         INT NOT NULL,
                            gpus            INT NOT NULL DEFAULT 0,
                            cost            BIGINT NOT NULL,
                            CONSTRAINT uq_tiers_name UNIQUE (name),
                            CONSTRAINT uq_tiers_shape UNIQUE (cpus, memory_mb, disk_gb, gpus)
                        );
                    """);

            // ---------- WORKLOADS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS workloads (
                            id              VARCHAR(64) PRIMARY KEY,
                            name            VARCHAR(256) NOT NULL,
                            account_id      VARCHAR(64) NOT NULL REFERENCES accounts(id),
                            node_id         VARCHAR(64) NOT NULL REFERENCES nodes(id),
                            cpus            INT NOT NULL,
                            memory_mb       INT NOT NULL,
                            disk_gb         INT NOT NULL,
                            gpus            INT NOT NULL DEFAULT 0,
                            credit_rate     BIGINT NOT NULL,
                            status          VARCHAR(20) NOT NULL DEFAULT 'SCHEDULED',
                            domain          VARCHAR(256) NOT NULL,
                            managed_domain  BOOLEAN NOT NULL DEFAULT TRUE,
                            payload         CLOB NOT NULL,
                            created_at      TIMESTAMP NOT NULL,
                            updated_at      TIMESTAMP NOT NULL,
                            CONSTRAINT uq_workloads_domain UNIQUE (domain)
                        );
                    """);

            // ---------- WORKLOAD EVENTS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS workload_events (
                            seq             BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            id              VARCHAR(64) NOT NULL,
                            workload_id     VARCHAR(64) NOT NULL REFERENCES workloads(id) ON DELETE CASCADE,
                            kind            VARCHAR(32) NOT NULL,
                            detail          VARCHAR(4096),
                            occurred_at     TIMESTAMP NOT NULL,
                            CONSTRAINT uq_workload_events_id UNIQUE (id)
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_workloads_node_status ON workloads(node_id, status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_workloads_account_status ON workloads(account_id, status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_nodes_last_seen ON nodes(last_seen_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_events_workload_time ON workload_events(workload_id, occurred_at);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize database schema", e);
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Database pool closed");
        }
    }
}
