package metalcc.coordinator.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * One database transaction, passed explicitly to every repository call that must
 * see or produce the same state. Row locks taken through it are held until
 * {@link #commit()} or {@link #close()}.
 */
public final class UnitOfWork implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(UnitOfWork.class);

    private final Connection connection;
    private boolean committed;
    private boolean closed;

    public UnitOfWork(Connection connection) {
        this.connection = connection;
    }

    public Connection connection() {
        if (closed) {
            throw new IllegalStateException("unit of work already closed");
        }
        return connection;
    }

    public void commit() {
        try {
            connection().commit();
            committed = true;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to commit transaction", e);
        }
    }

    public boolean isCommitted() {
        return committed;
    }

    /**
     * Roll back unless committed, then return the connection to the pool.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            if (!committed) {
                connection.rollback();
                log.debug("Transaction rolled back");
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to roll back transaction", e);
        } finally {
            try {
                connection.close();
            } catch (SQLException e) {
                log.warn("Failed to release connection: {}", e.getMessage());
            }
        }
    }
}
