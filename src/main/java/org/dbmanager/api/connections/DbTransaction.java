package org.dbmanager.api.connections;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * A transaction bound to its own connection.
 * <p>
 * The connection has auto-commit disabled for the lifetime of the transaction. Closing the
 * transaction rolls back uncommitted work, restores auto-commit and closes the connection.
 */
public class DbTransaction implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DbTransaction.class);

    private final Connection connection;
    private boolean completed;
    private boolean closed;

    /**
     * @param connection an open connection with auto-commit already disabled
     */
    public DbTransaction(Connection connection) {
        this.connection = Objects.requireNonNull(connection, "connection cannot be null");
    }

    public Connection getConnection() {
        return connection;
    }

    public boolean isCompleted() {
        return completed;
    }

    public void commit() throws SQLException {
        ensureActive();
        connection.commit();
        completed = true;
    }

    public void rollback() throws SQLException {
        ensureActive();
        connection.rollback();
        completed = true;
    }

    private void ensureActive() {
        if (closed || completed) {
            throw new IllegalStateException("Transaction has already been completed");
        }
    }

    @Override
    public void close() throws SQLException {
        if (closed) {
            return;
        }
        closed = true;
        try {
            if (!completed) {
                log.debug("Rolling back uncommitted transaction on close");
                connection.rollback();
            }
            connection.setAutoCommit(true);
        } finally {
            connection.close();
        }
    }
}
