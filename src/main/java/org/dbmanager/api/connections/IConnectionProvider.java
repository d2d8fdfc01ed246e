package org.dbmanager.api.connections;

import org.dbmanager.api.batches.IsolationLevel;

import java.sql.Connection;
import java.util.Optional;

/**
 * Opens connections and transactions to the managed database.
 * <p>
 * Failures are logged by the provider and reported as an empty {@link Optional}.
 * Returned resources are owned by the caller and must be closed by it.
 */
public interface IConnectionProvider extends AutoCloseable {

    /**
     * Prepares the provider for use (e.g. starts a pool). Calling it on an open provider is a no-op.
     */
    void open();

    Optional<Connection> createConnection(boolean readOnly);

    Optional<DbTransaction> createTransaction(boolean readOnly, IsolationLevel isolationLevel);

    /**
     * Releases the provider's resources. The provider can be re-opened afterwards.
     */
    @Override
    void close();
}
