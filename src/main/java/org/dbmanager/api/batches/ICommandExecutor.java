package org.dbmanager.api.batches;

import org.dbmanager.api.connections.DbTransaction;

import java.sql.Connection;

/**
 * Executes a single script or callback command on an open connection.
 */
public interface ICommandExecutor {

    /**
     * @param connection  the open connection
     * @param transaction the transaction owning {@code connection}, or {@code null}
     * @param command     a valid command (exactly one of script and callback set)
     * @return the result as defined by the command's {@link ExecutionType}
     * @throws Exception if execution fails
     */
    Object execute(Connection connection, DbTransaction transaction, BatchCommand command) throws Exception;
}
