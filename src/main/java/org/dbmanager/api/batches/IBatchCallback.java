package org.dbmanager.api.batches;

import org.dbmanager.api.connections.DbTransaction;

import java.sql.Connection;

/**
 * Code executed as a batch command.
 * <p>
 * A callback may report a failure either by throwing (the batch is aborted) or by calling
 * {@link BatchCommand#setError(String)} on the passed command and returning normally (the failure
 * is recorded and the batch continues).
 */
@FunctionalInterface
public interface IBatchCallback {

    /**
     * @param connection  the open connection the batch runs on
     * @param transaction the transaction the batch runs in, or {@code null} if it runs without one
     * @param command     the command being executed, for access to its parameters
     * @return the command result, may be {@code null}
     * @throws Exception any failure; aborts the batch
     */
    Object execute(Connection connection, DbTransaction transaction, BatchCommand command) throws Exception;
}
