package org.dbmanager.api.batches;

/**
 * Determines how a script command is executed and what ends up in its result.
 */
public enum ExecutionType {
    /** All values of all rows, flattened row by row into one list. */
    READER,
    /** The first column of the first row, or {@code null} if there is no row. */
    SCALAR,
    /** The update count; {@code -1} if the statement produced a result set. */
    NON_QUERY
}
