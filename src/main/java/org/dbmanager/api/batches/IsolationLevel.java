package org.dbmanager.api.batches;

import java.sql.Connection;

/**
 * Transaction isolation levels a batch command can request, mapped to the JDBC constants.
 */
public enum IsolationLevel {
    READ_UNCOMMITTED(Connection.TRANSACTION_READ_UNCOMMITTED),
    READ_COMMITTED(Connection.TRANSACTION_READ_COMMITTED),
    REPEATABLE_READ(Connection.TRANSACTION_REPEATABLE_READ),
    SERIALIZABLE(Connection.TRANSACTION_SERIALIZABLE);

    private final int jdbcLevel;

    IsolationLevel(int jdbcLevel) {
        this.jdbcLevel = jdbcLevel;
    }

    /**
     * @return the matching {@code Connection.TRANSACTION_*} constant
     */
    public int toJdbcLevel() {
        return jdbcLevel;
    }
}
