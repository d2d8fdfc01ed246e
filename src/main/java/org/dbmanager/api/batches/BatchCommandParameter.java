package org.dbmanager.api.batches;

import java.sql.JDBCType;
import java.util.Objects;

/**
 * A named, optionally typed value bound to a script command.
 * <p>
 * Scripts reference parameters as {@code :name}. A {@code null} type lets the driver infer it.
 *
 * @param name  the parameter name without the leading colon
 * @param type  the JDBC type used for binding, may be {@code null}
 * @param value the value, may be {@code null}
 */
public record BatchCommandParameter(String name, JDBCType type, Object value) {

    public BatchCommandParameter {
        Objects.requireNonNull(name, "name cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Parameter name cannot be blank");
        }
    }

    public BatchCommandParameter(String name, Object value) {
        this(name, null, value);
    }
}
