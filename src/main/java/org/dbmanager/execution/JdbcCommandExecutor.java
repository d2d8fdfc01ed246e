package org.dbmanager.execution;

import org.dbmanager.api.batches.BatchCommand;
import org.dbmanager.api.batches.BatchCommandParameter;
import org.dbmanager.api.batches.ICommandExecutor;
import org.dbmanager.api.connections.DbTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Executes batch commands through plain JDBC.
 * <p>
 * Scripts run as prepared statements with {@code :name} parameters bound from the command's
 * parameter set. The result depends on the command's execution type:
 * <ul>
 *   <li>{@code READER}: all values of all rows, flattened into one list</li>
 *   <li>{@code SCALAR}: first column of the first row, or {@code null}</li>
 *   <li>{@code NON_QUERY}: the update count, {@code -1} for statements returning rows</li>
 * </ul>
 * Callbacks are invoked with the connection, the transaction (if any) and the command.
 */
public class JdbcCommandExecutor implements ICommandExecutor {

    private static final Logger log = LoggerFactory.getLogger(JdbcCommandExecutor.class);

    @Override
    public Object execute(Connection connection, DbTransaction transaction, BatchCommand command) throws Exception {
        if (command.isCallback()) {
            return command.getCallback().execute(connection, transaction, command);
        }
        return executeScript(connection, command);
    }

    private Object executeScript(Connection connection, BatchCommand command) throws SQLException {
        NamedParameterSql parsed = NamedParameterSql.parse(command.getScript());
        try (PreparedStatement statement = connection.prepareStatement(parsed.sql())) {
            bindParameters(statement, parsed, command);
            boolean hasResultSet = statement.execute();

            return switch (command.getExecutionType()) {
                case READER -> hasResultSet ? readAll(statement.getResultSet()) : new ArrayList<>();
                case SCALAR -> hasResultSet ? readScalar(statement.getResultSet()) : null;
                case NON_QUERY -> hasResultSet ? -1 : statement.getUpdateCount();
            };
        }
    }

    private void bindParameters(PreparedStatement statement, NamedParameterSql parsed, BatchCommand command)
            throws SQLException {
        List<String> names = parsed.parameterNames();
        for (int i = 0; i < names.size(); i++) {
            String name = names.get(i);
            BatchCommandParameter parameter = command.getParameters().get(name)
                    .orElseThrow(() -> new IllegalArgumentException(String.format(
                            "Parameter ':%s' is used by the script but not defined on the command", name)));
            if (parameter.type() != null) {
                statement.setObject(i + 1, parameter.value(), parameter.type());
            } else {
                statement.setObject(i + 1, parameter.value());
            }
        }
        if (!names.isEmpty()) {
            log.debug("Bound {} parameter(s): {}", names.size(), names);
        }
    }

    private static List<Object> readAll(ResultSet resultSet) throws SQLException {
        List<Object> values = new ArrayList<>();
        try (ResultSet rows = resultSet) {
            int columns = rows.getMetaData().getColumnCount();
            while (rows.next()) {
                for (int column = 1; column <= columns; column++) {
                    values.add(rows.getObject(column));
                }
            }
        }
        return values;
    }

    private static Object readScalar(ResultSet resultSet) throws SQLException {
        try (ResultSet rows = resultSet) {
            return rows.next() ? rows.getObject(1) : null;
        }
    }
}
