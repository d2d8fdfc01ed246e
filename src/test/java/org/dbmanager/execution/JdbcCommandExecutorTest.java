package org.dbmanager.execution;

import org.dbmanager.api.batches.BatchCommand;
import org.dbmanager.api.batches.ExecutionType;
import org.dbmanager.api.connections.DbTransaction;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.JDBCType;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs commands against an in-memory H2 database.
 */
@Tag("integration")
class JdbcCommandExecutorTest {

    private final JdbcCommandExecutor executor = new JdbcCommandExecutor();
    private Connection connection;

    @BeforeEach
    void setUp() throws SQLException {
        connection = DriverManager.getConnection("jdbc:h2:mem:executor-test;DB_CLOSE_DELAY=-1", "sa", "");
        try (Statement statement = connection.createStatement()) {
            statement.execute("CREATE TABLE items (id INT PRIMARY KEY, name VARCHAR(64))");
            statement.execute("INSERT INTO items VALUES (1, 'one'), (2, 'two')");
        }
    }

    @AfterEach
    void tearDown() throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.execute("DROP ALL OBJECTS");
        }
        connection.close();
    }

    private static BatchCommand script(String sql, ExecutionType executionType) {
        return new BatchCommand(sql, null, null, executionType);
    }

    @Test
    void testNonQuery_ReturnsUpdateCount() throws Exception {
        Object result = executor.execute(connection, null,
                script("INSERT INTO items VALUES (:id, :name)", ExecutionType.NON_QUERY)
                        .withParameter("id", 3)
                        .withParameter("name", "three"));

        assertEquals(1, result);
    }

    @Test
    void testNonQuery_OnQueryReturnsMinusOne() throws Exception {
        assertEquals(-1, executor.execute(connection, null, script("SELECT * FROM items", ExecutionType.NON_QUERY)));
    }

    @Test
    void testReader_FlattensAllRows() throws Exception {
        Object result = executor.execute(connection, null, script("SELECT id, name FROM items ORDER BY id", ExecutionType.READER));

        assertThat(result).isInstanceOf(List.class);
        assertEquals(List.of(1, "one", 2, "two"), result);
    }

    @Test
    void testReader_OnStatementWithoutRowsIsEmpty() throws Exception {
        Object result = executor.execute(connection, null, script("DELETE FROM items WHERE id = 99", ExecutionType.READER));

        assertEquals(List.of(), result);
    }

    @Test
    void testScalar_ReturnsFirstColumnOfFirstRow() throws Exception {
        Object count = executor.execute(connection, null, script("SELECT COUNT(*) FROM items", ExecutionType.SCALAR));
        Object name = executor.execute(connection, null,
                script("SELECT name FROM items WHERE id = :id", ExecutionType.SCALAR).withParameter("ID", 2));

        assertEquals(2, ((Number) count).intValue());
        assertEquals("two", name);
    }

    @Test
    void testScalar_WithoutRowsIsNull() throws Exception {
        assertNull(executor.execute(connection, null, script("SELECT name FROM items WHERE id = 42", ExecutionType.SCALAR)));
    }

    @Test
    void testTypedParameter() throws Exception {
        BatchCommand command = script("SELECT CAST(:value AS VARCHAR)", ExecutionType.SCALAR);
        command.getParameters().add("value", JDBCType.INTEGER, 7);

        assertEquals("7", executor.execute(connection, null, command));
    }

    @Test
    void testUndefinedParameterIsRejected() {
        BatchCommand command = script("SELECT name FROM items WHERE id = :id", ExecutionType.SCALAR);

        IllegalArgumentException thrown = assertThrows(IllegalArgumentException.class,
                () -> executor.execute(connection, null, command));
        assertEquals("Parameter ':id' is used by the script but not defined on the command", thrown.getMessage());
    }

    @Test
    void testSqlErrorsPropagate() {
        assertThrows(SQLException.class,
                () -> executor.execute(connection, null, script("SELECT * FROM missing_table", ExecutionType.READER)));
    }

    @Test
    void testCallbackReceivesConnectionAndTransaction() throws Exception {
        DbTransaction transaction = new DbTransaction(connection);
        BatchCommand command = new BatchCommand((conn, tx, self) -> {
            assertSame(connection, conn);
            assertSame(transaction, tx);
            try (Statement statement = conn.createStatement()) {
                return statement.executeUpdate("DELETE FROM items");
            }
        }, null, null, null);

        assertEquals(2, executor.execute(connection, transaction, command));
    }
}
