package org.dbmanager.connections;

import com.typesafe.config.ConfigFactory;
import org.dbmanager.api.batches.IsolationLevel;
import org.dbmanager.api.connections.DbTransaction;
import org.dbmanager.junit.extensions.logging.AllowLog;
import org.dbmanager.junit.extensions.logging.ExpectLog;
import org.dbmanager.junit.extensions.logging.LogLevel;
import org.dbmanager.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

import static org.junit.jupiter.api.Assertions.*;

@Tag("integration")
@ExtendWith(LogWatchExtension.class)
class HikariConnectionProviderTest {

    private HikariConnectionProvider provider;

    @AfterEach
    void tearDown() {
        if (provider != null) {
            provider.close();
        }
        System.clearProperty("dbmanager.test.dbname");
    }

    private static HikariConnectionProvider create(String name, String jdbcUrl) {
        return new HikariConnectionProvider(name, ConfigFactory.parseString("jdbcUrl = \"" + jdbcUrl + "\"\nmaxPoolSize = 2"));
    }

    @Test
    void testCreateConnection_FromOpenPool() throws SQLException {
        provider = create("pool-test", "jdbc:h2:mem:pool-test");
        provider.open();

        try (Connection connection = provider.createConnection(true).orElseThrow()) {
            assertTrue(connection.isReadOnly());
            assertTrue(connection.isValid(1));
        }
    }

    @Test
    void testCreateTransaction_DisablesAutoCommitAndSetsIsolation() throws SQLException {
        provider = create("tx-test", "jdbc:h2:mem:tx-test;DB_CLOSE_DELAY=-1");
        provider.open();

        try (DbTransaction transaction = provider.createTransaction(false, IsolationLevel.SERIALIZABLE).orElseThrow()) {
            Connection connection = transaction.getConnection();
            assertFalse(connection.getAutoCommit());
            assertEquals(Connection.TRANSACTION_SERIALIZABLE, connection.getTransactionIsolation());
            try (Statement statement = connection.createStatement()) {
                statement.execute("CREATE TABLE t (id INT)");
                statement.execute("INSERT INTO t VALUES (1)");
            }
        }

        try (Connection connection = provider.createConnection(false).orElseThrow();
             Statement statement = connection.createStatement()) {
            statement.execute("SELECT COUNT(*) FROM t");
            statement.getResultSet().next();
            assertEquals(0, statement.getResultSet().getInt(1), "uncommitted insert must be rolled back");
            statement.execute("DROP ALL OBJECTS");
        }
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "Failed to create connection to database 'closed-test': Connection pool 'closed-test' is not open")
    void testCreateConnection_OnClosedPoolIsEmpty() {
        provider = create("closed-test", "jdbc:h2:mem:closed-test");

        assertTrue(provider.createConnection(false).isEmpty());

        provider.open();
        assertTrue(provider.createConnection(false).isPresent());
        provider.close();
        provider.open();
        assertTrue(provider.createConnection(false).isPresent());
    }

    @Test
    void testJdbcUrl_PlaceholdersAreExpanded() {
        System.setProperty("dbmanager.test.dbname", "expanded");
        provider = create("expand-test", "jdbc:h2:mem:${dbmanager.test.dbname}");

        assertEquals("jdbc:h2:mem:expanded", provider.getJdbcUrl());
    }

    @Test
    void testJdbcUrl_IsRequired() {
        assertThrows(IllegalArgumentException.class, () -> new HikariConnectionProvider("none", ConfigFactory.empty()));
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "Failed to open connection pool for database 'bad-url'.*")
    @AllowLog(level = LogLevel.WARN, loggerPattern = "com\\.zaxxer\\.hikari\\..*")
    void testOpen_FailureIsReported() {
        provider = create("bad-url", "jdbc:nosuchdriver:somewhere");

        RuntimeException thrown = assertThrows(RuntimeException.class, provider::open);
        assertTrue(thrown.getMessage().contains("URL=jdbc:nosuchdriver:somewhere"));
    }
}
