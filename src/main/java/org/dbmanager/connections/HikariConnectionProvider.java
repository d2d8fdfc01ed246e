package org.dbmanager.connections;

import com.typesafe.config.Config;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.dbmanager.api.batches.IsolationLevel;
import org.dbmanager.api.connections.DbTransaction;
import org.dbmanager.api.connections.IConnectionProvider;
import org.dbmanager.utils.PlaceholderExpansion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Optional;

/**
 * Connection provider backed by a HikariCP pool.
 * <p>
 * <strong>Options:</strong>
 * <ul>
 *   <li>{@code jdbcUrl} (required; {@code ${VAR}} placeholders are expanded)</li>
 *   <li>{@code driverClassName} (default: none, resolved by the URL)</li>
 *   <li>{@code username} (default "sa"), {@code password} (default "")</li>
 *   <li>{@code maxPoolSize} (default 4), {@code minIdle} (default 0)</li>
 * </ul>
 * The pool is created by {@link #open()} and shut down by {@link #close()}; a closed provider can
 * be opened again.
 */
public class HikariConnectionProvider implements IConnectionProvider {

    private static final Logger log = LoggerFactory.getLogger(HikariConnectionProvider.class);

    private final String name;
    private final HikariConfig hikariConfig;
    private HikariDataSource dataSource;

    public HikariConnectionProvider(String name, Config options) {
        this.name = Objects.requireNonNull(name, "Connection provider name cannot be null");
        Objects.requireNonNull(options, "Connection provider options cannot be null");

        this.hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(getJdbcUrl(options));
        if (options.hasPath("driverClassName")) {
            hikariConfig.setDriverClassName(options.getString("driverClassName"));
        }
        hikariConfig.setUsername(options.hasPath("username") ? options.getString("username") : "sa");
        hikariConfig.setPassword(options.hasPath("password") ? options.getString("password") : "");
        hikariConfig.setMaximumPoolSize(options.hasPath("maxPoolSize") ? options.getInt("maxPoolSize") : 4);
        hikariConfig.setMinimumIdle(options.hasPath("minIdle") ? options.getInt("minIdle") : 0);
        hikariConfig.setPoolName(name);
    }

    public String getJdbcUrl() {
        return hikariConfig.getJdbcUrl();
    }

    @Override
    public synchronized void open() {
        if (dataSource != null && !dataSource.isClosed()) {
            return;
        }
        try {
            dataSource = new HikariDataSource(hikariConfig);
            log.debug("Connection pool '{}' started (max={}, minIdle={})",
                    name, hikariConfig.getMaximumPoolSize(), hikariConfig.getMinimumIdle());
        } catch (Exception e) {
            Throwable cause = e;
            while (cause.getCause() != null && cause.getCause() != cause) {
                cause = cause.getCause();
            }
            String causeMsg = cause.getMessage() != null ? cause.getMessage() : "";

            String errorMsg;
            if (causeMsg.contains("already in use") || causeMsg.contains("file is locked")) {
                errorMsg = String.format(
                        "Cannot open database '%s': file already in use by another process. URL=%s",
                        name, hikariConfig.getJdbcUrl());
            } else if (causeMsg.contains("Wrong user name or password")) {
                errorMsg = String.format("Failed to connect to database '%s': wrong username/password. URL=%s, User=%s",
                        name, hikariConfig.getJdbcUrl(), hikariConfig.getUsername());
            } else {
                errorMsg = String.format("Failed to open connection pool for database '%s': %s. URL=%s. Error: %s",
                        name, cause.getClass().getSimpleName(), hikariConfig.getJdbcUrl(), causeMsg);
            }
            log.error(errorMsg);
            throw new RuntimeException(errorMsg, e);
        }
    }

    @Override
    public Optional<Connection> createConnection(boolean readOnly) {
        Connection connection = null;
        try {
            connection = requireDataSource().getConnection();
            connection.setReadOnly(readOnly);
            return Optional.of(connection);
        } catch (SQLException | IllegalStateException e) {
            log.error("Failed to create connection to database '{}': {}", name, e.getMessage());
            log.debug("Connection failure details for '{}':", name, e);
            closeQuietly(connection);
            return Optional.empty();
        }
    }

    @Override
    public Optional<DbTransaction> createTransaction(boolean readOnly, IsolationLevel isolationLevel) {
        Connection connection = null;
        try {
            connection = requireDataSource().getConnection();
            connection.setReadOnly(readOnly);
            if (isolationLevel != null) {
                connection.setTransactionIsolation(isolationLevel.toJdbcLevel());
            }
            connection.setAutoCommit(false);
            return Optional.of(new DbTransaction(connection));
        } catch (SQLException | IllegalStateException e) {
            log.error("Failed to create transaction on database '{}': {}", name, e.getMessage());
            log.debug("Transaction failure details for '{}':", name, e);
            closeQuietly(connection);
            return Optional.empty();
        }
    }

    @Override
    public synchronized void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.debug("Connection pool '{}' closed", name);
        }
        dataSource = null;
    }

    private synchronized HikariDataSource requireDataSource() {
        if (dataSource == null || dataSource.isClosed()) {
            throw new IllegalStateException(String.format("Connection pool '%s' is not open", name));
        }
        return dataSource;
    }

    private void closeQuietly(Connection connection) {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            log.debug("Failed to close connection of '{}' after error: {}", name, e.getMessage());
        }
    }

    private static String getJdbcUrl(Config options) {
        if (!options.hasPath("jdbcUrl")) {
            throw new IllegalArgumentException("'jdbcUrl' must be configured for a database manager.");
        }
        String jdbcUrl = options.getString("jdbcUrl");
        String expandedUrl = PlaceholderExpansion.expand(jdbcUrl);
        if (!jdbcUrl.equals(expandedUrl)) {
            log.debug("Expanded jdbcUrl: '{}' -> '{}'", jdbcUrl, expandedUrl);
        }
        return expandedUrl;
    }
}
