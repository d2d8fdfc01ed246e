package org.dbmanager.h2;

import com.typesafe.config.Config;
import org.dbmanager.api.backup.IBackupCreator;
import org.dbmanager.api.batches.Batch;
import org.dbmanager.api.manager.IDbManager;
import org.dbmanager.utils.PlaceholderExpansion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Locale;
import java.util.Optional;

/**
 * Backs up an H2 database into an SQL script file and restores it from one.
 * <p>
 * Backup and restore targets are a {@link Path}, a {@link File} or a path string
 * ({@code ${VAR}} placeholders are expanded). Restoring drops all objects of the database before
 * running the script.
 * <p>
 * <strong>Options:</strong>
 * <ul>
 *   <li>{@code compression}: {@code DEFLATE}, {@code LZF}, {@code ZIP} or {@code GZIP}; none by default</li>
 *   <li>{@code preprocessingBatchName}: batch to run before a backup</li>
 *   <li>{@code postprocessingBatchName}: batch to run after a successful backup</li>
 * </ul>
 */
public class H2BackupCreator implements IBackupCreator {

    private static final Logger log = LoggerFactory.getLogger(H2BackupCreator.class);

    private final String compression;
    private final String preprocessingBatchName;
    private final String postprocessingBatchName;

    public H2BackupCreator(Config options) {
        this.compression = optionalString(options, "compression");
        this.preprocessingBatchName = optionalString(options, "preprocessingBatchName");
        this.postprocessingBatchName = optionalString(options, "postprocessingBatchName");
        if (compression != null && !compression.matches("(?i)DEFLATE|LZF|ZIP|GZIP")) {
            throw new IllegalArgumentException("Unsupported backup compression: " + compression);
        }
    }

    @Override
    public boolean supportsBackup() {
        return true;
    }

    @Override
    public boolean supportsRestore() {
        return true;
    }

    @Override
    public boolean backup(IDbManager manager, Object backupTarget) {
        Path file = toPath(backupTarget);
        if (!runProcessingBatch(manager, preprocessingBatchName)) {
            return false;
        }

        try {
            if (file.toAbsolutePath().getParent() != null) {
                Files.createDirectories(file.toAbsolutePath().getParent());
            }
            executeStatements(manager, "SCRIPT TO " + H2DefaultBatches.literal(file.toString()) + compressionClause());
        } catch (SQLException | IOException e) {
            log.warn("Backup of database '{}' to '{}' failed: {}", manager.getName(), file, e.getMessage());
            log.debug("Backup failure details:", e);
            return false;
        }
        log.debug("Database '{}' backed up to '{}'", manager.getName(), file);

        return runProcessingBatch(manager, postprocessingBatchName);
    }

    @Override
    public boolean restore(IDbManager manager, Object backupSource) {
        Path file = toPath(backupSource);
        if (!Files.isRegularFile(file)) {
            log.warn("Cannot restore database '{}': backup file '{}' does not exist", manager.getName(), file);
            return false;
        }

        try {
            executeStatements(manager,
                    "DROP ALL OBJECTS",
                    "RUNSCRIPT FROM " + H2DefaultBatches.literal(file.toString()) + compressionClause());
        } catch (SQLException e) {
            log.warn("Restore of database '{}' from '{}' failed: {}", manager.getName(), file, e.getMessage());
            log.debug("Restore failure details:", e);
            return false;
        }
        log.debug("Database '{}' restored from '{}'", manager.getName(), file);
        return true;
    }

    private void executeStatements(IDbManager manager, String... statements) throws SQLException {
        Optional<Connection> acquired = manager.createConnection(false);
        if (acquired.isEmpty()) {
            throw new SQLException("No connection available for database '" + manager.getName() + "'");
        }
        try (Connection connection = acquired.get(); Statement statement = connection.createStatement()) {
            for (String sql : statements) {
                statement.execute(sql);
            }
        }
    }

    private boolean runProcessingBatch(IDbManager manager, String batchName) {
        if (batchName == null) {
            return true;
        }
        Optional<Batch> batch = manager.getBatch(batchName);
        if (batch.isEmpty()) {
            log.warn("Backup processing batch '{}' not found for database '{}'", batchName, manager.getName());
            return false;
        }
        return manager.executeBatch(batch.get(), false, false);
    }

    private String compressionClause() {
        return compression == null ? "" : " COMPRESSION " + compression.toUpperCase(Locale.ROOT);
    }

    private static Path toPath(Object target) {
        if (target instanceof Path path) {
            return path;
        }
        if (target instanceof File file) {
            return file.toPath();
        }
        if (target instanceof String text && !text.isBlank()) {
            return Paths.get(PlaceholderExpansion.expand(text));
        }
        throw new IllegalArgumentException("Backup target must be a Path, File or non-blank path string: " + target);
    }

    private static String optionalString(Config options, String path) {
        if (!options.hasPath(path)) {
            return null;
        }
        String value = options.getString(path);
        return value.isBlank() ? null : value;
    }
}
