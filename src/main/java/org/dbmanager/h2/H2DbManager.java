package org.dbmanager.h2;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.dbmanager.api.batches.IBatchLocator;
import org.dbmanager.batches.locators.AggregateBatchLocator;
import org.dbmanager.cleanup.BatchCleanupProcessor;
import org.dbmanager.connections.HikariConnectionProvider;
import org.dbmanager.execution.JdbcCommandExecutor;
import org.dbmanager.manager.AbstractDbManager;
import org.dbmanager.manager.DbManagerComponents;
import org.dbmanager.versioning.BatchNameVersionUpgrader;
import org.dbmanager.versioning.BatchVersionDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Database manager for H2, configured entirely from a {@link Config} block.
 * <p>
 * Connections come from a HikariCP pool that is started by {@link #initialize()} and shut down by
 * {@link #close()}. Version detection and cleanup use the batches of {@link H2DefaultBatches}
 * unless named batches are configured; upgrades and backups use {@link BatchNameVersionUpgrader}
 * and {@link H2BackupCreator}.
 * <p>
 * <strong>Options</strong> (defaults in {@code reference.conf} under {@code dbmanager}):
 * <ul>
 *   <li>connection: {@code jdbcUrl} (required), {@code username}, {@code password},
 *       {@code maxPoolSize}, {@code minIdle}</li>
 *   <li>{@code supportsReadOnly}, {@code defaultIsolationLevel}</li>
 *   <li>{@code batches}: {@code mode}, {@code commandSeparator}, {@code optionsPattern},
 *       {@code locators} (list of {@code { className, options }})</li>
 *   <li>{@code versioning}: settings table layout and {@code detectionBatchName}</li>
 *   <li>{@code upgrading}: {@code enabled}, {@code nameFormat}</li>
 *   <li>{@code cleanup}: {@code enabled}, {@code batchName}</li>
 *   <li>{@code backup}: {@code enabled} plus the {@link H2BackupCreator} options</li>
 * </ul>
 */
public class H2DbManager extends AbstractDbManager {

    private static final Logger log = LoggerFactory.getLogger(H2DbManager.class);

    private final H2DefaultBatches defaultBatches;

    public H2DbManager(String name, Config options) {
        this(name, options, createComponents(name, options));
    }

    protected H2DbManager(String name, Config options, DbManagerComponents components) {
        super(name, options, components);
        this.defaultBatches = new H2DefaultBatches(section(options, "versioning"));
    }

    /**
     * @return the default batches matching this manager's settings table layout
     */
    public H2DefaultBatches getDefaultBatches() {
        return defaultBatches;
    }

    @Override
    protected void openResources() {
        getConnectionProvider().open();
    }

    @Override
    protected void closeResources() {
        getConnectionProvider().close();
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        metrics.put("batch_names", getBatchNames().size());
    }

    private static DbManagerComponents createComponents(String name, Config options) {
        Config versioning = section(options, "versioning");
        Config upgrading = section(options, "upgrading");
        Config cleanup = section(options, "cleanup");
        Config backup = section(options, "backup");
        H2DefaultBatches defaults = new H2DefaultBatches(versioning);

        DbManagerComponents.Builder builder = DbManagerComponents.builder()
                .connectionProvider(new HikariConnectionProvider(name, options))
                .commandExecutor(new JdbcCommandExecutor())
                .batchLocator(createBatchLocator(section(options, "batches")))
                .versionDetector(new BatchVersionDetector(
                        versioning.hasPath("detectionBatchName") ? versioning.getString("detectionBatchName") : null,
                        defaults::versionDetection));

        if (enabled(upgrading)) {
            builder.versionUpgrader(upgrading.hasPath("nameFormat")
                    ? new BatchNameVersionUpgrader(upgrading.getString("nameFormat"))
                    : new BatchNameVersionUpgrader());
        }
        if (enabled(cleanup)) {
            builder.cleanupProcessor(new BatchCleanupProcessor(
                    cleanup.hasPath("batchName") ? cleanup.getString("batchName") : null,
                    defaults::cleanup));
        }
        if (enabled(backup)) {
            builder.backupCreator(new H2BackupCreator(backup));
        }

        log.debug("Created components for H2 database manager '{}' (upgrade={}, cleanup={}, backup={})",
                name, enabled(upgrading), enabled(cleanup), enabled(backup));
        return builder.build();
    }

    private static IBatchLocator createBatchLocator(Config batches) {
        AggregateBatchLocator locator = new AggregateBatchLocator(batches);
        return locator.getLocators().size() == 1 ? locator.getLocators().get(0) : locator;
    }

    private static boolean enabled(Config section) {
        return !section.hasPath("enabled") || section.getBoolean("enabled");
    }

    private static Config section(Config options, String path) {
        return options.hasPath(path) ? options.getConfig(path) : ConfigFactory.empty();
    }
}
