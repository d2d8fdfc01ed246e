package org.dbmanager.manager;

import com.typesafe.config.Config;
import org.dbmanager.api.backup.IBackupCreator;
import org.dbmanager.api.batches.Batch;
import org.dbmanager.api.batches.BatchCommand;
import org.dbmanager.api.batches.IBatchLocator;
import org.dbmanager.api.batches.ICommandExecutor;
import org.dbmanager.api.batches.InvalidBatchCommandException;
import org.dbmanager.api.batches.IsolationLevel;
import org.dbmanager.api.cleanup.ICleanupProcessor;
import org.dbmanager.api.connections.DbTransaction;
import org.dbmanager.api.connections.IConnectionProvider;
import org.dbmanager.api.manager.DbState;
import org.dbmanager.api.manager.IDbManager;
import org.dbmanager.api.manager.IDbManagerListener;
import org.dbmanager.api.resources.IMonitorable;
import org.dbmanager.api.resources.OperationalError;
import org.dbmanager.api.versioning.IVersionDetector;
import org.dbmanager.api.versioning.IVersionUpgrader;
import org.dbmanager.api.versioning.VersionDetection;
import org.dbmanager.utils.EnumNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Base implementation of {@link IDbManager}: lifecycle, batch execution and the upgrade loop.
 * <p>
 * <strong>State ownership:</strong> state and version change only through
 * {@link #setStateAndVersion(DbState, int)}, which logs the transition and notifies listeners once per
 * distinct change.
 * <p>
 * <strong>Collaborator calls:</strong> version detection, upgrade steps, backups and cleanups run
 * while the manager may not be ready yet (a new database is detected while uninitialized, upgraded
 * while {@link DbState#NEW}). For the duration of such a call the ready-state guard of
 * {@link #executeBatch(Batch, boolean, boolean)}, {@link #createConnection(boolean)} and
 * {@link #createTransaction(boolean, IsolationLevel)} is lifted so the collaborator can work through
 * this manager.
 * <p>
 * <strong>Error Handling:</strong>
 * <ul>
 *   <li>Precondition violations throw before anything is changed</li>
 *   <li>Failed commands, connections and upgrade steps are logged at WARN/ERROR without stack trace,
 *       recorded via {@link #recordError(String, String, String)} and reported as {@code false}</li>
 *   <li>Exceptions thrown by collaborators propagate</li>
 * </ul>
 * Not thread-safe.
 */
public abstract class AbstractDbManager implements IDbManager, IMonitorable {

    private static final Logger log = LoggerFactory.getLogger(AbstractDbManager.class);

    protected final String name;
    protected final Config options;

    private final IConnectionProvider connectionProvider;
    private final ICommandExecutor commandExecutor;
    private final IVersionDetector versionDetector;
    private final Optional<IBatchLocator> batchLocator;
    private final Optional<IVersionUpgrader> versionUpgrader;
    private final Optional<IBackupCreator> backupCreator;
    private final Optional<ICleanupProcessor> cleanupProcessor;

    private final boolean readOnlySupported;
    private final IsolationLevel defaultIsolationLevel;

    private final List<IDbManagerListener> listeners = new CopyOnWriteArrayList<>();
    private final ConcurrentLinkedDeque<OperationalError> errors = new ConcurrentLinkedDeque<>();

    private final AtomicLong batchesExecuted = new AtomicLong(0);
    private final AtomicLong batchesFailed = new AtomicLong(0);
    private final AtomicLong commandsExecuted = new AtomicLong(0);
    private final AtomicLong upgradeSteps = new AtomicLong(0);
    private final AtomicLong detections = new AtomicLong(0);

    private DbState state = DbState.UNINITIALIZED;
    private int version = -1;
    private DbState initialState = DbState.UNINITIALIZED;
    private int initialVersion = -1;
    private int collaboratorCallDepth = 0;

    /**
     * @param name       The name of the managed database, used in logs and errors.
     * @param options    Manager options; reads {@code supportsReadOnly} (default true) and
     *                   {@code defaultIsolationLevel} (default READ_COMMITTED).
     * @param components The collaborators to delegate to.
     */
    protected AbstractDbManager(String name, Config options, DbManagerComponents components) {
        this.name = Objects.requireNonNull(name, "Database manager name cannot be null");
        this.options = Objects.requireNonNull(options, "Database manager options cannot be null");
        Objects.requireNonNull(components, "Database manager components cannot be null");

        this.connectionProvider = components.connectionProvider();
        this.commandExecutor = components.commandExecutor();
        this.versionDetector = components.versionDetector();
        this.batchLocator = components.batchLocator();
        this.versionUpgrader = components.versionUpgrader();
        this.backupCreator = components.backupCreator();
        this.cleanupProcessor = components.cleanupProcessor();

        this.readOnlySupported = !options.hasPath("supportsReadOnly") || options.getBoolean("supportsReadOnly");
        String isolation = options.hasPath("defaultIsolationLevel") ? options.getString("defaultIsolationLevel") : "READ_COMMITTED";
        this.defaultIsolationLevel = EnumNames.parse(IsolationLevel.class, isolation)
                .orElseThrow(() -> new IllegalArgumentException(String.format(
                        "Unknown defaultIsolationLevel '%s' for database manager '%s'", isolation, name)));
    }

    /**
     * Acquires whatever the manager needs before the first detection (e.g. a connection pool).
     * Called at the start of every {@link #initialize()}.
     */
    protected abstract void openResources();

    /**
     * Releases what {@link #openResources()} acquired. Called by {@link #close()}.
     */
    protected abstract void closeResources();

    @Override
    public String getName() {
        return name;
    }

    public Config getOptions() {
        return options;
    }

    protected IConnectionProvider getConnectionProvider() {
        return connectionProvider;
    }

    // ===== Lifecycle =====

    @Override
    public DbState getState() {
        return state;
    }

    @Override
    public int getVersion() {
        return version;
    }

    @Override
    public DbState getInitialState() {
        return initialState;
    }

    @Override
    public int getInitialVersion() {
        return initialVersion;
    }

    @Override
    public void initialize() {
        if (state != DbState.UNINITIALIZED) {
            close();
        }

        log.debug("Initializing database manager '{}'", name);
        if (tryOpenResources()) {
            detectStateAndVersion();
        } else {
            setStateAndVersion(DbState.DAMAGED_OR_INVALID, -1);
        }

        initialState = state;
        initialVersion = version;
        log.info("Database manager '{}' initialized: state={}, version={}", name, state, version);
    }

    private boolean tryOpenResources() {
        try {
            openResources();
            return true;
        } catch (RuntimeException e) {
            log.warn("Failed to open resources of database manager '{}', treating it as damaged: {}",
                    name, e.getMessage());
            log.debug("Resource open failure details for '{}':", name, e);
            recordError("CONNECTION_FAILED", "Failed to open database resources", e.getMessage());
            return false;
        }
    }

    @Override
    public void close() {
        try {
            closeResources();
        } catch (RuntimeException e) {
            log.warn("Failed to release resources of database manager '{}': {}", name, e.getMessage());
            log.debug("Resource release failure details for '{}':", name, e);
            recordError("CLOSE_FAILED", "Failed to release resources", e.getMessage());
        }
        if (state != DbState.UNINITIALIZED) {
            log.info("Database manager '{}' closed", name);
        }
        setStateAndVersion(DbState.UNINITIALIZED, -1);
    }

    @Override
    public void addListener(IDbManagerListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener cannot be null"));
    }

    @Override
    public void removeListener(IDbManagerListener listener) {
        listeners.remove(listener);
    }

    /**
     * The single path through which state and version change.
     */
    protected void setStateAndVersion(DbState newState, int newVersion) {
        DbState oldState = state;
        int oldVersion = version;
        state = newState;
        version = newVersion;

        if (oldState != newState) {
            log.info("Database state changed: {} -> {} ('{}')", oldState, newState, name);
            for (IDbManagerListener listener : listeners) {
                try {
                    listener.stateChanged(this, oldState, newState);
                } catch (RuntimeException e) {
                    log.warn("State listener of database manager '{}' failed: {}", name, e.getMessage());
                    log.debug("Listener failure details:", e);
                }
            }
        }
        if (oldVersion != newVersion) {
            log.info("Database version changed: {} -> {} ('{}')", oldVersion, newVersion, name);
            for (IDbManagerListener listener : listeners) {
                try {
                    listener.versionChanged(this, oldVersion, newVersion);
                } catch (RuntimeException e) {
                    log.warn("Version listener of database manager '{}' failed: {}", name, e.getMessage());
                    log.debug("Listener failure details:", e);
                }
            }
        }
    }

    /**
     * Runs the version detector and derives state and version from its result.
     */
    protected void detectStateAndVersion() {
        VersionDetection detection = callCollaborator(() -> versionDetector.detect(this));
        detections.incrementAndGet();

        boolean upgradeSupported = supportsUpgrade();
        DbStateDerivation.StateAndVersion derived = DbStateDerivation.derive(detection,
                upgradeSupported ? getMinVersion() : -1,
                upgradeSupported ? getMaxVersion() : -1,
                upgradeSupported);

        if (derived.state() == DbState.DAMAGED_OR_INVALID) {
            log.warn("Version detection of database '{}' reported a damaged or invalid database: {}", name, detection);
        } else {
            log.debug("Version detection of database '{}': {} -> {}", name, detection, derived);
        }
        setStateAndVersion(derived.state(), derived.version());
    }

    private <T> T callCollaborator(Supplier<T> call) {
        collaboratorCallDepth++;
        try {
            return call.get();
        } finally {
            collaboratorCallDepth--;
        }
    }

    // ===== Capabilities =====

    @Override
    public boolean supportsUpgrade() {
        return versionUpgrader.isPresent();
    }

    @Override
    public boolean supportsBackup() {
        return backupCreator.map(IBackupCreator::supportsBackup).orElse(false);
    }

    @Override
    public boolean supportsRestore() {
        return backupCreator.map(IBackupCreator::supportsRestore).orElse(false);
    }

    @Override
    public boolean supportsCleanup() {
        return cleanupProcessor.isPresent();
    }

    @Override
    public boolean supportsReadOnly() {
        return readOnlySupported;
    }

    @Override
    public int getMinVersion() {
        return versionUpgrader.map(upgrader -> upgrader.getMinVersion(this)).orElse(-1);
    }

    @Override
    public int getMaxVersion() {
        return versionUpgrader.map(upgrader -> upgrader.getMaxVersion(this)).orElse(-1);
    }

    @Override
    public boolean canUpgrade() {
        return supportsUpgrade()
                && (state.isReady() || state == DbState.NEW)
                && version >= 0
                && version < getMaxVersion();
    }

    // ===== Connections =====

    @Override
    public Optional<Connection> createConnection(boolean readOnly) {
        requireReady("create a connection");
        requireReadOnlySupport(readOnly);

        Optional<Connection> connection = connectionProvider.createConnection(readOnly);
        if (connection.isEmpty()) {
            recordError("CONNECTION_FAILED", "Failed to create connection", "readOnly=" + readOnly);
        }
        return connection;
    }

    @Override
    public Optional<DbTransaction> createTransaction(boolean readOnly, IsolationLevel isolationLevel) {
        requireReady("create a transaction");
        requireReadOnlySupport(readOnly);

        IsolationLevel level = isolationLevel != null ? isolationLevel : defaultIsolationLevel;
        Optional<DbTransaction> transaction = connectionProvider.createTransaction(readOnly, level);
        if (transaction.isEmpty()) {
            recordError("TRANSACTION_FAILED", "Failed to create transaction",
                    "readOnly=" + readOnly + ", isolationLevel=" + level);
        }
        return transaction;
    }

    // ===== Batches =====

    @Override
    public Batch createBatch() {
        return new Batch();
    }

    @Override
    public Optional<Batch> getBatch(String batchName, String commandSeparator) {
        Objects.requireNonNull(batchName, "Batch name cannot be null");
        return batchLocator.flatMap(locator -> locator.getBatch(batchName, commandSeparator, this::createBatch));
    }

    @Override
    public Set<String> getBatchNames() {
        Set<String> names = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        batchLocator.ifPresent(locator -> names.addAll(locator.getNames()));
        return Collections.unmodifiableSet(names);
    }

    @Override
    public boolean executeBatch(Batch batch, boolean readOnly, boolean detectVersionAfter) {
        Objects.requireNonNull(batch, "Batch cannot be null");
        requireReady("execute a batch");
        requireReadOnlySupport(readOnly);

        batch.reset();
        boolean transactionRequired = batch.requiresTransaction();
        IsolationLevel isolationLevel = batch.getIsolationLevel();
        List<BatchCommand> commands = batch.getCommands();
        for (int i = 0; i < commands.size(); i++) {
            if (!commands.get(i).isValid()) {
                throw new InvalidBatchCommandException(String.format(
                        "Command %d of batch on database '%s' must have exactly one of script and callback: %s",
                        i, name, commands.get(i)));
            }
        }

        boolean success = transactionRequired
                ? executeInTransaction(batch, readOnly, isolationLevel)
                : executeOnConnection(batch, readOnly);

        batchesExecuted.incrementAndGet();
        if (!success) {
            batchesFailed.incrementAndGet();
        }

        if (detectVersionAfter) {
            detectStateAndVersion();
        }
        return success;
    }

    private boolean executeInTransaction(Batch batch, boolean readOnly, IsolationLevel isolationLevel) {
        Optional<DbTransaction> acquired = createTransaction(readOnly, isolationLevel);
        if (acquired.isEmpty()) {
            log.warn("Cannot execute batch on database '{}': no transaction available", name);
            return false;
        }
        try (DbTransaction transaction = acquired.get()) {
            if (!executeCommands(batch, transaction.getConnection(), transaction)) {
                return false;
            }
            return commit(batch, transaction);
        } catch (SQLException e) {
            log.warn("Failed to complete transaction of batch on database '{}': {}", name, e.getMessage());
            log.debug("Transaction failure details for '{}':", name, e);
            recordError("TRANSACTION_FAILED", "Failed to complete batch transaction", e.getMessage());
            return false;
        }
    }

    /**
     * Commits the transaction of a fully executed batch. A failed commit is recorded on the last
     * command, so the batch reports the failure like a failed command would.
     */
    private boolean commit(Batch batch, DbTransaction transaction) {
        try {
            transaction.commit();
            return true;
        } catch (SQLException e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.warn("Failed to commit batch on database '{}': {}", name, message);
            log.debug("Commit failure details for '{}':", name, e);
            recordError("COMMIT_FAILED", "Failed to commit batch transaction", message);
            List<BatchCommand> commands = batch.getCommands();
            if (!commands.isEmpty()) {
                BatchCommand last = commands.get(commands.size() - 1);
                last.setException(e);
                last.setError(message);
            }
            return false;
        }
    }

    private boolean executeOnConnection(Batch batch, boolean readOnly) {
        Optional<Connection> acquired = createConnection(readOnly);
        if (acquired.isEmpty()) {
            log.warn("Cannot execute batch on database '{}': no connection available", name);
            return false;
        }
        try (Connection connection = acquired.get()) {
            return executeCommands(batch, connection, null);
        } catch (SQLException e) {
            log.warn("Failed to close connection of batch on database '{}': {}", name, e.getMessage());
            log.debug("Connection failure details for '{}':", name, e);
            recordError("CONNECTION_FAILED", "Failed to close batch connection", e.getMessage());
            return false;
        }
    }

    private boolean executeCommands(Batch batch, Connection connection, DbTransaction transaction) {
        for (BatchCommand command : batch.getCommands()) {
            try {
                log.debug("Executing {} on database '{}'", command, name);
                Object result = commandExecutor.execute(connection, transaction, command);
                command.setResult(result);
                command.setExecuted(true);
                commandsExecuted.incrementAndGet();
                if (command.hasFailed()) {
                    log.warn("Command reported an error on database '{}': {}", name, command.getError());
                    recordError("COMMAND_ERROR", command.getError(), command.toString());
                }
            } catch (Exception e) {
                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                command.setException(e);
                command.setError(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
                log.warn("Command failed on database '{}', aborting batch: {}", name, command.getError());
                log.debug("Command failure details for {}:", command, e);
                recordError("COMMAND_FAILED", command.getError(), command.toString());
                return false;
            }
        }
        return !batch.hasFailed();
    }

    // ===== Maintenance =====

    @Override
    public boolean upgrade(int targetVersion) {
        IVersionUpgrader upgrader = versionUpgrader.orElseThrow(() -> new UnsupportedOperationException(
                String.format("Database '%s' does not support upgrading", name)));
        if (!state.isReady() && state != DbState.NEW) {
            throw new IllegalStateException(String.format(
                    "Cannot upgrade database '%s' in state %s", name, state));
        }
        int minVersion = getMinVersion();
        int maxVersion = getMaxVersion();
        if (targetVersion < minVersion || targetVersion > maxVersion) {
            throw new IllegalArgumentException(String.format(
                    "Target version %d of database '%s' is outside the supported range [%d, %d]",
                    targetVersion, name, minVersion, maxVersion));
        }
        if (targetVersion < version) {
            throw new IllegalArgumentException(String.format(
                    "Target version %d of database '%s' is below its current version %d",
                    targetVersion, name, version));
        }
        if (version == targetVersion) {
            log.debug("Database '{}' is already at version {}", name, targetVersion);
            return true;
        }

        log.info("Upgrading database '{}' from version {} to {}", name, version, targetVersion);
        while (version < targetVersion) {
            int sourceVersion = version;
            boolean stepSucceeded = callCollaborator(() -> upgrader.upgrade(this, sourceVersion));
            upgradeSteps.incrementAndGet();
            detectStateAndVersion();

            if (!stepSucceeded) {
                log.warn("Upgrade of database '{}' from version {} failed", name, sourceVersion);
                recordError("UPGRADE_FAILED", "Upgrade step failed", "sourceVersion=" + sourceVersion);
                return false;
            }
            if (!state.isReady()) {
                log.warn("Upgrade of database '{}' from version {} left it in state {}", name, sourceVersion, state);
                recordError("UPGRADE_FAILED", "Database not ready after upgrade step",
                        "sourceVersion=" + sourceVersion + ", state=" + state);
                return false;
            }
            if (version <= sourceVersion) {
                log.warn("Upgrade of database '{}' from version {} did not advance the version (now {})",
                        name, sourceVersion, version);
                recordError("UPGRADE_FAILED", "Upgrade step did not advance the version",
                        "sourceVersion=" + sourceVersion + ", version=" + version);
                return false;
            }
        }

        log.info("Database '{}' upgraded to version {}", name, version);
        return version == targetVersion;
    }

    @Override
    public boolean backup(Object backupTarget) {
        requireInitialized("back up");
        IBackupCreator creator = backupCreator.filter(IBackupCreator::supportsBackup)
                .orElseThrow(() -> new UnsupportedOperationException(
                        String.format("Database '%s' does not support backups", name)));

        boolean success = callCollaborator(() -> creator.backup(this, backupTarget));
        detectStateAndVersion();
        logMaintenanceOutcome("Backup", success, "BACKUP_FAILED");
        return success;
    }

    @Override
    public boolean restore(Object backupSource) {
        requireInitialized("restore");
        IBackupCreator creator = backupCreator.filter(IBackupCreator::supportsRestore)
                .orElseThrow(() -> new UnsupportedOperationException(
                        String.format("Database '%s' does not support restoring backups", name)));

        boolean success = callCollaborator(() -> creator.restore(this, backupSource));
        detectStateAndVersion();
        logMaintenanceOutcome("Restore", success, "RESTORE_FAILED");
        return success;
    }

    @Override
    public boolean cleanup() {
        ICleanupProcessor processor = cleanupProcessor.orElseThrow(() -> new UnsupportedOperationException(
                String.format("Database '%s' does not support cleanup", name)));
        if (!state.isReady() && state != DbState.NEW) {
            throw new IllegalStateException(String.format(
                    "Cannot clean up database '%s' in state %s", name, state));
        }

        boolean success = callCollaborator(() -> processor.cleanup(this));
        detectStateAndVersion();
        logMaintenanceOutcome("Cleanup", success, "CLEANUP_FAILED");
        return success;
    }

    private void logMaintenanceOutcome(String operation, boolean success, String errorCode) {
        if (success) {
            log.info("{} of database '{}' completed: state={}, version={}", operation, name, state, version);
        } else {
            log.warn("{} of database '{}' failed: state={}, version={}", operation, name, state, version);
            recordError(errorCode, operation + " failed", "state=" + state + ", version=" + version);
        }
    }

    // ===== Guards =====

    private void requireReady(String operation) {
        if (collaboratorCallDepth == 0 && !state.isReady()) {
            throw new IllegalStateException(String.format(
                    "Cannot %s on database '%s' in state %s", operation, name, state));
        }
    }

    private void requireInitialized(String operation) {
        if (state == DbState.UNINITIALIZED) {
            throw new IllegalStateException(String.format(
                    "Cannot %s database '%s' before it is initialized", operation, name));
        }
    }

    private void requireReadOnlySupport(boolean readOnly) {
        if (readOnly && !readOnlySupported) {
            throw new UnsupportedOperationException(String.format(
                    "Database '%s' does not support read-only connections", name));
        }
    }

    // ===== Monitoring =====

    /**
     * Records an operational error. The collection is bounded by {@link #getMaxErrors()}; the oldest
     * errors are dropped first.
     *
     * @param code    Error code for categorization (e.g., "CONNECTION_FAILED", "COMMAND_FAILED")
     * @param message Human-readable error message
     * @param details Additional context about the error
     */
    protected void recordError(String code, String message, String details) {
        errors.add(new OperationalError(Instant.now(), code, message, details));
        int maxErrors = getMaxErrors();
        while (errors.size() > maxErrors) {
            errors.pollFirst();
        }
    }

    protected int getMaxErrors() {
        return 1000;
    }

    @Override
    public List<OperationalError> getErrors() {
        return new ArrayList<>(errors);
    }

    @Override
    public void clearErrors() {
        errors.clear();
    }

    @Override
    public boolean isHealthy() {
        return errors.isEmpty();
    }

    @Override
    public final Map<String, Number> getMetrics() {
        Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("error_count", errors.size());
        metrics.put("version", version);
        metrics.put("batches_executed", batchesExecuted.get());
        metrics.put("batches_failed", batchesFailed.get());
        metrics.put("commands_executed", commandsExecuted.get());
        metrics.put("upgrade_steps", upgradeSteps.get());
        metrics.put("version_detections", detections.get());
        addCustomMetrics(metrics);
        return metrics;
    }

    /**
     * Hook for subclasses to add their own metrics.
     *
     * @param metrics Mutable map to add metrics to (already contains the base metrics)
     */
    protected void addCustomMetrics(Map<String, Number> metrics) {
        // Default: no custom metrics
    }

    @Override
    public String toString() {
        return String.format("%s[name=%s, state=%s, version=%d]", getClass().getSimpleName(), name, state, version);
    }
}
