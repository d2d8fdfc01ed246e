package org.dbmanager.api.manager;

import org.dbmanager.api.batches.Batch;
import org.dbmanager.api.batches.IsolationLevel;
import org.dbmanager.api.connections.DbTransaction;

import java.sql.Connection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Manages the lifecycle of one database: detects its version, executes batches against it and
 * drives incremental upgrades, backups and cleanups.
 * <p>
 * <strong>Lifecycle:</strong> {@link DbState#UNINITIALIZED} until {@link #initialize()}, which detects the
 * version and derives one of the other states. {@link #close()} returns to {@link DbState#UNINITIALIZED};
 * the manager can be initialized again afterwards.
 * <p>
 * <strong>Preconditions:</strong> operations called in the wrong state, for an unsupported capability or
 * with an out-of-range version fail immediately with {@link IllegalStateException},
 * {@link UnsupportedOperationException} or {@link IllegalArgumentException} before anything is changed.
 * <p>
 * <strong>Threading:</strong> not thread-safe. Callers must not run mutating operations concurrently.
 * {@link #getBatch(String, String)} and {@link #getBatchNames()} may run concurrently with each other.
 */
public interface IDbManager extends AutoCloseable {

    String getName();

    // ===== State =====

    DbState getState();

    int getVersion();

    /**
     * @return the state detected by the last {@link #initialize()}
     */
    DbState getInitialState();

    /**
     * @return the version detected by the last {@link #initialize()}
     */
    int getInitialVersion();

    default boolean isReady() {
        return getState().isReady();
    }

    void initialize();

    /**
     * Resets the manager to {@link DbState#UNINITIALIZED}. Never throws.
     */
    @Override
    void close();

    void addListener(IDbManagerListener listener);

    void removeListener(IDbManagerListener listener);

    // ===== Capabilities =====

    boolean supportsUpgrade();

    boolean supportsBackup();

    boolean supportsRestore();

    boolean supportsCleanup();

    boolean supportsReadOnly();

    /**
     * @return the lowest version the upgrader can start from, or -1 if upgrading is not supported
     */
    int getMinVersion();

    /**
     * @return the highest version the upgrader can reach, or -1 if upgrading is not supported
     */
    int getMaxVersion();

    /**
     * @return true if upgrading is supported, the state is ready or new and the version is below the maximum
     */
    boolean canUpgrade();

    // ===== Connections and batches =====

    /**
     * @return an open connection, or empty if the provider failed (already logged)
     * @throws IllegalStateException         if the manager is not ready
     * @throws UnsupportedOperationException if {@code readOnly} is requested but not supported
     */
    Optional<Connection> createConnection(boolean readOnly);

    /**
     * @param isolationLevel the isolation level, or {@code null} for the manager's default
     * @return an open transaction, or empty if the provider failed (already logged)
     */
    Optional<DbTransaction> createTransaction(boolean readOnly, IsolationLevel isolationLevel);

    default Optional<DbTransaction> createTransaction(boolean readOnly) {
        return createTransaction(readOnly, null);
    }

    Batch createBatch();

    /**
     * Executes the commands of {@code batch} in order on one connection or transaction.
     * <p>
     * Execution stops at the first command that throws. A command that records an error without
     * throwing does not stop execution. Results and failures are stored on the commands.
     *
     * @param batch          the batch to execute; reset before execution
     * @param readOnly       whether to open a read-only connection
     * @param detectVersionAfter whether to re-detect state and version afterwards
     * @return true if every command executed without failure
     * @throws org.dbmanager.api.batches.ConflictingRequirementException if the commands disagree on transaction
     *                                                                   or isolation requirements
     * @throws org.dbmanager.api.batches.InvalidBatchCommandException   if a command has neither or both of
     *                                                                   script and callback
     */
    boolean executeBatch(Batch batch, boolean readOnly, boolean detectVersionAfter);

    /**
     * @param commandSeparator separator line splitting scripts into commands; {@code null} for the default
     */
    Optional<Batch> getBatch(String name, String commandSeparator);

    default Optional<Batch> getBatch(String name) {
        return getBatch(name, null);
    }

    Set<String> getBatchNames();

    /**
     * @return all batches the locator provides, keyed by name
     */
    default Map<String, Batch> getBatches(String commandSeparator) {
        Map<String, Batch> batches = new LinkedHashMap<>();
        for (String name : getBatchNames()) {
            getBatch(name, commandSeparator).ifPresent(batch -> batches.put(name, batch));
        }
        return batches;
    }

    // ===== Maintenance =====

    /**
     * Upgrades one version at a time until {@code targetVersion} is reached.
     *
     * @return true if the target version was reached
     * @throws IllegalArgumentException if the target is outside the supported range or below the current version
     */
    boolean upgrade(int targetVersion);

    /**
     * Upgrades to {@link #getMaxVersion()}.
     */
    default boolean upgrade() {
        return upgrade(getMaxVersion());
    }

    boolean backup(Object backupTarget);

    boolean restore(Object backupSource);

    boolean cleanup();
}
