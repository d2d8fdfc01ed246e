package org.dbmanager.manager;

import org.dbmanager.api.backup.IBackupCreator;
import org.dbmanager.api.batches.IBatchLocator;
import org.dbmanager.api.batches.ICommandExecutor;
import org.dbmanager.api.cleanup.ICleanupProcessor;
import org.dbmanager.api.connections.IConnectionProvider;
import org.dbmanager.api.versioning.IVersionDetector;
import org.dbmanager.api.versioning.IVersionUpgrader;

import java.util.Objects;
import java.util.Optional;

/**
 * The collaborators a database manager delegates to.
 * <p>
 * Connection provider, command executor and version detector are mandatory. A missing batch
 * locator yields no batches; a missing upgrader, backup creator or cleanup processor disables
 * the corresponding capability.
 */
public final class DbManagerComponents {

    private final IConnectionProvider connectionProvider;
    private final ICommandExecutor commandExecutor;
    private final IVersionDetector versionDetector;
    private final IBatchLocator batchLocator;
    private final IVersionUpgrader versionUpgrader;
    private final IBackupCreator backupCreator;
    private final ICleanupProcessor cleanupProcessor;

    private DbManagerComponents(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider cannot be null");
        this.commandExecutor = Objects.requireNonNull(builder.commandExecutor, "commandExecutor cannot be null");
        this.versionDetector = Objects.requireNonNull(builder.versionDetector, "versionDetector cannot be null");
        this.batchLocator = builder.batchLocator;
        this.versionUpgrader = builder.versionUpgrader;
        this.backupCreator = builder.backupCreator;
        this.cleanupProcessor = builder.cleanupProcessor;
    }

    public static Builder builder() {
        return new Builder();
    }

    public IConnectionProvider connectionProvider() {
        return connectionProvider;
    }

    public ICommandExecutor commandExecutor() {
        return commandExecutor;
    }

    public IVersionDetector versionDetector() {
        return versionDetector;
    }

    public Optional<IBatchLocator> batchLocator() {
        return Optional.ofNullable(batchLocator);
    }

    public Optional<IVersionUpgrader> versionUpgrader() {
        return Optional.ofNullable(versionUpgrader);
    }

    public Optional<IBackupCreator> backupCreator() {
        return Optional.ofNullable(backupCreator);
    }

    public Optional<ICleanupProcessor> cleanupProcessor() {
        return Optional.ofNullable(cleanupProcessor);
    }

    public static final class Builder {
        private IConnectionProvider connectionProvider;
        private ICommandExecutor commandExecutor;
        private IVersionDetector versionDetector;
        private IBatchLocator batchLocator;
        private IVersionUpgrader versionUpgrader;
        private IBackupCreator backupCreator;
        private ICleanupProcessor cleanupProcessor;

        private Builder() {
        }

        public Builder connectionProvider(IConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        public Builder commandExecutor(ICommandExecutor commandExecutor) {
            this.commandExecutor = commandExecutor;
            return this;
        }

        public Builder versionDetector(IVersionDetector versionDetector) {
            this.versionDetector = versionDetector;
            return this;
        }

        public Builder batchLocator(IBatchLocator batchLocator) {
            this.batchLocator = batchLocator;
            return this;
        }

        public Builder versionUpgrader(IVersionUpgrader versionUpgrader) {
            this.versionUpgrader = versionUpgrader;
            return this;
        }

        public Builder backupCreator(IBackupCreator backupCreator) {
            this.backupCreator = backupCreator;
            return this;
        }

        public Builder cleanupProcessor(ICleanupProcessor cleanupProcessor) {
            this.cleanupProcessor = cleanupProcessor;
            return this;
        }

        public DbManagerComponents build() {
            return new DbManagerComponents(this);
        }
    }
}
