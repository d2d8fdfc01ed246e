package org.dbmanager.cleanup;

import org.dbmanager.api.batches.Batch;
import org.dbmanager.api.cleanup.ICleanupProcessor;
import org.dbmanager.api.manager.IDbManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Cleans up by running a batch: the configured named batch, or the dialect's default cleanup batch.
 */
public class BatchCleanupProcessor implements ICleanupProcessor {

    private static final Logger log = LoggerFactory.getLogger(BatchCleanupProcessor.class);

    private final String cleanupBatchName;
    private final Supplier<Batch> defaultCleanupBatch;

    public BatchCleanupProcessor(String cleanupBatchName, Supplier<Batch> defaultCleanupBatch) {
        this.cleanupBatchName = cleanupBatchName == null || cleanupBatchName.isBlank() ? null : cleanupBatchName;
        this.defaultCleanupBatch = defaultCleanupBatch;
    }

    @Override
    public boolean cleanup(IDbManager manager) {
        Optional<Batch> batch;
        if (cleanupBatchName != null) {
            batch = manager.getBatch(cleanupBatchName);
            if (batch.isEmpty()) {
                log.warn("Cleanup batch '{}' not found for database '{}'", cleanupBatchName, manager.getName());
                return false;
            }
        } else {
            batch = defaultCleanupBatch == null ? Optional.empty() : Optional.ofNullable(defaultCleanupBatch.get());
            if (batch.isEmpty()) {
                log.warn("No cleanup batch available for database '{}'", manager.getName());
                return false;
            }
        }
        return manager.executeBatch(batch.get(), false, false);
    }
}
