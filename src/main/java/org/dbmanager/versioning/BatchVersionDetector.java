package org.dbmanager.versioning;

import org.dbmanager.api.batches.Batch;
import org.dbmanager.api.batches.BatchCommand;
import org.dbmanager.api.batches.ExecutionType;
import org.dbmanager.api.manager.IDbManager;
import org.dbmanager.api.versioning.IVersionDetector;
import org.dbmanager.api.versioning.VersionDetection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Detects the database version by running a detection batch.
 * <p>
 * The batch is either the named batch configured for detection or the dialect's default. Its
 * commands run one at a time, each as a single-command batch, and each yields a number:
 * <ul>
 *   <li>{@code <= 0}: detection stops and the value is the version (0: new database, negative: damaged)</li>
 *   <li>{@code > 0}: detection continues with the next command</li>
 * </ul>
 * The value of the last command is the version. A failing command makes the detection unsuccessful.
 */
public class BatchVersionDetector implements IVersionDetector {

    private static final Logger log = LoggerFactory.getLogger(BatchVersionDetector.class);

    private final String detectionBatchName;
    private final Supplier<Batch> defaultDetectionBatch;

    /**
     * @param detectionBatchName    name of the batch to run, {@code null} or blank to use the default
     * @param defaultDetectionBatch creates the default detection batch
     */
    public BatchVersionDetector(String detectionBatchName, Supplier<Batch> defaultDetectionBatch) {
        this.detectionBatchName = detectionBatchName == null || detectionBatchName.isBlank() ? null : detectionBatchName;
        this.defaultDetectionBatch = defaultDetectionBatch;
    }

    @Override
    public VersionDetection detect(IDbManager manager) {
        Optional<Batch> batch = detectionBatch(manager);
        if (batch.isEmpty() || batch.get().isEmpty()) {
            log.warn("No version detection batch available for database '{}'", manager.getName());
            return VersionDetection.failed();
        }

        int version = -1;
        for (Batch step : batch.get().splitCommands()) {
            BatchCommand command = step.getCommands().get(0);
            command.setExecutionType(ExecutionType.SCALAR);
            if (!manager.executeBatch(step, false, false)) {
                log.warn("Version detection of database '{}' failed: {}", manager.getName(), step.getError());
                return VersionDetection.failed();
            }
            Optional<Integer> value = toVersion(step.getResult());
            if (value.isEmpty()) {
                log.warn("Version detection of database '{}' returned a non-numeric value: {}",
                        manager.getName(), step.getResult());
                return VersionDetection.failed();
            }
            version = value.get();
            if (version <= 0) {
                break;
            }
        }
        return VersionDetection.of(version);
    }

    private Optional<Batch> detectionBatch(IDbManager manager) {
        if (detectionBatchName != null) {
            return manager.getBatch(detectionBatchName);
        }
        return defaultDetectionBatch == null ? Optional.empty() : Optional.ofNullable(defaultDetectionBatch.get());
    }

    /**
     * Interprets a scalar result as version. {@code null} (no row) counts as damaged.
     */
    static Optional<Integer> toVersion(Object result) {
        if (result == null) {
            return Optional.of(-1);
        }
        if (result instanceof List<?> values) {
            return values.isEmpty() ? Optional.of(-1) : toVersion(values.get(values.size() - 1));
        }
        if (result instanceof Number number) {
            long value = number.longValue();
            if (value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) {
                return Optional.empty();
            }
            return Optional.of((int) value);
        }
        if (result instanceof Boolean flag) {
            return Optional.of(flag ? 1 : 0);
        }
        try {
            return Optional.of(Integer.parseInt(result.toString().trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
