package org.dbmanager.api.batches;

/**
 * Surfaces failures captured on the commands of an executed batch.
 * <p>
 * Further failures (when more than one command failed) are attached as suppressed exceptions.
 *
 * @see Batch#throwIfFailed()
 * @see Batch#throwIfAnyFailed()
 */
public class BatchExecutionException extends RuntimeException {

    public BatchExecutionException(String message, Throwable cause) {
        super(String.format("Database batch execution failed: %s", message), cause);
    }
}
