package org.dbmanager.api.batches;

/**
 * Thrown when a command reaches execution with neither or both of script and callback set.
 * This is a programming error and is never reported as an ordinary command failure.
 */
public class InvalidBatchCommandException extends IllegalStateException {

    public InvalidBatchCommandException(String message) {
        super(message);
    }
}
