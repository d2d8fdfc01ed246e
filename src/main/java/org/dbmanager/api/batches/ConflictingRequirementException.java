package org.dbmanager.api.batches;

/**
 * Thrown when the commands of a batch disagree on their transaction requirement or isolation level,
 * or when an inline script directive contradicts a requirement already set for the batch.
 * <p>
 * Raised before execution starts; a batch that fails this check is never run.
 */
public class ConflictingRequirementException extends IllegalStateException {

    public ConflictingRequirementException(String message) {
        super(message);
    }
}
