package org.dbmanager.api.batches;

/**
 * Transaction requirement of a single batch command.
 * <p>
 * A batch as a whole requires a transaction if any of its commands is {@link #REQUIRED}; a batch
 * containing both {@link #REQUIRED} and {@link #DISALLOWED} commands cannot be executed.
 */
public enum TransactionRequirement {
    /** The command runs either inside or outside of a transaction. */
    DONT_CARE,
    /** The command must run inside a transaction. */
    REQUIRED,
    /** The command must not run inside a transaction (e.g. maintenance statements). */
    DISALLOWED;

    /**
     * Merges two requirements. {@link #DONT_CARE} yields to the other side.
     *
     * @param other the requirement to merge with
     * @return the merged requirement
     * @throws ConflictingRequirementException if one side requires and the other disallows a transaction
     */
    public TransactionRequirement merge(TransactionRequirement other) {
        if (other == null || other == DONT_CARE || other == this) {
            return this;
        }
        if (this == DONT_CARE) {
            return other;
        }
        throw new ConflictingRequirementException("Conflicting transaction requirements: " + this + " and " + other);
    }
}
