package org.dbmanager.batches.locators;

import org.dbmanager.api.batches.ExecutionType;
import org.dbmanager.api.batches.IsolationLevel;
import org.dbmanager.api.batches.TransactionRequirement;

import java.util.Optional;

/**
 * Options found in the inline directives of a script command. Absent options were not specified
 * or could not be parsed.
 */
public record ScriptCommandOptions(
    Optional<TransactionRequirement> transactionRequirement,
    Optional<IsolationLevel> isolationLevel,
    Optional<ExecutionType> executionType
) {

    public static ScriptCommandOptions none() {
        return new ScriptCommandOptions(Optional.empty(), Optional.empty(), Optional.empty());
    }
}
