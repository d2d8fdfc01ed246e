package org.dbmanager.api.batches;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * An ordered, mutable sequence of {@link BatchCommand}s executed as one logical unit against one
 * connection or transaction.
 * <p>
 * <strong>Transaction rule:</strong> a batch requires a transaction if any command requires one and
 * disallows one if any command disallows one. Both at once is a conflict, detected by
 * {@link #requiresTransaction()} and {@link #disallowsTransaction()} before every execution.
 * <p>
 * <strong>Execution state:</strong> the executor writes results into the commands in place. The
 * accessors below only read that state and return empty values for a batch that has not run.
 * <p>
 * Not thread-safe.
 */
public class Batch {

    private final List<BatchCommand> commands = new ArrayList<>();

    public Batch() {
    }

    /**
     * Creates a batch holding the given command instances (no copies).
     */
    public Batch(List<BatchCommand> commands) {
        commands.forEach(this::add);
    }

    // ===== Building =====

    public BatchCommand add(BatchCommand command) {
        commands.add(Objects.requireNonNull(command, "command cannot be null"));
        return command;
    }

    public BatchCommand addScript(String script) {
        return addScript(script, TransactionRequirement.DONT_CARE, null, null);
    }

    public BatchCommand addScript(String script, TransactionRequirement transactionRequirement) {
        return addScript(script, transactionRequirement, null, null);
    }

    public BatchCommand addScript(String script, TransactionRequirement transactionRequirement,
                                  IsolationLevel isolationLevel, ExecutionType executionType) {
        return add(new BatchCommand(Objects.requireNonNull(script, "script cannot be null"),
                transactionRequirement, isolationLevel, executionType));
    }

    public BatchCommand addCallback(IBatchCallback callback) {
        return addCallback(callback, TransactionRequirement.DONT_CARE, null, null);
    }

    public BatchCommand addCallback(IBatchCallback callback, TransactionRequirement transactionRequirement) {
        return addCallback(callback, transactionRequirement, null, null);
    }

    public BatchCommand addCallback(IBatchCallback callback, TransactionRequirement transactionRequirement,
                                    IsolationLevel isolationLevel, ExecutionType executionType) {
        return add(new BatchCommand(Objects.requireNonNull(callback, "callback cannot be null"),
                transactionRequirement, isolationLevel, executionType));
    }

    /**
     * @return the live, modifiable command list
     */
    public List<BatchCommand> getCommands() {
        return commands;
    }

    public int size() {
        return commands.size();
    }

    public boolean isEmpty() {
        return commands.isEmpty();
    }

    // ===== Requirements =====

    /**
     * @return true if at least one command requires a transaction
     * @throws ConflictingRequirementException if another command disallows one
     */
    public boolean requiresTransaction() {
        return mergedTransactionRequirement() == TransactionRequirement.REQUIRED;
    }

    /**
     * @return true if at least one command disallows a transaction
     * @throws ConflictingRequirementException if another command requires one
     */
    public boolean disallowsTransaction() {
        return mergedTransactionRequirement() == TransactionRequirement.DISALLOWED;
    }

    private TransactionRequirement mergedTransactionRequirement() {
        boolean required = false;
        boolean disallowed = false;
        for (BatchCommand command : commands) {
            required |= command.getTransactionRequirement() == TransactionRequirement.REQUIRED;
            disallowed |= command.getTransactionRequirement() == TransactionRequirement.DISALLOWED;
        }
        if (required && disallowed) {
            throw new ConflictingRequirementException(
                    "Conflicting transaction requirements: batch contains commands that require and disallow a transaction");
        }
        return required ? TransactionRequirement.REQUIRED
                : disallowed ? TransactionRequirement.DISALLOWED : TransactionRequirement.DONT_CARE;
    }

    /**
     * @return the isolation level requested by the commands, or {@code null} if none requests one
     * @throws ConflictingRequirementException if commands request different levels
     */
    public IsolationLevel getIsolationLevel() {
        IsolationLevel level = null;
        for (BatchCommand command : commands) {
            IsolationLevel commandLevel = command.getIsolationLevel().orElse(null);
            if (commandLevel == null) {
                continue;
            }
            if (level != null && level != commandLevel) {
                throw new ConflictingRequirementException(String.format(
                        "Conflicting isolation levels: %s and %s", level, commandLevel));
            }
            level = commandLevel;
        }
        return level;
    }

    // ===== Execution state =====

    /**
     * Clears the execution state of every command. Idempotent.
     */
    public void reset() {
        commands.forEach(BatchCommand::reset);
    }

    /**
     * True when every command was executed. An empty batch is fully executed.
     */
    public boolean wasFullyExecuted() {
        return commands.stream().allMatch(BatchCommand::wasExecuted);
    }

    public boolean wasPartiallyExecuted() {
        return commands.stream().anyMatch(BatchCommand::wasExecuted);
    }

    public boolean hasFailed() {
        return commands.stream().anyMatch(BatchCommand::hasFailed);
    }

    /**
     * @return the result of the last executed command, or {@code null}
     */
    public Object getResult() {
        Object result = null;
        for (BatchCommand command : commands) {
            if (command.wasExecuted()) {
                result = command.getResult();
            }
        }
        return result;
    }

    /**
     * @return the results of all executed commands, in order
     */
    public List<Object> getResults() {
        List<Object> results = new ArrayList<>();
        for (BatchCommand command : commands) {
            if (command.wasExecuted()) {
                results.add(command.getResult());
            }
        }
        return Collections.unmodifiableList(results);
    }

    /**
     * @return the first recorded error message, or {@code null}
     */
    public String getError() {
        List<String> errors = getErrors();
        return errors.isEmpty() ? null : errors.get(0);
    }

    public List<String> getErrors() {
        List<String> errors = new ArrayList<>();
        for (BatchCommand command : commands) {
            if (command.getError() != null && !command.getError().isEmpty()) {
                errors.add(command.getError());
            }
        }
        return Collections.unmodifiableList(errors);
    }

    /**
     * @return the first captured exception, or {@code null}
     */
    public Throwable getException() {
        List<Throwable> exceptions = getExceptions();
        return exceptions.isEmpty() ? null : exceptions.get(0);
    }

    public List<Throwable> getExceptions() {
        List<Throwable> exceptions = new ArrayList<>();
        for (BatchCommand command : commands) {
            if (command.getException() != null) {
                exceptions.add(command.getException());
            }
        }
        return Collections.unmodifiableList(exceptions);
    }

    /**
     * Throws a {@link BatchExecutionException} for the first failed command, if any.
     */
    public void throwIfFailed() {
        for (BatchCommand command : commands) {
            if (command.hasFailed()) {
                throw failureOf(command);
            }
        }
    }

    /**
     * Throws one {@link BatchExecutionException} for the first failed command with the failures of all
     * further failed commands attached as suppressed exceptions.
     */
    public void throwIfAnyFailed() {
        BatchExecutionException aggregate = null;
        for (BatchCommand command : commands) {
            if (!command.hasFailed()) {
                continue;
            }
            BatchExecutionException failure = failureOf(command);
            if (aggregate == null) {
                aggregate = failure;
            } else {
                aggregate.addSuppressed(failure);
            }
        }
        if (aggregate != null) {
            throw aggregate;
        }
    }

    private static BatchExecutionException failureOf(BatchCommand command) {
        String message = command.getError() != null && !command.getError().isEmpty()
                ? command.getError()
                : String.valueOf(command.getException());
        return new BatchExecutionException(message, command.getException());
    }

    // ===== Splitting and copying =====

    /**
     * @return one batch per command, each holding the original command instance
     */
    public List<Batch> splitCommands() {
        return splitCommands(null);
    }

    /**
     * @param filter selects the commands to split out; {@code null} selects all
     * @return one batch per selected command, each holding the original command instance
     */
    public List<Batch> splitCommands(Predicate<BatchCommand> filter) {
        List<Batch> batches = new ArrayList<>();
        for (BatchCommand command : commands) {
            if (filter == null || filter.test(command)) {
                Batch single = new Batch();
                single.add(command);
                batches.add(single);
            }
        }
        return batches;
    }

    /**
     * @return a deep copy; commands and their parameters are independent of this batch
     */
    public Batch copy() {
        Batch copy = new Batch();
        commands.forEach(command -> copy.add(command.copy()));
        return copy;
    }

    @Override
    public String toString() {
        return "Batch" + commands;
    }
}
