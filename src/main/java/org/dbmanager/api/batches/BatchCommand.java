package org.dbmanager.api.batches;

import java.util.Objects;
import java.util.Optional;

/**
 * A single unit of work inside a {@link Batch}: either script text or a callback.
 * <p>
 * The requirements (transaction, isolation, execution type) and parameters are set when the command
 * is built. Result, error, exception and the executed flag are written by the executor and cleared
 * by {@link #reset()}.
 */
public class BatchCommand {

    private String script;
    private IBatchCallback callback;
    private TransactionRequirement transactionRequirement;
    private IsolationLevel isolationLevel;
    private ExecutionType executionType;
    private final BatchCommandParameters parameters;

    private Object result;
    private String error;
    private Throwable exception;
    private boolean executed;

    public BatchCommand(String script, TransactionRequirement transactionRequirement,
                        IsolationLevel isolationLevel, ExecutionType executionType) {
        this(script, null, transactionRequirement, isolationLevel, executionType, new BatchCommandParameters());
    }

    public BatchCommand(IBatchCallback callback, TransactionRequirement transactionRequirement,
                        IsolationLevel isolationLevel, ExecutionType executionType) {
        this(null, callback, transactionRequirement, isolationLevel, executionType, new BatchCommandParameters());
    }

    private BatchCommand(String script, IBatchCallback callback, TransactionRequirement transactionRequirement,
                         IsolationLevel isolationLevel, ExecutionType executionType,
                         BatchCommandParameters parameters) {
        this.script = script;
        this.callback = callback;
        this.transactionRequirement = transactionRequirement != null ? transactionRequirement : TransactionRequirement.DONT_CARE;
        this.isolationLevel = isolationLevel;
        this.executionType = executionType != null ? executionType : ExecutionType.NON_QUERY;
        this.parameters = parameters;
    }

    public String getScript() {
        return script;
    }

    public void setScript(String script) {
        this.script = script;
    }

    public IBatchCallback getCallback() {
        return callback;
    }

    public void setCallback(IBatchCallback callback) {
        this.callback = callback;
    }

    public boolean isScript() {
        return script != null && callback == null;
    }

    public boolean isCallback() {
        return callback != null && script == null;
    }

    /**
     * @return true if exactly one of script and callback is set
     */
    public boolean isValid() {
        return isScript() || isCallback();
    }

    public TransactionRequirement getTransactionRequirement() {
        return transactionRequirement;
    }

    public BatchCommand setTransactionRequirement(TransactionRequirement transactionRequirement) {
        this.transactionRequirement = Objects.requireNonNull(transactionRequirement, "transactionRequirement cannot be null");
        return this;
    }

    public Optional<IsolationLevel> getIsolationLevel() {
        return Optional.ofNullable(isolationLevel);
    }

    public BatchCommand setIsolationLevel(IsolationLevel isolationLevel) {
        this.isolationLevel = isolationLevel;
        return this;
    }

    public ExecutionType getExecutionType() {
        return executionType;
    }

    public BatchCommand setExecutionType(ExecutionType executionType) {
        this.executionType = Objects.requireNonNull(executionType, "executionType cannot be null");
        return this;
    }

    public BatchCommandParameters getParameters() {
        return parameters;
    }

    public BatchCommand withParameter(String name, Object value) {
        parameters.add(name, value);
        return this;
    }

    public Object getResult() {
        return result;
    }

    public void setResult(Object result) {
        this.result = result;
    }

    public String getError() {
        return error;
    }

    /**
     * Records a failure without throwing. Callbacks use this to report soft errors.
     */
    public void setError(String error) {
        this.error = error;
    }

    public Throwable getException() {
        return exception;
    }

    public void setException(Throwable exception) {
        this.exception = exception;
    }

    public boolean wasExecuted() {
        return executed;
    }

    public void setExecuted(boolean executed) {
        this.executed = executed;
    }

    public boolean hasFailed() {
        return (error != null && !error.isEmpty()) || exception != null;
    }

    /**
     * Clears result, error, exception and the executed flag.
     */
    public void reset() {
        result = null;
        error = null;
        exception = null;
        executed = false;
    }

    /**
     * Deep copy including parameters and execution state.
     */
    public BatchCommand copy() {
        BatchCommand copy = new BatchCommand(script, callback, transactionRequirement, isolationLevel,
                executionType, parameters.copy());
        copy.result = result;
        copy.error = error;
        copy.exception = exception;
        copy.executed = executed;
        return copy;
    }

    @Override
    public String toString() {
        String body = isCallback() ? "callback" : abbreviate(script);
        return String.format("BatchCommand[%s, tx=%s, type=%s]", body, transactionRequirement, executionType);
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "null";
        }
        String singleLine = text.replaceAll("\\s+", " ").trim();
        return singleLine.length() <= 60 ? singleLine : singleLine.substring(0, 57) + "...";
    }
}
