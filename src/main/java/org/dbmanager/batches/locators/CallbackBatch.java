package org.dbmanager.batches.locators;

import org.dbmanager.api.batches.ExecutionType;
import org.dbmanager.api.batches.TransactionRequirement;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Metadata of an {@link ICallbackBatch}.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface CallbackBatch {

    /**
     * Batch name; defaults to the simple class name.
     */
    String name() default "";

    TransactionRequirement transactionRequirement() default TransactionRequirement.DONT_CARE;

    /**
     * Isolation level name (e.g. {@code "SERIALIZABLE"}); empty for none.
     */
    String isolationLevel() default "";

    ExecutionType executionType() default ExecutionType.NON_QUERY;
}
