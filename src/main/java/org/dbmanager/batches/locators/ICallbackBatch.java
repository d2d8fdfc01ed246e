package org.dbmanager.batches.locators;

import org.dbmanager.api.batches.IBatchCallback;

/**
 * A callback that can be registered with a {@link CallbackBatchLocator} as a batch of its own.
 * <p>
 * Implementations are annotated with {@link CallbackBatch} for their metadata and may be
 * listed in {@code META-INF/services/org.dbmanager.batches.locators.ICallbackBatch} for discovery
 * through {@link java.util.ServiceLoader}, in which case they need a public no-argument constructor.
 */
public interface ICallbackBatch extends IBatchCallback {
}
