package org.dbmanager.api.batches;

import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Resolves named batches from some source of scripts or callbacks.
 * <p>
 * Batch names are case-insensitive. Implementations must be safe to query concurrently as long
 * as their registrations are not modified at the same time.
 */
public interface IBatchLocator {

    /**
     * @return the names of all batches this locator can provide; never {@code null}, case-insensitive
     */
    Set<String> getNames();

    /**
     * Resolves a batch.
     *
     * @param name             the batch name
     * @param commandSeparator separator line splitting scripts into commands; {@code null} selects the
     *                         locator's default
     * @param batchFactory     creates the batch instance to fill
     * @return the filled batch, or empty if this locator does not know {@code name}
     */
    Optional<Batch> getBatch(String name, String commandSeparator, Supplier<Batch> batchFactory);

    default Optional<Batch> getBatch(String name) {
        return getBatch(name, null, Batch::new);
    }
}
