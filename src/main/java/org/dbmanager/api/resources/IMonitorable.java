package org.dbmanager.api.resources;

import java.util.List;
import java.util.Map;

/**
 * A component exposing metrics, recorded operational errors and a health flag.
 */
public interface IMonitorable {

    /**
     * Returns a map of metrics for the component.
     * <p>
     * The keys are metric names (e.g., "batches_executed", "upgrade_steps") and the
     * values are the corresponding numeric values.
     *
     * @return A map of metric names to their current values.
     */
    Map<String, Number> getMetrics();

    /**
     * Returns the operational errors recorded since the last {@link #clearErrors()}.
     *
     * @return A list of {@link OperationalError}s, oldest first.
     */
    List<OperationalError> getErrors();

    void clearErrors();

    /**
     * @return true if the component is healthy, false if it has recorded errors.
     */
    boolean isHealthy();
}
