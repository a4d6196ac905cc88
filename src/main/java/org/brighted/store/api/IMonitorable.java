package org.brighted.store.api;

import java.util.List;
import java.util.Map;

/**
 * Components exposing metrics, recorded errors and health.
 */
public interface IMonitorable {

    /**
     * Returns metric names (e.g. {@code "transactions_committed"}) mapped to current values.
     */
    Map<String, Number> getMetrics();

    /**
     * Returns the operational errors recorded since the last {@link #clearErrors()}.
     */
    List<OperationalError> getErrors();

    void clearErrors();

    /**
     * @return true if no operational errors are recorded
     */
    boolean isHealthy();
}
