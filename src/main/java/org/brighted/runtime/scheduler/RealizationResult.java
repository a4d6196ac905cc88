package org.brighted.runtime.scheduler;

import org.brighted.runtime.model.Consequence;
import org.brighted.runtime.model.ResourceBundle;

/**
 * Outcome of realizing one consequence.
 *
 * @param bundle      resources after realization (unchanged when {@code applied} is false)
 * @param consequence the consequence with {@code appliedAt} stamped
 * @param applied     false when the consequence had already been applied (stale, no-op)
 */
public record RealizationResult(ResourceBundle bundle, Consequence consequence, boolean applied) {
}
