package org.brighted.practicals;

import org.brighted.runtime.model.Consequence;
import org.brighted.runtime.model.ResourceEffect;

import java.util.List;

/**
 * Result of a submitted decision.
 *
 * @param decisionId       id of the decision log entry
 * @param view             the session after the decision
 * @param immediateEffects effects applied at once
 * @param scheduled        delayed consequences created by the decision
 */
public record DecisionOutcome(String decisionId, SessionView view, List<ResourceEffect> immediateEffects,
                              List<Consequence> scheduled) {
}
