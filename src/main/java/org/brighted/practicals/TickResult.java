package org.brighted.practicals;

import org.brighted.runtime.model.Consequence;

import java.util.List;

/**
 * Result of advancing a session to an instant.
 *
 * @param view    the session after the tick
 * @param applied consequences realized by this tick, in realization order
 */
public record TickResult(SessionView view, List<Consequence> applied) {
}
