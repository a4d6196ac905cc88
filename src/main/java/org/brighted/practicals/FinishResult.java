package org.brighted.practicals;

import org.brighted.runtime.progression.XpUpdateResult;

import java.util.Optional;

/**
 * Result of finishing a session.
 *
 * @param view the archived session
 * @param xp   the completion award; empty for failed sessions
 */
public record FinishResult(SessionView view, Optional<XpUpdateResult> xp) {
}
