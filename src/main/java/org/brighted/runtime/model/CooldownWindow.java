package org.brighted.runtime.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Interval during which reward-granting mission completions are suppressed.
 *
 * @param until  end of the window (exclusive)
 * @param reason human-readable explanation
 */
public record CooldownWindow(Instant until, String reason) {

    public CooldownWindow {
        Objects.requireNonNull(until, "until");
        Objects.requireNonNull(reason, "reason");
    }

    public boolean isActiveAt(Instant now) {
        return now.isBefore(until);
    }
}
