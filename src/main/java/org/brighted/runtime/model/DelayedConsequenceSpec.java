package org.brighted.runtime.model;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * A rule's request to apply effects later. The caller turns it into a persisted
 * {@link Consequence} with {@code scheduledAt = now + delay}.
 *
 * @param ruleId  rule identifier for audit
 * @param delay   relative delay, never negative
 * @param effects effects to realize once due
 */
public record DelayedConsequenceSpec(String ruleId, Duration delay, List<ResourceEffect> effects) {

    public DelayedConsequenceSpec {
        Objects.requireNonNull(ruleId, "ruleId");
        Objects.requireNonNull(delay, "delay");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay cannot be negative: " + delay);
        }
        effects = List.copyOf(effects);
    }

    public static DelayedConsequenceSpec inMinutes(String ruleId, long delayMinutes, List<ResourceEffect> effects) {
        return new DelayedConsequenceSpec(ruleId, Duration.ofMinutes(delayMinutes), effects);
    }

    public long delayMinutes() {
        return delay.toMinutes();
    }
}
