package org.brighted.runtime.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A resource-effect bundle tied to a prior decision.
 * <p>
 * Created with {@code appliedAt == null}; becomes due once {@code now >= scheduledAt};
 * transitions to applied exactly once. The scheduler's realize step is the only writer
 * of {@code appliedAt}.
 *
 * @param id          unique id
 * @param decisionId  the decision log entry that produced this consequence
 * @param sessionId   owning session
 * @param type        immediate or delayed
 * @param scheduledAt instant from which the consequence is due
 * @param appliedAt   instant it was applied, {@code null} while pending
 * @param ruleId      rule identifier kept for audit
 * @param effects     effects to apply, in order
 * @param sequence    creation order within the store, used to break {@code scheduledAt} ties
 */
public record Consequence(
        String id,
        String decisionId,
        String sessionId,
        ConsequenceType type,
        Instant scheduledAt,
        Instant appliedAt,
        String ruleId,
        List<ResourceEffect> effects,
        long sequence
) {

    public Consequence {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(scheduledAt, "scheduledAt");
        Objects.requireNonNull(ruleId, "ruleId");
        effects = List.copyOf(effects);
    }

    public boolean isApplied() {
        return appliedAt != null;
    }

    /**
     * Returns true when the consequence is pending and its scheduled time has been reached.
     */
    public boolean isDueAt(Instant now) {
        return appliedAt == null && !scheduledAt.isAfter(now);
    }

    public Consequence withAppliedAt(Instant at) {
        return new Consequence(id, decisionId, sessionId, type, scheduledAt, at, ruleId, effects, sequence);
    }

    public Consequence withSequence(long seq) {
        return new Consequence(id, decisionId, sessionId, type, scheduledAt, appliedAt, ruleId, effects, seq);
    }
}
