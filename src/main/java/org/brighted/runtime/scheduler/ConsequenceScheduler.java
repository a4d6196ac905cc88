package org.brighted.runtime.scheduler;

import org.brighted.runtime.ledger.ResourceLedger;
import org.brighted.runtime.model.Consequence;
import org.brighted.runtime.model.ConsequenceType;
import org.brighted.runtime.model.DelayedConsequenceSpec;
import org.brighted.runtime.model.ResourceBundle;
import org.brighted.runtime.model.ResourceEffect;
import org.brighted.runtime.model.SessionSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Creates, selects and realizes delayed consequences.
 * <p>
 * <strong>Stateless:</strong> the scheduler owns no consequence records. Candidates come
 * from the store; results go back to the store.
 * <p>
 * <strong>At-most-once:</strong> {@link #listDue} never selects a consequence with
 * {@code appliedAt} set, and {@link #realize} of an applied consequence is a no-op.
 * Durability across processes belongs to the caller, which must mark a consequence applied
 * with a compare-and-swap on {@code appliedAt IS NULL} in the same transaction that writes
 * the resulting resources, and apply only the consequences whose swap succeeded.
 * <p>
 * <strong>Ordering:</strong> due consequences are realized by ascending {@code scheduledAt},
 * ties broken by creation {@code sequence}.
 */
public class ConsequenceScheduler {

    private static final Logger log = LoggerFactory.getLogger(ConsequenceScheduler.class);

    /** Realization order: due time, then creation order. */
    public static final Comparator<Consequence> DUE_ORDER =
            Comparator.comparing(Consequence::scheduledAt).thenComparingLong(Consequence::sequence);

    private final ResourceLedger ledger;

    public ConsequenceScheduler(ResourceLedger ledger) {
        this.ledger = Objects.requireNonNull(ledger, "ledger");
    }

    /**
     * Builds the pending consequence for a delayed spec. The store assigns the sequence on insert.
     *
     * @param id         new consequence id
     * @param decisionId owning decision
     * @param sessionId  owning session
     * @param spec       the rule's delayed spec
     * @param now        decision time; {@code scheduledAt = now + spec.delay()}
     * @return a pending consequence
     */
    public Consequence schedule(String id, String decisionId, String sessionId, DelayedConsequenceSpec spec, Instant now) {
        return new Consequence(id, decisionId, sessionId, ConsequenceType.DELAYED,
                now.plus(spec.delay()), null, spec.ruleId(), spec.effects(), 0L);
    }

    /**
     * Builds the audit record for effects that were applied at decision time.
     * The record is born applied and can never be selected as due.
     */
    public Consequence recordImmediate(String id, String decisionId, String sessionId, String ruleId,
                                       List<ResourceEffect> effects, Instant now) {
        return new Consequence(id, decisionId, sessionId, ConsequenceType.IMMEDIATE, now, now, ruleId, effects, 0L);
    }

    /**
     * Selects the due consequences of one session.
     *
     * @param candidates consequences loaded from the store (any session, any state)
     * @param sessionId  session to select for
     * @param now        evaluation time
     * @return pending consequences with {@code scheduledAt <= now}, in realization order
     */
    public List<Consequence> listDue(Collection<Consequence> candidates, String sessionId, Instant now) {
        return candidates.stream()
                .filter(c -> c.sessionId().equals(sessionId))
                .filter(c -> c.isDueAt(now))
                .sorted(DUE_ORDER)
                .toList();
    }

    /**
     * Applies a consequence's effects and stamps it applied.
     *
     * @param consequence consequence to realize
     * @param bundle      resources before realization
     * @param now         realization time written to {@code appliedAt}
     * @return the new bundle and stamped consequence; a stale consequence yields the input bundle unchanged
     */
    public RealizationResult realize(Consequence consequence, ResourceBundle bundle, Instant now) {
        if (consequence.isApplied()) {
            log.debug("Consequence {} already applied at {}, skipping", consequence.id(), consequence.appliedAt());
            return new RealizationResult(bundle, consequence, false);
        }
        ResourceBundle next = ledger.applyDelta(bundle, consequence.effects());
        return new RealizationResult(next, consequence.withAppliedAt(now), true);
    }

    /**
     * Realizes a batch against a session snapshot, including reputation effects.
     * Input is re-filtered and re-ordered, so stale or not-yet-due entries are skipped.
     *
     * @param due      consequences believed due
     * @param snapshot snapshot before realization
     * @param now      realization time
     * @return the new snapshot and the consequences applied
     */
    public SnapshotRealization realizeAll(Collection<Consequence> due, SessionSnapshot snapshot, Instant now) {
        List<Consequence> ordered = due.stream().filter(c -> c.isDueAt(now)).sorted(DUE_ORDER).toList();
        SessionSnapshot current = snapshot;
        List<Consequence> applied = new ArrayList<>(ordered.size());
        for (Consequence c : ordered) {
            current = ledger.applyToSnapshot(current, c.effects());
            applied.add(c.withAppliedAt(now));
        }
        if (!applied.isEmpty()) {
            log.debug("Realized {} consequence(s) at {}", applied.size(), now);
        }
        return new SnapshotRealization(current, applied);
    }

    public ResourceLedger getLedger() {
        return ledger;
    }
}
