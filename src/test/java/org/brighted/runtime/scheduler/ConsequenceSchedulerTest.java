package org.brighted.runtime.scheduler;

import org.brighted.junit.extensions.logging.LogWatchExtension;
import org.brighted.runtime.ledger.ResourceLedger;
import org.brighted.runtime.model.Consequence;
import org.brighted.runtime.model.ConsequenceType;
import org.brighted.runtime.model.DelayedConsequenceSpec;
import org.brighted.runtime.model.ResourceBundle;
import org.brighted.runtime.model.ResourceEffect;
import org.brighted.runtime.model.SessionSnapshot;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ConsequenceSchedulerTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private final ConsequenceScheduler scheduler = new ConsequenceScheduler(new ResourceLedger(100));

    @Test
    void scheduleAddsDelayToDecisionTime() {
        Consequence c = scheduler.schedule("c1", "d1", "s1",
                DelayedConsequenceSpec.inMinutes("audit_risk", 5, List.of(ResourceEffect.currency(-100))), T0);

        assertThat(c.type()).isEqualTo(ConsequenceType.DELAYED);
        assertThat(c.scheduledAt()).isEqualTo(T0.plusSeconds(300));
        assertThat(c.isApplied()).isFalse();
    }

    @Test
    void immediateRecordIsBornApplied() {
        Consequence c = scheduler.recordImmediate("c1", "d1", "s1", "business_take_loan",
                List.of(ResourceEffect.currency(200)), T0);

        assertThat(c.type()).isEqualTo(ConsequenceType.IMMEDIATE);
        assertThat(c.appliedAt()).isEqualTo(T0);
        assertThat(scheduler.listDue(List.of(c), "s1", T0.plusSeconds(3600))).isEmpty();
    }

    @Test
    void listDueFiltersBySessionTimeAndState() {
        Consequence due = pending("a", "s1", T0, 1);
        Consequence exactlyNow = pending("b", "s1", T0.plusSeconds(60), 2);
        Consequence future = pending("c", "s1", T0.plusSeconds(61), 3);
        Consequence otherSession = pending("d", "s2", T0, 4);
        Consequence applied = pending("e", "s1", T0, 5).withAppliedAt(T0);

        assertThat(scheduler.listDue(List.of(future, exactlyNow, otherSession, applied, due), "s1", T0.plusSeconds(60)))
                .extracting(Consequence::id)
                .containsExactly("a", "b");
    }

    @Test
    void tiesAreBrokenByCreationSequence() {
        Consequence later = pending("late", "s1", T0, 9);
        Consequence earlier = pending("early", "s1", T0, 3);

        assertThat(scheduler.listDue(List.of(later, earlier), "s1", T0))
                .extracting(Consequence::id)
                .containsExactly("early", "late");
    }

    @Test
    void realizeAppliesOnceAndStaleIsNoOp() {
        Consequence c = pending("a", "s1", T0, 1);
        ResourceBundle bundle = ResourceBundle.of(100, 0, 0);

        RealizationResult first = scheduler.realize(c, bundle, T0.plusSeconds(10));
        RealizationResult second = scheduler.realize(first.consequence(), first.bundle(), T0.plusSeconds(20));

        assertThat(first.applied()).isTrue();
        assertThat(first.bundle().currency()).isEqualTo(50);
        assertThat(first.consequence().appliedAt()).isEqualTo(T0.plusSeconds(10));
        assertThat(second.applied()).isFalse();
        assertThat(second.bundle()).isSameAs(first.bundle());
        assertThat(second.consequence().appliedAt()).isEqualTo(T0.plusSeconds(10));
    }

    @Test
    void realizeAllAppliesInOrderIncludingReputation() {
        Consequence morale = new Consequence("m", "d1", "s1", ConsequenceType.DELAYED, T0.plusSeconds(180), null,
                "morale_drop_productivity", List.of(ResourceEffect.currency(-50)), 1);
        Consequence audit = new Consequence("a", "d2", "s1", ConsequenceType.DELAYED, T0.plusSeconds(300), null,
                "audit_risk", List.of(ResourceEffect.currency(-100), ResourceEffect.reputation("regulator", -20)), 2);
        SessionSnapshot snapshot = new SessionSnapshot(ResourceBundle.of(120, 10, 10), Map.of(), null);

        SnapshotRealization result = scheduler.realizeAll(List.of(audit, morale), snapshot, T0.plusSeconds(300));

        assertThat(result.applied()).extracting(Consequence::id).containsExactly("m", "a");
        assertThat(result.applied()).allSatisfy(c -> assertThat(c.appliedAt()).isEqualTo(T0.plusSeconds(300)));
        assertThat(result.snapshot().resources().currency()).isZero();
        assertThat(result.snapshot().reputation()).containsEntry("regulator", -20);
    }

    @Test
    void realizeAllSkipsNotYetDueEntries() {
        SessionSnapshot snapshot = new SessionSnapshot(ResourceBundle.of(100, 0, 0), Map.of(), null);

        SnapshotRealization result = scheduler.realizeAll(List.of(pending("a", "s1", T0.plusSeconds(1), 1)), snapshot, T0);

        assertThat(result.applied()).isEmpty();
        assertThat(result.snapshot()).isSameAs(snapshot);
    }

    private static Consequence pending(String id, String sessionId, Instant at, long sequence) {
        return new Consequence(id, "d", sessionId, ConsequenceType.DELAYED, at, null, "rule",
                List.of(ResourceEffect.currency(-50)), sequence);
    }
}
