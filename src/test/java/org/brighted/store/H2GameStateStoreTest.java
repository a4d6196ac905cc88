package org.brighted.store;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.brighted.junit.extensions.logging.LogWatchExtension;
import org.brighted.runtime.model.BusinessSimState;
import org.brighted.runtime.model.Consequence;
import org.brighted.runtime.model.ConsequenceType;
import org.brighted.runtime.model.CooldownWindow;
import org.brighted.runtime.model.MissionCooldownState;
import org.brighted.runtime.model.PlayerProfile;
import org.brighted.runtime.model.PracticalSession;
import org.brighted.runtime.model.ProgressionCounters;
import org.brighted.runtime.model.RegistrationStatus;
import org.brighted.runtime.model.ResourceBundle;
import org.brighted.runtime.model.ResourceEffect;
import org.brighted.runtime.model.SessionSnapshot;
import org.brighted.runtime.model.SessionState;
import org.brighted.runtime.progression.XpUpdateInstruction;
import org.brighted.store.api.DecisionLogEntry;
import org.brighted.store.api.StoreConflictException;
import org.brighted.store.api.StoreException;
import org.h2.api.ErrorCode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("integration")
@ExtendWith(LogWatchExtension.class)
class H2GameStateStoreTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private H2GameStateStore store;

    @BeforeEach
    void setUp() {
        Config options = ConfigFactory.parseMap(Map.of(
                "jdbcUrl", "jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1",
                "maxPoolSize", 4,
                "minIdle", 1));
        store = new H2GameStateStore("h2-test", options);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void sessionSnapshotIsStoredAndUpdated() {
        BusinessSimState business = BusinessSimState.initial(500, T0)
                .withRegistration(RegistrationStatus.PENDING, T0, "Acme");
        PracticalSession session = new PracticalSession("s1", "u1", "business-financial-literacy", SessionState.ACTIVE,
                new SessionSnapshot(new ResourceBundle(100, 90, 80, Map.of("stock", 2)), Map.of("regulator", -20), business),
                T0, T0, null);

        store.inTransaction(tx -> {
            tx.insertSession(session);
            return null;
        });
        PracticalSession finished = session.finish(SessionState.COMPLETED, T0.plusSeconds(60));
        store.inTransaction(tx -> {
            tx.updateSession(finished);
            return null;
        });

        assertThat(store.<Optional<PracticalSession>>inTransaction(tx -> tx.findSessionForUpdate("s1"))).contains(finished);
    }

    @Test
    void profileRoundTrips() {
        PlayerProfile profile = PlayerProfile.newPlayer("u1", ResourceBundle.of(100, 100, 100));

        store.inTransaction(tx -> {
            tx.saveProfile(profile);
            tx.saveProfile(profile.withResources(ResourceBundle.of(70, 100, 100)));
            return null;
        });

        assertThat(store.<Optional<PlayerProfile>>inTransaction(tx -> tx.findProfile("u1")))
                .hasValueSatisfying(p -> assertThat(p.resources().currency()).isEqualTo(70));
    }

    @Test
    void consequenceIsClaimedAtMostOnce() {
        Consequence stored = store.inTransaction(tx -> tx.insertConsequence(new Consequence("c1", "d1", "s1",
                ConsequenceType.DELAYED, T0, null, "audit_risk",
                List.of(ResourceEffect.currency(-100), ResourceEffect.reputation("regulator", -20)), 0)));

        assertThat(stored.sequence()).isPositive();
        assertThat(store.<List<Consequence>>inTransaction(tx -> tx.listPendingConsequences("s1")))
                .singleElement().satisfies(c -> assertThat(c.effects()).isEqualTo(stored.effects()));
        assertThat(store.<Boolean>inTransaction(tx -> tx.markConsequenceApplied("c1", T0))).isTrue();
        assertThat(store.<Boolean>inTransaction(tx -> tx.markConsequenceApplied("c1", T0))).isFalse();
        assertThat(store.<List<Consequence>>inTransaction(tx -> tx.listPendingConsequences("s1"))).isEmpty();
    }

    @Test
    void rolledBackTransactionDiscardsWrites() {
        assertThatThrownBy(() -> store.inTransaction(tx -> {
            tx.saveProfile(PlayerProfile.newPlayer("u1", ResourceBundle.of(1, 1, 1)));
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(store.<Optional<PlayerProfile>>inTransaction(tx -> tx.findProfile("u1"))).isEmpty();
        assertThat(store.isHealthy()).isTrue();
        assertThat(store.getMetrics()).containsKeys("transactions_rolled_back", "pool_active_connections");
    }

    @Test
    void experienceIncrementsAccumulate() {
        store.inTransaction(tx -> {
            tx.applyXpUpdate("u1", new XpUpdateInstruction(150, XpUpdateInstruction.Mode.SET, 150, "2026-03-01"));
            tx.applyXpUpdate("u1", new XpUpdateInstruction(40, XpUpdateInstruction.Mode.INCREMENT, 40, "2026-03-01"));
            return null;
        });
        store.inTransaction(tx -> {
            tx.applyXpUpdate("u1", new XpUpdateInstruction(10, XpUpdateInstruction.Mode.INCREMENT, 10, "2026-03-01"));
            return null;
        });

        assertThat(store.<ProgressionCounters>inTransaction(tx -> tx.loadProgressionForUpdate("u1")))
                .isEqualTo(new ProgressionCounters(200, 200, "2026-03-01"));
        assertThat(store.<ProgressionCounters>inTransaction(tx -> tx.loadProgressionForUpdate("nobody")))
                .isEqualTo(ProgressionCounters.empty());
    }

    @Test
    void labAndMissionStateAreUpserted() {
        MissionCooldownState missions = new MissionCooldownState("2026-03-01", Set.of("m1", "m2"),
                new CooldownWindow(T0.plusSeconds(300), "Daily mission limit reached (5). Cooldown active."));

        store.inTransaction(tx -> {
            tx.saveLabCompletion("u1", "photosynthesis-1", "2026-02-28");
            tx.saveLabCompletion("u1", "photosynthesis-1", "2026-03-01");
            tx.saveMissionState("u1", MissionCooldownState.empty());
            tx.saveMissionState("u1", missions);
            return null;
        });

        assertThat(store.<Optional<String>>inTransaction(tx -> tx.findLabCompletionDay("u1", "photosynthesis-1"))).contains("2026-03-01");
        assertThat(store.<MissionCooldownState>inTransaction(tx -> tx.loadMissionStateForUpdate("u1"))).isEqualTo(missions);
    }

    @Test
    void decisionsAreListedInInsertionOrder() {
        store.inTransaction(tx -> {
            tx.appendDecision(new DecisionLogEntry("d1", "s1", "u1", "business_register", Map.of("businessName", "Acme"),
                    List.of(), List.of(), T0));
            tx.appendDecision(new DecisionLogEntry("d2", "s1", "u1", "business_take_loan", Map.of("principal", 300L),
                    List.of(ResourceEffect.currency(300)), List.of(), T0.plusSeconds(1)));
            return null;
        });

        List<DecisionLogEntry> decisions = store.inTransaction(tx -> tx.listDecisions("s1"));

        assertThat(decisions).extracting(DecisionLogEntry::id).containsExactly("d1", "d2");
        assertThat(decisions.get(1).payload()).containsEntry("principal", 300L);
        assertThat(decisions.get(1).immediateEffects()).containsExactly(ResourceEffect.currency(300));
    }

    @Test
    void lockFailuresAreConflicts() {
        assertThat(H2GameStateStore.translate("tick", new SQLException("lock", "HYT00", ErrorCode.LOCK_TIMEOUT_1)))
                .isInstanceOf(StoreConflictException.class);
        assertThat(H2GameStateStore.translate("tick", new SQLException("syntax", "42000", ErrorCode.SYNTAX_ERROR_1)))
                .isExactlyInstanceOf(StoreException.class);
    }

    @Test
    void missingJdbcUrlIsRejected() {
        assertThatThrownBy(() -> new H2GameStateStore("broken", ConfigFactory.empty()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
