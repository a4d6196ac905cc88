package org.brighted.practicals;

import com.typesafe.config.ConfigFactory;
import org.brighted.config.EngineSettings;
import org.brighted.junit.extensions.logging.LogWatchExtension;
import org.brighted.runtime.decisions.BusinessChoiceRules;
import org.brighted.runtime.internal.services.SeededRandomProvider;
import org.brighted.runtime.model.MissionCooldownState;
import org.brighted.runtime.model.ProgressionCounters;
import org.brighted.runtime.progression.XpUpdateResult;
import org.brighted.store.H2GameStateStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Races several devices of one user against a real H2 store, where serialization comes from
 * row locks and conflict retries instead of a single in-process lock.
 */
@Tag("integration")
@ExtendWith(LogWatchExtension.class)
class H2ConcurrentProgressTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");
    private static final String USER = "student-1";
    private static final int DEVICES = 6;

    private PracticalsEngine engine;
    private ProgressionService progression;
    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        EngineSettings settings = EngineSettings.from(ConfigFactory.parseString(
                "brighted.retry.max-attempts = 6\nbrighted.retry.initial-backoff = 5ms\n"));
        H2GameStateStore store = new H2GameStateStore("h2-concurrency", ConfigFactory.parseMap(Map.of(
                "jdbcUrl", "jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000",
                "maxPoolSize", DEVICES,
                "minIdle", 1)));
        engine = PracticalsEngine.create(settings, store, new SeededRandomProvider(7L));
        progression = engine.progression();
        pool = Executors.newFixedThreadPool(DEVICES);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
        engine.close();
    }

    @Test
    void firstAwardsOfANewUserRespectTheDailyCap() throws Exception {
        List<Callable<XpUpdateResult>> awards = new ArrayList<>();
        for (int i = 0; i < DEVICES; i++) {
            awards.add(() -> progression.awardXp(USER, 40, T0));
        }

        int granted = 0;
        for (Future<XpUpdateResult> result : pool.invokeAll(awards)) {
            XpUpdateResult award = result.get();
            assertThat(award.xpToday()).isLessThanOrEqualTo(200);
            granted += award.xpGain();
        }

        ProgressionCounters counters = progression.getProgression(USER);
        assertThat(granted).isEqualTo(200);
        assertThat(counters.xpTotal()).isEqualTo(granted);
        assertThat(counters.xpAwardedToday()).isEqualTo(200);
    }

    @Test
    void concurrentAwardsOnAnExistingUserAddUp() throws Exception {
        progression.awardXp(USER, 10, T0);

        List<Callable<XpUpdateResult>> awards = new ArrayList<>();
        for (int i = 0; i < DEVICES; i++) {
            awards.add(() -> progression.awardXp(USER, 20, T0.plusSeconds(1)));
        }
        int granted = 10;
        for (Future<XpUpdateResult> result : pool.invokeAll(awards)) {
            granted += result.get().xpGain();
        }

        ProgressionCounters counters = progression.getProgression(USER);
        assertThat(granted).isEqualTo(10 + DEVICES * 20);
        assertThat(counters.xpTotal()).isEqualTo(granted);
        assertThat(counters.xpAwardedToday()).isEqualTo(granted);
    }

    @Test
    void concurrentMissionsLoseNoIdAndOpenOneCooldown() throws Exception {
        List<Callable<MissionCompletionResult>> missions = new ArrayList<>();
        for (int i = 1; i <= DEVICES; i++) {
            String missionId = "mission-" + i;
            missions.add(() -> progression.completeMission(USER, missionId, T0, null));
        }

        List<MissionCompletionResult> results = new ArrayList<>();
        for (Future<MissionCompletionResult> result : pool.invokeAll(missions)) {
            results.add(result.get());
        }

        List<MissionCompletionResult> rewarded = results.stream().filter(MissionCompletionResult::rewarded).toList();
        assertThat(rewarded).extracting(MissionCompletionResult::dailyCount).containsExactlyInAnyOrder(1, 2, 3, 4, 5);
        assertThat(results).filteredOn(r -> !r.rewarded()).singleElement()
                .satisfies(r -> assertThat(r.cooldown()).isPresent());

        int granted = rewarded.stream().mapToInt(r -> r.xp().orElseThrow().xpGain()).sum();
        ProgressionCounters counters = progression.getProgression(USER);
        assertThat(granted).isEqualTo(200);
        assertThat(counters.xpTotal()).isEqualTo(granted);

        MissionCooldownState state = engine.store().inTransaction(tx -> tx.loadMissionStateForUpdate(USER));
        assertThat(state.completedMissionIds()).hasSize(5).allMatch(id -> id.startsWith("mission-"));
        assertThat(progression.getMissionCooldown(USER, T0.plusSeconds(1))).isPresent();
    }

    @Test
    void concurrentTicksApplyADelayedConsequenceOnce() throws Exception {
        PracticalSessionService sessions = engine.sessions();
        String id = sessions.startSession(USER, BusinessChoiceRules.STORY_SLUG, T0).session().id();
        sessions.submitDecision(USER, id, BusinessChoiceRules.UNDERPAY_STAFF, Map.of(), T0);
        Instant due = T0.plus(Duration.ofMinutes(3));

        List<Callable<TickResult>> ticks = new ArrayList<>();
        for (int i = 0; i < DEVICES; i++) {
            ticks.add(() -> sessions.tick(USER, id, due));
        }
        int applied = 0;
        for (Future<TickResult> result : pool.invokeAll(ticks)) {
            applied += result.get().applied().size();
        }

        assertThat(applied).isEqualTo(1);
        assertThat(sessions.viewSession(USER, id, due).session().snapshot().resources().currency()).isEqualTo(70);
    }
}
