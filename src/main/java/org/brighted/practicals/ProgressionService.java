package org.brighted.practicals;

import org.brighted.runtime.ledger.ResourceLedger;
import org.brighted.runtime.missions.CooldownLimiter;
import org.brighted.runtime.missions.MissionRegistration;
import org.brighted.runtime.model.CooldownWindow;
import org.brighted.runtime.model.MissionCooldownState;
import org.brighted.runtime.model.PlayerProfile;
import org.brighted.runtime.model.ProgressionCounters;
import org.brighted.runtime.model.ResourceBundle;
import org.brighted.runtime.model.ResourceEffect;
import org.brighted.runtime.progression.LabCompletionPolicy;
import org.brighted.runtime.progression.LabCompletionResult;
import org.brighted.runtime.progression.ProgressionAccumulator;
import org.brighted.runtime.progression.XpUpdateResult;
import org.brighted.runtime.spi.IRandomProvider;
import org.brighted.store.api.IGameStateStore;
import org.brighted.store.api.IStoreTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Experience, lab and mission rewards of a user.
 * <p>
 * The user's counters are locked for the transaction, so two devices recording progress
 * at the same time cannot both pass the daily cap or the mission threshold.
 */
public class ProgressionService {

    private static final Logger log = LoggerFactory.getLogger(ProgressionService.class);

    private final IGameStateStore store;
    private final ProgressionAccumulator accumulator;
    private final LabCompletionPolicy labPolicy;
    private final CooldownLimiter cooldownLimiter;
    private final ResourceLedger ledger;
    private final IRandomProvider random;
    private final TransactionRetry retry;
    private final ResourceBundle startingResources;
    private final int missionXpReward;

    public ProgressionService(IGameStateStore store,
                              ProgressionAccumulator accumulator,
                              CooldownLimiter cooldownLimiter,
                              ResourceLedger ledger,
                              IRandomProvider random,
                              TransactionRetry retry,
                              ResourceBundle startingResources,
                              int missionXpReward) {
        this.store = store;
        this.accumulator = accumulator;
        this.labPolicy = new LabCompletionPolicy(accumulator);
        this.cooldownLimiter = cooldownLimiter;
        this.ledger = ledger;
        this.random = random;
        this.retry = retry;
        this.startingResources = startingResources;
        this.missionXpReward = missionXpReward;
    }

    /**
     * Awards experience through the daily cap.
     *
     * @param rawReward unadjusted reward, {@code >= 0}
     * @return the granted amount and today's total
     */
    public XpUpdateResult awardXp(String userId, int rawReward, Instant now) {
        return retry.run("awardXp", () -> store.inTransaction(tx -> award(tx, userId, rawReward, now)));
    }

    /**
     * Completes a lab once per day: experience through the cap plus a coin reward.
     * A second completion of the same lab on the same day awards nothing.
     */
    public LabCompletionResult completeLab(String userId, String labId, int rawReward, Instant now) {
        return retry.run("completeLab", () -> store.inTransaction(tx -> {
            String dayKey = accumulator.dayKey(now);
            ProgressionCounters counters = tx.loadProgressionForUpdate(userId);
            String lastDay = tx.findLabCompletionDay(userId, labId).orElse(null);

            LabCompletionResult result = labPolicy.completeLab(counters, lastDay, labId, rawReward, dayKey, random);
            if (result.alreadyCompleted()) {
                log.debug("Lab '{}' already completed today by user {}", labId, userId);
                return result;
            }
            tx.applyXpUpdate(userId, result.xp().updates());
            tx.saveLabCompletion(userId, labId, dayKey);

            PlayerProfile profile = tx.findProfile(userId)
                    .orElseGet(() -> PlayerProfile.newPlayer(userId, startingResources));
            tx.saveProfile(profile.withResources(
                    ledger.applyDelta(profile.resources(), List.of(ResourceEffect.currency(result.coins())))));
            return result;
        }));
    }

    /**
     * Records a mission completion. While a cooldown is active the completion is neither
     * counted nor rewarded.
     *
     * @param cooldownMinutesOverride fixed cooldown length if this completion opens one; {@code null} to draw
     */
    public MissionCompletionResult completeMission(String userId, String missionId, Instant now,
                                                   Integer cooldownMinutesOverride) {
        return retry.run("completeMission", () -> store.inTransaction(tx -> {
            String dayKey = accumulator.dayKey(now);
            MissionCooldownState state = cooldownLimiter.normalize(tx.loadMissionStateForUpdate(userId), dayKey, now);
            if (state.cooldown() != null) {
                log.debug("Mission '{}' of user {} suppressed by cooldown until {}",
                        missionId, userId, state.cooldown().until());
                return new MissionCompletionResult(false, state.completedCount(),
                        Optional.of(state.cooldown()), Optional.empty());
            }

            MissionRegistration registration = cooldownLimiter.register(state, missionId, dayKey, now, random,
                    cooldownMinutesOverride);
            tx.saveMissionState(userId, registration.state());
            XpUpdateResult xp = award(tx, userId, missionXpReward, now);
            return new MissionCompletionResult(true, registration.dailyCount(), registration.cooldown(), Optional.of(xp));
        }));
    }

    /**
     * Returns the user's active mission cooldown, if any.
     */
    public Optional<CooldownWindow> getMissionCooldown(String userId, Instant now) {
        return retry.run("getMissionCooldown", () -> store.inTransaction(tx ->
                cooldownLimiter.currentCooldown(tx.loadMissionStateForUpdate(userId), accumulator.dayKey(now), now)));
    }

    /**
     * Returns the user's stored experience counters.
     */
    public ProgressionCounters getProgression(String userId) {
        return retry.run("getProgression", () -> store.inTransaction(tx -> tx.loadProgressionForUpdate(userId)));
    }

    private XpUpdateResult award(IStoreTransaction tx, String userId, int rawReward, Instant now) {
        XpUpdateResult result = accumulator.calculateXPUpdate(
                tx.loadProgressionForUpdate(userId), rawReward, accumulator.dayKey(now));
        tx.applyXpUpdate(userId, result.updates());
        if (result.isCapped()) {
            log.debug("Experience for user {} capped: granted {} of raw {}", userId, result.xpGain(), rawReward);
        }
        return result;
    }
}
