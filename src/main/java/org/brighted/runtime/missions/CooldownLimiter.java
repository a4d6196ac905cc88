package org.brighted.runtime.missions;

import org.brighted.runtime.model.CooldownWindow;
import org.brighted.runtime.model.MissionCooldownState;
import org.brighted.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Daily mission completion counter with a randomized cooldown.
 * <p>
 * Completions are a set per calendar day. The completion that brings the set to the
 * threshold opens a cooldown of a uniformly drawn length; later completions that day neither
 * extend it nor open another one after it expired. Every read goes through {@link #normalize}, which resets
 * the set on a new day and drops a window once it expired or its count no longer holds.
 */
public class CooldownLimiter {

    private static final Logger log = LoggerFactory.getLogger(CooldownLimiter.class);

    static final String REASON_FORMAT = "Daily mission limit reached (%d). Cooldown active.";

    private final CooldownSettings settings;

    public CooldownLimiter(CooldownSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public CooldownSettings getSettings() {
        return settings;
    }

    /**
     * Records a mission completion.
     *
     * @param state             stored state
     * @param missionId         completed mission
     * @param dayKey            current calendar day
     * @param now               completion time
     * @param random            source for the cooldown length
     * @param overrideMinutes   fixed cooldown length, clamped to the configured range; {@code null} draws one
     * @return the new state and the day's count
     */
    public MissionRegistration register(MissionCooldownState state, String missionId, String dayKey, Instant now,
                                        IRandomProvider random, Integer overrideMinutes) {
        if (missionId == null || missionId.isBlank()) {
            throw new IllegalArgumentException("missionId cannot be blank");
        }
        MissionCooldownState current = normalize(state, dayKey, now);
        Set<String> completed = new LinkedHashSet<>(current.completedMissionIds());
        boolean added = completed.add(missionId);
        int count = completed.size();

        // only the completion that reaches the threshold opens a window, so at most one per day
        CooldownWindow window = current.cooldown();
        boolean opened = false;
        if (window == null && added && count == settings.threshold()) {
            int minutes = overrideMinutes != null
                    ? settings.clampMinutes(overrideMinutes)
                    : settings.minMinutes() + random.nextInt(settings.maxMinutes() - settings.minMinutes() + 1);
            window = new CooldownWindow(now.plus(Duration.ofMinutes(minutes)), String.format(REASON_FORMAT, count));
            opened = true;
            log.debug("Mission cooldown opened for {} minute(s) after {} completion(s)", minutes, count);
        }
        return new MissionRegistration(new MissionCooldownState(dayKey, completed, window), count, opened);
    }

    /**
     * Returns the active cooldown window, if any.
     */
    public Optional<CooldownWindow> currentCooldown(MissionCooldownState state, String dayKey, Instant now) {
        return Optional.ofNullable(normalize(state, dayKey, now).cooldown());
    }

    /**
     * Brings stored state up to date: a different day starts empty, and a window is cleared
     * when {@code now >= until} or the count is below the threshold.
     */
    public MissionCooldownState normalize(MissionCooldownState state, String dayKey, Instant now) {
        if (state == null || !dayKey.equals(state.dayKey())) {
            return new MissionCooldownState(dayKey, Set.of(), null);
        }
        CooldownWindow window = state.cooldown();
        if (window != null && (!window.isActiveAt(now) || state.completedCount() < settings.threshold())) {
            return new MissionCooldownState(dayKey, state.completedMissionIds(), null);
        }
        return state;
    }
}
