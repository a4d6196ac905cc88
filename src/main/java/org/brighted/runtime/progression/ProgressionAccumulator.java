package org.brighted.runtime.progression;

import org.brighted.runtime.model.ProgressionCounters;

import java.time.Instant;
import java.util.Objects;

/**
 * Daily-capped experience awarding.
 * <p>
 * The day is a calendar day in the configured zone, not a sliding window: when the stored
 * day key differs from the current one, today's total counts as zero before the cap check.
 * The raw reward is scaled by the reward modifier and rounded, with a floor of one point for
 * every award, zero included; the result is then truncated to the remaining headroom, so an
 * award against an exhausted cap grants nothing and reports {@code isCapped}.
 */
public class ProgressionAccumulator {

    private final ProgressionSettings settings;

    public ProgressionAccumulator(ProgressionSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public ProgressionSettings getSettings() {
        return settings;
    }

    /**
     * Returns the day key for an instant in the configured zone.
     */
    public String dayKey(Instant now) {
        return DayKeys.of(now, settings.zone());
    }

    /**
     * Computes the capped award for a raw reward.
     *
     * @param counters  the user's current counters
     * @param rawReward unadjusted reward, {@code >= 0}
     * @param dayKey    current calendar day
     * @return the grant and its write-back instruction
     * @throws IllegalArgumentException if {@code rawReward} is negative
     */
    public XpUpdateResult calculateXPUpdate(ProgressionCounters counters, int rawReward, String dayKey) {
        if (rawReward < 0) {
            throw new IllegalArgumentException("rawReward cannot be negative: " + rawReward);
        }
        Objects.requireNonNull(dayKey, "dayKey");
        int cap = settings.dailyCap();
        boolean sameDay = dayKey.equals(counters.dayKeyOfLastAward());
        int today = sameDay ? Math.min(counters.xpAwardedToday(), cap) : 0;
        int headroom = Math.max(0, cap - today);

        int adjusted = adjust(rawReward);
        int gain = Math.min(headroom, adjusted);
        boolean capped = adjusted > headroom;

        XpUpdateInstruction updates = sameDay
                ? new XpUpdateInstruction(gain, XpUpdateInstruction.Mode.INCREMENT, gain, dayKey)
                : new XpUpdateInstruction(gain, XpUpdateInstruction.Mode.SET, gain, dayKey);
        return new XpUpdateResult(gain, today + gain, capped, updates);
    }

    private int adjust(int rawReward) {
        long scaled = Math.round(rawReward * settings.rewardModifier());
        return (int) Math.max(1, Math.min(Integer.MAX_VALUE, scaled));
    }
}
