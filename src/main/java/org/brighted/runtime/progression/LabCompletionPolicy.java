package org.brighted.runtime.progression;

import org.brighted.runtime.model.ProgressionCounters;
import org.brighted.runtime.spi.IRandomProvider;

/**
 * Once-per-day awards for discrete lab activities.
 */
public class LabCompletionPolicy {

    public static final int MIN_COINS = 25;
    public static final int MAX_COINS = 45;

    private final ProgressionAccumulator accumulator;

    public LabCompletionPolicy(ProgressionAccumulator accumulator) {
        this.accumulator = accumulator;
    }

    /**
     * Awards a lab completion unless the same lab was already completed today.
     * A repeat is skipped entirely, not capped.
     *
     * @param counters             user's progression counters
     * @param lastCompletedDayKey  day the lab was last completed, or {@code null}
     * @param labId                lab identifier
     * @param rawReward            unadjusted experience reward
     * @param dayKey               current day
     * @param random               source for the coin reward
     * @return the award
     */
    public LabCompletionResult completeLab(ProgressionCounters counters, String lastCompletedDayKey, String labId,
                                           int rawReward, String dayKey, IRandomProvider random) {
        if (labId == null || labId.isBlank()) {
            throw new IllegalArgumentException("labId cannot be blank");
        }
        if (dayKey.equals(lastCompletedDayKey)) {
            return LabCompletionResult.repeat();
        }
        XpUpdateResult xp = accumulator.calculateXPUpdate(counters, rawReward, dayKey);
        int coins = MIN_COINS + random.nextInt(MAX_COINS - MIN_COINS + 1);
        return new LabCompletionResult(false, xp, coins);
    }
}
