package org.brighted.runtime.progression;

import org.brighted.runtime.model.ProgressionCounters;

/**
 * Write-back description for an experience award.
 * <p>
 * Stores that support atomic increments translate this into
 * {@code xp_total = xp_total + totalIncrement} and, depending on {@link #todayMode()},
 * {@code xp_today = todayValue} or {@code xp_today = xp_today + todayValue}, so concurrent
 * awards for one user both land. {@link #applyTo(ProgressionCounters)} is the read-modify-write
 * fallback for stores that serialize per user.
 *
 * @param totalIncrement amount added to the lifetime total
 * @param todayMode      how {@code todayValue} is written
 * @param todayValue     new today total ({@code SET}) or amount to add ({@code INCREMENT})
 * @param dayKey         day key to store as the day of the last award
 */
public record XpUpdateInstruction(long totalIncrement, Mode todayMode, int todayValue, String dayKey) {

    public enum Mode {
        /** First award of a new day: overwrite today's total. */
        SET,
        /** Same-day award: add to today's total. */
        INCREMENT
    }

    public ProgressionCounters applyTo(ProgressionCounters counters) {
        int today = switch (todayMode) {
            case SET -> todayValue;
            case INCREMENT -> counters.xpAwardedToday() + todayValue;
        };
        return new ProgressionCounters(counters.xpTotal() + totalIncrement, today, dayKey);
    }
}
