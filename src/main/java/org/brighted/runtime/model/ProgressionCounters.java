package org.brighted.runtime.model;

/**
 * Per-user experience counters.
 *
 * @param xpTotal            lifetime experience
 * @param xpAwardedToday     experience granted on {@code dayKeyOfLastAward}
 * @param dayKeyOfLastAward  calendar day ({@code yyyy-MM-dd}) of the last award, or {@code null}
 */
public record ProgressionCounters(long xpTotal, int xpAwardedToday, String dayKeyOfLastAward) {

    public ProgressionCounters {
        if (xpTotal < 0 || xpAwardedToday < 0) {
            throw new IllegalArgumentException("experience counters cannot be negative");
        }
    }

    public static ProgressionCounters empty() {
        return new ProgressionCounters(0, 0, null);
    }
}
