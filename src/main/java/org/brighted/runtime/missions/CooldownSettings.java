package org.brighted.runtime.missions;

import org.brighted.runtime.Config;

/**
 * Tunables of the mission cooldown.
 *
 * @param threshold  distinct completions per day that open a cooldown
 * @param minMinutes shortest cooldown, inclusive
 * @param maxMinutes longest cooldown, inclusive
 */
public record CooldownSettings(int threshold, int minMinutes, int maxMinutes) {

    public CooldownSettings {
        if (threshold <= 0) {
            throw new IllegalArgumentException("threshold must be positive: " + threshold);
        }
        if (minMinutes <= 0 || maxMinutes < minMinutes) {
            throw new IllegalArgumentException(
                    "cooldown range must satisfy 0 < min <= max, got [" + minMinutes + ", " + maxMinutes + "]");
        }
    }

    public static CooldownSettings defaults() {
        return new CooldownSettings(Config.MISSION_COOLDOWN_THRESHOLD,
                Config.MISSION_COOLDOWN_MIN_MINUTES, Config.MISSION_COOLDOWN_MAX_MINUTES);
    }

    /**
     * Clamps a requested cooldown length into {@code [minMinutes, maxMinutes]}.
     */
    public int clampMinutes(int requested) {
        return Math.max(minMinutes, Math.min(maxMinutes, requested));
    }
}
