package org.brighted.runtime.progression;

import org.brighted.runtime.Config;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Tunables of the progression accumulator.
 *
 * @param dailyCap       maximum experience granted per calendar day, {@code >= 0}
 * @param rewardModifier multiplier applied to raw rewards before capping, {@code > 0}
 * @param zone           time zone in which calendar days are computed
 */
public record ProgressionSettings(int dailyCap, double rewardModifier, ZoneId zone) {

    public ProgressionSettings {
        Objects.requireNonNull(zone, "zone");
        if (dailyCap < 0) {
            throw new IllegalArgumentException("dailyCap cannot be negative: " + dailyCap);
        }
        if (!(rewardModifier > 0) || Double.isInfinite(rewardModifier)) {
            throw new IllegalArgumentException("rewardModifier must be a positive finite number: " + rewardModifier);
        }
    }

    public static ProgressionSettings defaults() {
        return new ProgressionSettings(Config.DEFAULT_DAILY_XP_CAP, 1.0, ZoneOffset.UTC);
    }

    public ProgressionSettings withDailyCap(int cap) {
        return new ProgressionSettings(cap, rewardModifier, zone);
    }
}
