package org.brighted.runtime;

/**
 * Provides centralized default settings for the practicals engine.
 * This final class contains static constants used where no configuration value
 * is supplied (tests, direct engine calls). Runtime overrides come from
 * {@code reference.conf} via {@link org.brighted.config.EngineSettings}.
 */
public final class Config {

    private Config() {}

    /**
     * The maximum energy a player can hold. Energy deltas clamp into {@code [0, MAX_ENERGY]}.
     */
    public static final int MAX_ENERGY = 100;

    /**
     * Starting cash of a freshly created business.
     */
    public static final int INITIAL_BUSINESS_CASH = 500;

    /**
     * Default time a submitted registration spends in processing (30 seconds).
     */
    public static final long DEFAULT_REGISTRATION_WINDOW_SECONDS = 30;

    /**
     * Default ceiling on experience points granted per calendar day.
     */
    public static final int DEFAULT_DAILY_XP_CAP = 200;

    /**
     * Number of distinct missions per day after which a cooldown window opens.
     */
    public static final int MISSION_COOLDOWN_THRESHOLD = 5;

    /**
     * Lower bound (inclusive) of the randomized mission cooldown, in minutes.
     */
    public static final int MISSION_COOLDOWN_MIN_MINUTES = 5;

    /**
     * Upper bound (inclusive) of the randomized mission cooldown, in minutes.
     */
    public static final int MISSION_COOLDOWN_MAX_MINUTES = 10;

    public static final long MS_PER_MINUTE = 60_000L;
}
