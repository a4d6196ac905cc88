package org.brighted.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.brighted.runtime.business.BusinessConfig;
import org.brighted.runtime.missions.CooldownSettings;
import org.brighted.runtime.model.ResourceBundle;
import org.brighted.runtime.progression.ProgressionSettings;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Typed view of the {@code brighted} configuration tree.
 * <p>
 * Reads every engine tunable once at startup; missing keys fall back to {@code reference.conf}.
 * <pre>
 * brighted {
 *   engine {
 *     ledger.max-energy = 100
 *     player { starting-currency = 100, starting-time-units = 100, starting-energy = 100 }
 *     business { processing-window = 30s, initial-cash = 500, ... }
 *     progression { daily-cap = 200, reward-modifier = 1.0, zone = "UTC", ... }
 *     missions { threshold = 5, cooldown-min-minutes = 5, cooldown-max-minutes = 10 }
 *   }
 *   retry { max-attempts = 3, initial-backoff = 50ms, max-backoff = 1s }
 *   store { className = "...", options { ... } }
 * }
 * </pre>
 */
public final class EngineSettings {

    private final int maxEnergy;
    private final ResourceBundle startingResources;
    private final BusinessConfig business;
    private final ProgressionSettings progression;
    private final CooldownSettings missions;
    private final int practicalXpReward;
    private final int missionXpReward;
    private final Long randomSeed;
    private final RetrySettings retry;
    private final Config store;

    private EngineSettings(Config root) {
        Config engine = root.getConfig("brighted.engine");
        this.maxEnergy = engine.getInt("ledger.max-energy");
        this.startingResources = ResourceBundle.of(
                engine.getInt("player.starting-currency"),
                engine.getInt("player.starting-time-units"),
                Math.min(maxEnergy, engine.getInt("player.starting-energy")));

        Config b = engine.getConfig("business");
        this.business = new BusinessConfig(
                b.getDuration("processing-window"),
                b.getLong("initial-cash"),
                b.getDouble("loan-rate"),
                b.getDuration("loan-term"),
                b.getDouble("tax-rate"),
                b.getDouble("market-bias"),
                b.getDouble("market-range"));

        Config p = engine.getConfig("progression");
        this.progression = new ProgressionSettings(
                p.getInt("daily-cap"),
                p.getDouble("reward-modifier"),
                ZoneId.of(p.getString("zone")));
        this.practicalXpReward = p.getInt("practical-xp-reward");
        this.missionXpReward = p.getInt("mission-xp-reward");

        Config m = engine.getConfig("missions");
        this.missions = new CooldownSettings(
                m.getInt("threshold"),
                m.getInt("cooldown-min-minutes"),
                m.getInt("cooldown-max-minutes"));

        this.randomSeed = engine.hasPath("random-seed") ? engine.getLong("random-seed") : null;

        Config r = root.getConfig("brighted.retry");
        this.retry = new RetrySettings(r.getInt("max-attempts"), r.getDuration("initial-backoff"),
                r.getDuration("max-backoff"));

        this.store = root.getConfig("brighted.store");
    }

    /**
     * Maps a loaded configuration; keys absent from {@code root} take their reference defaults.
     *
     * @param root configuration as returned by {@link ConfigLoader}
     * @return the typed settings
     * @throws com.typesafe.config.ConfigException if a value has the wrong type
     */
    public static EngineSettings from(Config root) {
        Objects.requireNonNull(root, "root");
        return new EngineSettings(root.withFallback(ConfigFactory.parseResources("reference.conf")).resolve());
    }

    /**
     * Settings built from {@code reference.conf} alone.
     */
    public static EngineSettings defaults() {
        return from(ConfigFactory.empty());
    }

    public int getMaxEnergy() {
        return maxEnergy;
    }

    /** Resources of a newly created player profile. */
    public ResourceBundle getStartingResources() {
        return startingResources;
    }

    public BusinessConfig getBusiness() {
        return business;
    }

    public ProgressionSettings getProgression() {
        return progression;
    }

    public CooldownSettings getMissions() {
        return missions;
    }

    /** Raw experience granted for completing a practical. */
    public int getPracticalXpReward() {
        return practicalXpReward;
    }

    /** Raw experience granted for a rewarded mission completion. */
    public int getMissionXpReward() {
        return missionXpReward;
    }

    /**
     * Seed of the engine's random provider, or {@code null} to seed from the clock.
     */
    public Long getRandomSeed() {
        return randomSeed;
    }

    public RetrySettings getRetry() {
        return retry;
    }

    /**
     * The {@code brighted.store} block: {@code className} and {@code options}.
     */
    public Config getStoreConfig() {
        return store;
    }

    /**
     * Retry policy for store conflicts.
     *
     * @param maxAttempts    total attempts including the first, {@code >= 1}
     * @param initialBackoff wait before the second attempt; doubles per retry
     * @param maxBackoff     upper bound of a single wait
     */
    public record RetrySettings(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {

        public RetrySettings {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be at least 1");
            }
            if (initialBackoff.isNegative() || maxBackoff.isNegative()) {
                throw new IllegalArgumentException("backoff cannot be negative");
            }
        }
    }
}
