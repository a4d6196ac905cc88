package org.brighted.practicals;

import org.brighted.config.EngineSettings;
import org.brighted.runtime.business.BusinessLifecycle;
import org.brighted.runtime.decisions.DecisionResolutionEngine;
import org.brighted.runtime.internal.services.SeededRandomProvider;
import org.brighted.runtime.ledger.ResourceLedger;
import org.brighted.runtime.missions.CooldownLimiter;
import org.brighted.runtime.progression.ProgressionAccumulator;
import org.brighted.runtime.scheduler.ConsequenceScheduler;
import org.brighted.runtime.spi.IRandomProvider;
import org.brighted.store.GameStateStoreFactory;
import org.brighted.store.api.IGameStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires the engine components and services from {@link EngineSettings}.
 * Owns the store and closes it on {@link #close()}.
 */
public final class PracticalsEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PracticalsEngine.class);

    private final IGameStateStore store;
    private final PracticalSessionService sessions;
    private final ProgressionService progression;

    private PracticalsEngine(IGameStateStore store, PracticalSessionService sessions, ProgressionService progression) {
        this.store = store;
        this.sessions = sessions;
        this.progression = progression;
    }

    /**
     * Creates the engine with the store named in the settings.
     */
    public static PracticalsEngine create(EngineSettings settings) {
        IGameStateStore store = GameStateStoreFactory.create("game-state", settings.getStoreConfig());
        long seed = settings.getRandomSeed() != null ? settings.getRandomSeed() : System.nanoTime();
        return create(settings, store, new SeededRandomProvider(seed));
    }

    /**
     * Creates the engine on an existing store and random source.
     */
    public static PracticalsEngine create(EngineSettings settings, IGameStateStore store, IRandomProvider random) {
        ResourceLedger ledger = new ResourceLedger(settings.getMaxEnergy());
        ProgressionAccumulator accumulator = new ProgressionAccumulator(settings.getProgression());
        TransactionRetry retry = new TransactionRetry(settings.getRetry());

        PracticalSessionService sessions = new PracticalSessionService(
                store,
                DecisionResolutionEngine.withDefaultRules(),
                new ConsequenceScheduler(ledger),
                new BusinessLifecycle(settings.getBusiness()),
                accumulator,
                random,
                retry,
                settings.getStartingResources(),
                settings.getPracticalXpReward());
        ProgressionService progression = new ProgressionService(
                store,
                accumulator,
                new CooldownLimiter(settings.getMissions()),
                ledger,
                random,
                retry,
                settings.getStartingResources(),
                settings.getMissionXpReward());

        log.debug("Practicals engine created on store '{}'", store.getStoreName());
        return new PracticalsEngine(store, sessions, progression);
    }

    public PracticalSessionService sessions() {
        return sessions;
    }

    public ProgressionService progression() {
        return progression;
    }

    public IGameStateStore store() {
        return store;
    }

    @Override
    public void close() {
        store.close();
    }
}
