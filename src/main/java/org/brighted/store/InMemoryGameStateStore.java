package org.brighted.store;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.brighted.runtime.model.Consequence;
import org.brighted.runtime.model.MissionCooldownState;
import org.brighted.runtime.model.PlayerProfile;
import org.brighted.runtime.model.PracticalSession;
import org.brighted.runtime.model.ProgressionCounters;
import org.brighted.runtime.progression.XpUpdateInstruction;
import org.brighted.store.api.DecisionLogEntry;
import org.brighted.store.api.IStoreTransaction;
import org.brighted.store.api.SessionNotFoundException;
import org.brighted.store.api.StoreException;
import org.brighted.store.api.TransactionWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Heap-backed store for tests and single-instance deployments.
 * <p>
 * Transactions are serialized by one lock. Each transaction works on a staged copy of the
 * tables, which replaces the committed tables only when the work returns normally, so a
 * failing request leaves no partial writes.
 */
public class InMemoryGameStateStore extends AbstractStoreResource {

    private static final Logger log = LoggerFactory.getLogger(InMemoryGameStateStore.class);

    private final ReentrantLock lock = new ReentrantLock(true);
    private Tables committed = new Tables();

    public InMemoryGameStateStore() {
        this("memory", ConfigFactory.empty());
    }

    public InMemoryGameStateStore(String name, Config options) {
        super(name, options);
        log.debug("In-memory store '{}' created", name);
    }

    @Override
    protected <T> T doInTransaction(TransactionWork<T> work) {
        lock.lock();
        try {
            Tables staged = committed.copy();
            T result = work.execute(new MemoryTransaction(staged));
            committed = staged;
            return result;
        } finally {
            lock.unlock();
        }
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("sessions", committed.sessions.size());
        metrics.put("consequences", committed.consequences.size());
    }

    @Override
    public void close() {
        log.debug("In-memory store '{}' closed", storeName);
    }

    private record LabKey(String userId, String labId) {
    }

    private static final class Tables {
        final Map<String, PlayerProfile> profiles;
        final Map<String, PracticalSession> sessions;
        final Map<String, Consequence> consequences;
        final List<DecisionLogEntry> decisions;
        final Map<String, ProgressionCounters> progression;
        final Map<LabKey, String> labCompletions;
        final Map<String, MissionCooldownState> missions;
        long nextSequence;

        Tables() {
            this(new LinkedHashMap<>(), new LinkedHashMap<>(), new LinkedHashMap<>(), new ArrayList<>(),
                    new LinkedHashMap<>(), new LinkedHashMap<>(), new LinkedHashMap<>(), 1L);
        }

        private Tables(Map<String, PlayerProfile> profiles, Map<String, PracticalSession> sessions,
                       Map<String, Consequence> consequences, List<DecisionLogEntry> decisions,
                       Map<String, ProgressionCounters> progression, Map<LabKey, String> labCompletions,
                       Map<String, MissionCooldownState> missions, long nextSequence) {
            this.profiles = profiles;
            this.sessions = sessions;
            this.consequences = consequences;
            this.decisions = decisions;
            this.progression = progression;
            this.labCompletions = labCompletions;
            this.missions = missions;
            this.nextSequence = nextSequence;
        }

        // Values are immutable records; copying the containers is enough.
        Tables copy() {
            return new Tables(new LinkedHashMap<>(profiles), new LinkedHashMap<>(sessions),
                    new LinkedHashMap<>(consequences), new ArrayList<>(decisions),
                    new LinkedHashMap<>(progression), new LinkedHashMap<>(labCompletions),
                    new LinkedHashMap<>(missions), nextSequence);
        }
    }

    private static final class MemoryTransaction implements IStoreTransaction {

        private final Tables t;

        MemoryTransaction(Tables tables) {
            this.t = tables;
        }

        @Override
        public Optional<PlayerProfile> findProfile(String userId) {
            return Optional.ofNullable(t.profiles.get(userId));
        }

        @Override
        public void saveProfile(PlayerProfile profile) {
            t.profiles.put(profile.userId(), profile);
        }

        @Override
        public Optional<PracticalSession> findSessionForUpdate(String sessionId) {
            return Optional.ofNullable(t.sessions.get(sessionId));
        }

        @Override
        public void insertSession(PracticalSession session) {
            if (t.sessions.putIfAbsent(session.id(), session) != null) {
                throw new StoreException("Session already exists: " + session.id());
            }
        }

        @Override
        public void updateSession(PracticalSession session) {
            if (!t.sessions.containsKey(session.id())) {
                throw new SessionNotFoundException(session.id());
            }
            t.sessions.put(session.id(), session);
        }

        @Override
        public Consequence insertConsequence(Consequence consequence) {
            if (t.consequences.containsKey(consequence.id())) {
                throw new StoreException("Consequence already exists: " + consequence.id());
            }
            Consequence stored = consequence.withSequence(t.nextSequence++);
            t.consequences.put(stored.id(), stored);
            return stored;
        }

        @Override
        public List<Consequence> listPendingConsequences(String sessionId) {
            return t.consequences.values().stream()
                    .filter(c -> c.sessionId().equals(sessionId) && !c.isApplied())
                    .sorted(Comparator.comparingLong(Consequence::sequence))
                    .toList();
        }

        @Override
        public List<Consequence> listConsequences(String sessionId) {
            return t.consequences.values().stream()
                    .filter(c -> c.sessionId().equals(sessionId))
                    .sorted(Comparator.comparingLong(Consequence::sequence))
                    .toList();
        }

        @Override
        public boolean markConsequenceApplied(String consequenceId, Instant appliedAt) {
            Consequence current = t.consequences.get(consequenceId);
            if (current == null) {
                throw new StoreException("Consequence not found: " + consequenceId);
            }
            if (current.isApplied()) {
                return false;
            }
            t.consequences.put(consequenceId, current.withAppliedAt(appliedAt));
            return true;
        }

        @Override
        public void appendDecision(DecisionLogEntry entry) {
            t.decisions.add(entry);
        }

        @Override
        public List<DecisionLogEntry> listDecisions(String sessionId) {
            return t.decisions.stream().filter(d -> d.sessionId().equals(sessionId)).toList();
        }

        @Override
        public ProgressionCounters loadProgressionForUpdate(String userId) {
            return t.progression.getOrDefault(userId, ProgressionCounters.empty());
        }

        @Override
        public void applyXpUpdate(String userId, XpUpdateInstruction update) {
            t.progression.put(userId, update.applyTo(loadProgressionForUpdate(userId)));
        }

        @Override
        public Optional<String> findLabCompletionDay(String userId, String labId) {
            return Optional.ofNullable(t.labCompletions.get(new LabKey(userId, labId)));
        }

        @Override
        public void saveLabCompletion(String userId, String labId, String dayKey) {
            t.labCompletions.put(new LabKey(userId, labId), dayKey);
        }

        @Override
        public MissionCooldownState loadMissionStateForUpdate(String userId) {
            return t.missions.getOrDefault(userId, MissionCooldownState.empty());
        }

        @Override
        public void saveMissionState(String userId, MissionCooldownState state) {
            t.missions.put(userId, state);
        }
    }
}
