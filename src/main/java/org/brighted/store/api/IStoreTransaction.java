package org.brighted.store.api;

import org.brighted.runtime.model.Consequence;
import org.brighted.runtime.model.MissionCooldownState;
import org.brighted.runtime.model.PlayerProfile;
import org.brighted.runtime.model.PracticalSession;
import org.brighted.runtime.model.ProgressionCounters;
import org.brighted.runtime.progression.XpUpdateInstruction;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Reads and writes available inside one store transaction.
 * <p>
 * Loads of sessions and per-user counters lock the underlying rows until the
 * transaction ends.
 */
public interface IStoreTransaction {

    // Profiles

    Optional<PlayerProfile> findProfile(String userId);

    void saveProfile(PlayerProfile profile);

    // Sessions

    /**
     * Loads a session and locks it for the rest of the transaction.
     */
    Optional<PracticalSession> findSessionForUpdate(String sessionId);

    void insertSession(PracticalSession session);

    /**
     * Overwrites a stored session.
     *
     * @throws SessionNotFoundException if the session does not exist
     */
    void updateSession(PracticalSession session);

    // Consequences

    /**
     * Stores a consequence and assigns its creation sequence.
     *
     * @return the stored consequence carrying its sequence
     */
    Consequence insertConsequence(Consequence consequence);

    /**
     * Returns consequences of a session whose {@code appliedAt} is unset.
     */
    List<Consequence> listPendingConsequences(String sessionId);

    /**
     * Returns all consequences of a session, in creation order.
     */
    List<Consequence> listConsequences(String sessionId);

    /**
     * Compare-and-swap on {@code appliedAt}: sets it only while it is still unset.
     *
     * @return {@code true} if this call marked the consequence, {@code false} if it was already applied
     */
    boolean markConsequenceApplied(String consequenceId, Instant appliedAt);

    // Decision log

    void appendDecision(DecisionLogEntry entry);

    List<DecisionLogEntry> listDecisions(String sessionId);

    // Progression

    /**
     * Loads and locks a user's counters; a user without counters gets {@link ProgressionCounters#empty()}.
     */
    ProgressionCounters loadProgressionForUpdate(String userId);

    /**
     * Applies an award, using atomic increments where the store supports them.
     */
    void applyXpUpdate(String userId, XpUpdateInstruction update);

    Optional<String> findLabCompletionDay(String userId, String labId);

    void saveLabCompletion(String userId, String labId, String dayKey);

    // Missions

    /**
     * Loads and locks a user's mission state; a user without state gets {@link MissionCooldownState#empty()}.
     */
    MissionCooldownState loadMissionStateForUpdate(String userId);

    void saveMissionState(String userId, MissionCooldownState state);
}
