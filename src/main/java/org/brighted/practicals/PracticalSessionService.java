package org.brighted.practicals;

import org.brighted.runtime.business.BusinessLifecycle;
import org.brighted.runtime.decisions.BusinessChoiceRules;
import org.brighted.runtime.decisions.ChoiceContext;
import org.brighted.runtime.decisions.DecisionResolutionEngine;
import org.brighted.runtime.decisions.InvalidChoiceException;
import org.brighted.runtime.ledger.ResourceLedger;
import org.brighted.runtime.model.BusinessSimState;
import org.brighted.runtime.model.ChoiceResolution;
import org.brighted.runtime.model.Consequence;
import org.brighted.runtime.model.DelayedConsequenceSpec;
import org.brighted.runtime.model.PlayerProfile;
import org.brighted.runtime.model.PracticalSession;
import org.brighted.runtime.model.ResourceBundle;
import org.brighted.runtime.model.SessionSnapshot;
import org.brighted.runtime.model.SessionState;
import org.brighted.runtime.progression.ProgressionAccumulator;
import org.brighted.runtime.progression.XpUpdateResult;
import org.brighted.runtime.scheduler.ConsequenceScheduler;
import org.brighted.runtime.scheduler.SnapshotRealization;
import org.brighted.runtime.spi.IRandomProvider;
import org.brighted.store.api.DecisionLogEntry;
import org.brighted.store.api.IGameStateStore;
import org.brighted.store.api.IStoreTransaction;
import org.brighted.store.api.SessionNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Runs practical sessions against the store: start, decide, tick, view, finish.
 * <p>
 * Every operation is one store transaction, retried as a whole on conflicts. The
 * session row is locked for the duration, so concurrent requests against one session
 * never interleave their read-modify-write.
 */
public class PracticalSessionService {

    private static final Logger log = LoggerFactory.getLogger(PracticalSessionService.class);

    private final IGameStateStore store;
    private final DecisionResolutionEngine engine;
    private final ConsequenceScheduler scheduler;
    private final BusinessLifecycle lifecycle;
    private final ProgressionAccumulator accumulator;
    private final IRandomProvider random;
    private final TransactionRetry retry;
    private final ResourceBundle startingResources;
    private final int practicalXpReward;

    public PracticalSessionService(IGameStateStore store,
                                   DecisionResolutionEngine engine,
                                   ConsequenceScheduler scheduler,
                                   BusinessLifecycle lifecycle,
                                   ProgressionAccumulator accumulator,
                                   IRandomProvider random,
                                   TransactionRetry retry,
                                   ResourceBundle startingResources,
                                   int practicalXpReward) {
        this.store = store;
        this.engine = engine;
        this.scheduler = scheduler;
        this.lifecycle = lifecycle;
        this.accumulator = accumulator;
        this.random = random;
        this.retry = retry;
        this.startingResources = startingResources;
        this.practicalXpReward = practicalXpReward;
    }

    /**
     * Starts a session. The snapshot copies the player's current resources and reputation;
     * the business story additionally gets a fresh, unregistered business.
     *
     * @param userId    player
     * @param storySlug story to play
     * @param now       start time
     * @return the new session
     */
    public SessionView startSession(String userId, String storySlug, Instant now) {
        if (storySlug == null || storySlug.isBlank()) {
            throw new IllegalArgumentException("storySlug cannot be blank");
        }
        return retry.run("startSession", () -> store.inTransaction(tx -> {
            PlayerProfile profile = loadOrCreateProfile(tx, userId);
            BusinessSimState business = BusinessChoiceRules.STORY_SLUG.equals(storySlug)
                    ? BusinessSimState.initial(lifecycle.getConfig().initialCash(), now)
                    : null;
            SessionSnapshot snapshot = new SessionSnapshot(profile.resources(), profile.reputation(), business);
            PracticalSession session = new PracticalSession(UUID.randomUUID().toString(), userId, storySlug,
                    SessionState.ACTIVE, snapshot, now, now, null);
            tx.insertSession(session);
            log.info("Started session {} of '{}' for user {}", session.id(), storySlug, userId);
            return view(tx, session, now);
        }));
    }

    /**
     * Resolves a decision and applies it: immediate effects, business transitions, the
     * decision log entry and the scheduled consequences commit together or not at all.
     *
     * @param userId    deciding player
     * @param sessionId session
     * @param choiceId  chosen option
     * @param payload   request fields, may be {@code null}
     * @param now       decision time
     * @return the decision outcome
     * @throws SessionNotFoundException  if the session does not exist or belongs to another user
     * @throws SessionNotActiveException if the session is not active
     * @throws InvalidChoiceException   for unknown choices, or business choices outside the business story
     * @throws org.brighted.runtime.decisions.InvalidPayloadException for malformed payloads
     */
    public DecisionOutcome submitDecision(String userId, String sessionId, String choiceId,
                                          Map<String, Object> payload, Instant now) {
        return retry.run("submitDecision", () -> store.inTransaction(tx -> {
            PracticalSession session = loadOwned(tx, userId, sessionId);
            requireActive(session);
            if (BusinessChoiceRules.changesBusiness(choiceId)
                    && !BusinessChoiceRules.STORY_SLUG.equals(session.storySlug())) {
                throw new InvalidChoiceException(choiceId,
                        "Choice '" + choiceId + "' is not available in story '" + session.storySlug() + "'");
            }
            PlayerProfile profile = loadOrCreateProfile(tx, userId);

            ChoiceResolution resolution = engine.resolveChoice(choiceId, payload, sessionId, profile);
            String decisionId = UUID.randomUUID().toString();

            SessionSnapshot snapshot = applyBusinessTransition(session.snapshot(), choiceId,
                    new ChoiceContext(choiceId, payload, sessionId, profile), decisionId, now);
            snapshot = scheduler.getLedger().applyToSnapshot(snapshot, resolution.immediate());

            if (!resolution.immediate().isEmpty()) {
                tx.insertConsequence(scheduler.recordImmediate(UUID.randomUUID().toString(), decisionId, sessionId,
                        choiceId, resolution.immediate(), now));
            }
            List<Consequence> scheduled = new ArrayList<>(resolution.delayed().size());
            for (DelayedConsequenceSpec spec : resolution.delayed()) {
                scheduled.add(tx.insertConsequence(
                        scheduler.schedule(UUID.randomUUID().toString(), decisionId, sessionId, spec, now)));
            }
            tx.appendDecision(new DecisionLogEntry(decisionId, sessionId, userId, choiceId, payload,
                    resolution.immediate(),
                    resolution.delayed().stream().map(DelayedConsequenceSpec::ruleId).collect(Collectors.toList()),
                    now));

            PracticalSession updated = session.withSnapshot(snapshot, now);
            tx.updateSession(updated);
            tx.saveProfile(profile.withResources(snapshot.resources()));
            return new DecisionOutcome(decisionId, view(tx, updated, now), resolution.immediate(), scheduled);
        }));
    }

    /**
     * Brings a session up to {@code now}: realizes due consequences at most once each,
     * then advances the business. Finished sessions are returned unchanged.
     *
     * @param userId    owning player
     * @param sessionId session
     * @param now       observed time
     * @return the updated session and the consequences realized by this call
     */
    public TickResult tick(String userId, String sessionId, Instant now) {
        return retry.run("tick", () -> store.inTransaction(tx -> {
            PracticalSession session = loadOwned(tx, userId, sessionId);
            if (session.state().isFinished()) {
                return new TickResult(view(tx, session, now), List.of());
            }

            List<Consequence> due = scheduler.listDue(tx.listPendingConsequences(sessionId), sessionId, now);
            List<Consequence> claimed = new ArrayList<>(due.size());
            for (Consequence c : due) {
                // Only the transaction whose swap succeeds may apply the effects.
                if (tx.markConsequenceApplied(c.id(), now)) {
                    claimed.add(c);
                }
            }
            SnapshotRealization realization = scheduler.realizeAll(claimed, session.snapshot(), now);
            SessionSnapshot snapshot = realization.snapshot();

            if (snapshot.business() != null) {
                snapshot = snapshot.withBusiness(
                        lifecycle.tick(snapshot.business(), now, session.state() == SessionState.ACTIVE, random));
            }

            PracticalSession updated = session.withSnapshot(snapshot, now);
            tx.updateSession(updated);
            if (!realization.applied().isEmpty()) {
                PlayerProfile profile = loadOrCreateProfile(tx, userId);
                tx.saveProfile(profile.withResources(snapshot.resources()));
            }
            return new TickResult(view(tx, updated, now), realization.applied());
        }));
    }

    /**
     * Ticks the session and returns what the player sees.
     */
    public SessionView viewSession(String userId, String sessionId, Instant now) {
        return tick(userId, sessionId, now).view();
    }

    /**
     * Finishes a session. The session is archived, never deleted; a completed session awards
     * the practical's experience reward through the daily cap.
     *
     * @param outcome {@link SessionState#COMPLETED} or {@link SessionState#FAILED}
     * @throws IllegalArgumentException  if {@code outcome} is not a final state
     * @throws SessionNotActiveException if the session already finished
     */
    public FinishResult finishSession(String userId, String sessionId, SessionState outcome, Instant now) {
        if (outcome == null || !outcome.isFinished()) {
            throw new IllegalArgumentException("outcome must be COMPLETED or FAILED, got " + outcome);
        }
        return retry.run("finishSession", () -> store.inTransaction(tx -> {
            PracticalSession session = loadOwned(tx, userId, sessionId);
            if (session.state().isFinished()) {
                throw new SessionNotActiveException(sessionId, session.state());
            }
            PracticalSession finished = session.finish(outcome, now);
            tx.updateSession(finished);

            Optional<XpUpdateResult> xp = Optional.empty();
            if (outcome == SessionState.COMPLETED) {
                XpUpdateResult award = accumulator.calculateXPUpdate(
                        tx.loadProgressionForUpdate(userId), practicalXpReward, accumulator.dayKey(now));
                tx.applyXpUpdate(userId, award.updates());
                xp = Optional.of(award);
            }
            log.info("Session {} of user {} finished as {}", sessionId, userId, outcome);
            return new FinishResult(view(tx, finished, now), xp);
        }));
    }

    /**
     * Returns the decision history of a session, oldest first.
     */
    public List<DecisionLogEntry> decisionHistory(String userId, String sessionId) {
        return retry.run("decisionHistory", () -> store.inTransaction(tx -> {
            loadOwned(tx, userId, sessionId);
            return tx.listDecisions(sessionId);
        }));
    }

    private SessionSnapshot applyBusinessTransition(SessionSnapshot snapshot, String choiceId, ChoiceContext ctx,
                                                    String decisionId, Instant now) {
        if (BusinessChoiceRules.REGISTER.equals(choiceId)) {
            return snapshot.withBusiness(
                    lifecycle.submitRegistration(snapshot.business(), BusinessChoiceRules.businessName(ctx), now));
        }
        if (BusinessChoiceRules.TAKE_LOAN.equals(choiceId)) {
            BusinessSimState business = snapshot.business() != null
                    ? snapshot.business()
                    : BusinessSimState.initial(lifecycle.getConfig().initialCash(), now);
            return snapshot.withBusiness(
                    lifecycle.recordLoan(business, decisionId, BusinessChoiceRules.loanPrincipal(ctx), now));
        }
        return snapshot;
    }

    private PracticalSession loadOwned(IStoreTransaction tx, String userId, String sessionId) {
        return tx.findSessionForUpdate(sessionId)
                .filter(s -> s.isOwnedBy(userId))
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    private static void requireActive(PracticalSession session) {
        if (session.state() != SessionState.ACTIVE) {
            throw new SessionNotActiveException(session.id(), session.state());
        }
    }

    private PlayerProfile loadOrCreateProfile(IStoreTransaction tx, String userId) {
        Optional<PlayerProfile> existing = tx.findProfile(userId);
        if (existing.isPresent()) {
            return existing.get();
        }
        PlayerProfile created = PlayerProfile.newPlayer(userId, startingResources);
        tx.saveProfile(created);
        return created;
    }

    private SessionView view(IStoreTransaction tx, PracticalSession session, Instant now) {
        BusinessSimState business = session.snapshot().business();
        OptionalInt remaining = business == null
                ? OptionalInt.empty()
                : BusinessLifecycle.registrationRemainingMinutes(business, lifecycle.getConfig(), now);
        return new SessionView(session, remaining, tx.listPendingConsequences(session.id()));
    }

    public ResourceLedger getLedger() {
        return scheduler.getLedger();
    }
}
