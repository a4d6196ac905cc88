package org.brighted.runtime.decisions;

import org.brighted.runtime.model.ChoiceResolution;
import org.brighted.runtime.model.PlayerProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Resolves a player's choice into immediate effects and delayed consequence specs.
 * <p>
 * Pure with respect to its inputs: no I/O, no clock, no randomness. Scheduling the
 * delayed specs ({@code scheduledAt = now + delay}) is the caller's job.
 */
public class DecisionResolutionEngine {

    private static final Logger log = LoggerFactory.getLogger(DecisionResolutionEngine.class);

    private final ChoiceRuleRegistry registry;

    public DecisionResolutionEngine(ChoiceRuleRegistry registry) {
        this.registry = registry;
    }

    /**
     * Creates an engine with every built-in practical rule registered.
     */
    public static DecisionResolutionEngine withDefaultRules() {
        return new DecisionResolutionEngine(BusinessChoiceRules.registerAll(new ChoiceRuleRegistry()));
    }

    /**
     * Resolves a choice.
     *
     * @param choiceId  chosen option
     * @param payload   request fields, may be {@code null}
     * @param sessionId session the choice belongs to
     * @param profile   the player's skills and reputation
     * @return immediate effects and delayed specs
     * @throws InvalidChoiceException  if no rule exists for {@code choiceId}
     * @throws InvalidPayloadException if the rule rejects the payload
     */
    public ChoiceResolution resolveChoice(String choiceId, Map<String, Object> payload, String sessionId,
                                          PlayerProfile profile) {
        if (choiceId == null || choiceId.isBlank()) {
            throw new InvalidChoiceException(choiceId, "Missing choiceId");
        }
        ChoiceRule rule = registry.find(choiceId)
                .orElseThrow(() -> new InvalidChoiceException(choiceId, "Unknown choice: '" + choiceId + "'"));

        ChoiceResolution resolution = rule.resolve(new ChoiceContext(choiceId, payload, sessionId, profile));
        log.debug("Resolved choice '{}' for session {}: {} immediate effect(s), {} delayed consequence(s)",
                choiceId, sessionId, resolution.immediate().size(), resolution.delayed().size());
        return resolution;
    }

    public ChoiceRuleRegistry getRegistry() {
        return registry;
    }
}
