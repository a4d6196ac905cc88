package org.brighted.runtime.decisions;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Rule table keyed by choice id. Populated once at start-up, read concurrently afterwards.
 */
public final class ChoiceRuleRegistry {

    private final Map<String, ChoiceRule> rules = new LinkedHashMap<>();

    /**
     * Registers a rule.
     *
     * @param choiceId choice the rule resolves
     * @param rule     the rule
     * @throws IllegalStateException if a rule is already registered for the id
     */
    public synchronized ChoiceRuleRegistry register(String choiceId, ChoiceRule rule) {
        if (choiceId == null || choiceId.isBlank()) {
            throw new IllegalArgumentException("choiceId cannot be null or blank");
        }
        if (rules.putIfAbsent(choiceId, rule) != null) {
            throw new IllegalStateException("A rule is already registered for choice '" + choiceId + "'");
        }
        return this;
    }

    public synchronized Optional<ChoiceRule> find(String choiceId) {
        return Optional.ofNullable(rules.get(choiceId));
    }

    public synchronized Set<String> choiceIds() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(rules.keySet()));
    }
}
