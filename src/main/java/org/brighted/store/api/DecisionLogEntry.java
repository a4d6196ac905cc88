package org.brighted.store.api;

import org.brighted.runtime.model.ResourceEffect;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Audit record of one resolved decision.
 *
 * @param id                decision id, shared with its consequences
 * @param sessionId         session the decision was made in
 * @param userId            deciding user
 * @param choiceId          chosen option
 * @param payload           submitted payload
 * @param immediateEffects  effects applied at decision time
 * @param delayedRuleIds    rule ids of the consequences scheduled by the decision
 * @param decidedAt         decision time
 */
public record DecisionLogEntry(
        String id,
        String sessionId,
        String userId,
        String choiceId,
        Map<String, Object> payload,
        List<ResourceEffect> immediateEffects,
        List<String> delayedRuleIds,
        Instant decidedAt
) {

    public DecisionLogEntry {
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        immediateEffects = List.copyOf(immediateEffects);
        delayedRuleIds = List.copyOf(delayedRuleIds);
    }
}
