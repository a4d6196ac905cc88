package org.brighted.runtime.decisions;

import org.brighted.runtime.model.PlayerProfile;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Everything a rule may look at when resolving a choice. Rules read; they never mutate.
 *
 * @param choiceId  the chosen option
 * @param payload   free-form request fields, e.g. {@code businessName}
 * @param sessionId session the choice was made in
 * @param profile   the player's skills and reputation
 */
public record ChoiceContext(String choiceId, Map<String, Object> payload, String sessionId, PlayerProfile profile) {

    public ChoiceContext {
        Objects.requireNonNull(choiceId, "choiceId");
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(profile, "profile");
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    /**
     * Returns true when the payload carries a non-null value for {@code field}.
     */
    public boolean has(String field) {
        return payload.get(field) != null;
    }

    /**
     * Reads a required, non-blank string field.
     *
     * @param field     payload key
     * @param maxLength maximum accepted length after trimming
     * @return the trimmed value
     * @throws InvalidPayloadException if the field is missing, not a string, blank or too long
     */
    public String requireText(String field, int maxLength) {
        Object raw = payload.get(field);
        if (raw == null) {
            throw new InvalidPayloadException(choiceId, field, "required field is missing");
        }
        if (!(raw instanceof String text)) {
            throw new InvalidPayloadException(choiceId, field, "expected text but got " + raw.getClass().getSimpleName());
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            throw new InvalidPayloadException(choiceId, field, "must not be blank");
        }
        if (trimmed.length() > maxLength) {
            throw new InvalidPayloadException(choiceId, field, "must be at most " + maxLength + " characters");
        }
        return trimmed;
    }

    /**
     * Reads an optional whole-number field within {@code [1, max]}.
     *
     * @param field        payload key
     * @param defaultValue value used when the field is absent
     * @param max          inclusive upper bound
     * @return the value
     * @throws InvalidPayloadException if present but not a positive whole number within bounds
     */
    public int optionalPositiveInt(String field, int defaultValue, int max) {
        Object raw = payload.get(field);
        if (raw == null) {
            return defaultValue;
        }
        if (!(raw instanceof Number number)) {
            throw new InvalidPayloadException(choiceId, field, "expected a number but got " + raw.getClass().getSimpleName());
        }
        double value = number.doubleValue();
        if (value != Math.rint(value) || Double.isInfinite(value)) {
            throw new InvalidPayloadException(choiceId, field, "must be a whole number");
        }
        if (value < 1 || value > max) {
            throw new InvalidPayloadException(choiceId, field, "must be between 1 and " + max);
        }
        return (int) value;
    }
}
