package org.brighted.runtime.decisions;

/**
 * Thrown when a choice's rule requires payload fields that are absent or malformed.
 */
public class InvalidPayloadException extends EngineException {

    private final String choiceId;
    private final String field;

    /**
     * @param choiceId choice whose payload was rejected
     * @param field    offending payload field
     * @param message  description of the problem
     */
    public InvalidPayloadException(String choiceId, String field, String message) {
        super(String.format("Invalid payload for choice '%s', field '%s': %s", choiceId, field, message));
        this.choiceId = choiceId;
        this.field = field;
    }

    public String getChoiceId() {
        return choiceId;
    }

    public String getField() {
        return field;
    }
}
