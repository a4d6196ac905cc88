package org.brighted.runtime.decisions;

/**
 * Thrown when a choice id has no rule, or the choice is not available in the
 * session's current state. Surfaced to the player as a client error.
 */
public class InvalidChoiceException extends EngineException {

    private final String choiceId;

    /**
     * @param choiceId the rejected choice id
     * @param message  description of why the choice was rejected
     */
    public InvalidChoiceException(String choiceId, String message) {
        super(message);
        this.choiceId = choiceId;
    }

    public String getChoiceId() {
        return choiceId;
    }
}
