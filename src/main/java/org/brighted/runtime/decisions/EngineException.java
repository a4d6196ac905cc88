package org.brighted.runtime.decisions;

/**
 * Base class for errors raised by engine computations. An engine exception always means
 * the request's input was rejected and no state was changed.
 */
public abstract class EngineException extends RuntimeException {

    protected EngineException(String message) {
        super(message);
    }
}
