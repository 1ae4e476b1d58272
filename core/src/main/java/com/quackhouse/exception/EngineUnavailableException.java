package com.quackhouse.exception;

/**
 * Thrown when the query engine could not be constructed or is shutting down.
 *
 * <p>The failure is not cached: the next acquisition attempt retries
 * construction.
 */
public class EngineUnavailableException extends QuackhouseException {

    public EngineUnavailableException(String message) {
        super(message);
    }

    public EngineUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
