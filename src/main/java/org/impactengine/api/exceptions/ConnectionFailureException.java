package org.impactengine.api.exceptions;

/**
 * Thrown when an adapter fails to initialize through {@code connect}.
 */
public class ConnectionFailureException extends ImpactEngineException {

    public ConnectionFailureException(String message) {
        super(message);
    }

    public ConnectionFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
