package org.impactengine.api.exceptions;

/**
 * Wraps an error raised by the numerical part of a model fit.
 * The original cause is always preserved.
 */
public class EstimationFailureException extends ImpactEngineException {

    public EstimationFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
