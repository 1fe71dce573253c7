package org.impactengine.api.exceptions;

/**
 * Thrown when a required collaborator (storage handle, adapter) is absent.
 */
public class MissingDependencyException extends ImpactEngineException {

    public MissingDependencyException(String message) {
        super(message);
    }
}
