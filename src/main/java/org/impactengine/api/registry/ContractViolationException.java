package org.impactengine.api.registry;

import org.impactengine.api.exceptions.ImpactEngineException;

/**
 * Thrown at registration time when an implementation class does not satisfy
 * the capability contract of the registry it is registered with.
 */
public class ContractViolationException extends ImpactEngineException {

    public ContractViolationException(String message) {
        super(message);
    }

    public ContractViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
