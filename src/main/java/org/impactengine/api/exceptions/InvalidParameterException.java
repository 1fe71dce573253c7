package org.impactengine.api.exceptions;

/**
 * Raised by a model adapter when a fit-time parameter is missing or malformed.
 * The offending key is always available through {@link #getParameter()}.
 */
public class InvalidParameterException extends ImpactEngineException {

    private final String parameter;

    public InvalidParameterException(String parameter, String message) {
        super(message);
        this.parameter = parameter;
    }

    public String getParameter() {
        return parameter;
    }
}
