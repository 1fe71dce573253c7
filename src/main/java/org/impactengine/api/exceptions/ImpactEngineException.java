package org.impactengine.api.exceptions;

/**
 * Base class of every domain error raised by the pipeline.
 * <p>
 * All subclasses are unchecked. Storage I/O is the one concern that surfaces
 * as a checked {@link java.io.IOException} instead.
 */
public class ImpactEngineException extends RuntimeException {

    public ImpactEngineException(String message) {
        super(message);
    }

    public ImpactEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
