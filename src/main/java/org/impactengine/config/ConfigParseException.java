package org.impactengine.config;

/**
 * The pipeline configuration could not be parsed into a mapping.
 */
public class ConfigParseException extends ConfigurationException {

    public ConfigParseException(String message, Throwable cause) {
        super(new ConfigError("", message), cause);
    }
}
