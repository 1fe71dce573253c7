package org.impactengine.config;

import org.impactengine.api.exceptions.ImpactEngineException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Aggregates every violation found by one configuration processing stage.
 */
public class ConfigurationException extends ImpactEngineException {

    private final List<ConfigError> errors;

    public ConfigurationException(List<ConfigError> errors) {
        super(format(errors));
        this.errors = List.copyOf(errors);
    }

    public ConfigurationException(ConfigError error, Throwable cause) {
        super(format(List.of(error)), cause);
        this.errors = List.of(error);
    }

    public List<ConfigError> getErrors() {
        return errors;
    }

    /**
     * Returns the paths of all violations, in detection order.
     */
    public List<String> getPaths() {
        return errors.stream().map(ConfigError::path).collect(Collectors.toList());
    }

    private static String format(List<ConfigError> errors) {
        if (errors.size() == 1) {
            return "Invalid configuration: " + errors.get(0);
        }
        return "Invalid configuration (" + errors.size() + " errors):\n  - "
            + errors.stream().map(ConfigError::toString).collect(Collectors.joining("\n  - "));
    }
}
