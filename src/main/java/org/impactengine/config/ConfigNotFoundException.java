package org.impactengine.config;

import java.nio.file.Path;
import java.util.List;

/**
 * The pipeline configuration file does not exist.
 */
public class ConfigNotFoundException extends ConfigurationException {

    public ConfigNotFoundException(Path file) {
        super(List.of(new ConfigError("", "Configuration file not found: " + file.toAbsolutePath())));
    }
}
