package org.impactengine.config;

import com.typesafe.config.Config;

/**
 * Validated {@code MEASUREMENT} section. For statically known models the parameters
 * already carry the schema defaults.
 */
public record MeasurementSection(String model, Config params) {
}
