package org.impactengine.config;

import com.typesafe.config.Config;

/**
 * Validated {@code DATA.TRANSFORM} section.
 */
public record TransformSection(String function, Config params) {
}
