package org.impactengine.config;

import com.typesafe.config.Config;

import java.time.LocalDate;

/**
 * Validated {@code DATA.ENRICHMENT} section.
 *
 * @param function        enrichment function name, or {@code null} if not declared
 * @param params          the {@code PARAMS} block, possibly empty
 * @param enrichmentStart first enriched day, or {@code null} if not declared
 */
public record EnrichmentSection(String function, Config params, LocalDate enrichmentStart) {
}
