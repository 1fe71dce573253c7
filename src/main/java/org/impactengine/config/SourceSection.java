package org.impactengine.config;

import com.typesafe.config.Config;

import java.time.LocalDate;

/**
 * Validated {@code DATA.SOURCE} section.
 *
 * @param type      metrics adapter key
 * @param config    the {@code CONFIG} block handed to the metrics adapter; when the pipeline
 *                  declares {@code ENRICHMENT}, that block is included as {@code ENRICHMENT}
 * @param path      data location
 * @param startDate first day of the analysis window, inclusive
 * @param endDate   last day of the analysis window, inclusive
 */
public record SourceSection(String type, Config config, String path, LocalDate startDate, LocalDate endDate) {
}
