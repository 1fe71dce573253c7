package org.impactengine.api.metrics;

import com.typesafe.config.Config;
import org.impactengine.api.data.PanelFrame;

import java.io.IOException;
import java.time.LocalDate;

/**
 * Capability contract of a business-metrics source.
 * <p>
 * {@link #connect(Config)} is called once by the metrics manager with the source
 * configuration (the {@code DATA.SOURCE.CONFIG} section, plus an {@code ENRICHMENT}
 * sub-section when the pipeline declares one). Retrieval before a successful connect
 * must fail.
 * <p>
 * Implementations must be public with a public no-argument constructor.
 */
public interface IMetricsAdapter {

    /**
     * @return true if the source is usable
     * @throws IllegalArgumentException if the configuration is malformed
     */
    boolean connect(Config config);

    /**
     * Retrieves metrics for the given products over an inclusive date range.
     *
     * @param products  the products to retrieve metrics for; never empty
     * @param startDate first day, inclusive
     * @param endDate   last day, inclusive
     * @return the retrieved metrics
     * @throws IOException if the underlying source cannot be read
     */
    PanelFrame retrieveBusinessMetrics(PanelFrame products, LocalDate startDate, LocalDate endDate)
        throws IOException;

    default boolean validateConnection() {
        return true;
    }
}
