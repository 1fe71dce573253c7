package org.impactengine.metrics;

import org.impactengine.api.data.ColumnType;
import org.impactengine.api.data.PanelFrame;
import org.impactengine.api.exceptions.ConnectionFailureException;
import org.impactengine.api.metrics.IMetricsAdapter;
import org.impactengine.config.SourceSection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;

/**
 * Owns one metrics adapter and its connect lifecycle.
 * <p>
 * The adapter is connected once, in the constructor, with the source's {@code CONFIG}
 * block. Retrieval always uses the validated source date range; callers cannot pass their own.
 * Every retrieved frame is stamped with {@code metrics_source} and
 * {@code retrieval_timestamp} columns.
 */
public class MetricsManager {

    private static final Logger log = LoggerFactory.getLogger(MetricsManager.class);

    static final String METRICS_SOURCE_COLUMN = "metrics_source";
    static final String RETRIEVAL_TIMESTAMP_COLUMN = "retrieval_timestamp";

    private final SourceSection source;
    private final IMetricsAdapter adapter;

    /**
     * @throws ConnectionFailureException if the adapter rejects its configuration or fails to connect
     */
    public MetricsManager(SourceSection source, IMetricsAdapter adapter) {
        this.source = source;
        this.adapter = adapter;

        boolean connected;
        try {
            connected = adapter.connect(source.config());
        } catch (IllegalArgumentException e) {
            throw new ConnectionFailureException(
                "Metrics adapter '" + source.type() + "' rejected its configuration: " + e.getMessage(), e);
        }
        if (!connected) {
            throw new ConnectionFailureException("Failed to connect metrics adapter '" + source.type() + "'");
        }
        log.debug("Metrics adapter '{}' connected", source.type());
    }

    /**
     * Retrieves business metrics for the products over the configured date range.
     *
     * @throws IllegalArgumentException if {@code products} is null or empty
     * @throws IOException              if the adapter cannot read its source
     */
    public PanelFrame retrieve(PanelFrame products) throws IOException {
        if (products == null || products.isEmpty()) {
            throw new IllegalArgumentException("Products must be a non-empty frame");
        }
        PanelFrame metrics = adapter.retrieveBusinessMetrics(products, source.startDate(), source.endDate());
        if (metrics == null) {
            throw new IllegalStateException("Metrics adapter '" + source.type() + "' returned no data");
        }

        PanelFrame stamped = metrics
            .withConstantColumn(METRICS_SOURCE_COLUMN, ColumnType.STRING, source.type())
            .withConstantColumn(RETRIEVAL_TIMESTAMP_COLUMN, ColumnType.STRING, Instant.now().toString());

        log.info("Retrieved {} rows from '{}' for {} products between {} and {}",
            stamped.rowCount(), source.type(), products.rowCount(), source.startDate(), source.endDate());
        return stamped;
    }

    public SourceSection getSource() {
        return source;
    }
}
