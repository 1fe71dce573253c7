package org.impactengine.metrics.simulator;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.impactengine.api.data.ColumnType;
import org.impactengine.api.data.PanelFrame;
import org.impactengine.api.metrics.IMetricsAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.List;
import java.util.Random;

/**
 * Generates deterministic daily sales for a product catalog.
 * <p>
 * For each product and each day of the range, {@code sales_volume} is drawn around
 * {@code base_sales} with multiplicative Gaussian noise from a seeded generator, and
 * {@code revenue = sales_volume * price}. A numeric {@code price} column on the products
 * overrides the configured price.
 * <p>
 * When the pipeline declares an {@code ENRICHMENT} block with the {@code quantity_boost}
 * function, a seeded share of products ({@code enrichment_fraction}) is marked
 * {@code treated = 1} and their sales are multiplied by {@code 1 + effect_size} from
 * {@code enrichment_start} on.
 * <p>
 * <strong>Configuration</strong> ({@code DATA.SOURCE.CONFIG}): {@code seed} (42),
 * {@code base_sales} (100), {@code price} (10.0), {@code noise} (0.1).
 * <br>
 * <strong>Output columns:</strong> product_id, date, sales_volume, price, revenue, treated.
 */
public class SimulatorMetricsAdapter implements IMetricsAdapter {

    private static final Logger log = LoggerFactory.getLogger(SimulatorMetricsAdapter.class);

    static final String QUANTITY_BOOST = "quantity_boost";

    private boolean connected;
    private long seed;
    private double baseSales;
    private double price;
    private double noise;
    private Enrichment enrichment;

    @Override
    public boolean connect(Config config) {
        this.seed = config.hasPath("seed") ? config.getLong("seed") : 42L;
        this.baseSales = config.hasPath("base_sales") ? config.getDouble("base_sales") : 100.0;
        this.price = config.hasPath("price") ? config.getDouble("price") : 10.0;
        this.noise = config.hasPath("noise") ? config.getDouble("noise") : 0.1;
        if (baseSales < 0 || price < 0 || noise < 0) {
            throw new IllegalArgumentException("base_sales, price and noise must not be negative");
        }
        this.enrichment = config.hasPath("ENRICHMENT") ? Enrichment.from(config.getConfig("ENRICHMENT")) : null;
        this.connected = true;
        return true;
    }

    @Override
    public PanelFrame retrieveBusinessMetrics(PanelFrame products, LocalDate startDate, LocalDate endDate) {
        if (!connected) {
            throw new IllegalStateException("Simulator not connected. Call connect() first.");
        }
        products.requireColumns(List.of("product_id"));
        boolean hasPrice = products.hasColumn("price") && products.type("price").isNumeric();

        Random random = new Random(seed);
        PanelFrame.Builder builder = PanelFrame.builder()
            .column("product_id", ColumnType.STRING)
            .column("date", ColumnType.DATE)
            .column("sales_volume", ColumnType.LONG)
            .column("price", ColumnType.DOUBLE)
            .column("revenue", ColumnType.DOUBLE)
            .column("treated", ColumnType.LONG);

        int treatedProducts = 0;
        for (int row = 0; row < products.rowCount(); row++) {
            String productId = String.valueOf(products.get(row, "product_id"));
            Object productPrice = hasPrice ? products.get(row, "price") : null;
            double unitPrice = productPrice != null ? ((Number) productPrice).doubleValue() : price;
            boolean treated = enrichment != null && random.nextDouble() < enrichment.fraction;
            if (treated) {
                treatedProducts++;
            }

            for (LocalDate date = startDate; !date.isAfter(endDate); date = date.plusDays(1)) {
                double volume = Math.max(0.0, baseSales * (1.0 + noise * random.nextGaussian()));
                if (treated && enrichment.start != null && !date.isBefore(enrichment.start)) {
                    volume *= 1.0 + enrichment.effectSize;
                }
                long sales = Math.round(volume);
                builder.row(productId, date, sales, unitPrice, sales * unitPrice, treated ? 1L : 0L);
            }
        }

        PanelFrame result = builder.build();
        log.debug("Simulated {} rows for {} products ({} treated)", result.rowCount(), products.rowCount(), treatedProducts);
        return result;
    }

    @Override
    public boolean validateConnection() {
        return connected;
    }

    private static final class Enrichment {
        final double effectSize;
        final double fraction;
        final LocalDate start;

        private Enrichment(double effectSize, double fraction, LocalDate start) {
            this.effectSize = effectSize;
            this.fraction = fraction;
            this.start = start;
        }

        static Enrichment from(Config config) {
            String function = config.hasPath("FUNCTION") ? config.getString("FUNCTION") : QUANTITY_BOOST;
            if (!QUANTITY_BOOST.equals(function)) {
                throw new IllegalArgumentException(
                    "Unknown enrichment function '" + function + "'. Available: [" + QUANTITY_BOOST + "]");
            }
            Config params = config.hasPath("PARAMS") ? config.getConfig("PARAMS") : ConfigFactory.empty();
            double effectSize = params.hasPath("effect_size") ? params.getDouble("effect_size") : 0.3;
            double fraction = params.hasPath("enrichment_fraction") ? params.getDouble("enrichment_fraction") : 0.5;
            if (fraction < 0.0 || fraction > 1.0) {
                throw new IllegalArgumentException("enrichment_fraction must be between 0 and 1, got " + fraction);
            }
            LocalDate start = params.hasPath("enrichment_start") ? LocalDate.parse(params.getString("enrichment_start")) : null;
            return new Enrichment(effectSize, fraction, start);
        }
    }
}
