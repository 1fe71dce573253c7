package org.impactengine.metrics.file;

import com.typesafe.config.Config;
import org.impactengine.api.data.PanelFrame;
import org.impactengine.api.metrics.IMetricsAdapter;
import org.impactengine.api.storage.StorageFormat;
import org.impactengine.storage.TabularCodec;
import org.impactengine.utils.PathExpansion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Reads business metrics from a CSV or Parquet file produced upstream.
 * <p>
 * <strong>Configuration</strong> ({@code DATA.SOURCE.CONFIG}):
 * <ul>
 *   <li>{@code path}: data file, {@code .csv}, {@code .parquet} or {@code .pq} (required)</li>
 *   <li>{@code date_column}: when set and present, rows outside the date range are dropped</li>
 *   <li>{@code product_id_column} (default {@code product_id}): when present in the file and
 *       the products carry {@code product_id}, rows of other products are dropped</li>
 * </ul>
 */
public class FileMetricsAdapter implements IMetricsAdapter {

    private static final Logger log = LoggerFactory.getLogger(FileMetricsAdapter.class);

    private Path file;
    private StorageFormat format;
    private String dateColumn;
    private String productIdColumn;

    @Override
    public boolean connect(Config config) {
        if (!config.hasPath("path") || config.getString("path").isBlank()) {
            throw new IllegalArgumentException("'path' is required in file adapter configuration");
        }
        Path candidate = Paths.get(PathExpansion.expandPath(config.getString("path")));
        StorageFormat candidateFormat = formatOf(candidate);
        if (!Files.isRegularFile(candidate)) {
            log.warn("Data file not found: {}", candidate.toAbsolutePath());
            return false;
        }
        this.file = candidate;
        this.format = candidateFormat;
        this.dateColumn = config.hasPath("date_column") ? config.getString("date_column") : null;
        this.productIdColumn = config.hasPath("product_id_column") ? config.getString("product_id_column") : "product_id";
        log.debug("Connected to file source {}", file);
        return true;
    }

    /**
     * Loads the whole file.
     */
    private PanelFrame load() throws IOException {
        requireConnected();
        PanelFrame data = TabularCodec.readFile(file, format);
        log.debug("Loaded {} rows from {}", data.rowCount(), file);
        return data;
    }

    @Override
    public PanelFrame retrieveBusinessMetrics(PanelFrame products, LocalDate startDate, LocalDate endDate) throws IOException {
        PanelFrame result = load();

        if (dateColumn != null && result.hasColumn(dateColumn)) {
            final PanelFrame data = result;
            final String column = dateColumn;
            result = data.filter(row -> {
                LocalDate date = toDate(data.get(row, column));
                return date != null && !date.isBefore(startDate) && !date.isAfter(endDate);
            });
            log.debug("Filtered to {} rows for date range {} to {}", result.rowCount(), startDate, endDate);
        }

        if (products != null && products.hasColumn("product_id") && result.hasColumn(productIdColumn)) {
            Set<String> ids = new HashSet<>();
            for (Object id : products.column("product_id")) {
                ids.add(String.valueOf(id));
            }
            final PanelFrame data = result;
            result = data.filter(row -> ids.contains(String.valueOf(data.get(row, productIdColumn))));
            log.debug("Filtered to {} rows for {} products", result.rowCount(), ids.size());
        }
        return result;
    }

    @Override
    public boolean validateConnection() {
        return file != null && Files.isRegularFile(file);
    }

    private void requireConnected() {
        if (file == null) {
            throw new IllegalStateException("Not connected to file source. Call connect() first.");
        }
    }

    private static LocalDate toDate(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof LocalDate) {
            return (LocalDate) value;
        }
        String text = value.toString();
        return LocalDate.parse(text.length() > 10 ? text.substring(0, 10) : text);
    }

    /**
     * Derives the tabular format from a file extension.
     *
     * @throws IllegalArgumentException for anything but CSV or Parquet
     */
    public static StorageFormat formatOf(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".csv")) {
            return StorageFormat.CSV;
        }
        if (name.endsWith(".parquet") || name.endsWith(".pq")) {
            return StorageFormat.PARQUET;
        }
        throw new IllegalArgumentException("Unsupported file format: " + path + ". Use .csv or .parquet");
    }
}
