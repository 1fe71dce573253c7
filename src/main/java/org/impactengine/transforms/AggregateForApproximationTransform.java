package org.impactengine.transforms;

import com.typesafe.config.Config;
import org.impactengine.api.data.ColumnType;
import org.impactengine.api.data.PanelFrame;
import org.impactengine.api.transforms.ITransform;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds one cross-sectional row per product for metrics-approximation models.
 * <p>
 * <strong>Parameters:</strong>
 * <ul>
 *   <li>{@code product_id_column} (default {@code product_id}, falling back to {@code asin})</li>
 *   <li>{@code baseline_metric} (default {@code revenue}): numeric column summed per product</li>
 *   <li>{@code carry_columns} (default none): columns copied through with their first
 *       non-null value per product</li>
 * </ul>
 * <strong>Surviving columns:</strong> {@code product_id}, {@code baseline_sales} and the
 * carry columns, in that order. Everything else is dropped.
 */
public class AggregateForApproximationTransform implements ITransform {

    @Override
    public PanelFrame apply(PanelFrame data, Config params) {
        String idColumn = resolveIdColumn(data, params);
        String baselineMetric = Params.string(params, "baseline_metric", "revenue");
        List<String> carryColumns = Params.stringList(params, "carry_columns");

        if (!data.hasColumn(baselineMetric)) {
            throw new IllegalArgumentException("Data must contain baseline metric column '" + baselineMetric + "'");
        }
        if (!data.type(baselineMetric).isNumeric()) {
            throw new IllegalArgumentException("Baseline metric column '" + baselineMetric + "' must be numeric");
        }
        data.requireColumns(carryColumns);

        Map<Object, List<Integer>> groups = data.groupRows(idColumn);
        List<Object> ids = new ArrayList<>(groups.keySet());
        List<Object> baselines = new ArrayList<>(groups.size());
        for (List<Integer> rows : groups.values()) {
            Object sum = Params.sum(data, baselineMetric, rows);
            baselines.add(sum == null ? null : ((Number) sum).doubleValue());
        }

        PanelFrame result = PanelFrame.empty()
            .withColumn("product_id", data.type(idColumn), ids)
            .withColumn("baseline_sales", ColumnType.DOUBLE, baselines);
        for (String column : carryColumns) {
            List<Object> values = new ArrayList<>(groups.size());
            for (List<Integer> rows : groups.values()) {
                values.add(firstNonNull(data, column, rows));
            }
            result = result.withColumn(column, data.type(column), values);
        }
        return result;
    }

    private static String resolveIdColumn(PanelFrame data, Config params) {
        if (params.hasPath("product_id_column")) {
            String column = params.getString("product_id_column");
            if (!data.hasColumn(column)) {
                throw new IllegalArgumentException("Data must contain product id column '" + column + "'");
            }
            return column;
        }
        if (data.hasColumn("product_id")) {
            return "product_id";
        }
        if (data.hasColumn("asin")) {
            return "asin";
        }
        throw new IllegalArgumentException(
            "Data must contain 'product_id' or 'asin' column for aggregate_for_approximation");
    }

    private static Object firstNonNull(PanelFrame data, String column, List<Integer> rows) {
        for (int row : rows) {
            Object value = data.get(row, column);
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
