package org.impactengine.transforms;

import com.typesafe.config.Config;
import org.impactengine.api.data.ColumnType;
import org.impactengine.api.data.PanelFrame;
import org.impactengine.api.transforms.ITransform;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Collapses panel data into one row per date for time-series models.
 * <p>
 * <strong>Parameters:</strong> {@code date_column} (default {@code date}) and {@code metric}
 * (default {@code revenue}); the metric column must exist and be numeric.
 * <p>
 * <strong>Surviving columns:</strong> the date column followed by every numeric column, each
 * summed per date (nulls skipped). All non-numeric columns are dropped. Rows are ordered by date.
 */
public class AggregateByDateTransform implements ITransform {

    @Override
    public PanelFrame apply(PanelFrame data, Config params) {
        String dateColumn = Params.string(params, "date_column", "date");
        String metric = Params.string(params, "metric", "revenue");

        if (!data.hasColumn(dateColumn)) {
            throw new IllegalArgumentException("Data must contain '" + dateColumn + "' column for aggregate_by_date transform");
        }
        if (!data.hasColumn(metric)) {
            throw new IllegalArgumentException("Data must contain metric column '" + metric + "'");
        }
        if (!data.type(metric).isNumeric()) {
            throw new IllegalArgumentException("Metric column '" + metric + "' must be numeric, got " + data.type(metric));
        }

        List<String> numericColumns = new ArrayList<>();
        for (String column : data.columns()) {
            if (!column.equals(dateColumn) && data.type(column).isNumeric()) {
                numericColumns.add(column);
            }
        }

        List<Map.Entry<Object, List<Integer>>> groups = new ArrayList<>(data.groupRows(dateColumn).entrySet());
        groups.sort(Map.Entry.<Object, List<Integer>>comparingByKey(Params.keyOrder(data.type(dateColumn))));

        List<Object> dates = new ArrayList<>(groups.size());
        for (Map.Entry<Object, List<Integer>> group : groups) {
            dates.add(group.getKey());
        }
        PanelFrame result = PanelFrame.empty().withColumn(dateColumn, data.type(dateColumn), dates);
        for (String column : numericColumns) {
            ColumnType type = data.type(column);
            List<Object> sums = new ArrayList<>(groups.size());
            for (Map.Entry<Object, List<Integer>> group : groups) {
                sums.add(Params.sum(data, column, group.getValue()));
            }
            result = result.withColumn(column, type, sums);
        }
        return result;
    }
}
