package org.impactengine.models.approximation;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValueType;
import org.impactengine.api.data.ColumnType;
import org.impactengine.api.data.PanelFrame;
import org.impactengine.api.exceptions.EstimationFailureException;
import org.impactengine.api.exceptions.InvalidParameterException;
import org.impactengine.api.models.AbstractModelAdapter;
import org.impactengine.api.models.ModelResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Map;

/**
 * Approximates impact from per-product metric changes.
 * <p>
 * For each row: {@code delta = metric_after - metric_before} and
 * {@code impact = response(delta, baseline)}. The response function is looked up in
 * {@link ResponseFunctions} by {@code response.FUNCTION} and receives {@code response.PARAMS}.
 * <p>
 * <strong>Parameters:</strong> {@code metric_before_column} ("quality_before"),
 * {@code metric_after_column} ("quality_after"), {@code baseline_column} ("baseline_sales"),
 * {@code response} ({@code {FUNCTION: "linear"}}).
 * <br>
 * <strong>Artifact</strong> {@value #PER_PRODUCT}: product_id, delta_metric, baseline_outcome,
 * approximated_impact.
 */
public class MetricsApproximationAdapter extends AbstractModelAdapter {

    private static final Logger log = LoggerFactory.getLogger(MetricsApproximationAdapter.class);

    public static final String MODEL_TYPE = "metrics_approximation";
    public static final String PER_PRODUCT = "per_product";

    private String metricBeforeColumn;
    private String metricAfterColumn;
    private String baselineColumn;
    private String responseFunction;
    private Config responseParams;

    @Override
    protected boolean doConnect(Config config) {
        this.metricBeforeColumn = string(config, "metric_before_column", "quality_before");
        this.metricAfterColumn = string(config, "metric_after_column", "quality_after");
        this.baselineColumn = string(config, "baseline_column", "baseline_sales");

        Config response = response(config);
        if (!response.hasPath("FUNCTION") || response.getString("FUNCTION").isBlank()) {
            throw new IllegalArgumentException("response.FUNCTION is required");
        }
        this.responseFunction = response.getString("FUNCTION");
        if (!ResponseFunctions.contains(responseFunction)) {
            throw new IllegalArgumentException("Invalid response function: Unknown response function '"
                + responseFunction + "'. Available: " + ResponseFunctions.registry().keys());
        }
        this.responseParams = response.hasPath("PARAMS") ? response.getConfig("PARAMS") : ConfigFactory.empty();
        return true;
    }

    @Override
    public void validateParams(Config params) {
        Config response;
        try {
            response = response(params);
        } catch (IllegalArgumentException e) {
            throw new InvalidParameterException("response", e.getMessage());
        }
        if (response.hasPath("FUNCTION") && !ResponseFunctions.contains(response.getString("FUNCTION"))) {
            throw new InvalidParameterException("response", "Unknown response function '"
                + response.getString("FUNCTION") + "'. Available: " + ResponseFunctions.registry().keys());
        }
    }

    @Override
    public List<String> getRequiredColumns() {
        if (metricBeforeColumn == null) {
            return List.of("quality_before", "quality_after", "baseline_sales");
        }
        return List.of(metricBeforeColumn, metricAfterColumn, baselineColumn);
    }

    @Override
    protected ModelResult doFit(PanelFrame data, Config params) {
        if (data.isEmpty()) {
            throw new IllegalArgumentException("Data validation failed: input data is empty");
        }
        data.requireColumns(getRequiredColumns());
        double[] before = data.doubles(metricBeforeColumn);
        double[] after = data.doubles(metricAfterColumn);
        double[] baseline = data.doubles(baselineColumn);

        Config response = response(params);
        String functionName = response.hasPath("FUNCTION") ? response.getString("FUNCTION") : responseFunction;
        Config functionParams = response.hasPath("PARAMS") ? response.getConfig("PARAMS") : responseParams;
        ResponseFunction function = ResponseFunctions.get(functionName);
        boolean hasProductId = data.hasColumn("product_id");

        PanelFrame.Builder perProduct = PanelFrame.builder()
            .column("product_id", ColumnType.STRING)
            .column("delta_metric", ColumnType.DOUBLE)
            .column("baseline_outcome", ColumnType.DOUBLE)
            .column("approximated_impact", ColumnType.DOUBLE);
        double totalImpact = 0.0;
        double totalDelta = 0.0;
        try {
            for (int i = 0; i < data.rowCount(); i++) {
                double delta = after[i] - before[i];
                double impact = function.respond(delta, baseline[i], functionParams);
                Object productId = hasProductId ? data.get(i, "product_id") : null;
                perProduct.row(productId != null ? productId.toString() : Integer.toString(i),
                    round(delta, 4), round(baseline[i], 2), round(impact, 2));
                totalImpact += impact;
                totalDelta += delta;
            }
        } catch (RuntimeException e) {
            throw new EstimationFailureException(
                "Response function '" + functionName + "' failed: " + e.getMessage(), e);
        }

        int n = data.rowCount();
        ModelResult result = ModelResult.builder(MODEL_TYPE)
            .modelParam("metric_before_column", metricBeforeColumn)
            .modelParam("metric_after_column", metricAfterColumn)
            .modelParam("baseline_column", baselineColumn)
            .modelParam("response_function", functionName)
            .modelParam("response_params", functionParams.root().unwrapped())
            .impactEstimate("total_approximated_impact", round(totalImpact, 2))
            .impactEstimate("mean_approximated_impact", round(totalImpact / n, 2))
            .impactEstimate("mean_metric_change", round(totalDelta / n, 4))
            .impactEstimate("n_products", n)
            .summary("n_products", n)
            .summary("response_function", functionName)
            .artifact(PER_PRODUCT, perProduct.build())
            .build();

        log.info("Metrics approximation complete: {} products, total impact={}",
            n, result.getImpactEstimates().get("total_approximated_impact"));
        return result;
    }

    private static Config response(Config config) {
        if (!config.hasPath("response")) {
            return ConfigFactory.parseMap(Map.of("FUNCTION", LinearResponse.NAME));
        }
        if (config.getValue("response").valueType() != ConfigValueType.OBJECT) {
            throw new IllegalArgumentException("response must be a mapping with a FUNCTION key");
        }
        return config.getConfig("response");
    }

    private static String string(Config config, String key, String defaultValue) {
        return config.hasPath(key) ? config.getString(key) : defaultValue;
    }

    static double round(double value, int places) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_EVEN).doubleValue();
    }
}
