package org.impactengine.models.subclassification;

import com.typesafe.config.Config;
import org.impactengine.api.data.ColumnType;
import org.impactengine.api.data.PanelFrame;
import org.impactengine.api.exceptions.EstimationFailureException;
import org.impactengine.api.exceptions.InvalidParameterException;
import org.impactengine.api.models.AbstractModelAdapter;
import org.impactengine.api.models.ModelResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Model adapter estimating treatment effects by subclassification on covariates.
 * <p>
 * <strong>Parameters</strong> ({@code MEASUREMENT.PARAMS}):
 * <ul>
 *   <li>{@code treatment_column} (required): binary treatment indicator (0/1 or boolean)</li>
 *   <li>{@code covariate_columns} (required): one column name or a list of names</li>
 *   <li>{@code dependent_variable} ("revenue"): numeric outcome</li>
 *   <li>{@code n_strata} (5): quantile bins per covariate</li>
 *   <li>{@code estimand} ("att"): {@code att} or {@code ate}</li>
 * </ul>
 * The estimation itself is done by {@link StratificationEstimator}. When at least one stratum
 * has common support, the per-stratum table is returned as artifact {@value #STRATUM_DETAILS}.
 */
public class SubclassificationAdapter extends AbstractModelAdapter {

    private static final Logger log = LoggerFactory.getLogger(SubclassificationAdapter.class);

    public static final String MODEL_TYPE = "subclassification";
    public static final String STRATUM_DETAILS = "stratum_details";

    private SubclassificationParams settings;

    @Override
    protected boolean doConnect(Config config) {
        try {
            this.settings = SubclassificationParams.read(config, SubclassificationParams.DEFAULTS).requireColumns();
        } catch (InvalidParameterException e) {
            throw new IllegalArgumentException(e.getMessage(), e);
        }
        return true;
    }

    @Override
    public void validateParams(Config params) {
        SubclassificationParams.read(params, SubclassificationParams.DEFAULTS).requireColumns();
    }

    @Override
    public List<String> getRequiredColumns() {
        if (settings == null) {
            return List.of();
        }
        List<String> required = new ArrayList<>();
        required.add(settings.treatmentColumn());
        required.addAll(settings.covariateColumns());
        return required;
    }

    /**
     * Fits with {@code params} over the connect-time parameters: every key present in
     * {@code params} wins.
     */
    @Override
    protected ModelResult doFit(PanelFrame data, Config params) {
        SubclassificationParams effective = SubclassificationParams.read(params, settings).requireColumns();
        if (data.isEmpty()) {
            throw new IllegalArgumentException("Data validation failed: input data is empty");
        }
        List<String> required = new ArrayList<>();
        required.add(effective.treatmentColumn());
        required.addAll(effective.covariateColumns());
        required.add(effective.dependentVariable());
        data.requireColumns(required);
        boolean[] treated = treatmentIndicator(data, effective.treatmentColumn());
        double[] outcome = data.doubles(effective.dependentVariable());
        List<double[]> covariates = new ArrayList<>();
        for (String column : effective.covariateColumns()) {
            covariates.add(data.doubles(column));
        }

        Estimand estimand = effective.estimand();
        StratificationEstimator.Estimate estimate;
        try {
            estimate = new StratificationEstimator(effective.nStrata(), estimand)
                .estimate(outcome, treated, effective.covariateColumns(), covariates);
        } catch (RuntimeException e) {
            log.error("Error fitting subclassification: {}", e.getMessage());
            throw new EstimationFailureException("Model fitting failed: " + e.getMessage(), e);
        }

        long nTreated = 0;
        for (boolean t : treated) {
            if (t) {
                nTreated++;
            }
        }

        ModelResult.Builder result = ModelResult.builder(MODEL_TYPE)
            .modelParam("dependent_variable", effective.dependentVariable())
            .modelParam("treatment_column", effective.treatmentColumn())
            .modelParam("covariate_columns", effective.covariateColumns())
            .modelParam("n_strata", effective.nStrata())
            .modelParam("estimand", estimand.key())
            .impactEstimate("treatment_effect", estimate.treatmentEffect())
            .impactEstimate("n_strata", estimate.retainedStrata())
            .impactEstimate("n_strata_dropped", estimate.droppedStrata())
            .summary("n_observations", data.rowCount())
            .summary("n_treated", nTreated)
            .summary("n_control", data.rowCount() - nTreated)
            .summary("estimand", estimand.key());
        if (estimate.retainedStrata() > 0) {
            result.artifact(STRATUM_DETAILS, estimate.details());
        }
        log.debug("Subclassification {} = {} over {} strata ({} dropped)", estimand.key(),
            estimate.treatmentEffect(), estimate.retainedStrata(), estimate.droppedStrata());
        return result.build();
    }

    /**
     * Reads a binary treatment column.
     *
     * @throws IllegalArgumentException if a value is null or not 0/1/boolean
     */
    static boolean[] treatmentIndicator(PanelFrame data, String column) {
        ColumnType type = data.type(column);
        if (type != ColumnType.BOOLEAN && !type.isNumeric()) {
            throw new IllegalArgumentException("Treatment column '" + column + "' must be binary, found type " + type);
        }
        boolean[] treated = new boolean[data.rowCount()];
        for (int i = 0; i < treated.length; i++) {
            Object value = data.get(i, column);
            if (value instanceof Boolean) {
                treated[i] = (Boolean) value;
            } else if (value instanceof Number && ((Number) value).doubleValue() == 1.0) {
                treated[i] = true;
            } else if (value instanceof Number && ((Number) value).doubleValue() == 0.0) {
                treated[i] = false;
            } else {
                throw new IllegalArgumentException(
                    "Treatment column '" + column + "' must contain only 0 and 1, found " + value + " at row " + i);
            }
        }
        return treated;
    }
}
