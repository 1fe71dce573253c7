package org.impactengine.models.subclassification;

import org.impactengine.api.data.ColumnType;
import org.impactengine.api.data.PanelFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * Treatment effect estimation by subclassification on covariates.
 * <p>
 * <strong>Algorithm:</strong>
 * <ol>
 *   <li>Each covariate is binned independently into {@code nStrata} quantile bins
 *       ({@link QuantileBinning}); ties may reduce the achievable bin count, which is logged
 *       as a warning.</li>
 *   <li>An observation's stratum is the {@code _}-joined tuple of its bin indices.</li>
 *   <li>Per stratum the mean outcome of treated and control observations is computed.
 *       Strata without both groups lack common support and are dropped with a warning.</li>
 *   <li>The stratum effect is {@code mean(treated) - mean(control)}.</li>
 *   <li>The overall effect is the weighted mean of the retained stratum effects, weighted
 *       by treated count for {@link Estimand#ATT} and by total count for {@link Estimand#ATE}.</li>
 * </ol>
 * If every stratum is dropped, the estimate is 0.0 with zero retained strata. That case is
 * reported through {@link Estimate#retainedStrata()} rather than an exception.
 */
public final class StratificationEstimator {

    private static final Logger log = LoggerFactory.getLogger(StratificationEstimator.class);

    private final int nStrata;
    private final Estimand estimand;

    /**
     * @throws IllegalArgumentException if {@code nStrata < 1}
     */
    public StratificationEstimator(int nStrata, Estimand estimand) {
        if (nStrata < 1) {
            throw new IllegalArgumentException("n_strata must be a positive integer, got " + nStrata);
        }
        this.nStrata = nStrata;
        this.estimand = estimand;
    }

    /**
     * Effect within one stratum that has common support.
     */
    public record StratumEffect(String stratum, int nTreated, int nControl,
                                double meanTreated, double meanControl, double effect) {
    }

    /**
     * Result of one estimation.
     *
     * @param treatmentEffect weighted effect, 0.0 if no stratum has common support
     * @param retained        strata with common support, ordered by label
     * @param totalStrata     distinct strata observed before pruning
     */
    public record Estimate(double treatmentEffect, List<StratumEffect> retained, int totalStrata) {

        public int retainedStrata() {
            return retained.size();
        }

        public int droppedStrata() {
            return totalStrata - retained.size();
        }

        /**
         * Per-stratum details as a frame: stratum, n_treated, n_control, mean_treated,
         * mean_control, effect.
         */
        public PanelFrame details() {
            PanelFrame.Builder builder = PanelFrame.builder()
                .column("stratum", ColumnType.STRING)
                .column("n_treated", ColumnType.LONG)
                .column("n_control", ColumnType.LONG)
                .column("mean_treated", ColumnType.DOUBLE)
                .column("mean_control", ColumnType.DOUBLE)
                .column("effect", ColumnType.DOUBLE);
            for (StratumEffect s : retained) {
                builder.row(s.stratum(), (long) s.nTreated(), (long) s.nControl(),
                    s.meanTreated(), s.meanControl(), s.effect());
            }
            return builder.build();
        }
    }

    /**
     * Estimates the treatment effect.
     *
     * @param outcome        outcome per observation
     * @param treated        treatment indicator per observation
     * @param covariateNames covariate names, used in warnings
     * @param covariates     one value array per covariate, each as long as {@code outcome}
     */
    public Estimate estimate(double[] outcome, boolean[] treated, List<String> covariateNames, List<double[]> covariates) {
        int n = outcome.length;
        if (treated.length != n) {
            throw new IllegalArgumentException("Treatment indicator has " + treated.length + " values, outcome has " + n);
        }
        if (covariates.isEmpty() || covariates.size() != covariateNames.size()) {
            throw new IllegalArgumentException("At least one named covariate is required");
        }

        String[] strata = stratify(n, covariateNames, covariates);
        List<StratumEffect> retained = stratumEffects(outcome, treated, strata);
        int totalStrata = (int) Arrays.stream(strata).distinct().count();

        if (retained.isEmpty()) {
            log.warn("All {} strata dropped due to lack of common support, returning zero-effect result", totalStrata);
            return new Estimate(0.0, retained, totalStrata);
        }
        return new Estimate(aggregate(retained), retained, totalStrata);
    }

    private String[] stratify(int n, List<String> covariateNames, List<double[]> covariates) {
        StringJoiner[] labels = new StringJoiner[n];
        for (int i = 0; i < n; i++) {
            labels[i] = new StringJoiner("_");
        }
        for (int c = 0; c < covariates.size(); c++) {
            double[] values = covariates.get(c);
            if (values.length != n) {
                throw new IllegalArgumentException("Covariate '" + covariateNames.get(c) + "' has "
                    + values.length + " values, outcome has " + n);
            }
            int[] bins = QuantileBinning.assign(values, nStrata);
            int achieved = QuantileBinning.distinctBins(bins);
            if (achieved < nStrata) {
                log.warn("Covariate '{}': requested {} bins but got {} due to duplicate quantile edges",
                    covariateNames.get(c), nStrata, achieved);
            }
            for (int i = 0; i < n; i++) {
                labels[i].add(Integer.toString(bins[i]));
            }
        }
        String[] strata = new String[n];
        for (int i = 0; i < n; i++) {
            strata[i] = labels[i].toString();
        }
        return strata;
    }

    private List<StratumEffect> stratumEffects(double[] outcome, boolean[] treated, String[] strata) {
        Map<String, double[]> sums = new TreeMap<>();
        for (int i = 0; i < outcome.length; i++) {
            // {treated count, treated sum, control count, control sum}
            double[] acc = sums.computeIfAbsent(strata[i], k -> new double[4]);
            if (treated[i]) {
                acc[0]++;
                acc[1] += outcome[i];
            } else {
                acc[2]++;
                acc[3] += outcome[i];
            }
        }

        List<StratumEffect> retained = new ArrayList<>();
        for (Map.Entry<String, double[]> entry : sums.entrySet()) {
            double[] acc = entry.getValue();
            int nTreated = (int) acc[0];
            int nControl = (int) acc[2];
            if (nTreated == 0 || nControl == 0) {
                log.warn("Stratum '{}' lacks common support (treated={}, control={}), dropping",
                    entry.getKey(), nTreated, nControl);
                continue;
            }
            double meanTreated = acc[1] / nTreated;
            double meanControl = acc[3] / nControl;
            retained.add(new StratumEffect(entry.getKey(), nTreated, nControl,
                meanTreated, meanControl, meanTreated - meanControl));
        }
        return retained;
    }

    private double aggregate(List<StratumEffect> retained) {
        double weightedSum = 0.0;
        double totalWeight = 0.0;
        for (StratumEffect s : retained) {
            double weight = estimand == Estimand.ATT ? s.nTreated() : s.nTreated() + s.nControl();
            weightedSum += weight * s.effect();
            totalWeight += weight;
        }
        return weightedSum / totalWeight;
    }
}
