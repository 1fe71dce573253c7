package org.impactengine.models.approximation;

import com.typesafe.config.Config;

/**
 * {@code impact = coefficient * delta * baseline}. With a coefficient of 0.5 a one-unit
 * metric increase yields half the baseline as impact. The coefficient defaults to 1.0.
 */
public class LinearResponse implements ResponseFunction {

    public static final String NAME = "linear";

    @Override
    public double respond(double deltaMetric, double baselineOutcome, Config params) {
        double coefficient = params.hasPath("coefficient") ? params.getDouble("coefficient") : 1.0;
        return coefficient * deltaMetric * baselineOutcome;
    }
}
