package org.impactengine.models.approximation;

import com.typesafe.config.Config;

/**
 * Maps a metric change to an approximated outcome change.
 * <p>
 * Implementations are registered in {@link ResponseFunctions} and must be public with a
 * public no-argument constructor.
 */
@FunctionalInterface
public interface ResponseFunction {

    /**
     * @param deltaMetric     metric after minus metric before
     * @param baselineOutcome baseline outcome of the product, e.g. summed sales
     * @param params          function parameters from {@code response.PARAMS}
     * @return the approximated impact on the outcome
     */
    double respond(double deltaMetric, double baselineOutcome, Config params);
}
