package org.impactengine.engine;

import org.impactengine.models.FitOutput;

/**
 * Outcome of a completed pipeline run.
 *
 * @param jobId        job identifier
 * @param jobDirectory full location of the job root
 * @param manifest     the manifest written last
 * @param fit          the models manager's output
 */
public record RunResult(String jobId, String jobDirectory, Manifest manifest, FitOutput fit) {

    /**
     * Full location of {@code impact_results.json}.
     */
    public String resultsPath() {
        return fit.resultsPath();
    }
}
