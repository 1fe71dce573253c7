package org.impactengine.engine;

import org.impactengine.api.data.PanelFrame;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything a completed job persisted, loaded back through its manifest.
 *
 * @param jobDirectory       the job directory
 * @param manifest           the manifest
 * @param config             the processed pipeline document
 * @param impactResults      the result envelope
 * @param products           products as read from the source
 * @param businessMetrics    retrieved metrics
 * @param transformedMetrics model input
 * @param modelArtifacts     model artifacts keyed by artifact name (without the model prefix)
 */
public record JobResult(String jobDirectory, Manifest manifest, Map<String, Object> config,
                        Map<String, Object> impactResults, PanelFrame products, PanelFrame businessMetrics,
                        PanelFrame transformedMetrics, Map<String, PanelFrame> modelArtifacts) {

    public JobResult {
        modelArtifacts = Collections.unmodifiableMap(new LinkedHashMap<>(modelArtifacts));
    }

    public String modelType() {
        return manifest.modelType();
    }

    /**
     * The {@code impact_estimates} section of the result envelope.
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> impactEstimates() {
        Object data = impactResults.get("data");
        if (!(data instanceof Map)) {
            return Map.of();
        }
        Object estimates = ((Map<String, Object>) data).get("impact_estimates");
        return estimates instanceof Map ? (Map<String, Object>) estimates : Map.of();
    }
}
