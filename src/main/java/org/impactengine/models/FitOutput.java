package org.impactengine.models;

import org.impactengine.api.models.ModelResult;
import org.impactengine.storage.StoredFile;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What a model fit persisted.
 *
 * @param results   the canonical result envelope ({@code impact_results.json})
 * @param artifacts artifact name to stored file, in the order the model returned them
 * @param modelType the model type that produced the output
 * @param result    the in-memory result, including the execution timestamp
 */
public record FitOutput(StoredFile results, Map<String, StoredFile> artifacts, String modelType, ModelResult result) {

    public FitOutput {
        artifacts = Collections.unmodifiableMap(new LinkedHashMap<>(artifacts));
    }

    public String resultsPath() {
        return results.path();
    }

    /**
     * Artifact name to full path.
     */
    public Map<String, String> artifactPaths() {
        Map<String, String> paths = new LinkedHashMap<>();
        artifacts.forEach((name, file) -> paths.put(name, file.path()));
        return paths;
    }
}
