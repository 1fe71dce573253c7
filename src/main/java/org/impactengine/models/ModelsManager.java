package org.impactengine.models;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigValueFactory;
import org.impactengine.api.data.PanelFrame;
import org.impactengine.api.exceptions.ConnectionFailureException;
import org.impactengine.api.exceptions.EstimationFailureException;
import org.impactengine.api.exceptions.ImpactEngineException;
import org.impactengine.api.exceptions.MissingDependencyException;
import org.impactengine.api.models.IModelAdapter;
import org.impactengine.api.models.ModelResult;
import org.impactengine.config.MeasurementSection;
import org.impactengine.storage.StorageManager;
import org.impactengine.storage.StoredFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Owns one model adapter: connects it, merges fit parameters, runs the fit and persists
 * everything the fit produced.
 * <p>
 * Persistence is centralized here. Adapters return artifacts as frames and this manager
 * writes each one exactly once as {@code <model_type>__<artifact_name>.<ext>}, followed by the
 * result envelope {@value #RESULTS_FILE}.
 */
public class ModelsManager {

    private static final Logger log = LoggerFactory.getLogger(ModelsManager.class);

    /** Name of the canonical result envelope. */
    public static final String RESULTS_FILE = "impact_results.json";

    private final MeasurementSection measurement;
    private final IModelAdapter adapter;

    /**
     * Connects the adapter with {@code MEASUREMENT.PARAMS}.
     *
     * @throws ConnectionFailureException if the adapter rejects its configuration or fails to connect
     */
    public ModelsManager(MeasurementSection measurement, IModelAdapter adapter) {
        this.measurement = measurement;
        this.adapter = adapter;

        boolean connected;
        try {
            connected = adapter.connect(measurement.params());
        } catch (IllegalArgumentException | ConfigException e) {
            throw new ConnectionFailureException(
                "Model '" + measurement.model() + "' rejected its configuration: " + e.getMessage(), e);
        }
        if (!connected) {
            throw new ConnectionFailureException("Failed to connect model '" + measurement.model() + "'");
        }
    }

    public FitOutput fit(PanelFrame data, StorageManager storage) throws IOException {
        return fit(data, storage, Map.of());
    }

    /**
     * Fits the model and persists its output.
     *
     * @param data      transformed input data
     * @param storage   job storage; required
     * @param overrides parameters taking precedence over {@code MEASUREMENT.PARAMS};
     *                  {@code null} values are ignored
     * @throws org.impactengine.api.exceptions.InvalidParameterException if the merged parameters are invalid
     * @throws MissingDependencyException if {@code storage} is null
     * @throws EstimationFailureException if the adapter fails with an unexpected error
     * @throws IOException                if persisting fails
     */
    public FitOutput fit(PanelFrame data, StorageManager storage, Map<String, ?> overrides) throws IOException {
        Config params = mergeOverrides(measurement.params(), overrides);
        adapter.validateParams(params);

        if (storage == null) {
            throw new MissingDependencyException(
                "Model '" + measurement.model() + "' needs a storage manager to persist its results");
        }

        ModelResult result;
        try {
            result = adapter.fit(data, params);
        } catch (ImpactEngineException | IllegalArgumentException | IllegalStateException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EstimationFailureException(
                "Model '" + measurement.model() + "' failed to fit: " + e.getMessage(), e);
        }
        if (result == null) {
            throw new IllegalStateException("Model '" + measurement.model() + "' returned no result");
        }
        result = result.withMetadata("executed_at", Instant.now().toString());

        Map<String, StoredFile> artifacts = new LinkedHashMap<>();
        for (Map.Entry<String, PanelFrame> artifact : result.getArtifacts().entrySet()) {
            String baseName = artifactBaseName(result.getModelType(), artifact.getKey());
            artifacts.put(artifact.getKey(), storage.writeTable(baseName, artifact.getValue()));
            log.debug("Persisted artifact '{}' as {}", artifact.getKey(), storage.tabularFileName(baseName));
        }
        StoredFile results = storage.writeJson(RESULTS_FILE, result.toEnvelope());

        log.info("Model '{}' fitted on {} rows, {} artifacts written", result.getModelType(), data.rowCount(), artifacts.size());
        return new FitOutput(results, artifacts, result.getModelType(), result);
    }

    public IModelAdapter getAdapter() {
        return adapter;
    }

    /**
     * File base name of a model artifact: {@code <model_type>__<artifact_name>}.
     */
    public static String artifactBaseName(String modelType, String artifactName) {
        return modelType + "__" + artifactName;
    }

    static Config mergeOverrides(Config params, Map<String, ?> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return params;
        }
        Map<String, Object> effective = new LinkedHashMap<>();
        overrides.forEach((key, value) -> {
            if (value != null) {
                effective.put(key, value);
            }
        });
        return ConfigValueFactory.fromMap(effective).toConfig().withFallback(params);
    }
}
