package org.impactengine.api.models;

import org.impactengine.api.data.PanelFrame;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Standardized output of a model fit.
 * <p>
 * The {@link #data()} section always has exactly three sub-sections, {@code model_params},
 * {@code impact_estimates} and {@code model_summary}, even when some of them are empty.
 * Every model therefore shares one consumer shape.
 * <p>
 * Artifacts are supplementary tables (e.g. per-stratum details). Adapters only return
 * them; persisting them is the job of the models manager.
 */
public final class ModelResult {

    /** Version of the result envelope and manifest layout. */
    public static final String SCHEMA_VERSION = "2.0";

    public static final String MODEL_PARAMS = "model_params";
    public static final String IMPACT_ESTIMATES = "impact_estimates";
    public static final String MODEL_SUMMARY = "model_summary";

    private final String modelType;
    private final Map<String, Object> modelParams;
    private final Map<String, Object> impactEstimates;
    private final Map<String, Object> modelSummary;
    private final Map<String, PanelFrame> artifacts;
    private final Map<String, Object> metadata;

    private ModelResult(Builder builder) {
        this.modelType = Objects.requireNonNull(builder.modelType, "modelType");
        this.modelParams = freeze(builder.modelParams);
        this.impactEstimates = freeze(builder.impactEstimates);
        this.modelSummary = freeze(builder.modelSummary);
        this.artifacts = freeze(builder.artifacts);
        this.metadata = freeze(builder.metadata);
    }

    public static Builder builder(String modelType) {
        return new Builder(modelType);
    }

    public String getModelType() {
        return modelType;
    }

    public Map<String, Object> getModelParams() {
        return modelParams;
    }

    public Map<String, Object> getImpactEstimates() {
        return impactEstimates;
    }

    public Map<String, Object> getModelSummary() {
        return modelSummary;
    }

    public Map<String, PanelFrame> getArtifacts() {
        return artifacts;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    /**
     * Returns the data section with exactly {@code model_params}, {@code impact_estimates}
     * and {@code model_summary}, in that order.
     */
    public Map<String, Object> data() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(MODEL_PARAMS, modelParams);
        data.put(IMPACT_ESTIMATES, impactEstimates);
        data.put(MODEL_SUMMARY, modelSummary);
        return Collections.unmodifiableMap(data);
    }

    /**
     * Returns a copy with one metadata entry added or replaced.
     */
    public ModelResult withMetadata(String key, Object value) {
        Builder builder = toBuilder();
        builder.metadata.put(key, value);
        return builder.build();
    }

    /**
     * Builds the canonical JSON envelope:
     * {@code {schema_version, model_type, data: {...}, metadata: {...}}}.
     */
    public Map<String, Object> toEnvelope() {
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("schema_version", SCHEMA_VERSION);
        envelope.put("model_type", modelType);
        envelope.put("data", data());
        envelope.put("metadata", metadata);
        return envelope;
    }

    public Builder toBuilder() {
        Builder builder = new Builder(modelType);
        builder.modelParams.putAll(modelParams);
        builder.impactEstimates.putAll(impactEstimates);
        builder.modelSummary.putAll(modelSummary);
        builder.artifacts.putAll(artifacts);
        builder.metadata.putAll(metadata);
        return builder;
    }

    private static <V> Map<String, V> freeze(Map<String, V> map) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }

    @Override
    public String toString() {
        return "ModelResult{modelType=" + modelType + ", impactEstimates=" + impactEstimates
            + ", artifacts=" + artifacts.keySet() + "}";
    }

    public static final class Builder {
        private final String modelType;
        private final Map<String, Object> modelParams = new LinkedHashMap<>();
        private final Map<String, Object> impactEstimates = new LinkedHashMap<>();
        private final Map<String, Object> modelSummary = new LinkedHashMap<>();
        private final Map<String, PanelFrame> artifacts = new LinkedHashMap<>();
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        private Builder(String modelType) {
            this.modelType = modelType;
        }

        public Builder modelParam(String key, Object value) {
            modelParams.put(key, value);
            return this;
        }

        public Builder modelParams(Map<String, ?> values) {
            modelParams.putAll(values);
            return this;
        }

        public Builder impactEstimate(String key, Object value) {
            impactEstimates.put(key, value);
            return this;
        }

        public Builder summary(String key, Object value) {
            modelSummary.put(key, value);
            return this;
        }

        public Builder artifact(String name, PanelFrame frame) {
            artifacts.put(name, Objects.requireNonNull(frame, "frame"));
            return this;
        }

        public Builder metadata(String key, Object value) {
            metadata.put(key, value);
            return this;
        }

        public ModelResult build() {
            return new ModelResult(this);
        }
    }
}
