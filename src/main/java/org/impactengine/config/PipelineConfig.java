package org.impactengine.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigRenderOptions;
import org.impactengine.utils.DocumentCodec;

import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;

/**
 * Fully merged and validated pipeline configuration with typed section views.
 * <p>
 * Instances are only created by {@link ConfigProcessor} and are immutable.
 */
public final class PipelineConfig {

    private final Config document;

    PipelineConfig(Config document) {
        this.document = document;
    }

    /**
     * Returns the underlying document.
     */
    public Config document() {
        return document;
    }

    public SourceSection source() {
        Config sourceConfig = document.getConfig(ConfigProcessor.SOURCE_CONFIG);
        Optional<EnrichmentSection> enrichment = enrichment();
        if (enrichment.isPresent()) {
            sourceConfig = sourceConfig.withValue("ENRICHMENT", document.getValue(ConfigProcessor.ENRICHMENT));
        }
        return new SourceSection(
            document.getString(ConfigProcessor.SOURCE_TYPE),
            sourceConfig,
            document.getString(ConfigProcessor.SOURCE_PATH),
            LocalDate.parse(document.getString(ConfigProcessor.START_DATE)),
            LocalDate.parse(document.getString(ConfigProcessor.END_DATE)));
    }

    public TransformSection transform() {
        Config params = document.hasPath(ConfigProcessor.TRANSFORM_PARAMS)
            ? document.getConfig(ConfigProcessor.TRANSFORM_PARAMS)
            : ConfigFactory.empty();
        return new TransformSection(document.getString(ConfigProcessor.TRANSFORM_FUNCTION), params);
    }

    public Optional<EnrichmentSection> enrichment() {
        if (!document.hasPath(ConfigProcessor.ENRICHMENT)) {
            return Optional.empty();
        }
        Config enrichment = document.getConfig(ConfigProcessor.ENRICHMENT);
        String function = enrichment.hasPath("FUNCTION") ? enrichment.getString("FUNCTION") : null;
        Config params = enrichment.hasPath("PARAMS") ? enrichment.getConfig("PARAMS") : ConfigFactory.empty();
        LocalDate start = params.hasPath(ConfigProcessor.ENRICHMENT_START_KEY)
            ? LocalDate.parse(params.getString(ConfigProcessor.ENRICHMENT_START_KEY))
            : null;
        return Optional.of(new EnrichmentSection(function, params, start));
    }

    public MeasurementSection measurement() {
        return new MeasurementSection(
            document.getString(ConfigProcessor.MODEL),
            document.getConfig(ConfigProcessor.MODEL_PARAMS));
    }

    /**
     * Returns the document as a plain map tree with sorted keys.
     */
    public Map<String, Object> toMap() {
        return DocumentCodec.sorted(document.root().unwrapped());
    }

    /**
     * Renders the document as YAML. Equal documents render byte-identically.
     */
    public byte[] toYaml() {
        return DocumentCodec.toYaml(toMap());
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof PipelineConfig && document.equals(((PipelineConfig) o).document);
    }

    @Override
    public int hashCode() {
        return document.hashCode();
    }

    @Override
    public String toString() {
        return "PipelineConfig{" + document.root().render(ConfigRenderOptions.concise()) + "}";
    }
}
