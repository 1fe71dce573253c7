package org.impactengine.engine;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.impactengine.api.data.PanelFrame;
import org.impactengine.api.models.ModelResult;
import org.impactengine.api.transforms.ITransform;
import org.impactengine.config.ConfigProcessor;
import org.impactengine.config.PipelineConfig;
import org.impactengine.config.TransformSection;
import org.impactengine.metrics.MetricsManager;
import org.impactengine.metrics.file.FileMetricsAdapter;
import org.impactengine.models.FitOutput;
import org.impactengine.models.ModelsManager;
import org.impactengine.storage.StorageManager;
import org.impactengine.storage.StoredFile;
import org.impactengine.storage.TabularCodec;
import org.impactengine.utils.PathExpansion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs one causal-impact pipeline end to end.
 * <p>
 * <strong>Stage order:</strong>
 * <ol>
 *   <li>process and validate the pipeline document</li>
 *   <li>open job storage and build the metrics and models managers</li>
 *   <li>persist {@code config.yaml} and the products read from {@code DATA.SOURCE.CONFIG.path}</li>
 *   <li>retrieve business metrics</li>
 *   <li>apply the configured transform</li>
 *   <li>fit the model (the models manager persists results and artifacts)</li>
 *   <li>write {@value Manifest#FILE_NAME}</li>
 * </ol>
 * Stages run strictly in sequence and fail fast. The manifest is only written after every
 * file it lists has been verified to exist, so a job directory without a manifest is an
 * incomplete run. Files of a failed run are kept for inspection.
 * <p>
 * <strong>Thread Safety:</strong> an engine may run concurrent pipelines as long as they
 * use distinct job identifiers; the registries are only read during runs.
 */
public class ImpactEngine {

    private static final Logger log = LoggerFactory.getLogger(ImpactEngine.class);

    static final String CONFIG_FILE = "config.yaml";
    static final String PRODUCTS = "products";
    static final String BUSINESS_METRICS = "business_metrics";
    static final String TRANSFORMED_METRICS = "transformed_metrics";
    static final String CONFIG = "config";
    static final String IMPACT_RESULTS = "impact_results";

    private final EngineSettings settings;
    private final AdapterRegistries registries;
    private final ConfigProcessor configProcessor;

    /**
     * Creates an engine with the built-in adapters plus the extension adapters declared
     * under {@code impact-engine.adapters}.
     */
    public ImpactEngine(Config appConfig) {
        this(EngineSettings.from(appConfig), AdapterRegistries.forApplication(appConfig), new ConfigProcessor());
    }

    public ImpactEngine(EngineSettings settings, AdapterRegistries registries, ConfigProcessor configProcessor) {
        this.settings = settings;
        this.registries = registries;
        this.configProcessor = configProcessor;
    }

    /**
     * Runs the pipeline described by a YAML, JSON or HOCON file under a new job identifier.
     */
    public RunResult run(Path pipelineFile) throws IOException {
        return run(configProcessor.process(pipelineFile), null);
    }

    /**
     * Runs the pipeline described by an in-memory document under a new job identifier.
     */
    public RunResult run(Map<String, ?> pipelineDocument) throws IOException {
        return run(configProcessor.process(pipelineDocument), null);
    }

    /**
     * Runs an already processed pipeline.
     *
     * @param config validated pipeline configuration
     * @param jobId  job identifier, or {@code null} to generate one
     * @return the written manifest and fit output
     * @throws org.impactengine.api.exceptions.ImpactEngineException for domain failures
     * @throws IllegalArgumentException if the input data does not meet a stage's requirements
     * @throws IOException if reading inputs or persisting artifacts fails
     */
    public RunResult run(PipelineConfig config, String jobId) throws IOException {
        String effectiveJobId = jobId != null ? jobId : StorageManager.newJobId(settings.jobPrefix());
        log.info("Starting job '{}' (model '{}', source '{}')",
            effectiveJobId, config.measurement().model(), config.source().type());

        StorageManager storage = new StorageManager(registries.storage().get(settings.storageType()),
            settings.storageUrl(), effectiveJobId, settings.tabularFormat(), settings.tempDirectory());
        MetricsManager metricsManager = new MetricsManager(config.source(), registries.metrics().get(config.source().type()));
        ModelsManager modelsManager = new ModelsManager(config.measurement(), registries.models().get(config.measurement().model()));
        TransformSection transformSection = config.transform();
        ITransform transform = registries.transforms().get(transformSection.function());

        Map<String, StoredFile> files = new LinkedHashMap<>();
        files.put(CONFIG, storage.writeYaml(CONFIG_FILE, config.toYaml()));

        PanelFrame products = readProducts(config.source().path());
        files.put(PRODUCTS, storage.writeTable(PRODUCTS, products));

        PanelFrame businessMetrics = metricsManager.retrieve(products);
        files.put(BUSINESS_METRICS, storage.writeTable(BUSINESS_METRICS, businessMetrics));

        PanelFrame transformed = transform.apply(businessMetrics, transformSection.params());
        if (transformed == null) {
            throw new IllegalStateException("Transform '" + transformSection.function() + "' returned no data");
        }
        List<String> missing = transformed.missingColumns(modelsManager.getAdapter().getRequiredColumns());
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException(String.format(
                "Transform '%s' output lacks columns required by model '%s': %s. Available: %s",
                transformSection.function(), config.measurement().model(), missing, transformed.columns()));
        }
        files.put(TRANSFORMED_METRICS, storage.writeTable(TRANSFORMED_METRICS, transformed));
        log.info("Transform '{}' produced {} rows", transformSection.function(), transformed.rowCount());

        FitOutput fit = modelsManager.fit(transformed, storage);
        files.put(IMPACT_RESULTS, fit.results());
        fit.artifacts().forEach((name, file) ->
            files.put(ModelsManager.artifactBaseName(fit.modelType(), name), file));

        Manifest manifest = writeManifest(storage, fit.modelType(), files);
        log.info("Job '{}' complete: {} files listed in {}", effectiveJobId, manifest.files().size(),
            storage.fullPath(Manifest.FILE_NAME));
        return new RunResult(effectiveJobId, storage.getRootPath(), manifest, fit);
    }

    public EngineSettings getSettings() {
        return settings;
    }

    public AdapterRegistries getRegistries() {
        return registries;
    }

    private static PanelFrame readProducts(String sourcePath) throws IOException {
        Path path = Path.of(PathExpansion.expandPath(sourcePath));
        if (!Files.isRegularFile(path)) {
            throw new IllegalArgumentException("Source file not found: " + path.toAbsolutePath());
        }
        return TabularCodec.readFile(path, FileMetricsAdapter.formatOf(path));
    }

    private static Manifest writeManifest(StorageManager storage, String modelType, Map<String, StoredFile> files) throws IOException {
        Map<String, Manifest.FileEntry> entries = new LinkedHashMap<>();
        for (Map.Entry<String, StoredFile> entry : files.entrySet()) {
            StoredFile file = entry.getValue();
            if (!storage.exists(file.key())) {
                throw new IOException("Refusing to write manifest: '" + entry.getKey() + "' is missing at " + file.path());
            }
            entries.put(entry.getKey(), new Manifest.FileEntry(file.key(), file.format().manifestName()));
        }
        Manifest manifest = new Manifest(ModelResult.SCHEMA_VERSION, modelType,
            Instant.now().truncatedTo(ChronoUnit.SECONDS).toString(), entries);
        storage.writeJson(Manifest.FILE_NAME, manifest);
        return manifest;
    }

    /**
     * Creates an engine from the bundled defaults only.
     */
    public static ImpactEngine withDefaults() {
        return new ImpactEngine(ConfigFactory.load());
    }
}
