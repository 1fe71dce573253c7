package org.impactengine.engine;

import org.impactengine.api.data.PanelFrame;
import org.impactengine.api.models.ModelResult;
import org.impactengine.api.storage.StorageFormat;
import org.impactengine.storage.TabularCodec;
import org.impactengine.utils.DocumentCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Loads a completed job from its directory.
 * <p>
 * The manifest is the only index trusted: a directory without {@value Manifest#FILE_NAME}
 * is an incomplete run and is refused, as is a manifest whose major schema version differs
 * from {@link ModelResult#SCHEMA_VERSION}.
 */
public final class ResultsLoader {

    private static final Logger log = LoggerFactory.getLogger(ResultsLoader.class);

    private ResultsLoader() {
    }

    /**
     * @throws IllegalStateException if the manifest is missing or has an incompatible version
     * @throws IOException           if a listed file cannot be read
     */
    public static JobResult load(Path jobDirectory) throws IOException {
        Manifest manifest = readManifest(jobDirectory);

        Map<String, Object> config = null;
        Map<String, Object> impactResults = null;
        PanelFrame products = null;
        PanelFrame businessMetrics = null;
        PanelFrame transformedMetrics = null;
        Map<String, PanelFrame> artifacts = new LinkedHashMap<>();
        String artifactPrefix = manifest.modelType() + "__";

        for (Map.Entry<String, Manifest.FileEntry> entry : manifest.files().entrySet()) {
            String name = entry.getKey();
            Path file = resolve(jobDirectory, entry.getValue());
            StorageFormat format = entry.getValue().storageFormat();
            switch (name) {
                case ImpactEngine.CONFIG -> config = readDocument(file, format);
                case ImpactEngine.IMPACT_RESULTS -> impactResults = readDocument(file, format);
                case ImpactEngine.PRODUCTS -> products = TabularCodec.readFile(file, format);
                case ImpactEngine.BUSINESS_METRICS -> businessMetrics = TabularCodec.readFile(file, format);
                case ImpactEngine.TRANSFORMED_METRICS -> transformedMetrics = TabularCodec.readFile(file, format);
                default -> {
                    if (name.startsWith(artifactPrefix) && format.isTabular()) {
                        artifacts.put(name.substring(artifactPrefix.length()), TabularCodec.readFile(file, format));
                    } else {
                        log.debug("Skipping unrecognized manifest entry '{}'", name);
                    }
                }
            }
        }
        if (impactResults == null) {
            throw new IllegalStateException("Manifest in " + jobDirectory + " does not list " + ImpactEngine.IMPACT_RESULTS);
        }
        return new JobResult(jobDirectory.toString(), manifest, config, impactResults,
            products, businessMetrics, transformedMetrics, artifacts);
    }

    /**
     * Reads and checks the manifest only.
     *
     * @throws IllegalStateException if the manifest is missing or has an incompatible version
     */
    public static Manifest readManifest(Path jobDirectory) throws IOException {
        Path manifestFile = jobDirectory.resolve(Manifest.FILE_NAME);
        if (!Files.isRegularFile(manifestFile)) {
            throw new IllegalStateException("No " + Manifest.FILE_NAME + " in " + jobDirectory
                + ". The job did not complete.");
        }
        Manifest manifest = DocumentCodec.jsonMapper().readValue(Files.readAllBytes(manifestFile), Manifest.class);
        int expected = Manifest.majorVersion(ModelResult.SCHEMA_VERSION);
        int actual;
        try {
            actual = manifest.majorVersion();
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Unreadable manifest in " + jobDirectory + ": " + e.getMessage(), e);
        }
        if (actual != expected) {
            throw new IllegalStateException(String.format(
                "Incompatible manifest schema_version '%s' in %s, expected major version %d",
                manifest.schemaVersion(), jobDirectory, expected));
        }
        return manifest;
    }

    private static Path resolve(Path jobDirectory, Manifest.FileEntry entry) {
        Path path = jobDirectory.resolve(entry.path()).normalize();
        if (!path.startsWith(jobDirectory.normalize())) {
            throw new IllegalStateException("Manifest entry escapes the job directory: " + entry.path());
        }
        return path;
    }

    private static Map<String, Object> readDocument(Path file, StorageFormat format) throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        return format == StorageFormat.YAML ? DocumentCodec.parseYaml(bytes) : DocumentCodec.parseJson(bytes);
    }
}
