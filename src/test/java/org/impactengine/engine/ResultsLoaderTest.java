package org.impactengine.engine;

import org.impactengine.api.models.ModelResult;
import org.impactengine.utils.DocumentCodec;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

@Tag("unit")
class ResultsLoaderTest {

    @TempDir
    Path jobDir;

    private void writeManifest(String schemaVersion, Map<String, Manifest.FileEntry> files) throws IOException {
        Manifest manifest = new Manifest(schemaVersion, "stub", "2024-01-01T00:00:00Z", files);
        Files.write(jobDir.resolve(Manifest.FILE_NAME), DocumentCodec.toJson(manifest));
    }

    private void writeResults() throws IOException {
        Map<String, Object> envelope = ModelResult.builder("stub").impactEstimate("effect", 1.25).build().toEnvelope();
        Files.write(jobDir.resolve("impact_results.json"), DocumentCodec.toJson(envelope));
    }

    @Test
    void load_readsListedDocuments() throws IOException {
        writeResults();
        Files.writeString(jobDir.resolve("config.yaml"), "MEASUREMENT:\n  MODEL: stub\n", StandardCharsets.UTF_8);
        writeManifest(ModelResult.SCHEMA_VERSION, Map.of(
            "impact_results", new Manifest.FileEntry("impact_results.json", "json"),
            "config", new Manifest.FileEntry("config.yaml", "yaml")));

        JobResult job = ResultsLoader.load(jobDir);

        assertEquals("stub", job.modelType());
        assertThat(job.impactEstimates()).containsEntry("effect", 1.25);
        assertThat(job.config()).containsEntry("MEASUREMENT", Map.of("MODEL", "stub"));
        assertThat(job.modelArtifacts()).isEmpty();
    }

    @Test
    void readManifest_toleratesUnknownFieldsAndMinorVersions() throws IOException {
        Files.writeString(jobDir.resolve(Manifest.FILE_NAME),
            "{\"schema_version\": \"2.7\", \"model_type\": \"stub\", \"created_at\": \"x\", \"files\": {}, \"extra\": 1}",
            StandardCharsets.UTF_8);

        Manifest manifest = ResultsLoader.readManifest(jobDir);

        assertEquals(2, manifest.majorVersion());
        assertThat(manifest.files()).isEmpty();
    }

    @Test
    void readManifest_incompatibleMajorVersion_isRefused() throws IOException {
        writeManifest("3.0", Map.of());

        assertThatThrownBy(() -> ResultsLoader.readManifest(jobDir))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Incompatible manifest schema_version '3.0'");
    }

    @Test
    void load_withoutManifest_isIncompleteJob() {
        assertThatThrownBy(() -> ResultsLoader.load(jobDir))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("did not complete");
    }

    @Test
    void load_withoutImpactResults_isRefused() throws IOException {
        writeManifest(ModelResult.SCHEMA_VERSION, Map.of());

        assertThatThrownBy(() -> ResultsLoader.load(jobDir))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("impact_results");
    }

    @Test
    void load_entryEscapingJobDirectory_isRefused() throws IOException {
        writeManifest(ModelResult.SCHEMA_VERSION, Map.of(
            "impact_results", new Manifest.FileEntry("../elsewhere/impact_results.json", "json")));

        assertThatThrownBy(() -> ResultsLoader.load(jobDir))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("escapes");
    }

    @Test
    void majorVersion_rejectsMalformedVersions() {
        assertEquals(2, Manifest.majorVersion("2"));
        assertThatThrownBy(() -> Manifest.majorVersion("v2")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Manifest.majorVersion(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
