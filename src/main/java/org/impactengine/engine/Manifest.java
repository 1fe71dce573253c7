package org.impactengine.engine;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.impactengine.api.storage.StorageFormat;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Run-completing index of every file a job produced. Written last; its presence marks the
 * job as complete.
 *
 * @param schemaVersion layout version, see {@link org.impactengine.api.models.ModelResult#SCHEMA_VERSION}
 * @param modelType     model that produced the results
 * @param createdAt     ISO-8601 UTC timestamp
 * @param files         logical name to file entry, in write order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Manifest(
    @JsonProperty("schema_version") String schemaVersion,
    @JsonProperty("model_type") String modelType,
    @JsonProperty("created_at") String createdAt,
    @JsonProperty("files") Map<String, FileEntry> files) {

    /** Name of the manifest file in the job directory. */
    public static final String FILE_NAME = "manifest.json";

    public Manifest {
        files = files == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(files));
    }

    /**
     * @param path   location relative to the job directory
     * @param format one of json, yaml, csv, parquet
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FileEntry(@JsonProperty("path") String path, @JsonProperty("format") String format) {

        public StorageFormat storageFormat() {
            return StorageFormat.fromName(format);
        }
    }

    /**
     * Major component of {@link #schemaVersion()}, e.g. {@code 2} for {@code "2.0"}.
     *
     * @throws IllegalArgumentException if the version is missing or malformed
     */
    public int majorVersion() {
        return majorVersion(schemaVersion);
    }

    static int majorVersion(String version) {
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("Manifest has no schema_version");
        }
        int dot = version.indexOf('.');
        try {
            return Integer.parseInt(dot < 0 ? version : version.substring(0, dot));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed schema_version '" + version + "'", e);
        }
    }
}
