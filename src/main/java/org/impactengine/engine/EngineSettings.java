package org.impactengine.engine;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.impactengine.api.storage.StorageFormat;
import org.impactengine.utils.PathExpansion;

import java.nio.file.Path;

/**
 * Process settings read from the {@code impact-engine} block of the application configuration.
 *
 * @param storageUrl     root under which every job gets its own directory
 * @param storageType    storage backend key
 * @param jobPrefix      prefix of generated job identifiers
 * @param tabularFormat  format of tabular artifacts
 * @param tempDirectory  scratch directory for tabular encoding
 */
public record EngineSettings(String storageUrl, String storageType, String jobPrefix,
                             StorageFormat tabularFormat, Path tempDirectory) {

    static final String ROOT = "impact-engine";

    public EngineSettings {
        if (!tabularFormat.isTabular()) {
            throw new IllegalArgumentException("tabular-format must be csv or parquet, got " + tabularFormat.manifestName());
        }
    }

    /**
     * Reads the settings, falling back to the bundled {@code reference.conf} for missing keys.
     *
     * @throws IllegalArgumentException if a value is malformed
     */
    public static EngineSettings from(Config appConfig) {
        Config config = appConfig.withFallback(ConfigFactory.defaultReference()).getConfig(ROOT);
        return new EngineSettings(
            PathExpansion.expandPath(config.getString("storage.url")),
            config.getString("storage.type"),
            config.getString("storage.job-prefix"),
            StorageFormat.fromName(config.getString("storage.tabular-format")),
            Path.of(PathExpansion.expandPath(config.getString("temp-directory"))));
    }

    public EngineSettings withStorageUrl(String url) {
        return new EngineSettings(url, storageType, jobPrefix, tabularFormat, tempDirectory);
    }
}
