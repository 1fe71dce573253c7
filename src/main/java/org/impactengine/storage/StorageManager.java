package org.impactengine.storage;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.impactengine.api.data.PanelFrame;
import org.impactengine.api.exceptions.ConnectionFailureException;
import org.impactengine.api.storage.IStorageAdapter;
import org.impactengine.api.storage.StorageFormat;
import org.impactengine.utils.DocumentCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Typed access to one job's storage.
 * <p>
 * Owns one {@link IStorageAdapter} and its connect lifecycle, and layers JSON, YAML, CSV and
 * Parquet encoding on top of the adapter's byte-level operations. Tabular artifacts are
 * written in the manager's configured tabular format.
 */
public class StorageManager {

    private static final Logger log = LoggerFactory.getLogger(StorageManager.class);

    private final IStorageAdapter adapter;
    private final String jobId;
    private final StorageFormat tabularFormat;
    private final Path tempDirectory;

    /**
     * Connects the adapter to the job root.
     *
     * @param adapter       an unconnected storage adapter
     * @param storageUrl    root location of all jobs
     * @param jobId         run-scoped job identifier
     * @param tabularFormat format for tabular artifacts
     * @param tempDirectory scratch directory for tabular encoding
     * @throws ConnectionFailureException if the adapter cannot open the job root
     */
    public StorageManager(IStorageAdapter adapter, String storageUrl, String jobId,
                          StorageFormat tabularFormat, Path tempDirectory) {
        if (!tabularFormat.isTabular()) {
            throw new IllegalArgumentException("Tabular format must be csv or parquet, got " + tabularFormat);
        }
        this.adapter = adapter;
        this.jobId = jobId;
        this.tabularFormat = tabularFormat;
        this.tempDirectory = tempDirectory;

        Config connection = ConfigFactory.parseMap(Map.of("storage_url", storageUrl, "job_id", jobId));
        boolean connected;
        try {
            connected = adapter.connect(connection);
        } catch (IllegalArgumentException e) {
            throw new ConnectionFailureException("Storage adapter rejected its configuration: " + e.getMessage(), e);
        }
        if (!connected) {
            throw new ConnectionFailureException("Failed to connect storage for job '" + jobId + "' at " + storageUrl);
        }
        log.debug("Storage ready for job '{}' at {}", jobId, adapter.rootPath());
    }

    /**
     * Generates a job identifier of the form {@code <prefix>-<12 hex chars>}.
     */
    public static String newJobId(String prefix) {
        return prefix + "-" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }

    public String getJobId() {
        return jobId;
    }

    public String getRootPath() {
        return adapter.rootPath();
    }

    public StorageFormat getTabularFormat() {
        return tabularFormat;
    }

    /**
     * Appends the tabular format's extension to a base name.
     */
    public String tabularFileName(String baseName) {
        return baseName + "." + tabularFormat.extension();
    }

    public StoredFile writeJson(String key, Object value) throws IOException {
        adapter.write(key, DocumentCodec.toJson(value));
        return stored(key, StorageFormat.JSON);
    }

    public StoredFile writeYaml(String key, Map<String, ?> value) throws IOException {
        adapter.write(key, DocumentCodec.toYaml(value));
        return stored(key, StorageFormat.YAML);
    }

    public StoredFile writeYaml(String key, byte[] renderedYaml) throws IOException {
        adapter.write(key, renderedYaml);
        return stored(key, StorageFormat.YAML);
    }

    /**
     * Writes a frame as {@code <baseName>.<ext>} in the configured tabular format.
     */
    public StoredFile writeTable(String baseName, PanelFrame frame) throws IOException {
        String key = tabularFileName(baseName);
        adapter.write(key, TabularCodec.encode(frame, tabularFormat, tempDirectory));
        return stored(key, tabularFormat);
    }

    public Map<String, Object> readJson(String key) throws IOException {
        return DocumentCodec.parseJson(adapter.read(key));
    }

    public Map<String, Object> readYaml(String key) throws IOException {
        return DocumentCodec.parseYaml(adapter.read(key));
    }

    /**
     * Reads a table; the format follows the key's extension.
     */
    public PanelFrame readTable(String key) throws IOException {
        return TabularCodec.decode(adapter.read(key), StorageFormat.fromFileName(key), tempDirectory);
    }

    public boolean exists(String key) throws IOException {
        return adapter.exists(key);
    }

    public List<String> list() throws IOException {
        return adapter.list();
    }

    public String fullPath(String key) {
        return adapter.fullPath(key);
    }

    private StoredFile stored(String key, StorageFormat format) {
        return new StoredFile(key, adapter.fullPath(key), format);
    }
}
