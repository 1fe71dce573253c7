package org.impactengine.api.storage;

import com.typesafe.config.Config;

import java.io.IOException;
import java.util.List;

/**
 * Capability contract of a run-scoped, path-addressable blob store.
 * <p>
 * After {@link #connect(Config)} every key is relative to the job root, so one run never
 * sees another run's files. Keys use {@code /} separators and must not escape the root.
 * <p>
 * Typed (json/yaml/csv/parquet) reading and writing is layered on top by the storage
 * manager; backends only move bytes.
 */
public interface IStorageAdapter {

    /**
     * Opens the job root.
     * <p>
     * Recognized keys: {@code storage_url} (required) and {@code job_id} (required).
     *
     * @return true if the job root is usable
     * @throws IllegalArgumentException if the configuration is malformed
     */
    boolean connect(Config config);

    /**
     * Writes a blob. Readers never observe a partially written blob.
     */
    void write(String key, byte[] data) throws IOException;

    /**
     * @throws IOException if the blob does not exist or cannot be read
     */
    byte[] read(String key) throws IOException;

    boolean exists(String key) throws IOException;

    /**
     * Lists the keys directly and transitively under the job root, sorted.
     */
    List<String> list() throws IOException;

    /**
     * Returns the backend-specific location of a key, e.g. an absolute file path.
     */
    String fullPath(String key);

    /**
     * Returns the backend-specific location of the job root.
     */
    String rootPath();

    default boolean validateConnection() {
        return true;
    }
}
