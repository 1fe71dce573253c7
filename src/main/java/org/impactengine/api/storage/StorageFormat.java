package org.impactengine.api.storage;

import java.util.Locale;

/**
 * File formats the storage manager can write and read.
 */
public enum StorageFormat {
    JSON("json"),
    YAML("yaml"),
    CSV("csv"),
    PARQUET("parquet");

    private final String extension;

    StorageFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    public boolean isTabular() {
        return this == CSV || this == PARQUET;
    }

    /**
     * Name used in manifests: {@code json}, {@code yaml}, {@code csv} or {@code parquet}.
     */
    public String manifestName() {
        return extension;
    }

    /**
     * Parses a format name case-insensitively; {@code yml} is accepted for YAML.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static StorageFormat fromName(String name) {
        String normalized = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        if ("yml".equals(normalized)) {
            return YAML;
        }
        for (StorageFormat format : values()) {
            if (format.extension.equals(normalized)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown storage format '" + name + "'. Supported: json, yaml, csv, parquet");
    }

    /**
     * Derives the format from a file name's extension.
     *
     * @throws IllegalArgumentException if the extension is missing or unknown
     */
    public static StorageFormat fromFileName(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            throw new IllegalArgumentException("Cannot derive storage format from file name: " + fileName);
        }
        return fromName(fileName.substring(dot + 1));
    }
}
