package org.impactengine.storage;

import org.impactengine.api.storage.StorageFormat;

/**
 * An artifact written by the storage manager.
 *
 * @param key    location relative to the job root, as recorded in the manifest
 * @param path   backend-specific full location
 * @param format file format
 */
public record StoredFile(String key, String path, StorageFormat format) {
}
