package org.impactengine.api.registry;

import org.impactengine.api.exceptions.ImpactEngineException;

import java.util.List;

/**
 * Thrown when a registry lookup misses. The message lists every known key.
 */
public class UnknownKeyException extends ImpactEngineException {

    private final String key;
    private final List<String> knownKeys;

    public UnknownKeyException(String registryName, String key, List<String> knownKeys) {
        super(String.format("Unknown %s '%s'. Available: %s", registryName, key, knownKeys));
        this.key = key;
        this.knownKeys = List.copyOf(knownKeys);
    }

    public String getKey() {
        return key;
    }

    public List<String> getKnownKeys() {
        return knownKeys;
    }
}
