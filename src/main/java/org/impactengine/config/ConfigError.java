package org.impactengine.config;

/**
 * One configuration violation, tagged with the dotted path of the offending field
 * (e.g. {@code MEASUREMENT.PARAMS.n_strata}).
 */
public record ConfigError(String path, String message) {

    @Override
    public String toString() {
        return path.isEmpty() ? message : path + ": " + message;
    }
}
