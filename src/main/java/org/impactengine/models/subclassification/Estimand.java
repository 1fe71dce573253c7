package org.impactengine.models.subclassification;

import java.util.Locale;

/**
 * Target population of a treatment effect estimate.
 */
public enum Estimand {
    /** Average treatment effect on the treated: strata weighted by treated count. */
    ATT,
    /** Average treatment effect: strata weighted by total count. */
    ATE;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @throws IllegalArgumentException unless the name is {@code att} or {@code ate}
     */
    public static Estimand fromKey(String key) {
        if ("att".equals(key)) {
            return ATT;
        }
        if ("ate".equals(key)) {
            return ATE;
        }
        throw new IllegalArgumentException("estimand must be 'att' or 'ate', got '" + key + "'");
    }
}
