package com.medcore.model;

/**
 * Canonical severity ranking shared by every severity vocabulary in the engine.
 *
 * Lower rank means more severe. CDSS alerts, drug interactions and allergy
 * cross-reactivity records each map their own levels onto these four buckets
 * and are only ever compared through them.
 */
public enum SeverityBucket {
    CONTRAINDICATED,
    MAJOR,
    MODERATE,
    MINOR;

    public int rank() {
        return ordinal();
    }
}
