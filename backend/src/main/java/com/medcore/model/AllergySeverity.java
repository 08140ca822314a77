package com.medcore.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Severity vocabulary of the allergy cross-reactivity table.
 */
public enum AllergySeverity implements RankedSeverity {
    MILD("mild", SeverityBucket.MINOR),
    MODERATE("moderate", SeverityBucket.MODERATE),
    SEVERE("severe", SeverityBucket.MAJOR),
    LIFE_THREATENING("life_threatening", SeverityBucket.CONTRAINDICATED);

    private final String code;
    private final SeverityBucket bucket;

    AllergySeverity(String code, SeverityBucket bucket) {
        this.code = code;
        this.bucket = bucket;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @Override
    public SeverityBucket bucket() {
        return bucket;
    }

    @JsonCreator
    public static AllergySeverity fromCode(String code) {
        for (AllergySeverity severity : values()) {
            if (severity.code.equalsIgnoreCase(code)) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown allergy severity: " + code);
    }
}
