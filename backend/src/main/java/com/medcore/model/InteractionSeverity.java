package com.medcore.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Severity vocabulary of the drug-drug and drug-disease interaction tables.
 */
public enum InteractionSeverity implements RankedSeverity {
    MINOR("minor", SeverityBucket.MINOR),
    MODERATE("moderate", SeverityBucket.MODERATE),
    MAJOR("major", SeverityBucket.MAJOR),
    CONTRAINDICATED("contraindicated", SeverityBucket.CONTRAINDICATED);

    private final String code;
    private final SeverityBucket bucket;

    InteractionSeverity(String code, SeverityBucket bucket) {
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
    public static InteractionSeverity fromCode(String code) {
        for (InteractionSeverity severity : values()) {
            if (severity.code.equalsIgnoreCase(code)) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown interaction severity: " + code);
    }
}
