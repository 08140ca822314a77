package com.medcore.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AlertSeverity implements RankedSeverity {
    INFO("info", SeverityBucket.MINOR),
    WARNING("warning", SeverityBucket.MODERATE),
    CRITICAL("critical", SeverityBucket.MAJOR),
    CONTRAINDICATED("contraindicated", SeverityBucket.CONTRAINDICATED);

    private final String code;
    private final SeverityBucket bucket;

    AlertSeverity(String code, SeverityBucket bucket) {
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
    public static AlertSeverity fromCode(String code) {
        for (AlertSeverity severity : values()) {
            if (severity.code.equalsIgnoreCase(code)) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown alert severity: " + code);
    }
}
