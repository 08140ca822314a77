package com.medcore.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AlertCategory {
    MEDICATION("medication"),
    LAB("lab"),
    VITALS("vitals"),
    GUIDELINE("guideline"),
    PROTOCOL("protocol"),
    REMINDER("reminder");

    private final String code;

    AlertCategory(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
