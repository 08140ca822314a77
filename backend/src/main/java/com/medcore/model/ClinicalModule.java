package com.medcore.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Clinical module a guideline rule belongs to. {@link #GENERAL} rules apply to every module.
 */
public enum ClinicalModule {
    DIALYSE("dialyse"),
    CARDIOLOGY("cardiology"),
    OPHTHALMOLOGY("ophthalmology"),
    GENERAL("general");

    private final String code;

    ClinicalModule(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static ClinicalModule fromCode(String code) {
        for (ClinicalModule module : values()) {
            if (module.code.equalsIgnoreCase(code)) {
                return module;
            }
        }
        throw new IllegalArgumentException(
            "Invalid module. Must be: dialyse, cardiology, ophthalmology, or general");
    }
}
