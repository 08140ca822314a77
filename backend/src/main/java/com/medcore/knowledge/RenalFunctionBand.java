package com.medcore.knowledge;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * eGFR band used to pick a renal dose recommendation.
 */
public enum RenalFunctionBand {
    NORMAL("normal"),
    EGFR_30_59("egfr_30_59"),
    EGFR_15_29("egfr_15_29"),
    EGFR_BELOW_15("egfr_below_15"),
    DIALYSIS("dialysis");

    private final String code;

    RenalFunctionBand(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Dialysis wins over any eGFR value; a missing eGFR means normal dosing.
     */
    public static RenalFunctionBand of(Double egfr, Boolean onDialysis) {
        if (Boolean.TRUE.equals(onDialysis)) {
            return DIALYSIS;
        }
        if (egfr == null) {
            return NORMAL;
        }
        if (egfr < 15) {
            return EGFR_BELOW_15;
        }
        if (egfr < 30) {
            return EGFR_15_29;
        }
        if (egfr < 60) {
            return EGFR_30_59;
        }
        return NORMAL;
    }
}
