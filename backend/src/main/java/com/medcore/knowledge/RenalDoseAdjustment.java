package com.medcore.knowledge;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Dose guidance for one drug, bucketed by renal function.
 */
@Value
@Builder
@Jacksonized
public class RenalDoseAdjustment {
    String drug;
    String normalDose;
    String egfr30to59;
    String egfr15to29;
    String egfrBelow15;
    String dialysis;
    String notes;

    public String doseFor(RenalFunctionBand band) {
        return switch (band) {
            case NORMAL -> normalDose;
            case EGFR_30_59 -> egfr30to59;
            case EGFR_15_29 -> egfr15to29;
            case EGFR_BELOW_15 -> egfrBelow15;
            case DIALYSIS -> dialysis;
        };
    }
}
