package com.medcore.dto;

import com.medcore.knowledge.AllergyCrossReactivity;
import com.medcore.knowledge.DrugDiseaseInteraction;
import com.medcore.knowledge.DrugInteraction;
import com.medcore.knowledge.RenalDoseAdjustment;
import com.medcore.knowledge.RenalFunctionBand;
import lombok.*;

import java.util.List;

public class InteractionDTO {

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CheckResult {
        private List<DrugInteraction> drugDrugInteractions;
        private List<DrugDiseaseInteraction> drugDiseaseInteractions;
        private List<AllergyCrossReactivity> allergyAlerts;
        // advisory only, not counted in the summary
        private List<RenalDoseAdjustment> renalAdjustments;
        private Summary summary;
    }

    /**
     * Counts across drug-drug, drug-disease and allergy findings, in the shared four buckets.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Summary {
        private int contraindicated;
        private int major;
        private int moderate;
        private int minor;

        public int total() {
            return contraindicated + major + moderate + minor;
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RenalDoseLookup {
        private RenalDoseAdjustment adjustment;
        private RenalFunctionBand band;
        private String applicableDose;
        private Double patientEgfr;
        private boolean onDialysis;
    }
}
