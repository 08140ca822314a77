package com.medcore.dto;

import com.fasterxml.jackson.annotation.JsonValue;
import com.medcore.model.ClinicalSnapshot;
import lombok.*;

import java.util.List;

public class CalculatorDTO {

    public enum QtcFormula {
        BAZETT("bazett"),
        FRIDERICIA("fridericia"),
        FRAMINGHAM("framingham");

        private final String code;

        QtcFormula(String code) {
            this.code = code;
        }

        @JsonValue
        public String getCode() {
            return code;
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CkdStage {
        private double egfr;
        private String stage;
        private String description;
        private List<String> recommendations;
        private String kdigoClassification;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CreatinineClearance {
        private double creatinineClearance;
        private String unit;
        private String category;
        private String formula;
        private int age;
        private double weight;
        private ClinicalSnapshot.Sex sex;
        private double creatinine;
        private String note;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BodyMassIndex {
        private double bmi;
        private String category;
        private List<String> recommendations;
        private long idealWeightMin;
        private long idealWeightMax;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CorrectedQt {
        private long qtc;
        private String unit;
        private QtcFormula formula;
        private String interpretation;
        private String riskLevel;
        private List<String> recommendations;
    }
}
