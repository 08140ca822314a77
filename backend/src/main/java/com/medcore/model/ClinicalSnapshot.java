package com.medcore.model;

import lombok.*;

import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Point-in-time clinical picture of one patient, assembled by the caller from
 * persisted records and handed to the CDSS engine.
 *
 * Every section and every value inside a section is optional. Rules read values
 * through the accessor helpers below, which return {@link Optional#empty()} when
 * either the section or the value is missing.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClinicalSnapshot {

    private String patientId;
    private Demographics demographics;
    private Vitals vitals;
    private Labs labs;
    private List<String> conditions;
    private List<Medication> medications;
    private List<String> allergies;
    private DialysisProfile dialysis;
    private CardiologyProfile cardiology;
    private OphthalmologyProfile ophthalmology;

    public <V> Optional<V> demographic(Function<Demographics, V> field) {
        return read(demographics, field);
    }

    public <V> Optional<V> vital(Function<Vitals, V> field) {
        return read(vitals, field);
    }

    public <V> Optional<V> lab(Function<Labs, V> field) {
        return read(labs, field);
    }

    public <V> Optional<V> dialysisValue(Function<DialysisProfile, V> field) {
        return read(dialysis, field);
    }

    public <V> Optional<V> cardiac(Function<CardiologyProfile, V> field) {
        return read(cardiology, field);
    }

    public <V> Optional<V> ocular(Function<OphthalmologyProfile, V> field) {
        return read(ophthalmology, field);
    }

    /**
     * True only when the dialysis profile is present and explicitly flags the patient.
     */
    public boolean isOnDialysis() {
        return Boolean.TRUE.equals(dialysisValue(DialysisProfile::getOnDialysis).orElse(null));
    }

    /**
     * Case-insensitive exact match against the condition tags.
     */
    public boolean hasCondition(String tag) {
        if (conditions == null || tag == null) {
            return false;
        }
        String wanted = tag.trim().toLowerCase(Locale.ROOT);
        return conditions.stream()
            .filter(Objects::nonNull)
            .anyMatch(c -> c.trim().toLowerCase(Locale.ROOT).equals(wanted));
    }

    private static <S, V> Optional<V> read(S section, Function<S, V> field) {
        return section == null ? Optional.empty() : Optional.ofNullable(field.apply(section));
    }

    public enum Sex {
        MALE,
        FEMALE
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Demographics {
        private Integer age;
        private Sex sex;
        private Double weight; // kg
        private Double height; // cm
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Vitals {
        private Double systolicBP;
        private Double diastolicBP;
        private Double heartRate;
        private Double temperature;
        private Double oxygenSaturation;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Labs {
        private Double creatinine;
        private Double egfr;
        private Double potassium;
        private Double hemoglobin;
        private Double hba1c;
        private Double cholesterolTotal;
        private Double ldl;
        private Double hdl;
        private Double triglycerides;
        private Double calcium;
        private Double phosphorus;
        private Double pth;
        private Double albumin;
        private Double inr;
        private Double bnp;
        private Double troponin;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Medication {
        private String name;
        private String dose;
        private String frequency;
        private String atcCode;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DialysisProfile {
        private Boolean onDialysis;
        private Double ktv;
        private String accessType; // AVF, AVG, CVC
        private LocalDate lastSessionDate;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CardiologyProfile {
        private Double lvef;
        private Boolean atrialFibrillation;
        private Boolean heartFailure;
        private Boolean coronaryArteryDisease;
        private Boolean pacemaker;
        private Boolean stent;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class OphthalmologyProfile {
        private Double iopLeft;
        private Double iopRight;
        private Boolean diabeticMacularEdema;
        private Boolean macularDegeneration;
        private Boolean glaucoma;
    }
}
