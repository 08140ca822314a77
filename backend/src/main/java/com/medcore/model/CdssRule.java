package com.medcore.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.function.Function;
import java.util.function.Predicate;

/**
 * One guideline-derived rule: identity, a condition over the snapshot and an
 * alert generator.
 *
 * Conditions must treat absent data as "does not apply". The generator is only
 * called after the condition returned true for the same snapshot.
 */
@Value
@Builder(toBuilder = true)
public class CdssRule {

    @NonNull
    String id;
    String name;
    String description;
    AlertCategory category;
    @NonNull
    ClinicalModule module;
    GuidelineSource guidelineSource;
    // Reserved for tie-breaking; ordering is driven by severity only.
    int priority;
    @Builder.Default
    boolean active = true;
    @NonNull
    Predicate<ClinicalSnapshot> condition;
    @NonNull
    Function<ClinicalSnapshot, AlertDraft> alertGenerator;

    public boolean appliesTo(ClinicalSnapshot snapshot) {
        return condition.test(snapshot);
    }

    public AlertDraft generateAlert(ClinicalSnapshot snapshot) {
        return alertGenerator.apply(snapshot);
    }

    public boolean belongsTo(ClinicalModule filter) {
        return filter == null || module == filter || module == ClinicalModule.GENERAL;
    }
}
