package com.medcore.service;

import com.medcore.dto.InteractionDTO;
import com.medcore.knowledge.*;
import com.medcore.model.RankedSeverity;
import com.medcore.model.SeverityBucket;
import com.medcore.terminology.TerminologyMatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Medication safety checks against the interaction knowledge base: drug-drug,
 * drug-disease, allergy cross-reactivity and renal dose adjustment.
 *
 * Inputs are free-text tokens; they are trimmed and lower-cased before matching.
 * Null lists count as empty and null or blank tokens are skipped.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DrugInteractionService {

    private final KnowledgeSnapshotHolder<InteractionKnowledgeBase> knowledgeBase;
    private final TerminologyMatcher matcher;

    public InteractionDTO.CheckResult checkInteractions(List<String> medications, List<String> conditions,
                                                        List<String> allergies) {
        return checkInteractions(medications, conditions, allergies, null, null);
    }

    public InteractionDTO.CheckResult checkInteractions(List<String> medications, List<String> conditions,
                                                        List<String> allergies, Double egfr, Boolean onDialysis) {
        InteractionKnowledgeBase kb = knowledgeBase.current();
        List<String> meds = normalize(medications);
        List<String> conds = normalize(conditions);
        List<String> allergens = normalize(allergies);

        List<DrugInteraction> drugDrug = findDrugDrugInteractions(kb, meds);
        List<DrugDiseaseInteraction> drugDisease = findDrugDiseaseInteractions(kb, meds, conds);
        List<AllergyCrossReactivity> allergyAlerts = findAllergyAlerts(kb, meds, allergens);
        List<RenalDoseAdjustment> renal = findRenalAdjustments(kb, meds, egfr, onDialysis);

        InteractionDTO.Summary summary = summarize(drugDrug, drugDisease, allergyAlerts);

        log.debug("Interaction check: {} medications, {} drug-drug, {} drug-disease, {} allergy, {} renal",
            meds.size(), drugDrug.size(), drugDisease.size(), allergyAlerts.size(), renal.size());

        return InteractionDTO.CheckResult.builder()
            .drugDrugInteractions(drugDrug)
            .drugDiseaseInteractions(drugDisease)
            .allergyAlerts(allergyAlerts)
            .renalAdjustments(renal)
            .summary(summary)
            .build();
    }

    /**
     * Dose guidance for a single drug at the patient's renal function.
     */
    public Optional<InteractionDTO.RenalDoseLookup> lookupRenalDose(String drugName, Double egfr, Boolean onDialysis) {
        String drug = normalizeToken(drugName);
        if (drug.isEmpty()) {
            return Optional.empty();
        }
        RenalFunctionBand band = RenalFunctionBand.of(egfr, onDialysis);
        return knowledgeBase.current().getRenalDoseAdjustments().stream()
            .filter(adjustment -> matcher.matchesDrug(drug, adjustment.getDrug()))
            .findFirst()
            .map(adjustment -> InteractionDTO.RenalDoseLookup.builder()
                .adjustment(adjustment)
                .band(band)
                .applicableDose(adjustment.doseFor(band))
                .patientEgfr(egfr)
                .onDialysis(Boolean.TRUE.equals(onDialysis))
                .build());
    }

    public Map<String, List<String>> getDrugClasses() {
        return matcher.getIndex().getDrugClasses();
    }

    /**
     * Atomically replaces the interaction tables. Checks already running finish on the old ones.
     */
    public void replaceKnowledgeBase(InteractionKnowledgeBase replacement) {
        InteractionKnowledgeBase previous = knowledgeBase.publish(replacement);
        log.info("Interaction knowledge base replaced: {} -> {}", previous.getVersion(), replacement.getVersion());
    }

    private List<DrugInteraction> findDrugDrugInteractions(InteractionKnowledgeBase kb, List<String> meds) {
        List<DrugInteraction> found = new ArrayList<>();
        for (int i = 0; i < meds.size(); i++) {
            for (int j = i + 1; j < meds.size(); j++) {
                String first = meds.get(i);
                String second = meds.get(j);
                for (DrugInteraction interaction : kb.getDrugInteractions()) {
                    boolean forward = matcher.matchesDrug(first, interaction.getDrugA())
                        && matcher.matchesDrug(second, interaction.getDrugB());
                    boolean reverse = matcher.matchesDrug(first, interaction.getDrugB())
                        && matcher.matchesDrug(second, interaction.getDrugA());
                    if (forward || reverse) {
                        found.add(interaction);
                    }
                }
            }
        }
        found.sort(RankedSeverity.mostSevereFirst(DrugInteraction::getSeverity));
        return found;
    }

    private List<DrugDiseaseInteraction> findDrugDiseaseInteractions(InteractionKnowledgeBase kb,
                                                                     List<String> meds, List<String> conds) {
        List<DrugDiseaseInteraction> found = new ArrayList<>();
        for (String med : meds) {
            for (String condition : conds) {
                for (DrugDiseaseInteraction interaction : kb.getDrugDiseaseInteractions()) {
                    if (matcher.matchesDrug(med, interaction.getDrug())
                        && matcher.matchesCondition(condition, interaction.getCondition())) {
                        found.add(interaction);
                    }
                }
            }
        }
        found.sort(RankedSeverity.mostSevereFirst(DrugDiseaseInteraction::getSeverity));
        return found;
    }

    private List<AllergyCrossReactivity> findAllergyAlerts(InteractionKnowledgeBase kb,
                                                           List<String> meds, List<String> allergens) {
        List<AllergyCrossReactivity> found = new ArrayList<>();
        for (String med : meds) {
            for (String allergy : allergens) {
                for (AllergyCrossReactivity check : kb.getAllergyCrossReactivities()) {
                    if (matcher.matchesDrug(med, check.getDrug())
                        && matcher.matchesAllergen(allergy, check.getAllergen())) {
                        found.add(check);
                    }
                }
            }
        }
        found.sort(RankedSeverity.mostSevereFirst(AllergyCrossReactivity::getSeverity));
        return found;
    }

    private List<RenalDoseAdjustment> findRenalAdjustments(InteractionKnowledgeBase kb, List<String> meds,
                                                           Double egfr, Boolean onDialysis) {
        if (egfr == null && !Boolean.TRUE.equals(onDialysis)) {
            return List.of();
        }
        List<RenalDoseAdjustment> found = new ArrayList<>();
        for (String med : meds) {
            for (RenalDoseAdjustment adjustment : kb.getRenalDoseAdjustments()) {
                if (matcher.matchesDrug(med, adjustment.getDrug())) {
                    found.add(adjustment);
                }
            }
        }
        return found;
    }

    private static InteractionDTO.Summary summarize(List<DrugInteraction> drugDrug,
                                                    List<DrugDiseaseInteraction> drugDisease,
                                                    List<AllergyCrossReactivity> allergyAlerts) {
        Map<SeverityBucket, Integer> counts = new EnumMap<>(SeverityBucket.class);
        drugDrug.forEach(i -> count(counts, i.getSeverity()));
        drugDisease.forEach(i -> count(counts, i.getSeverity()));
        allergyAlerts.forEach(a -> count(counts, a.getSeverity()));

        return InteractionDTO.Summary.builder()
            .contraindicated(counts.getOrDefault(SeverityBucket.CONTRAINDICATED, 0))
            .major(counts.getOrDefault(SeverityBucket.MAJOR, 0))
            .moderate(counts.getOrDefault(SeverityBucket.MODERATE, 0))
            .minor(counts.getOrDefault(SeverityBucket.MINOR, 0))
            .build();
    }

    private static void count(Map<SeverityBucket, Integer> counts, RankedSeverity severity) {
        if (severity != null) {
            counts.merge(severity.bucket(), 1, Integer::sum);
        }
    }

    private static List<String> normalize(List<String> tokens) {
        if (tokens == null) {
            return List.of();
        }
        return tokens.stream()
            .map(DrugInteractionService::normalizeToken)
            .filter(t -> !t.isEmpty())
            .toList();
    }

    private static String normalizeToken(String token) {
        return token == null ? "" : token.trim().toLowerCase(Locale.ROOT);
    }
}
