package com.medcore.knowledge;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.medcore.terminology.TerminologyIndex;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.function.Predicate;

/**
 * Reads the versioned knowledge-base artifacts (JSON) from a resource folder.
 *
 * Expected files under the folder:
 * - drug-drug-interactions.json
 * - drug-disease-interactions.json
 * - allergy-cross-reactivity.json
 * - renal-dose-adjustments.json
 * - terminology.json
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class KnowledgeBaseLoader {

    static final String DRUG_DRUG_FILE = "drug-drug-interactions.json";
    static final String DRUG_DISEASE_FILE = "drug-disease-interactions.json";
    static final String ALLERGY_FILE = "allergy-cross-reactivity.json";
    static final String RENAL_FILE = "renal-dose-adjustments.json";
    static final String TERMINOLOGY_FILE = "terminology.json";

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;

    public InteractionKnowledgeBase loadInteractions(String location) {
        List<DrugInteraction> drugDrug = read(location, DRUG_DRUG_FILE, new TypeReference<List<DrugInteraction>>() {});
        List<DrugDiseaseInteraction> drugDisease = read(location, DRUG_DISEASE_FILE, new TypeReference<List<DrugDiseaseInteraction>>() {});
        List<AllergyCrossReactivity> allergy = read(location, ALLERGY_FILE, new TypeReference<List<AllergyCrossReactivity>>() {});
        List<RenalDoseAdjustment> renal = read(location, RENAL_FILE, new TypeReference<List<RenalDoseAdjustment>>() {});

        requireComplete(location, DRUG_DRUG_FILE, drugDrug, "drugA, drugB and severity",
            r -> StringUtils.hasText(r.getDrugA()) && StringUtils.hasText(r.getDrugB()) && r.getSeverity() != null);
        requireComplete(location, DRUG_DISEASE_FILE, drugDisease, "drug, condition and severity",
            r -> StringUtils.hasText(r.getDrug()) && StringUtils.hasText(r.getCondition()) && r.getSeverity() != null);
        requireComplete(location, ALLERGY_FILE, allergy, "drug, allergen and severity",
            r -> StringUtils.hasText(r.getDrug()) && StringUtils.hasText(r.getAllergen()) && r.getSeverity() != null);
        requireComplete(location, RENAL_FILE, renal, "drug",
            r -> StringUtils.hasText(r.getDrug()));

        log.info("Loaded interaction knowledge base from {}: {} drug-drug, {} drug-disease, {} allergy, {} renal records",
            location, drugDrug.size(), drugDisease.size(), allergy.size(), renal.size());

        return InteractionKnowledgeBase.builder()
            .version(location)
            .drugInteractions(drugDrug)
            .drugDiseaseInteractions(drugDisease)
            .allergyCrossReactivities(allergy)
            .renalDoseAdjustments(renal)
            .build();
    }

    public TerminologyIndex loadTerminology(String location) {
        TerminologyIndex index = read(location, TERMINOLOGY_FILE, new TypeReference<TerminologyIndex>() {});
        log.info("Loaded terminology index from {}: {} drug classes, {} condition synonym sets, {} allergen synonym sets",
            location, index.getDrugClasses().size(), index.getConditionSynonyms().size(),
            index.getAllergenSynonyms().size());
        return index;
    }

    /**
     * Rejects the whole artifact when any record lacks a field the matchers and
     * the severity ordering depend on.
     */
    private static <T> void requireComplete(String location, String fileName, List<T> records,
                                            String requiredFields, Predicate<T> complete) {
        for (int i = 0; i < records.size(); i++) {
            T record = records.get(i);
            if (record == null || !complete.test(record)) {
                log.error("Incomplete record #{} in {} at {}: {} are required", i, fileName, location, requiredFields);
                throw new KnowledgeBaseException(
                    "Incomplete record #" + i + " in " + fileName + " (" + requiredFields + " are required)", null);
            }
        }
    }

    private <T> T read(String location, String fileName, TypeReference<T> type) {
        String path = location.endsWith("/") ? location + fileName : location + "/" + fileName;
        Resource resource = resourceLoader.getResource(path);
        if (!resource.exists()) {
            throw new KnowledgeBaseException("Knowledge base artifact not found: " + path, null);
        }
        try (InputStream in = resource.getInputStream()) {
            T value = objectMapper.readValue(in, type);
            if (value == null) {
                throw new KnowledgeBaseException("Knowledge base artifact is empty: " + path, null);
            }
            return value;
        } catch (IOException e) {
            log.error("Failed to read knowledge base artifact {}: {}", path, e.getMessage());
            throw new KnowledgeBaseException("Failed to read knowledge base artifact: " + path, e);
        }
    }
}
