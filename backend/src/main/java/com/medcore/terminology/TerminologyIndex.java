package com.medcore.terminology;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only lookup of drug classes, condition synonyms and allergen synonyms.
 *
 * Built once at startup from {@code terminology.json}. Keys and members are
 * normalized to trimmed lower case, and declaration order is preserved.
 */
public final class TerminologyIndex {

    private final Map<String, List<String>> drugClasses;
    private final Map<String, List<String>> conditionSynonyms;
    private final Map<String, List<String>> allergenSynonyms;

    @JsonCreator
    public TerminologyIndex(
            @JsonProperty("drugClasses") Map<String, List<String>> drugClasses,
            @JsonProperty("conditionSynonyms") Map<String, List<String>> conditionSynonyms,
            @JsonProperty("allergenSynonyms") Map<String, List<String>> allergenSynonyms) {
        this.drugClasses = normalize(drugClasses);
        this.conditionSynonyms = normalize(conditionSynonyms);
        this.allergenSynonyms = normalize(allergenSynonyms);
    }

    public static TerminologyIndex empty() {
        return new TerminologyIndex(Map.of(), Map.of(), Map.of());
    }

    public List<String> drugClassMembers(String classKey) {
        return lookup(drugClasses, classKey);
    }

    public List<String> conditionSynonyms(String conditionKey) {
        return lookup(conditionSynonyms, conditionKey);
    }

    public List<String> allergenSynonyms(String allergenKey) {
        return lookup(allergenSynonyms, allergenKey);
    }

    public Map<String, List<String>> getDrugClasses() {
        return drugClasses;
    }

    public Map<String, List<String>> getConditionSynonyms() {
        return conditionSynonyms;
    }

    public Map<String, List<String>> getAllergenSynonyms() {
        return allergenSynonyms;
    }

    private static List<String> lookup(Map<String, List<String>> table, String key) {
        if (key == null) {
            return List.of();
        }
        return table.getOrDefault(key.trim().toLowerCase(Locale.ROOT), List.of());
    }

    private static Map<String, List<String>> normalize(Map<String, List<String>> raw) {
        if (raw == null) {
            return Map.of();
        }
        Map<String, List<String>> normalized = new LinkedHashMap<>();
        raw.forEach((key, members) -> {
            if (key == null || key.isBlank()) {
                return;
            }
            List<String> cleaned = members == null ? List.of() : members.stream()
                .filter(Objects::nonNull)
                .map(m -> m.trim().toLowerCase(Locale.ROOT))
                .filter(m -> !m.isEmpty())
                .toList();
            normalized.put(key.trim().toLowerCase(Locale.ROOT), cleaned);
        });
        return Collections.unmodifiableMap(normalized);
    }
}
