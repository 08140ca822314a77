package com.medcore.terminology;

import java.util.List;
import java.util.Locale;

/**
 * Resolves free-text drug, condition and allergen tokens against table patterns.
 *
 * All three matchers apply the same strategies in order, case-insensitively:
 * <ol>
 *   <li>exact equality</li>
 *   <li>containment in either direction</li>
 *   <li>the pattern is a class key in the {@link TerminologyIndex} and the input
 *       contains one of the class members</li>
 * </ol>
 * Any strategy succeeding is a match: a missed interaction costs more than a
 * spurious one. Null or blank tokens never match, and no method throws.
 */
public class TerminologyMatcher {

    private final TerminologyIndex index;

    public TerminologyMatcher(TerminologyIndex index) {
        this.index = index;
    }

    public boolean matchesDrug(String medication, String drugPattern) {
        return matches(medication, drugPattern) || containsMember(medication, index.drugClassMembers(drugPattern));
    }

    public boolean matchesCondition(String condition, String conditionPattern) {
        return matches(condition, conditionPattern) || containsMember(condition, index.conditionSynonyms(conditionPattern));
    }

    public boolean matchesAllergen(String allergy, String allergenPattern) {
        return matches(allergy, allergenPattern) || containsMember(allergy, index.allergenSynonyms(allergenPattern));
    }

    public TerminologyIndex getIndex() {
        return index;
    }

    static String normalize(String token) {
        if (token == null) {
            return "";
        }
        return token.trim().toLowerCase(Locale.ROOT);
    }

    private static boolean matches(String input, String pattern) {
        String in = normalize(input);
        String pat = normalize(pattern);
        if (in.isEmpty() || pat.isEmpty()) {
            return false;
        }
        return in.equals(pat) || in.contains(pat) || pat.contains(in);
    }

    private static boolean containsMember(String input, List<String> members) {
        String in = normalize(input);
        if (in.isEmpty()) {
            return false;
        }
        return members.stream().anyMatch(in::contains);
    }
}
