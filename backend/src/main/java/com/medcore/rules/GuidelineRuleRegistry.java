package com.medcore.rules;

import com.medcore.model.CdssRule;
import com.medcore.model.ClinicalModule;
import com.medcore.model.RuleCountSummary;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable, ordered collection of CDSS rules.
 *
 * Registry order is the evaluation order and the tie order for alerts of equal
 * severity. Rule ids are unique.
 */
public final class GuidelineRuleRegistry {

    private final List<CdssRule> rules;

    public GuidelineRuleRegistry(List<CdssRule> rules) {
        Set<String> ids = new HashSet<>();
        for (CdssRule rule : rules) {
            if (!ids.add(rule.getId())) {
                throw new IllegalArgumentException("Duplicate rule id: " + rule.getId());
            }
        }
        this.rules = List.copyOf(rules);
    }

    public List<CdssRule> getRules() {
        return rules;
    }

    /**
     * Rules of the given module plus the general rules; every rule when {@code module} is null.
     */
    public List<CdssRule> getRules(ClinicalModule module) {
        return rules.stream()
            .filter(rule -> rule.belongsTo(module))
            .toList();
    }

    public List<CdssRule> activeRules(ClinicalModule module) {
        return rules.stream()
            .filter(CdssRule::isActive)
            .filter(rule -> rule.belongsTo(module))
            .toList();
    }

    public RuleCountSummary getActiveRulesCount() {
        Map<ClinicalModule, Integer> byModule = new EnumMap<>(ClinicalModule.class);
        for (ClinicalModule module : ClinicalModule.values()) {
            byModule.put(module, 0);
        }
        int total = 0;
        for (CdssRule rule : rules) {
            if (rule.isActive()) {
                byModule.merge(rule.getModule(), 1, Integer::sum);
                total++;
            }
        }
        return new RuleCountSummary(total, Collections.unmodifiableMap(byModule));
    }

    /**
     * Copy of this registry with the given rule ids switched off. Unknown ids are ignored.
     */
    public GuidelineRuleRegistry withDisabled(Set<String> disabledIds) {
        if (disabledIds == null || disabledIds.isEmpty()) {
            return this;
        }
        return new GuidelineRuleRegistry(rules.stream()
            .map(rule -> disabledIds.contains(rule.getId()) ? rule.toBuilder().active(false).build() : rule)
            .toList());
    }

    public int size() {
        return rules.size();
    }
}
