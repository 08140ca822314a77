package com.medcore.rules;

import com.medcore.model.CdssRule;

import java.util.ArrayList;
import java.util.List;

/**
 * Built-in guideline rule catalogue, in registry order: dialysis, cardiology,
 * ophthalmology, then general safety rules.
 */
public final class GuidelineRules {

    private GuidelineRules() {
    }

    public static List<CdssRule> defaultRules() {
        List<CdssRule> rules = new ArrayList<>();
        rules.addAll(DialysisRules.rules());
        rules.addAll(CardiologyRules.rules());
        rules.addAll(OphthalmologyRules.rules());
        rules.addAll(GeneralSafetyRules.rules());
        return List.copyOf(rules);
    }

    public static GuidelineRuleRegistry defaultRegistry() {
        return new GuidelineRuleRegistry(defaultRules());
    }
}
