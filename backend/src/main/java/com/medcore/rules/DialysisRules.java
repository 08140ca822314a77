package com.medcore.rules;

import com.medcore.model.*;
import com.medcore.model.ClinicalSnapshot.DialysisProfile;
import com.medcore.model.ClinicalSnapshot.Labs;

import java.util.List;
import java.util.Locale;

import static com.medcore.rules.RuleSupport.*;

/**
 * Nephrology rules (KDIGO): dialysis adequacy and CKD-MBD / anemia / potassium labs.
 */
final class DialysisRules {

    private DialysisRules() {
    }

    static List<CdssRule> rules() {
        return List.of(
            inadequateKtV(),
            hyperphosphatemia(),
            secondaryHyperparathyroidism(),
            anemia(),
            hyperkalemia()
        );
    }

    static CdssRule inadequateKtV() {
        return CdssRule.builder()
            .id("kdigo-ktv-001")
            .name("Inadequate Dialysis Kt/V")
            .description("Kt/V below target per KDIGO guidelines")
            .category(AlertCategory.GUIDELINE)
            .module(ClinicalModule.DIALYSE)
            .guidelineSource(GuidelineSource.KDIGO)
            .priority(1)
            .condition(s -> s.isOnDialysis() && below(s.dialysisValue(DialysisProfile::getKtv), 1.2))
            .alertGenerator(s -> {
                double ktv = s.dialysisValue(DialysisProfile::getKtv).orElseThrow();
                return AlertDraft.builder()
                    .category(AlertCategory.GUIDELINE)
                    .severity(ktv < 1.0 ? AlertSeverity.CRITICAL : AlertSeverity.WARNING)
                    .title("Inadequate dialysis - Kt/V below target")
                    .message(String.format(Locale.ROOT,
                        "Current Kt/V (%.2f) is below the KDIGO target of 1.2", ktv))
                    .guidelineSource(GuidelineSource.KDIGO)
                    .guidelineReference("KDIGO 2015 Hemodialysis Guidelines")
                    .recommendation("Increase dialysis session duration")
                    .recommendation("Increase blood flow rate if tolerated")
                    .recommendation("Check vascular access (recirculation)")
                    .recommendation("Consider a larger surface-area dialyzer")
                    .recommendation("Reassess the patient's dry weight")
                    .datum("ktv", ktv)
                    .datum("target", 1.2)
                    .build();
            })
            .build();
    }

    static CdssRule hyperphosphatemia() {
        return CdssRule.builder()
            .id("kdigo-phosphorus-001")
            .name("Hyperphosphatemia")
            .description("Elevated phosphorus per KDIGO guidelines")
            .category(AlertCategory.LAB)
            .module(ClinicalModule.DIALYSE)
            .guidelineSource(GuidelineSource.KDIGO)
            .priority(2)
            .condition(s -> s.isOnDialysis() && above(s.lab(Labs::getPhosphorus), 5.5))
            .alertGenerator(s -> {
                double phosphorus = s.lab(Labs::getPhosphorus).orElseThrow();
                return AlertDraft.builder()
                    .category(AlertCategory.LAB)
                    .severity(phosphorus > 7.0 ? AlertSeverity.CRITICAL : AlertSeverity.WARNING)
                    .title("Hyperphosphatemia")
                    .message("Elevated phosphorus (" + format(phosphorus) + " mg/dL) - Target: 3.5-5.5 mg/dL")
                    .guidelineSource(GuidelineSource.KDIGO)
                    .guidelineReference("KDIGO CKD-MBD 2017")
                    .recommendation("Reinforce dietary advice (reduce dietary phosphorus)")
                    .recommendation("Optimize phosphate binders")
                    .recommendation("Check treatment adherence")
                    .recommendation("Consider increasing dialysis duration or frequency")
                    .datum("phosphorus", phosphorus)
                    .build();
            })
            .build();
    }

    static CdssRule secondaryHyperparathyroidism() {
        return CdssRule.builder()
            .id("kdigo-pth-001")
            .name("Secondary Hyperparathyroidism")
            .description("Elevated PTH in dialysis patient")
            .category(AlertCategory.LAB)
            .module(ClinicalModule.DIALYSE)
            .guidelineSource(GuidelineSource.KDIGO)
            .priority(2)
            .condition(s -> s.isOnDialysis() && above(s.lab(Labs::getPth), 600))
            .alertGenerator(s -> {
                double pth = s.lab(Labs::getPth).orElseThrow();
                return AlertDraft.builder()
                    .category(AlertCategory.LAB)
                    .severity(pth > 900 ? AlertSeverity.CRITICAL : AlertSeverity.WARNING)
                    .title("Secondary hyperparathyroidism")
                    .message("Elevated PTH (" + format(pth) + " pg/mL) - Target: 2-9x upper normal (130-600 pg/mL)")
                    .guidelineSource(GuidelineSource.KDIGO)
                    .guidelineReference("KDIGO CKD-MBD 2017")
                    .recommendation("Optimize calcium and phosphorus levels")
                    .recommendation("Start or adjust calcimimetics (cinacalcet)")
                    .recommendation("Consider active vitamin D if calcium allows")
                    .recommendation("Refer for surgery if PTH is refractory (>1000 pg/mL)")
                    .datum("pth", pth)
                    .build();
            })
            .build();
    }

    static CdssRule anemia() {
        return CdssRule.builder()
            .id("kdigo-anemia-001")
            .name("Anemia in CKD/Dialysis")
            .description("Hemoglobin below target")
            .category(AlertCategory.LAB)
            .module(ClinicalModule.DIALYSE)
            .guidelineSource(GuidelineSource.KDIGO)
            .priority(2)
            .condition(s -> below(s.lab(Labs::getHemoglobin), 10.0))
            .alertGenerator(s -> {
                double hemoglobin = s.lab(Labs::getHemoglobin).orElseThrow();
                return AlertDraft.builder()
                    .category(AlertCategory.LAB)
                    .severity(hemoglobin < 8.0 ? AlertSeverity.CRITICAL : AlertSeverity.WARNING)
                    .title("Anemia")
                    .message("Low hemoglobin (" + format(hemoglobin) + " g/dL) - Target: 10-11.5 g/dL")
                    .guidelineSource(GuidelineSource.KDIGO)
                    .guidelineReference("KDIGO Anemia Guidelines 2012")
                    .recommendation("Check iron stores (ferritin, TSAT)")
                    .recommendation("Give IV iron if deficient")
                    .recommendation("Adjust erythropoiesis-stimulating agents (ESA)")
                    .recommendation("Look for causes of ESA resistance")
                    .recommendation("Rule out occult bleeding")
                    .datum("hemoglobin", hemoglobin)
                    .build();
            })
            .build();
    }

    static CdssRule hyperkalemia() {
        return CdssRule.builder()
            .id("kdigo-potassium-001")
            .name("Hyperkalemia")
            .description("Elevated potassium - life threatening")
            .category(AlertCategory.LAB)
            .module(ClinicalModule.DIALYSE)
            .guidelineSource(GuidelineSource.KDIGO)
            .priority(1)
            .condition(s -> above(s.lab(Labs::getPotassium), 5.5))
            .alertGenerator(s -> {
                double potassium = s.lab(Labs::getPotassium).orElseThrow();
                boolean severe = potassium > 6.5;
                return AlertDraft.builder()
                    .category(AlertCategory.LAB)
                    .severity(severe ? AlertSeverity.CRITICAL : AlertSeverity.WARNING)
                    .title("Hyperkalemia")
                    .message("Elevated potassium (" + format(potassium) + " mEq/L) - Risk of cardiac arrhythmia")
                    .guidelineSource(GuidelineSource.KDIGO)
                    .guidelineReference("KDIGO AKI Guidelines")
                    .recommendation(severe
                        ? "URGENT: immediate ECG, consider emergency dialysis"
                        : "Follow-up ECG recommended")
                    .recommendation("Dietary advice (potassium restriction)")
                    .recommendation("Review potassium-raising drugs (ACE inhibitors, ARBs, spironolactone)")
                    .recommendation("Potassium binders (sodium polystyrene sulfonate, patiromer)")
                    .recommendation("Consider increasing dialysis frequency")
                    .datum("potassium", potassium)
                    .build();
            })
            .build();
    }
}
