package com.medcore.rules;

import com.medcore.model.*;
import com.medcore.model.ClinicalSnapshot.Labs;

import java.util.List;

import static com.medcore.rules.RuleSupport.*;

final class GeneralSafetyRules {

    private GeneralSafetyRules() {
    }

    static List<CdssRule> rules() {
        return List.of(
            severeRenalImpairment(),
            hyperglycemia()
        );
    }

    static CdssRule severeRenalImpairment() {
        return CdssRule.builder()
            .id("safety-egfr-001")
            .name("Severe Renal Impairment")
            .description("eGFR indicating severe CKD")
            .category(AlertCategory.LAB)
            .module(ClinicalModule.GENERAL)
            .guidelineSource(GuidelineSource.KDIGO)
            .priority(1)
            .condition(s -> below(s.lab(Labs::getEgfr), 30) && !s.isOnDialysis())
            .alertGenerator(s -> {
                double egfr = s.lab(Labs::getEgfr).orElseThrow();
                boolean kidneyFailure = egfr < 15;
                return AlertDraft.builder()
                    .category(AlertCategory.LAB)
                    .severity(kidneyFailure ? AlertSeverity.CRITICAL : AlertSeverity.WARNING)
                    .title("Severe renal impairment")
                    .message("eGFR " + format(egfr) + " mL/min/1.73m2 - CKD stage " + (kidneyFailure ? "5" : "4"))
                    .guidelineSource(GuidelineSource.KDIGO)
                    .guidelineReference("KDIGO CKD Guidelines 2012")
                    .recommendation(kidneyFailure
                        ? "Urgent nephrology referral - prepare renal replacement therapy"
                        : "Close nephrology follow-up")
                    .recommendation("Adjust drug doses to eGFR")
                    .recommendation("Avoid nephrotoxins (NSAIDs, contrast media)")
                    .recommendation("Vaccinate (hepatitis B, influenza, pneumococcus)")
                    .recommendation("Educate patient on renal replacement options")
                    .datum("egfr", egfr)
                    .build();
            })
            .build();
    }

    static CdssRule hyperglycemia() {
        return CdssRule.builder()
            .id("safety-glucose-001")
            .name("Hyperglycemia")
            .description("Elevated HbA1c")
            .category(AlertCategory.LAB)
            .module(ClinicalModule.GENERAL)
            .guidelineSource(GuidelineSource.AHA)
            .priority(2)
            .condition(s -> above(s.lab(Labs::getHba1c), 8.0))
            .alertGenerator(s -> {
                double hba1c = s.lab(Labs::getHba1c).orElseThrow();
                return AlertDraft.builder()
                    .category(AlertCategory.LAB)
                    .severity(hba1c > 10.0 ? AlertSeverity.CRITICAL : AlertSeverity.WARNING)
                    .title("Inadequate glycemic control")
                    .message("HbA1c " + format(hba1c) + "% - Target generally <7%")
                    .guidelineSource(GuidelineSource.AHA)
                    .guidelineReference("ADA Standards of Care 2024")
                    .recommendation("Optimize antidiabetic therapy")
                    .recommendation("Prefer SGLT2i or GLP-1 RA if cardiovascular or renal disease")
                    .recommendation("Reinforce therapeutic education")
                    .recommendation("Screen for complications (retinopathy, nephropathy, neuropathy)")
                    .recommendation("Individualize the target to the patient profile")
                    .datum("hba1c", hba1c)
                    .build();
            })
            .build();
    }
}
