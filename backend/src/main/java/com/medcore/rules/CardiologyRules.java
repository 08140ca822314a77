package com.medcore.rules;

import com.medcore.model.*;
import com.medcore.model.ClinicalSnapshot.CardiologyProfile;
import com.medcore.model.ClinicalSnapshot.Demographics;
import com.medcore.model.ClinicalSnapshot.Labs;
import com.medcore.model.ClinicalSnapshot.Sex;
import com.medcore.model.ClinicalSnapshot.Vitals;

import java.util.List;
import java.util.Optional;

import static com.medcore.rules.RuleSupport.*;

/**
 * Cardiology rules (ESC): heart failure, AF anticoagulation, blood pressure, ACS, lipids.
 */
final class CardiologyRules {

    static final double LDL_TARGET_VERY_HIGH_RISK = 55;
    static final double LDL_TARGET_HIGH_RISK = 70;

    private CardiologyRules() {
    }

    static List<CdssRule> rules() {
        return List.of(
            reducedEjectionFraction(),
            atrialFibrillationAnticoagulation(),
            uncontrolledHypertension(),
            elevatedTroponin(),
            ldlAboveTarget()
        );
    }

    static CdssRule reducedEjectionFraction() {
        return CdssRule.builder()
            .id("esc-hf-lvef-001")
            .name("Reduced LVEF Heart Failure")
            .description("LVEF < 40% per ESC guidelines")
            .category(AlertCategory.GUIDELINE)
            .module(ClinicalModule.CARDIOLOGY)
            .guidelineSource(GuidelineSource.ESC)
            .priority(1)
            .condition(s -> below(s.cardiac(CardiologyProfile::getLvef), 40))
            .alertGenerator(s -> {
                double lvef = s.cardiac(CardiologyProfile::getLvef).orElseThrow();
                return AlertDraft.builder()
                    .category(AlertCategory.GUIDELINE)
                    .severity(lvef < 30 ? AlertSeverity.CRITICAL : AlertSeverity.WARNING)
                    .title("Heart failure with reduced ejection fraction (HFrEF)")
                    .message("LVEF " + format(lvef) + "% - HFrEF classification (<40%)")
                    .guidelineSource(GuidelineSource.ESC)
                    .guidelineReference("ESC Heart Failure Guidelines 2021")
                    .recommendation("Start quadruple therapy unless contraindicated:")
                    .recommendation("  - ACE inhibitor / ARB / ARNI")
                    .recommendation("  - Beta-blocker")
                    .recommendation("  - Mineralocorticoid receptor antagonist (MRA)")
                    .recommendation("  - SGLT2 inhibitor")
                    .recommendation("Assess CRT/ICD indication if LVEF <= 35%")
                    .recommendation("Optimize diuretic therapy")
                    .recommendation("Sodium restriction and daily weighing")
                    .datum("lvef", lvef)
                    .build();
            })
            .build();
    }

    static CdssRule atrialFibrillationAnticoagulation() {
        return CdssRule.builder()
            .id("esc-af-chadsvasc-001")
            .name("AF Anticoagulation Required")
            .description("CHA2DS2-VASc indicates anticoagulation")
            .category(AlertCategory.GUIDELINE)
            .module(ClinicalModule.CARDIOLOGY)
            .guidelineSource(GuidelineSource.ESC)
            .priority(1)
            .condition(s -> {
                if (!isTrue(s.cardiac(CardiologyProfile::getAtrialFibrillation))) {
                    return false;
                }
                int score = chadsVascScore(s);
                boolean male = s.demographic(Demographics::getSex).map(sex -> sex == Sex.MALE).orElse(false);
                return score >= 2 || (score >= 1 && male);
            })
            .alertGenerator(s -> AlertDraft.builder()
                .category(AlertCategory.GUIDELINE)
                .severity(AlertSeverity.WARNING)
                .title("Anticoagulation recommended - AF")
                .message("Patient with AF and a CHA2DS2-VASc score indicating anticoagulation")
                .guidelineSource(GuidelineSource.ESC)
                .guidelineReference("ESC AF Guidelines 2020")
                .recommendation("Start oral anticoagulation (DOAC preferred over VKA)")
                .recommendation("Calculate HAS-BLED score to assess bleeding risk")
                .recommendation("Recommended DOACs: apixaban, rivaroxaban, dabigatran, edoxaban")
                .recommendation("Rate/rhythm control according to symptoms")
                .recommendation("Educate patient on stroke warning signs")
                .datum("chadsVascScore", chadsVascScore(s))
                .build())
            .build();
    }

    static CdssRule uncontrolledHypertension() {
        return CdssRule.builder()
            .id("esc-bp-001")
            .name("Uncontrolled Hypertension")
            .description("Blood pressure above target")
            .category(AlertCategory.VITALS)
            .module(ClinicalModule.CARDIOLOGY)
            .guidelineSource(GuidelineSource.ESC)
            .priority(2)
            .condition(s -> s.vital(Vitals::getSystolicBP).isPresent()
                && (atLeast(s.vital(Vitals::getSystolicBP), 140) || atLeast(s.vital(Vitals::getDiastolicBP), 90)))
            .alertGenerator(s -> {
                Optional<Double> systolic = s.vital(Vitals::getSystolicBP);
                boolean crisis = atLeast(systolic, 180);
                return AlertDraft.builder()
                    .category(AlertCategory.VITALS)
                    .severity(crisis ? AlertSeverity.CRITICAL : AlertSeverity.WARNING)
                    .title("Uncontrolled hypertension")
                    .message("BP " + format(systolic) + "/" + format(s.vital(Vitals::getDiastolicBP))
                        + " mmHg - Target <140/90 mmHg")
                    .guidelineSource(GuidelineSource.ESC)
                    .guidelineReference("ESC Hypertension Guidelines 2018")
                    .recommendation(crisis
                        ? "URGENT: assess for malignant hypertension / hypertensive emergency"
                        : "Optimize antihypertensive therapy")
                    .recommendation("Dual therapy recommended first line (ACE inhibitor/ARB + CCB or diuretic)")
                    .recommendation("Check medication adherence")
                    .recommendation("Lifestyle measures (salt, weight, exercise)")
                    .recommendation("Ambulatory or home BP monitoring to confirm")
                    .datum("systolicBP", systolic.orElseThrow())
                    .build();
            })
            .build();
    }

    static CdssRule elevatedTroponin() {
        return CdssRule.builder()
            .id("esc-acs-troponin-001")
            .name("Elevated Troponin - ACS")
            .description("Elevated cardiac markers suggesting ACS")
            .category(AlertCategory.LAB)
            .module(ClinicalModule.CARDIOLOGY)
            .guidelineSource(GuidelineSource.ESC)
            .priority(1)
            .condition(s -> above(s.lab(Labs::getTroponin), 0.04))
            .alertGenerator(s -> AlertDraft.builder()
                .category(AlertCategory.LAB)
                .severity(AlertSeverity.CRITICAL)
                .title("Elevated troponin - suspected ACS")
                .message("Troponin " + format(s.lab(Labs::getTroponin))
                    + " ng/mL (threshold: 0.04 ng/mL) - Evaluate for acute coronary syndrome")
                .guidelineSource(GuidelineSource.ESC)
                .guidelineReference("ESC NSTE-ACS Guidelines 2020")
                .recommendation("URGENT: immediate 12-lead ECG")
                .recommendation("Assess chest pain and risk factors")
                .recommendation("Calculate GRACE/TIMI score")
                .recommendation("Consider coronary angiography according to risk")
                .recommendation("Dual antiplatelet therapy if ACS confirmed")
                .recommendation("Coronary care unit admission if high risk")
                .datum("troponin", s.lab(Labs::getTroponin).orElseThrow())
                .build())
            .build();
    }

    static CdssRule ldlAboveTarget() {
        return CdssRule.builder()
            .id("esc-lipids-001")
            .name("LDL Above Target")
            .description("LDL cholesterol above cardiovascular risk target")
            .category(AlertCategory.LAB)
            .module(ClinicalModule.CARDIOLOGY)
            .guidelineSource(GuidelineSource.ESC)
            .priority(2)
            .condition(s -> above(s.lab(Labs::getLdl), ldlTarget(s)))
            .alertGenerator(s -> AlertDraft.builder()
                .category(AlertCategory.LAB)
                .severity(AlertSeverity.WARNING)
                .title("LDL cholesterol above target")
                .message("LDL " + format(s.lab(Labs::getLdl)) + " mg/dL - Patient at high cardiovascular risk")
                .guidelineSource(GuidelineSource.ESC)
                .guidelineReference("ESC Dyslipidemia Guidelines 2019")
                .recommendation("Intensify to high-intensity statin (atorvastatin 40-80 mg, rosuvastatin 20-40 mg)")
                .recommendation("If target not reached: add ezetimibe")
                .recommendation("If still not reached: consider a PCSK9 inhibitor")
                .recommendation("Lifestyle measures")
                .recommendation("Recheck LDL at 4-6 weeks")
                .datum("ldl", s.lab(Labs::getLdl).orElseThrow())
                .datum("target", ldlTarget(s))
                .build())
            .build();
    }

    /**
     * CHA2DS2-VASc stroke risk score. Missing inputs contribute nothing.
     */
    static int chadsVascScore(ClinicalSnapshot s) {
        int score = 0;
        if (isTrue(s.cardiac(CardiologyProfile::getHeartFailure))) {
            score += 1;
        }
        if (atLeast(s.vital(Vitals::getSystolicBP), 140)) {
            score += 1;
        }
        int age = s.demographic(Demographics::getAge).orElse(0);
        if (age >= 75) {
            score += 2;
        } else if (age >= 65) {
            score += 1;
        }
        if (s.hasCondition("diabetes")) {
            score += 1;
        }
        if (s.hasCondition("stroke") || s.hasCondition("tia")) {
            score += 2;
        }
        if (isTrue(s.cardiac(CardiologyProfile::getCoronaryArteryDisease))) {
            score += 1;
        }
        if (s.demographic(Demographics::getSex).orElse(null) == Sex.FEMALE) {
            score += 1;
        }
        return score;
    }

    static double ldlTarget(ClinicalSnapshot s) {
        boolean veryHighRisk = isTrue(s.cardiac(CardiologyProfile::getCoronaryArteryDisease))
            || s.hasCondition("stroke")
            || s.hasCondition("diabetes");
        return veryHighRisk ? LDL_TARGET_VERY_HIGH_RISK : LDL_TARGET_HIGH_RISK;
    }
}
