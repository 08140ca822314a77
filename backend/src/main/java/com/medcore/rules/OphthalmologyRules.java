package com.medcore.rules;

import com.medcore.model.*;
import com.medcore.model.ClinicalSnapshot.OphthalmologyProfile;

import java.util.List;
import java.util.Optional;

import static com.medcore.rules.RuleSupport.*;

/**
 * Ophthalmology rules (AAO).
 */
final class OphthalmologyRules {

    private OphthalmologyRules() {
    }

    static List<CdssRule> rules() {
        return List.of(
            elevatedIntraocularPressure(),
            diabeticMacularEdema(),
            wetMacularDegeneration()
        );
    }

    static CdssRule elevatedIntraocularPressure() {
        return CdssRule.builder()
            .id("aao-iop-001")
            .name("Elevated IOP - Glaucoma Risk")
            .description("Intraocular pressure above normal")
            .category(AlertCategory.VITALS)
            .module(ClinicalModule.OPHTHALMOLOGY)
            .guidelineSource(GuidelineSource.AAO)
            .priority(2)
            .condition(s -> above(s.ocular(OphthalmologyProfile::getIopLeft), 21)
                || above(s.ocular(OphthalmologyProfile::getIopRight), 21))
            .alertGenerator(s -> {
                Optional<Double> left = s.ocular(OphthalmologyProfile::getIopLeft);
                Optional<Double> right = s.ocular(OphthalmologyProfile::getIopRight);
                boolean severe = above(left, 30) || above(right, 30);
                AlertDraft.AlertDraftBuilder draft = AlertDraft.builder()
                    .category(AlertCategory.VITALS)
                    .severity(severe ? AlertSeverity.CRITICAL : AlertSeverity.WARNING)
                    .title("Elevated intraocular pressure")
                    .message("IOP: OD " + format(right) + " mmHg, OS " + format(left) + " mmHg - Normal: 10-21 mmHg")
                    .guidelineSource(GuidelineSource.AAO)
                    .guidelineReference("AAO Glaucoma PPP 2020")
                    .recommendation("Corneal pachymetry to correct IOP")
                    .recommendation("Optic nerve examination (cup/disc ratio)")
                    .recommendation("Baseline visual field")
                    .recommendation("RNFL OCT if glaucoma suspected")
                    .recommendation("Consider IOP-lowering therapy if risk factors present");
                // only eyes that were measured
                left.ifPresent(iop -> draft.datum("iopLeft", iop));
                right.ifPresent(iop -> draft.datum("iopRight", iop));
                return draft.build();
            })
            .build();
    }

    static CdssRule diabeticMacularEdema() {
        return CdssRule.builder()
            .id("aao-dme-001")
            .name("Diabetic Macular Edema")
            .description("DME requiring treatment")
            .category(AlertCategory.GUIDELINE)
            .module(ClinicalModule.OPHTHALMOLOGY)
            .guidelineSource(GuidelineSource.AAO)
            .priority(1)
            .condition(s -> isTrue(s.ocular(OphthalmologyProfile::getDiabeticMacularEdema)))
            .alertGenerator(s -> AlertDraft.builder()
                .category(AlertCategory.GUIDELINE)
                .severity(AlertSeverity.WARNING)
                .title("Diabetic macular edema")
                .message("DME detected - anti-VEGF therapy recommended")
                .guidelineSource(GuidelineSource.AAO)
                .guidelineReference("AAO Diabetic Retinopathy PPP 2019")
                .recommendation("Start anti-VEGF injections (aflibercept, ranibizumab, bevacizumab)")
                .recommendation("Monthly OCT to follow macular thickness")
                .recommendation("Optimize glycemic control (HbA1c <7%)")
                .recommendation("Control blood pressure and lipids")
                .recommendation("Consider focal laser if DME persists")
                .recommendation("Coordinate with the diabetologist")
                .datum("diabeticMacularEdema", true)
                .build())
            .build();
    }

    static CdssRule wetMacularDegeneration() {
        return CdssRule.builder()
            .id("aao-amd-001")
            .name("Wet AMD Detected")
            .description("Neovascular AMD requiring urgent treatment")
            .category(AlertCategory.GUIDELINE)
            .module(ClinicalModule.OPHTHALMOLOGY)
            .guidelineSource(GuidelineSource.AAO)
            .priority(1)
            .condition(s -> isTrue(s.ocular(OphthalmologyProfile::getMacularDegeneration)))
            .alertGenerator(s -> AlertDraft.builder()
                .category(AlertCategory.GUIDELINE)
                .severity(AlertSeverity.CRITICAL)
                .title("Wet age-related macular degeneration")
                .message("Neovascular AMD - urgent anti-VEGF therapy")
                .guidelineSource(GuidelineSource.AAO)
                .guidelineReference("AAO AMD PPP 2019")
                .recommendation("URGENT: start anti-VEGF within 2 weeks")
                .recommendation("Protocol: 3 monthly loading injections")
                .recommendation("Then treat-and-extend or PRN")
                .recommendation("Follow-up OCT and angiography")
                .recommendation("Smoking cessation is essential")
                .recommendation("AREDS2 supplementation for the fellow eye")
                .datum("macularDegeneration", true)
                .build())
            .build();
    }
}
