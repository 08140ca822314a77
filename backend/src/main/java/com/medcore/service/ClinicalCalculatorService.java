package com.medcore.service;

import com.medcore.dto.CalculatorDTO;
import com.medcore.model.ClinicalSnapshot.Sex;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;

/**
 * Bedside calculators used alongside the CDSS: CKD staging, creatinine clearance,
 * BMI and corrected QT.
 */
@Service
public class ClinicalCalculatorService {

    public CalculatorDTO.CkdStage ckdStage(double egfr) {
        if (egfr < 0) {
            throw new IllegalArgumentException("eGFR must not be negative");
        }

        String stage;
        String description;
        List<String> recommendations;

        if (egfr >= 90) {
            stage = "1";
            description = "Normal or high kidney function";
            recommendations = List.of(
                "Treat the underlying cause if present",
                "Reduce cardiovascular risk factors",
                "Annual follow-up");
        } else if (egfr >= 60) {
            stage = "2";
            description = "Mildly decreased GFR";
            recommendations = List.of(
                "Estimate progression",
                "Control BP (target <130/80)",
                "Avoid nephrotoxic drugs",
                "Annual follow-up");
        } else if (egfr >= 45) {
            stage = "3a";
            description = "Mildly to moderately decreased GFR";
            recommendations = List.of(
                "Refer to nephrology if proteinuria",
                "Adjust medications to GFR",
                "Monitor anemia and mineral bone disorder",
                "Follow-up every 6 months");
        } else if (egfr >= 30) {
            stage = "3b";
            description = "Moderately to severely decreased GFR";
            recommendations = List.of(
                "Nephrology follow-up recommended",
                "Treat anemia and calcium-phosphate disorders",
                "Vaccinate (hepatitis B)",
                "Follow-up every 3-6 months");
        } else if (egfr >= 15) {
            stage = "4";
            description = "Severely decreased GFR";
            recommendations = List.of(
                "Nephrology follow-up required",
                "Prepare for renal replacement therapy",
                "Patient education (HD, PD, transplant)",
                "Create vascular access if HD planned",
                "Follow-up every 1-3 months");
        } else {
            stage = "5";
            description = "Kidney failure";
            recommendations = List.of(
                "Start renal replacement therapy",
                "Transplant evaluation",
                "Manage uremic symptoms",
                "Monthly follow-up");
        }

        return CalculatorDTO.CkdStage.builder()
            .egfr(egfr)
            .stage(stage)
            .description(description)
            .recommendations(recommendations)
            .kdigoClassification("CKD G" + stage)
            .build();
    }

    /**
     * Cockcroft-Gault creatinine clearance in mL/min, rounded to one decimal.
     * Accepts adults aged 18-120, weight 30-300 kg and creatinine 0.1-20 mg/dL.
     */
    public CalculatorDTO.CreatinineClearance creatinineClearance(int age, double weightKg, Sex sex,
                                                                 double creatinineMgDl) {
        requireInRange(age, 18, 120, "Age");
        requireInRange(weightKg, 30, 300, "Weight (kg)");
        requireInRange(creatinineMgDl, 0.1, 20, "Creatinine (mg/dL)");
        if (sex == null) {
            throw new IllegalArgumentException("Sex is required");
        }

        double crcl = ((140 - age) * weightKg) / (72 * creatinineMgDl);
        if (sex == Sex.FEMALE) {
            crcl *= 0.85;
        }

        String category;
        if (crcl >= 90) {
            category = "Normal";
        } else if (crcl >= 60) {
            category = "Mildly decreased";
        } else if (crcl >= 30) {
            category = "Moderately decreased";
        } else if (crcl >= 15) {
            category = "Severely decreased";
        } else {
            category = "Kidney failure";
        }

        return CalculatorDTO.CreatinineClearance.builder()
            .creatinineClearance(roundToTenth(crcl))
            .unit("mL/min")
            .category(category)
            .formula("Cockcroft-Gault")
            .age(age)
            .weight(weightKg)
            .sex(sex)
            .creatinine(creatinineMgDl)
            .note("Cockcroft-Gault CrCl is commonly used for drug dose adjustment")
            .build();
    }

    public CalculatorDTO.BodyMassIndex bmi(double weightKg, double heightCm) {
        requireInRange(weightKg, 20, 500, "Weight (kg)");
        requireInRange(heightCm, 100, 250, "Height (cm)");

        double heightM = heightCm / 100;
        double bmi = weightKg / (heightM * heightM);

        String category;
        List<String> recommendations;
        if (bmi < 18.5) {
            category = "Underweight";
            recommendations = List.of("Nutritional assessment", "Look for an underlying cause");
        } else if (bmi < 25) {
            category = "Normal weight";
            recommendations = List.of("Maintain regular physical activity", "Balanced diet");
        } else if (bmi < 30) {
            category = "Overweight";
            recommendations = List.of("Diet and lifestyle advice", "Increase physical activity",
                "Screen for metabolic complications");
        } else if (bmi < 35) {
            category = "Obesity class I";
            recommendations = List.of("Nutritional management", "Physical activity program",
                "Screen for diabetes, hypertension, dyslipidemia");
        } else if (bmi < 40) {
            category = "Obesity class II";
            recommendations = List.of("Multidisciplinary management", "Consider pharmacotherapy",
                "Assess comorbidities");
        } else {
            category = "Obesity class III";
            recommendations = List.of("Evaluate for bariatric surgery", "Specialist management",
                "Close follow-up");
        }

        return CalculatorDTO.BodyMassIndex.builder()
            .bmi(roundToTenth(bmi))
            .category(category)
            .recommendations(recommendations)
            .idealWeightMin(Math.round(18.5 * heightM * heightM))
            .idealWeightMax(Math.round(24.9 * heightM * heightM))
            .build();
    }

    public CalculatorDTO.CorrectedQt qtc(double qtMs, double heartRate) {
        return qtc(qtMs, heartRate, CalculatorDTO.QtcFormula.BAZETT);
    }

    /**
     * Heart-rate corrected QT interval in ms. A null formula means Bazett.
     */
    public CalculatorDTO.CorrectedQt qtc(double qtMs, double heartRate, CalculatorDTO.QtcFormula formula) {
        requireInRange(qtMs, 200, 800, "QT interval (ms)");
        requireInRange(heartRate, 30, 200, "Heart rate (bpm)");
        CalculatorDTO.QtcFormula applied = formula == null ? CalculatorDTO.QtcFormula.BAZETT : formula;

        double rr = 60000 / heartRate;
        double qtc = switch (applied) {
            case FRIDERICIA -> qtMs / Math.cbrt(rr / 1000);
            case FRAMINGHAM -> qtMs + 0.154 * (1000 - rr);
            case BAZETT -> qtMs / Math.sqrt(rr / 1000);
        };

        String interpretation;
        String riskLevel;
        if (qtc < 440) {
            interpretation = "Normal QTc";
            riskLevel = "low";
        } else if (qtc < 460) {
            interpretation = "Borderline QTc";
            riskLevel = "borderline";
        } else if (qtc < 500) {
            interpretation = "Prolonged QTc";
            riskLevel = "moderate";
        } else {
            interpretation = "Severely prolonged QTc - risk of torsades de pointes";
            riskLevel = "high";
        }

        List<String> recommendations = qtc >= 500
            ? List.of(
                "Review QT-prolonging medications",
                "Correct hypokalemia/hypomagnesemia",
                "Monitoring ECG",
                "Consider admission if symptomatic")
            : List.of();

        return CalculatorDTO.CorrectedQt.builder()
            .qtc(Math.round(qtc))
            .unit("ms")
            .formula(applied)
            .interpretation(interpretation)
            .riskLevel(riskLevel)
            .recommendations(recommendations)
            .build();
    }

    private static double roundToTenth(double value) {
        return Math.round(value * 10) / 10.0;
    }

    // NaN fails the comparison as well
    private static void requireInRange(double value, double min, double max, String name) {
        if (!(value >= min && value <= max)) {
            throw new IllegalArgumentException(
                name + " must be between " + plain(min) + " and " + plain(max) + ", got " + value);
        }
    }

    private static String plain(double bound) {
        return BigDecimal.valueOf(bound).stripTrailingZeros().toPlainString();
    }
}
