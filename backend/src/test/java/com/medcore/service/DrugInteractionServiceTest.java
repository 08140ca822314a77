package com.medcore.service;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.medcore.dto.InteractionDTO;
import com.medcore.knowledge.*;
import com.medcore.model.AllergySeverity;
import com.medcore.model.InteractionSeverity;
import com.medcore.terminology.TerminologyIndex;
import com.medcore.terminology.TerminologyMatcher;

/**
 * Unit tests for DrugInteractionService
 *
 * Runs against the bundled knowledge base for clinical scenarios and against
 * small fixture tables for ordering and summary bucketing.
 */
@DisplayName("DrugInteractionService Tests")
class DrugInteractionServiceTest {

    private static InteractionKnowledgeBase bundledKnowledgeBase;
    private static TerminologyIndex bundledTerminology;

    private DrugInteractionService service;

    @BeforeAll
    static void loadBundledKnowledgeBase() {
        KnowledgeBaseLoader loader = new KnowledgeBaseLoader(new ObjectMapper(), new DefaultResourceLoader());
        bundledKnowledgeBase = loader.loadInteractions("classpath:knowledge/");
        bundledTerminology = loader.loadTerminology("classpath:knowledge/");
    }

    @BeforeEach
    void setUp() {
        service = new DrugInteractionService(
            new KnowledgeSnapshotHolder<>("interactions", bundledKnowledgeBase),
            new TerminologyMatcher(bundledTerminology));
    }

    @Nested
    @DisplayName("Clinical scenarios")
    class ClinicalScenarioTests {

        @Test
        @DisplayName("Should flag amoxicillin for a penicillin-allergic patient")
        void shouldFlagPenicillinAllergy() {
            // Act
            InteractionDTO.CheckResult result = service.checkInteractions(
                List.of("Amoxicillin"), List.of(), List.of("penicillin"));

            // Assert
            assertEquals(1, result.getAllergyAlerts().size());
            assertEquals(AllergySeverity.LIFE_THREATENING, result.getAllergyAlerts().get(0).getSeverity());
            assertTrue(result.getSummary().getContraindicated() >= 1);
        }

        @Test
        @DisplayName("Should contraindicate metformin in end-stage renal disease")
        void shouldContraindicateMetforminInEsrd() {
            for (String condition : List.of("ckd_stage_4_5", "esrd")) {
                InteractionDTO.CheckResult result = service.checkInteractions(
                    List.of("metformin"), List.of(condition), List.of());

                assertFalse(result.getDrugDiseaseInteractions().isEmpty(), condition);
                DrugDiseaseInteraction first = result.getDrugDiseaseInteractions().get(0);
                assertEquals("metformin", first.getDrug());
                assertEquals(InteractionSeverity.CONTRAINDICATED, first.getSeverity());
            }
        }

        @Test
        @DisplayName("Should return renal guidance without counting it in the summary")
        void shouldReturnRenalGuidance() {
            InteractionDTO.CheckResult result = service.checkInteractions(
                List.of("metformin"), List.of(), List.of(), 20.0, false);

            assertTrue(result.getRenalAdjustments().stream().anyMatch(r -> r.getDrug().equals("metformin")));
            assertEquals(0, result.getSummary().total());
        }

        @Test
        @DisplayName("Should rank the contraindicated drug pair first")
        void shouldRankContraindicatedPairFirst() {
            InteractionDTO.CheckResult result = service.checkInteractions(
                List.of("warfarin", "aspirin", "amiodarone", "sotalol"), List.of(), List.of());

            DrugInteraction first = result.getDrugDrugInteractions().get(0);
            assertEquals(InteractionSeverity.CONTRAINDICATED, first.getSeverity());
            assertEquals("amiodarone", first.getDrugA());
            assertEquals("sotalol", first.getDrugB());
            assertTrue(result.getDrugDrugInteractions().stream()
                .anyMatch(i -> i.getDrugA().equals("warfarin") && i.getDrugB().equals("aspirin")));
        }

        @Test
        @DisplayName("Should find the same drug pairs for any medication order")
        void shouldBePermutationInvariant() {
            // Arrange
            List<String> medications = List.of("warfarin", "aspirin", "amiodarone", "sotalol", "digoxin", "simvastatin");
            List<String> reversed = new ArrayList<>(medications);
            Collections.reverse(reversed);
            List<String> rotated = new ArrayList<>(medications);
            Collections.rotate(rotated, 2);

            // Act
            Set<DrugInteraction> original = new HashSet<>(
                service.checkInteractions(medications, List.of(), List.of()).getDrugDrugInteractions());

            // Assert
            assertFalse(original.isEmpty());
            assertEquals(original, new HashSet<>(
                service.checkInteractions(reversed, List.of(), List.of()).getDrugDrugInteractions()));
            assertEquals(original, new HashSet<>(
                service.checkInteractions(rotated, List.of(), List.of()).getDrugDrugInteractions()));
        }
    }

    @Nested
    @DisplayName("Input handling")
    class InputHandlingTests {

        @Test
        @DisplayName("Should return all-zero counts for empty input")
        void shouldHandleEmptyInput() {
            InteractionDTO.CheckResult result = service.checkInteractions(List.of(), List.of(), List.of());

            assertTrue(result.getDrugDrugInteractions().isEmpty());
            assertTrue(result.getDrugDiseaseInteractions().isEmpty());
            assertTrue(result.getAllergyAlerts().isEmpty());
            assertTrue(result.getRenalAdjustments().isEmpty());
            assertEquals(0, result.getSummary().getContraindicated());
            assertEquals(0, result.getSummary().getMajor());
            assertEquals(0, result.getSummary().getModerate());
            assertEquals(0, result.getSummary().getMinor());
        }

        @Test
        @DisplayName("Should treat null lists as empty and skip blank tokens")
        void shouldHandleNullAndBlankTokens() {
            List<String> medications = new ArrayList<>();
            medications.add(null);
            medications.add("  ");
            medications.add("amoxicillin");

            InteractionDTO.CheckResult result = service.checkInteractions(medications, null, List.of("", "penicillin"));

            assertEquals(1, result.getAllergyAlerts().size());
            assertTrue(result.getDrugDiseaseInteractions().isEmpty());
        }

        @Test
        @DisplayName("Should skip renal guidance without eGFR or dialysis")
        void shouldGateRenalGuidance() {
            assertTrue(service.checkInteractions(List.of("metformin"), List.of(), List.of(), null, false)
                .getRenalAdjustments().isEmpty());
            assertTrue(service.checkInteractions(List.of("metformin"), List.of(), List.of(), null, null)
                .getRenalAdjustments().isEmpty());
            assertFalse(service.checkInteractions(List.of("metformin"), List.of(), List.of(), null, true)
                .getRenalAdjustments().isEmpty());
        }
    }

    @Nested
    @DisplayName("Summary bucketing")
    class SummaryTests {

        @BeforeEach
        void useFixtureTables() {
            InteractionKnowledgeBase fixture = InteractionKnowledgeBase.builder()
                .version("fixture")
                .drugInteraction(DrugInteraction.builder()
                    .drugA("lisinopril").drugB("spironolactone").severity(InteractionSeverity.MINOR).build())
                .drugInteraction(DrugInteraction.builder()
                    .drugA("lisinopril").drugB("sotalol").severity(InteractionSeverity.CONTRAINDICATED).build())
                .drugDiseaseInteraction(DrugDiseaseInteraction.builder()
                    .drug("lisinopril").condition("hyperkalemia").severity(InteractionSeverity.MAJOR).build())
                .allergyCrossReactivity(AllergyCrossReactivity.builder()
                    .drug("spironolactone").allergen("test_allergen").severity(AllergySeverity.MILD).build())
                .allergyCrossReactivity(AllergyCrossReactivity.builder()
                    .drug("lisinopril").allergen("test_allergen").severity(AllergySeverity.SEVERE).build())
                .build();
            service = new DrugInteractionService(
                new KnowledgeSnapshotHolder<>("fixture", fixture),
                new TerminologyMatcher(TerminologyIndex.empty()));
        }

        @Test
        @DisplayName("Should map both vocabularies into the shared buckets")
        void shouldBucketAcrossVocabularies() {
            // Act
            InteractionDTO.CheckResult result = service.checkInteractions(
                List.of("spironolactone", "lisinopril", "sotalol"), List.of("hyperkalemia"), List.of("test_allergen"));

            // Assert
            assertEquals(1, result.getSummary().getContraindicated());
            assertEquals(2, result.getSummary().getMajor());
            assertEquals(0, result.getSummary().getModerate());
            assertEquals(2, result.getSummary().getMinor());
        }

        @Test
        @DisplayName("Should sort each finding list most severe first")
        void shouldSortFindings() {
            InteractionDTO.CheckResult result = service.checkInteractions(
                List.of("spironolactone", "lisinopril", "sotalol"), List.of(), List.of("test_allergen"));

            assertEquals(InteractionSeverity.CONTRAINDICATED, result.getDrugDrugInteractions().get(0).getSeverity());
            assertEquals(InteractionSeverity.MINOR, result.getDrugDrugInteractions().get(1).getSeverity());
            assertEquals(AllergySeverity.SEVERE, result.getAllergyAlerts().get(0).getSeverity());
            assertEquals(AllergySeverity.MILD, result.getAllergyAlerts().get(1).getSeverity());
        }

        @Test
        @DisplayName("Should place findings without a severity last instead of failing")
        void shouldToleratePairWithoutSeverity() {
            // Arrange
            InteractionKnowledgeBase partial = InteractionKnowledgeBase.builder()
                .version("partial")
                .drugInteraction(DrugInteraction.builder().drugA("warfarin").drugB("aspirin").build())
                .drugInteraction(DrugInteraction.builder()
                    .drugA("warfarin").drugB("ibuprofen").severity(InteractionSeverity.MAJOR).build())
                .build();
            service.replaceKnowledgeBase(partial);

            // Act
            InteractionDTO.CheckResult result = service.checkInteractions(
                List.of("warfarin", "aspirin", "ibuprofen"), List.of(), List.of());

            // Assert
            assertEquals(2, result.getDrugDrugInteractions().size());
            assertEquals(InteractionSeverity.MAJOR, result.getDrugDrugInteractions().get(0).getSeverity());
            assertNull(result.getDrugDrugInteractions().get(1).getSeverity());
            assertEquals(1, result.getSummary().getMajor());
        }
    }

    @Nested
    @DisplayName("lookupRenalDose()")
    class RenalLookupTests {

        @Test
        @DisplayName("Should return the dose for the patient's eGFR band")
        void shouldReturnBandDose() {
            Optional<InteractionDTO.RenalDoseLookup> lookup = service.lookupRenalDose("Metformin", 20.0, false);

            assertTrue(lookup.isPresent());
            assertEquals(RenalFunctionBand.EGFR_15_29, lookup.get().getBand());
            assertEquals(lookup.get().getAdjustment().getEgfr15to29(), lookup.get().getApplicableDose());
            assertEquals(20.0, lookup.get().getPatientEgfr());
            assertFalse(lookup.get().isOnDialysis());
        }

        @Test
        @DisplayName("Should use the dialysis dose for patients on dialysis")
        void shouldUseDialysisDose() {
            InteractionDTO.RenalDoseLookup lookup = service.lookupRenalDose("gabapentin", 8.0, true).orElseThrow();

            assertEquals(RenalFunctionBand.DIALYSIS, lookup.getBand());
            assertEquals(lookup.getAdjustment().getDialysis(), lookup.getApplicableDose());
            assertTrue(lookup.isOnDialysis());
        }

        @Test
        @DisplayName("Should return empty for unknown or blank drugs")
        void shouldReturnEmptyForUnknownDrug() {
            assertTrue(service.lookupRenalDose("unobtainium", 20.0, false).isEmpty());
            assertTrue(service.lookupRenalDose(" ", 20.0, false).isEmpty());
            assertTrue(service.lookupRenalDose(null, 20.0, false).isEmpty());
        }
    }

    @Test
    @DisplayName("Should expose the drug classes of the terminology index")
    void shouldExposeDrugClasses() {
        assertTrue(service.getDrugClasses().get("nsaids").contains("ibuprofen"));
    }

    @Test
    @DisplayName("Should use replaced tables for later checks")
    void shouldReplaceKnowledgeBase() {
        // Arrange
        List<String> medications = List.of("amoxicillin");
        List<String> allergies = List.of("penicillin");
        assertEquals(1, service.checkInteractions(medications, List.of(), allergies).getAllergyAlerts().size());

        // Act
        service.replaceKnowledgeBase(InteractionKnowledgeBase.empty());

        // Assert
        assertTrue(service.checkInteractions(medications, List.of(), allergies).getAllergyAlerts().isEmpty());
    }
}
