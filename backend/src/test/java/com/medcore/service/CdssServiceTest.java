package com.medcore.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.medcore.knowledge.KnowledgeSnapshotHolder;
import com.medcore.model.*;
import com.medcore.model.ClinicalSnapshot.DialysisProfile;
import com.medcore.model.ClinicalSnapshot.Labs;
import com.medcore.rules.GuidelineRuleRegistry;
import com.medcore.rules.GuidelineRules;

/**
 * Unit tests for CdssService
 *
 * Covers rule selection, failure isolation, severity ordering and the
 * evaluation summary.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("CdssService Tests")
class CdssServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    @Mock
    private Predicate<ClinicalSnapshot> brokenCondition;

    private KnowledgeSnapshotHolder<GuidelineRuleRegistry> holder;
    private CdssService cdssService;

    @BeforeEach
    void setUp() {
        holder = new KnowledgeSnapshotHolder<>("rules", GuidelineRules.defaultRegistry());
        cdssService = new CdssService(holder, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static ClinicalSnapshot inadequateDialysis() {
        return ClinicalSnapshot.builder()
            .patientId("patient-42")
            .dialysis(DialysisProfile.builder().onDialysis(true).ktv(0.9).build())
            .build();
    }

    private static CdssRule fixedRule(String id, AlertSeverity severity) {
        return CdssRule.builder()
            .id(id)
            .module(ClinicalModule.GENERAL)
            .condition(s -> true)
            .alertGenerator(s -> AlertDraft.builder()
                .category(AlertCategory.REMINDER)
                .severity(severity)
                .title(id)
                .build())
            .build();
    }

    @Nested
    @DisplayName("evaluate() with the default rule set")
    class DefaultRuleSetTests {

        @Test
        @DisplayName("Should raise a critical Kt/V alert for inadequate dialysis")
        void shouldRaiseCriticalKtvAlert() {
            // Act
            EvaluationResult result = cdssService.evaluate(inadequateDialysis());

            // Assert
            assertEquals("patient-42", result.getPatientId());
            assertEquals(NOW, result.getEvaluatedAt());
            assertEquals(15, result.getRulesEvaluated());
            assertEquals(1, result.getAlertsGenerated().size());

            Alert alert = result.getAlertsGenerated().get(0);
            assertEquals(AlertSeverity.CRITICAL, alert.getSeverity());
            assertTrue(alert.getTitle().contains("Kt/V"));
            assertEquals("kdigo-ktv-001", alert.getRuleId());
            assertEquals("kdigo-ktv-001-" + NOW.toEpochMilli(), alert.getId());
            assertEquals("patient-42", alert.getPatientId());
            assertEquals(NOW, alert.getCreatedAt());
            assertEquals(1, result.getSummary().getCritical());
        }

        @Test
        @DisplayName("Should return no alerts for an empty snapshot")
        void shouldReturnNoAlertsForEmptySnapshot() {
            ClinicalSnapshot empty = ClinicalSnapshot.builder().patientId("patient-0").build();

            EvaluationResult result = cdssService.evaluate(empty);

            assertTrue(result.getAlertsGenerated().isEmpty());
            assertEquals(15, result.getRulesEvaluated());
            assertEquals(0, result.getSummary().getCritical());
            assertEquals(0, result.getSummary().getWarning());
            assertEquals(0, result.getSummary().getInfo());
        }

        @Test
        @DisplayName("Should order critical alerts before warnings, ties in registry order")
        void shouldOrderBySeverity() {
            // Arrange
            ClinicalSnapshot snapshot = ClinicalSnapshot.builder()
                .patientId("patient-7")
                .labs(Labs.builder().hemoglobin(9.0).potassium(7.0).hba1c(9.0).build())
                .dialysis(DialysisProfile.builder().onDialysis(true).ktv(0.9).build())
                .build();

            // Act
            EvaluationResult result = cdssService.evaluate(snapshot);

            // Assert
            List<String> ruleIds = result.getAlertsGenerated().stream().map(Alert::getRuleId).toList();
            assertEquals(List.of("kdigo-ktv-001", "kdigo-potassium-001", "kdigo-anemia-001", "safety-glucose-001"),
                ruleIds);
            assertEquals(2, result.getSummary().getCritical());
            assertEquals(2, result.getSummary().getWarning());
        }

        @Test
        @DisplayName("Should give identical results for repeated evaluations")
        void shouldBeDeterministic() {
            ClinicalSnapshot snapshot = ClinicalSnapshot.builder()
                .patientId("patient-7")
                .labs(Labs.builder().hemoglobin(9.0).potassium(7.0).egfr(20.0).build())
                .build();

            EvaluationResult first = cdssService.evaluate(snapshot);
            EvaluationResult second = cdssService.evaluate(snapshot);

            assertEquals(first, second);
        }
    }

    @Nested
    @DisplayName("evaluate() with a module filter")
    class ModuleFilterTests {

        @Test
        @DisplayName("Should only run the module rules plus general rules")
        void shouldScopeToModule() {
            EvaluationResult result = cdssService.evaluate(inadequateDialysis(), ClinicalModule.CARDIOLOGY);

            assertEquals(7, result.getRulesEvaluated());
            assertTrue(result.getAlertsGenerated().isEmpty());
        }

        @Test
        @DisplayName("Should include general rules in a module evaluation")
        void shouldIncludeGeneralRules() {
            ClinicalSnapshot snapshot = ClinicalSnapshot.builder()
                .patientId("patient-9")
                .labs(Labs.builder().egfr(12.0).build())
                .build();

            EvaluationResult result = cdssService.evaluate(snapshot, ClinicalModule.OPHTHALMOLOGY);

            assertEquals(5, result.getRulesEvaluated());
            assertEquals(1, result.getAlertsGenerated().size());
            assertEquals("safety-egfr-001", result.getAlertsGenerated().get(0).getRuleId());
        }

        @Test
        @DisplayName("Should skip rules that are switched off")
        void shouldSkipInactiveRules() {
            cdssService.replaceRules(GuidelineRules.defaultRegistry().withDisabled(Set.of("kdigo-ktv-001")));

            EvaluationResult result = cdssService.evaluate(inadequateDialysis(), ClinicalModule.DIALYSE);

            assertEquals(6, result.getRulesEvaluated());
            assertTrue(result.getAlertsGenerated().isEmpty());
        }
    }

    @Nested
    @DisplayName("Rule failure isolation")
    class FailureIsolationTests {

        @Test
        @DisplayName("Should keep other alerts when a rule condition throws")
        void shouldIsolateThrowingCondition() {
            // Arrange
            when(brokenCondition.test(any())).thenThrow(new IllegalStateException("boom"));
            CdssRule broken = CdssRule.builder()
                .id("broken-001")
                .module(ClinicalModule.GENERAL)
                .condition(brokenCondition)
                .alertGenerator(s -> AlertDraft.builder().severity(AlertSeverity.CRITICAL).build())
                .build();
            List<CdssRule> healthy = List.of(fixedRule("a-001", AlertSeverity.WARNING), fixedRule("b-001", AlertSeverity.CRITICAL));

            cdssService.replaceRules(new GuidelineRuleRegistry(healthy));
            List<String> expected = cdssService.evaluate(inadequateDialysis()).getAlertsGenerated().stream()
                .map(Alert::getRuleId).toList();

            cdssService.replaceRules(new GuidelineRuleRegistry(List.of(healthy.get(0), broken, healthy.get(1))));

            // Act
            EvaluationResult result = cdssService.evaluate(inadequateDialysis());

            // Assert
            assertEquals(List.of("b-001", "a-001"), expected);
            assertEquals(expected, result.getAlertsGenerated().stream().map(Alert::getRuleId).toList());
            assertEquals(3, result.getRulesEvaluated());
            verify(brokenCondition).test(any());
        }

        @Test
        @DisplayName("Should keep other alerts when an alert generator throws")
        void shouldIsolateThrowingGenerator() {
            CdssRule broken = CdssRule.builder()
                .id("broken-002")
                .module(ClinicalModule.GENERAL)
                .condition(s -> true)
                .alertGenerator(s -> {
                    throw new IllegalStateException("generator failed");
                })
                .build();
            cdssService.replaceRules(new GuidelineRuleRegistry(List.of(broken, fixedRule("a-001", AlertSeverity.INFO))));

            EvaluationResult result = cdssService.evaluate(inadequateDialysis());

            assertEquals(1, result.getAlertsGenerated().size());
            assertEquals("a-001", result.getAlertsGenerated().get(0).getRuleId());
            assertEquals(2, result.getRulesEvaluated());
        }

        @Test
        @DisplayName("Should drop alerts generated without a severity")
        void shouldDropAlertWithoutSeverity() {
            CdssRule incomplete = CdssRule.builder()
                .id("incomplete-001")
                .module(ClinicalModule.GENERAL)
                .condition(s -> true)
                .alertGenerator(s -> AlertDraft.builder().title("no severity").build())
                .build();
            cdssService.replaceRules(new GuidelineRuleRegistry(List.of(incomplete)));

            EvaluationResult result = cdssService.evaluate(inadequateDialysis());

            assertTrue(result.getAlertsGenerated().isEmpty());
            assertEquals(1, result.getRulesEvaluated());
        }
    }

    @Test
    @DisplayName("Should rank contraindicated alerts before critical ones")
    void shouldRankContraindicatedFirst() {
        cdssService.replaceRules(new GuidelineRuleRegistry(List.of(
            fixedRule("info-001", AlertSeverity.INFO),
            fixedRule("critical-001", AlertSeverity.CRITICAL),
            fixedRule("contra-001", AlertSeverity.CONTRAINDICATED))));

        EvaluationResult result = cdssService.evaluate(inadequateDialysis());

        assertEquals(List.of("contra-001", "critical-001", "info-001"),
            result.getAlertsGenerated().stream().map(Alert::getRuleId).toList());
        assertEquals(2, result.getSummary().getCritical());
        assertEquals(1, result.getSummary().getInfo());
    }

    @Test
    @DisplayName("Should expose rules and active counts of the current registry")
    void shouldExposeRegistry() {
        assertEquals(7, cdssService.getRules(ClinicalModule.DIALYSE).size());
        assertEquals(15, cdssService.getActiveRulesCount().getTotal());
    }
}
