package com.medcore.service;

import com.medcore.knowledge.KnowledgeSnapshotHolder;
import com.medcore.model.*;
import com.medcore.rules.GuidelineRuleRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Clinical decision support engine: runs the guideline rules against a patient
 * snapshot and returns the alerts they raise, most severe first.
 *
 * A rule that throws is logged and skipped; it never suppresses the other rules.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CdssService {

    private final KnowledgeSnapshotHolder<GuidelineRuleRegistry> ruleRegistry;
    private final Clock clock;

    public EvaluationResult evaluate(ClinicalSnapshot snapshot) {
        return evaluate(snapshot, null);
    }

    /**
     * @param module restricts evaluation to that module's rules plus the general ones;
     *               null evaluates every module
     */
    public EvaluationResult evaluate(ClinicalSnapshot snapshot, ClinicalModule module) {
        GuidelineRuleRegistry registry = ruleRegistry.current();
        List<CdssRule> rules = registry.activeRules(module);
        Instant evaluatedAt = clock.instant();
        String patientId = snapshot.getPatientId();

        List<Alert> alerts = new ArrayList<>();
        for (CdssRule rule : rules) {
            try {
                if (rule.appliesTo(snapshot)) {
                    alerts.add(Alert.fromDraft(rule.generateAlert(snapshot), rule.getId(), patientId, evaluatedAt));
                }
            } catch (Exception e) {
                log.error("Error evaluating rule {}: {}", rule.getId(), e.getMessage(), e);
            }
        }

        alerts.sort(RankedSeverity.mostSevereFirst(Alert::getSeverity));

        log.debug("CDSS evaluation for patient {}: {} rules evaluated, {} alerts",
            patientId, rules.size(), alerts.size());

        return EvaluationResult.builder()
            .patientId(patientId)
            .evaluatedAt(evaluatedAt)
            .rulesEvaluated(rules.size())
            .alertsGenerated(List.copyOf(alerts))
            .summary(EvaluationResult.Summary.of(alerts))
            .build();
    }

    public List<CdssRule> getRules(ClinicalModule module) {
        return ruleRegistry.current().getRules(module);
    }

    public RuleCountSummary getActiveRulesCount() {
        return ruleRegistry.current().getActiveRulesCount();
    }

    /**
     * Atomically replaces the rule set. Evaluations already running finish on the old one.
     */
    public void replaceRules(GuidelineRuleRegistry registry) {
        GuidelineRuleRegistry previous = ruleRegistry.publish(registry);
        log.info("CDSS rule set replaced: {} -> {} rules", previous.size(), registry.size());
    }
}
