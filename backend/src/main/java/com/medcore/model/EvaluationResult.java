package com.medcore.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one CDSS evaluation.
 *
 * {@code rulesEvaluated} counts every active rule selected for the call, including
 * rules whose condition or generator failed.
 */
@Value
@Builder
public class EvaluationResult {
    String patientId;
    Instant evaluatedAt;
    int rulesEvaluated;
    List<Alert> alertsGenerated;
    Summary summary;

    @Value
    @Builder
    public static class Summary {
        // critical and contraindicated alerts
        int critical;
        int warning;
        int info;

        public static Summary of(List<Alert> alerts) {
            int critical = 0;
            int warning = 0;
            int info = 0;
            for (Alert alert : alerts) {
                switch (alert.getSeverity()) {
                    case CRITICAL, CONTRAINDICATED -> critical++;
                    case WARNING -> warning++;
                    case INFO -> info++;
                }
            }
            return new Summary(critical, warning, info);
        }
    }
}
