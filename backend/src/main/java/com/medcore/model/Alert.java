package com.medcore.model;

import lombok.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Clinician-facing CDSS alert.
 *
 * The engine fills everything up to {@code createdAt}. Expiry, acknowledgment and
 * resolution fields belong to whoever persists and manages the alert afterwards.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Alert {

    private String id;
    private String ruleId;
    private String patientId;
    private AlertCategory category;
    private AlertSeverity severity;
    private String title;
    private String message;
    private GuidelineSource guidelineSource;
    private String guidelineReference;
    private List<String> recommendations;
    private Map<String, Object> data;
    private Instant createdAt;

    private Instant expiresAt;
    private Instant acknowledgedAt;
    private String acknowledgedBy;
    private Instant resolvedAt;
    private String resolvedBy;

    /**
     * Materializes a rule's draft. The id is {@code <ruleId>-<epochMillis>} so that an
     * alert can be traced back to the rule and the evaluation that produced it.
     */
    public static Alert fromDraft(AlertDraft draft, String ruleId, String patientId, Instant evaluatedAt) {
        Objects.requireNonNull(draft, "Rule " + ruleId + " produced no alert");
        Objects.requireNonNull(draft.getSeverity(), "Rule " + ruleId + " produced an alert without severity");

        return Alert.builder()
            .id(ruleId + "-" + evaluatedAt.toEpochMilli())
            .ruleId(ruleId)
            .patientId(patientId)
            .category(draft.getCategory())
            .severity(draft.getSeverity())
            .title(draft.getTitle())
            .message(draft.getMessage())
            .guidelineSource(draft.getGuidelineSource())
            .guidelineReference(draft.getGuidelineReference())
            .recommendations(draft.getRecommendations())
            .data(draft.getData())
            .createdAt(evaluatedAt)
            .build();
    }
}
