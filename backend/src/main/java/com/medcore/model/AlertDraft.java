package com.medcore.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Alert content produced by a rule's generator, before the engine attaches
 * identity, patient and timestamp.
 */
@Value
@Builder
public class AlertDraft {
    AlertCategory category;
    AlertSeverity severity;
    String title;
    String message;
    GuidelineSource guidelineSource;
    String guidelineReference;
    @Singular
    List<String> recommendations;
    @Singular("datum")
    Map<String, Object> data;
}
