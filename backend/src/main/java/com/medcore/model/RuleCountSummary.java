package com.medcore.model;

import lombok.Value;

import java.util.Map;

@Value
public class RuleCountSummary {
    int total;
    Map<ClinicalModule, Integer> byModule;
}
