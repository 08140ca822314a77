package com.medcore.knowledge;

import com.medcore.model.AllergySeverity;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class AllergyCrossReactivity {
    String drug;
    String allergen;
    boolean crossReactivity;
    AllergySeverity severity;
    String recommendation;
}
