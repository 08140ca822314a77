package com.medcore.knowledge;

import com.medcore.model.InteractionSeverity;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Drug-drug interaction record. Either pattern may be a drug name or a drug class key.
 */
@Value
@Builder
@Jacksonized
public class DrugInteraction {
    String drugA;
    String drugB;
    InteractionSeverity severity;
    String mechanism;
    String effect;
    String management;
    @Singular
    List<String> references;
}
