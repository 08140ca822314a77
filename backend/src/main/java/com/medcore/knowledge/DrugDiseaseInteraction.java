package com.medcore.knowledge;

import com.medcore.model.InteractionSeverity;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class DrugDiseaseInteraction {
    String drug;
    String condition;
    InteractionSeverity severity;
    String mechanism;
    String effect;
    String management;
}
