package com.medcore.knowledge;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Immutable set of the four interaction tables consulted by the interaction check.
 *
 * One instance is shared by every concurrent check; replacing the tables means
 * publishing a new instance through {@link KnowledgeSnapshotHolder}.
 */
@Value
@Builder
public class InteractionKnowledgeBase {
    String version;
    @Singular
    List<DrugInteraction> drugInteractions;
    @Singular
    List<DrugDiseaseInteraction> drugDiseaseInteractions;
    @Singular
    List<AllergyCrossReactivity> allergyCrossReactivities;
    @Singular
    List<RenalDoseAdjustment> renalDoseAdjustments;

    public static InteractionKnowledgeBase empty() {
        return InteractionKnowledgeBase.builder().version("empty").build();
    }
}
