package com.medcore.model;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.medcore.model.ClinicalSnapshot.DialysisProfile;
import com.medcore.model.ClinicalSnapshot.Labs;

@DisplayName("ClinicalSnapshot Tests")
class ClinicalSnapshotTest {

    @Test
    @DisplayName("Should return empty when the section is missing")
    void shouldReturnEmptyForMissingSection() {
        ClinicalSnapshot snapshot = ClinicalSnapshot.builder().patientId("p-1").build();

        assertEquals(Optional.empty(), snapshot.lab(Labs::getPotassium));
        assertFalse(snapshot.isOnDialysis());
        assertFalse(snapshot.hasCondition("diabetes"));
    }

    @Test
    @DisplayName("Should return empty when the value inside a section is missing")
    void shouldReturnEmptyForMissingValue() {
        ClinicalSnapshot snapshot = ClinicalSnapshot.builder()
            .labs(Labs.builder().hemoglobin(11.0).build())
            .dialysis(DialysisProfile.builder().ktv(1.1).build())
            .build();

        assertEquals(Optional.of(11.0), snapshot.lab(Labs::getHemoglobin));
        assertTrue(snapshot.lab(Labs::getPotassium).isEmpty());
        assertFalse(snapshot.isOnDialysis());
    }

    @Test
    @DisplayName("Should match condition tags case-insensitively and skip null entries")
    void shouldMatchConditionTags() {
        ClinicalSnapshot snapshot = ClinicalSnapshot.builder()
            .conditions(Arrays.asList(" Diabetes ", null, "tia"))
            .build();

        assertTrue(snapshot.hasCondition("diabetes"));
        assertTrue(snapshot.hasCondition("TIA"));
        assertFalse(snapshot.hasCondition("stroke"));
        assertFalse(snapshot.hasCondition("diab"));
    }

    @Test
    @DisplayName("Should count critical and contraindicated alerts together")
    void shouldSummarizeAlerts() {
        List<Alert> alerts = List.of(
            Alert.builder().severity(AlertSeverity.CONTRAINDICATED).build(),
            Alert.builder().severity(AlertSeverity.CRITICAL).build(),
            Alert.builder().severity(AlertSeverity.WARNING).build(),
            Alert.builder().severity(AlertSeverity.INFO).build(),
            Alert.builder().severity(AlertSeverity.INFO).build());

        EvaluationResult.Summary summary = EvaluationResult.Summary.of(alerts);

        assertEquals(2, summary.getCritical());
        assertEquals(1, summary.getWarning());
        assertEquals(2, summary.getInfo());
    }
}
