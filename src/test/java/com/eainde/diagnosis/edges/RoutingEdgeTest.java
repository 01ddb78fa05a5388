package com.eainde.diagnosis.edges;

import com.eainde.diagnosis.state.DiagnosisState;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RoutingEdgeTest {

    @Test
    void validationRoutesOnViolations() throws Exception {
        ValidationRoutingEdge edge = new ValidationRoutingEdge();

        assertThat(edge.apply(new DiagnosisState(Map.of())).get()).isEqualTo(ValidationRoutingEdge.VALID);
        assertThat(edge.apply(new DiagnosisState(Map.of(
                DiagnosisState.VIOLATIONS, List.of("Heart rate must be between 40 and 200 bpm (was 250)")))).get())
                .isEqualTo(ValidationRoutingEdge.INVALID);
    }

    @Test
    void classifierRoutesOnAvailability() throws Exception {
        ClassifierRoutingEdge edge = new ClassifierRoutingEdge();

        assertThat(edge.apply(new DiagnosisState(Map.of(DiagnosisState.CLASSIFIER_AVAILABLE, true))).get())
                .isEqualTo(ClassifierRoutingEdge.REVIEW);
        assertThat(edge.apply(new DiagnosisState(Map.of(DiagnosisState.CLASSIFIER_AVAILABLE, false))).get())
                .isEqualTo(ClassifierRoutingEdge.DEGRADED);
        assertThat(edge.apply(new DiagnosisState(Map.of())).get())
                .isEqualTo(ClassifierRoutingEdge.DEGRADED);
    }
}
