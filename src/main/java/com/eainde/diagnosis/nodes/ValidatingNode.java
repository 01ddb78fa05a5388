package com.eainde.diagnosis.nodes;

import com.eainde.diagnosis.state.DiagnosisState;
import com.eainde.diagnosis.validation.PatientRecordValidator;
import com.eainde.diagnosis.workflow.Stages;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Log4j2
@Component
public class ValidatingNode implements AsyncNodeAction<DiagnosisState> {

    private final PatientRecordValidator validator;

    public ValidatingNode(PatientRecordValidator validator) {
        this.validator = validator;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(DiagnosisState state) {
        List<String> violations = List.copyOf(validator.violations(state.patient()));
        if (violations.isEmpty()) {
            log.info("Stage {}: patient record accepted", Stages.VALIDATING);
        } else {
            log.warn("Stage {}: {} violation(s) found", Stages.VALIDATING, violations.size());
        }
        return CompletableFuture.completedFuture(Map.of(
                DiagnosisState.VIOLATIONS, violations,
                DiagnosisState.STAGE, Stages.VALIDATING));
    }
}
