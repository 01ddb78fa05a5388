package com.eainde.diagnosis.nodes;

import com.eainde.diagnosis.state.DiagnosisState;
import com.eainde.diagnosis.workflow.Stages;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Terminal node for rejected records. The orchestrator turns the stored
 * violations into a {@link com.eainde.diagnosis.exception.ValidationException}.
 */
@Log4j2
@Component
public class FailedNode implements AsyncNodeAction<DiagnosisState> {

    @Override
    public CompletableFuture<Map<String, Object>> apply(DiagnosisState state) {
        log.warn("Diagnosis rejected: {}", String.join("; ", state.violations()));
        return CompletableFuture.completedFuture(DiagnosisState.updateStage(Stages.FAILED));
    }
}
