package com.eainde.diagnosis.nodes;

import com.eainde.diagnosis.engine.OverrideDecisionEngine;
import com.eainde.diagnosis.engine.Reconciliation;
import com.eainde.diagnosis.state.DiagnosisState;
import com.eainde.diagnosis.workflow.Stages;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Component
public class ReconcilingNode implements AsyncNodeAction<DiagnosisState> {

    private final OverrideDecisionEngine engine;

    public ReconcilingNode(OverrideDecisionEngine engine) {
        this.engine = engine;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(DiagnosisState state) {
        Reconciliation reconciliation = engine.reconcile(state.classifierOpinion(), state.reviewerOpinion());
        return CompletableFuture.completedFuture(Map.of(
                DiagnosisState.RECONCILED, reconciliation,
                DiagnosisState.STAGE, Stages.RECONCILING));
    }
}
