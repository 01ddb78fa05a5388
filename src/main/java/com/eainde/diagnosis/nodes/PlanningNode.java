package com.eainde.diagnosis.nodes;

import com.eainde.diagnosis.engine.Reconciliation;
import com.eainde.diagnosis.engine.TreatmentPlanAssembler;
import com.eainde.diagnosis.model.FinalDiagnosis;
import com.eainde.diagnosis.model.SeverityAssessment;
import com.eainde.diagnosis.model.TreatmentPlan;
import com.eainde.diagnosis.state.DiagnosisState;
import com.eainde.diagnosis.workflow.Stages;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Attaches the treatment plan and assembles the {@link FinalDiagnosis}.
 * The reviewer is only asked for a plan when the classifier ran, so a degraded
 * run always gets a static protocol.
 */
@Component
public class PlanningNode implements AsyncNodeAction<DiagnosisState> {

    private final TreatmentPlanAssembler assembler;

    public PlanningNode(TreatmentPlanAssembler assembler) {
        this.assembler = assembler;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(DiagnosisState state) {
        Reconciliation consensus = state.reconciled()
                .orElseGet(() -> Reconciliation.classifierOnly(state.classifierOpinion()));
        SeverityAssessment severity = state.severity();

        TreatmentPlan plan = assembler.assemble(consensus.primaryDiagnosis(), severity.severityScore(),
                state.patient(), state.classifierAvailable());

        FinalDiagnosis result = new FinalDiagnosis(
                consensus.primaryDiagnosis(),
                consensus.confidence(),
                consensus.source(),
                severity.severityScore(),
                severity.urgencyLevel(),
                consensus.clinicalReasoning(),
                consensus.differentials(),
                consensus.redFlags(),
                plan);

        return CompletableFuture.completedFuture(Map.of(
                DiagnosisState.TREATMENT_PLAN, plan,
                DiagnosisState.FINAL_DIAGNOSIS, result,
                DiagnosisState.STAGE, Stages.DONE));
    }
}
