package com.eainde.diagnosis.nodes;

import com.eainde.diagnosis.engine.SeverityScorer;
import com.eainde.diagnosis.model.SeverityAssessment;
import com.eainde.diagnosis.state.DiagnosisState;
import com.eainde.diagnosis.workflow.Stages;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Log4j2
@Component
public class ScoringNode implements AsyncNodeAction<DiagnosisState> {

    private final SeverityScorer scorer;

    public ScoringNode(SeverityScorer scorer) {
        this.scorer = scorer;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(DiagnosisState state) {
        SeverityAssessment severity = scorer.score(state.patient());
        log.info("Stage {}: {} points, severity {} ({})", Stages.SCORING,
                severity.points(), severity.severityScore(), severity.urgencyLevel().label());
        return CompletableFuture.completedFuture(Map.of(
                DiagnosisState.SEVERITY, severity,
                DiagnosisState.STAGE, Stages.SCORING));
    }
}
