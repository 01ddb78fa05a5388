package com.eainde.diagnosis.nodes;

import com.eainde.diagnosis.model.ReviewerOpinion;
import com.eainde.diagnosis.reviewer.ClinicalReviewer;
import com.eainde.diagnosis.state.DiagnosisState;
import com.eainde.diagnosis.workflow.Stages;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Asks the clinical reviewer for an independent opinion. A reviewer failure never
 * fails the graph: the state simply carries no opinion.
 */
@Log4j2
@Component
public class ReviewingNode implements AsyncNodeAction<DiagnosisState> {

    private final ClinicalReviewer reviewer;

    public ReviewingNode(ClinicalReviewer reviewer) {
        this.reviewer = reviewer;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(DiagnosisState state) {
        Optional<ReviewerOpinion> opinion;
        try {
            opinion = reviewer.review(state.classifierOpinion(), state.patient());
        } catch (RuntimeException e) {
            log.error("Stage {}: reviewer failed, continuing with the classifier only", Stages.REVIEWING, e);
            opinion = Optional.empty();
        }

        Map<String, Object> update = new HashMap<>();
        update.put(DiagnosisState.STAGE, Stages.REVIEWING);
        if (opinion.isPresent()) {
            log.info("Stage {}: reviewer says '{}' (verdict '{}', certainty {}{})", Stages.REVIEWING,
                    opinion.get().diagnosis(), opinion.get().validationVerdict(), opinion.get().certainty(),
                    opinion.get().fallback() ? ", fallback" : "");
            update.put(DiagnosisState.REVIEWER_OPINION, opinion.get());
        } else {
            log.info("Stage {}: no reviewer opinion", Stages.REVIEWING);
        }
        return CompletableFuture.completedFuture(update);
    }
}
