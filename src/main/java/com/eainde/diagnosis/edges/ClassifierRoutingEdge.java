package com.eainde.diagnosis.edges;

import com.eainde.diagnosis.state.DiagnosisState;
import org.bsc.langgraph4j.action.AsyncEdgeAction;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Skips the reviewer when no classifier model is loaded; a degraded run goes
 * straight to vitals-only scoring.
 */
@Component
public class ClassifierRoutingEdge implements AsyncEdgeAction<DiagnosisState> {

    public static final String REVIEW = "review";
    public static final String DEGRADED = "degraded";

    @Override
    public CompletableFuture<String> apply(DiagnosisState state) {
        return CompletableFuture.completedFuture(state.classifierAvailable() ? REVIEW : DEGRADED);
    }
}
