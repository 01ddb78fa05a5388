package com.eainde.diagnosis.edges;

import com.eainde.diagnosis.state.DiagnosisState;
import org.bsc.langgraph4j.action.AsyncEdgeAction;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

@Component
public class ValidationRoutingEdge implements AsyncEdgeAction<DiagnosisState> {

    public static final String VALID = "valid";
    public static final String INVALID = "invalid";

    @Override
    public CompletableFuture<String> apply(DiagnosisState state) {
        return CompletableFuture.completedFuture(state.violations().isEmpty() ? VALID : INVALID);
    }
}
