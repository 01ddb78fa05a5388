package com.eainde.diagnosis.workflow;

import com.eainde.diagnosis.edges.ClassifierRoutingEdge;
import com.eainde.diagnosis.edges.ValidationRoutingEdge;
import com.eainde.diagnosis.nodes.ClassifyingNode;
import com.eainde.diagnosis.nodes.FailedNode;
import com.eainde.diagnosis.nodes.PlanningNode;
import com.eainde.diagnosis.nodes.ReconcilingNode;
import com.eainde.diagnosis.nodes.ReviewingNode;
import com.eainde.diagnosis.nodes.ScoringNode;
import com.eainde.diagnosis.nodes.ValidatingNode;
import com.eainde.diagnosis.state.DiagnosisState;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.StateGraph;
import org.springframework.context.annotation.Bean;
import org.springframework.stereotype.Component;

import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;

/**
 * Wires the diagnosis pipeline:
 * <pre>
 * validating  -valid->    classifying
 * validating  -invalid->  failed -> END
 * classifying -review->   reviewing -> reconciling -> scoring -> planning -> END
 * classifying -degraded-> scoring -> planning -> END
 * </pre>
 * No node is visited twice.
 */
@Component
public class DiagnosisWorkflowGraph {

    private final ValidatingNode validatingNode;
    private final ClassifyingNode classifyingNode;
    private final ReviewingNode reviewingNode;
    private final ReconcilingNode reconcilingNode;
    private final ScoringNode scoringNode;
    private final PlanningNode planningNode;
    private final FailedNode failedNode;
    private final ValidationRoutingEdge validationRouting;
    private final ClassifierRoutingEdge classifierRouting;

    public DiagnosisWorkflowGraph(
            ValidatingNode validatingNode,
            ClassifyingNode classifyingNode,
            ReviewingNode reviewingNode,
            ReconcilingNode reconcilingNode,
            ScoringNode scoringNode,
            PlanningNode planningNode,
            FailedNode failedNode,
            ValidationRoutingEdge validationRouting,
            ClassifierRoutingEdge classifierRouting) {
        this.validatingNode = validatingNode;
        this.classifyingNode = classifyingNode;
        this.reviewingNode = reviewingNode;
        this.reconcilingNode = reconcilingNode;
        this.scoringNode = scoringNode;
        this.planningNode = planningNode;
        this.failedNode = failedNode;
        this.validationRouting = validationRouting;
        this.classifierRouting = classifierRouting;
    }

    @Bean("diagnosisWorkflow")
    public CompiledGraph<DiagnosisState> build() throws GraphStateException {

        StateGraph<DiagnosisState> workflow = new StateGraph<>(DiagnosisState::new);

        workflow.addNode(Stages.VALIDATING, validatingNode);
        workflow.addNode(Stages.CLASSIFYING, classifyingNode);
        workflow.addNode(Stages.REVIEWING, reviewingNode);
        workflow.addNode(Stages.RECONCILING, reconcilingNode);
        workflow.addNode(Stages.SCORING, scoringNode);
        workflow.addNode(Stages.PLANNING, planningNode);
        workflow.addNode(Stages.FAILED, failedNode);

        workflow.addEdge(START, Stages.VALIDATING);
        workflow.addConditionalEdges(
                Stages.VALIDATING,
                validationRouting,
                Map.of(
                        ValidationRoutingEdge.VALID, Stages.CLASSIFYING,
                        ValidationRoutingEdge.INVALID, Stages.FAILED
                )
        );
        workflow.addConditionalEdges(
                Stages.CLASSIFYING,
                classifierRouting,
                Map.of(
                        ClassifierRoutingEdge.REVIEW, Stages.REVIEWING,
                        ClassifierRoutingEdge.DEGRADED, Stages.SCORING
                )
        );
        workflow.addEdge(Stages.REVIEWING, Stages.RECONCILING);
        workflow.addEdge(Stages.RECONCILING, Stages.SCORING);
        workflow.addEdge(Stages.SCORING, Stages.PLANNING);
        workflow.addEdge(Stages.PLANNING, END);
        workflow.addEdge(Stages.FAILED, END);

        return workflow.compile();
    }
}
