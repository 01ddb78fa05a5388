package com.eainde.diagnosis.nodes;

import com.eainde.diagnosis.classifier.DiseaseClassifier;
import com.eainde.diagnosis.exception.ModelUnavailableException;
import com.eainde.diagnosis.exception.PredictionException;
import com.eainde.diagnosis.features.FeatureVectorizer;
import com.eainde.diagnosis.model.ClassifierOpinion;
import com.eainde.diagnosis.model.FeatureVector;
import com.eainde.diagnosis.state.DiagnosisState;
import com.eainde.diagnosis.workflow.Stages;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Runs the classifier. Never fails the graph: a missing model yields the
 * model-missing sentinel, a failing model the prediction-error opinion.
 */
@Log4j2
@Component
public class ClassifyingNode implements AsyncNodeAction<DiagnosisState> {

    private final FeatureVectorizer vectorizer;
    private final DiseaseClassifier classifier;

    public ClassifyingNode(FeatureVectorizer vectorizer, DiseaseClassifier classifier) {
        this.vectorizer = vectorizer;
        this.classifier = classifier;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(DiagnosisState state) {
        if (!classifier.isAvailable()) {
            log.warn("Stage {}: no classifier model loaded, continuing in degraded mode", Stages.CLASSIFYING);
            return completed(ClassifierOpinion.unavailable(), false);
        }

        FeatureVector vector = vectorizer.vectorize(state.patient(), classifier.featureSchema());
        try {
            ClassifierOpinion opinion = classifier.predict(vector);
            log.info("Stage {}: '{}' (confidence {})", Stages.CLASSIFYING, opinion.label(), opinion.confidence());
            return completed(opinion, true);
        } catch (PredictionException e) {
            log.error("Stage {}: classifier failed on this record", Stages.CLASSIFYING, e);
            return completed(ClassifierOpinion.predictionError(), true);
        } catch (ModelUnavailableException e) {
            log.error("Stage {}: {}", Stages.CLASSIFYING, e.getMessage());
            return completed(ClassifierOpinion.unavailable(), false);
        }
    }

    private static CompletableFuture<Map<String, Object>> completed(ClassifierOpinion opinion, boolean available) {
        return CompletableFuture.completedFuture(Map.of(
                DiagnosisState.CLASSIFIER_OPINION, opinion,
                DiagnosisState.CLASSIFIER_AVAILABLE, available,
                DiagnosisState.STAGE, Stages.CLASSIFYING));
    }
}
