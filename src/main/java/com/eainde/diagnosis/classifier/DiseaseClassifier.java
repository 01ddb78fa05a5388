package com.eainde.diagnosis.classifier;

import com.eainde.diagnosis.exception.ModelStoreException;
import com.eainde.diagnosis.exception.ModelUnavailableException;
import com.eainde.diagnosis.exception.PredictionException;
import com.eainde.diagnosis.model.ClassifierOpinion;
import com.eainde.diagnosis.model.FeatureVector;
import lombok.extern.log4j.Log4j2;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Adapter around the pre-trained classifier.
 *
 * <p>Artifacts are loaded exactly once, in the constructor. If that fails the
 * classifier stays unavailable for the lifetime of the process and every
 * {@link #predict} call throws {@link ModelUnavailableException}; nothing is retried.
 * The loaded artifacts are never mutated and are shared by all requests.</p>
 */
@Log4j2
public class DiseaseClassifier {

    private final ModelArtifacts artifacts;

    public DiseaseClassifier(ModelStore modelStore) {
        this.artifacts = loadOrNull(modelStore);
    }

    private static ModelArtifacts loadOrNull(ModelStore modelStore) {
        try {
            return modelStore.load();
        } catch (ModelStoreException e) {
            log.error("Classifier artifacts could not be loaded, running in degraded mode", e);
            return null;
        }
    }

    public boolean isAvailable() {
        return artifacts != null;
    }

    /**
     * Feature names the loaded model expects, in order. Empty when unavailable.
     */
    public List<String> featureSchema() {
        return artifacts == null ? List.of() : artifacts.featureSchema();
    }

    public int classCount() {
        return artifacts == null ? 0 : artifacts.labelMapping().size();
    }

    /**
     * @throws ModelUnavailableException when no model was loaded at startup
     * @throws PredictionException       when the model fails on this input
     */
    public ClassifierOpinion predict(FeatureVector vector) {
        if (artifacts == null) {
            throw new ModelUnavailableException("No classifier model loaded");
        }
        if (!vector.featureNames().equals(artifacts.featureSchema())) {
            throw new PredictionException("Feature vector does not follow the loaded schema");
        }

        double[] probabilities;
        try {
            probabilities = artifacts.model().predictProba(vector.values());
        } catch (RuntimeException e) {
            throw new PredictionException("Classifier failed: " + e.getMessage(), e);
        }
        if (probabilities == null || probabilities.length == 0) {
            throw new PredictionException("Classifier returned no probabilities");
        }

        int best = 0;
        Map<String, Double> distribution = new LinkedHashMap<>();
        for (int classId = 0; classId < probabilities.length; classId++) {
            distribution.put(labelFor(classId), probabilities[classId]);
            // strict '>' keeps the lowest class id on ties, like numpy argmax
            if (probabilities[classId] > probabilities[best]) {
                best = classId;
            }
        }

        String label = labelFor(best);
        log.debug("Classifier predicted '{}' with p={}", label, probabilities[best]);
        return new ClassifierOpinion(label, clamp(probabilities[best]), distribution);
    }

    private String labelFor(int classId) {
        String raw = artifacts.labelMapping().get(classId);
        return raw == null ? "Unknown" : titleCase(raw);
    }

    static String titleCase(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        boolean startOfWord = true;
        for (char c : text.toLowerCase(Locale.ROOT).toCharArray()) {
            sb.append(startOfWord ? Character.toUpperCase(c) : c);
            startOfWord = !Character.isLetter(c);
        }
        return sb.toString();
    }

    private static double clamp(double p) {
        return Math.max(0.0, Math.min(1.0, p));
    }
}
