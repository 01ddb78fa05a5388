package com.eainde.diagnosis.classifier;

import java.util.List;
import java.util.Map;

/**
 * Everything loaded from the model store at startup.
 *
 * @param model         the trained classifier
 * @param featureSchema feature names in the order the model expects them
 * @param labelMapping  class id to diagnosis name
 */
public record ModelArtifacts(
        ProbabilisticModel model,
        List<String> featureSchema,
        Map<Integer, String> labelMapping
) {
    public ModelArtifacts {
        featureSchema = List.copyOf(featureSchema);
        labelMapping = Map.copyOf(labelMapping);
    }
}
