package com.eainde.diagnosis.config;

import com.eainde.diagnosis.classifier.DiseaseClassifier;
import com.eainde.diagnosis.classifier.FileSystemModelStore;
import com.eainde.diagnosis.classifier.ModelStore;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ClassifierConfig {

    @Bean
    public ObjectMapper objectMapper() {
        return JsonMapper.builder()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    @Bean
    public ModelStore modelStore(DiagnosisProperties properties, ObjectMapper objectMapper) {
        return new FileSystemModelStore(properties.model().directory(), objectMapper);
    }

    /**
     * Loads the artifacts once. A failed load leaves the classifier in degraded mode
     * instead of stopping the application.
     */
    @Bean
    public DiseaseClassifier diseaseClassifier(ModelStore modelStore) {
        return new DiseaseClassifier(modelStore);
    }
}
