package com.eainde.diagnosis.classifier;

import com.eainde.diagnosis.TestPatients;
import com.eainde.diagnosis.exception.ModelStoreException;
import com.eainde.diagnosis.exception.ModelUnavailableException;
import com.eainde.diagnosis.exception.PredictionException;
import com.eainde.diagnosis.features.FeatureVectorizer;
import com.eainde.diagnosis.model.ClassifierOpinion;
import com.eainde.diagnosis.model.FeatureVector;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class DiseaseClassifierTest {

    private final FeatureVectorizer vectorizer = new FeatureVectorizer();

    private DiseaseClassifier fixtureClassifier() {
        return new DiseaseClassifier(new FileSystemModelStore(ModelFixtures.modelDirectory(), new ObjectMapper()));
    }

    // =========================================================================
    //  Loaded model
    // =========================================================================

    @Nested
    @DisplayName("With a loaded model")
    class Loaded {

        private final DiseaseClassifier classifier = fixtureClassifier();

        @Test
        @DisplayName("should report availability and schema")
        void available() {
            assertThat(classifier.isAvailable()).isTrue();
            assertThat(classifier.featureSchema()).hasSize(5);
            assertThat(classifier.classCount()).isEqualTo(3);
        }

        @Test
        @DisplayName("fever with hypoxia should predict title-cased Pneumonia")
        void predictsPneumonia() {
            FeatureVector vector = vectorizer.vectorize(TestPatients.septicShock(), classifier.featureSchema());

            ClassifierOpinion opinion = classifier.predict(vector);

            assertThat(opinion.label()).isEqualTo("Pneumonia");
            assertThat(opinion.confidence()).isCloseTo(0.70, within(1e-9));
            assertThat(opinion.probabilities().keySet())
                    .containsExactly("Pneumonia", "Myocardial Infarction", "Cardiovascular");
            assertThat(opinion.probabilities().values().stream().mapToDouble(Double::doubleValue).sum())
                    .isCloseTo(1.0, within(1e-9));
        }

        @Test
        @DisplayName("tachycardia without fever should predict Myocardial Infarction")
        void predictsInfarction() {
            FeatureVector vector = vectorizer.vectorize(TestPatients.tachycardic(), classifier.featureSchema());

            ClassifierOpinion opinion = classifier.predict(vector);

            assertThat(opinion.label()).isEqualTo("Myocardial Infarction");
            assertThat(opinion.confidence()).isCloseTo(0.50, within(1e-9));
        }

        @Test
        @DisplayName("a vector built for another schema should be a prediction error")
        void wrongSchema() {
            FeatureVector vector = new FeatureVector(List.of("temperature"), new double[]{37.0});

            assertThatThrownBy(() -> classifier.predict(vector)).isInstanceOf(PredictionException.class);
        }
    }

    // =========================================================================
    //  Failure modes
    // =========================================================================

    @Nested
    @DisplayName("Failure modes")
    class Failures {

        @Test
        @DisplayName("failed load should leave the classifier unavailable")
        void unavailable() {
            DiseaseClassifier classifier = new DiseaseClassifier(() -> {
                throw new ModelStoreException("disk on fire");
            });

            assertThat(classifier.isAvailable()).isFalse();
            assertThat(classifier.featureSchema()).isEmpty();
            assertThat(classifier.classCount()).isZero();
            assertThatThrownBy(() -> classifier.predict(new FeatureVector(List.of(), new double[0])))
                    .isInstanceOf(ModelUnavailableException.class);
        }

        @Test
        @DisplayName("runtime failure inside the model should become PredictionException")
        void modelThrows() {
            ProbabilisticModel broken = new ProbabilisticModel() {
                @Override
                public double[] predictProba(double[] features) {
                    throw new IllegalStateException("boom");
                }

                @Override
                public int featureCount() {
                    return 1;
                }

                @Override
                public int classCount() {
                    return 1;
                }
            };
            DiseaseClassifier classifier = new DiseaseClassifier(
                    () -> new ModelArtifacts(broken, List.of("temperature"), Map.of(0, "flu")));

            assertThatThrownBy(() -> classifier.predict(new FeatureVector(List.of("temperature"), new double[]{37})))
                    .isInstanceOf(PredictionException.class)
                    .hasMessageContaining("boom");
        }
    }

    @Test
    @DisplayName("title case should capitalise every word")
    void titleCase() {
        assertThat(DiseaseClassifier.titleCase("acute MYOCARDIAL infarction")).isEqualTo("Acute Myocardial Infarction");
        assertThat(DiseaseClassifier.titleCase("covid-19 pneumonia")).isEqualTo("Covid-19 Pneumonia");
    }
}
