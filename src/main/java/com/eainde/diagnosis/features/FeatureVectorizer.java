package com.eainde.diagnosis.features;

import com.eainde.diagnosis.model.FeatureVector;
import com.eainde.diagnosis.model.Gender;
import com.eainde.diagnosis.model.PatientRecord;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps a {@link PatientRecord} onto the classifier's feature schema.
 *
 * <p>The derived-flag thresholds are the ones used when the classifier was trained.
 * They are constants on purpose: a different value here does not fail, it silently
 * degrades predictions.</p>
 *
 * <p>Schema names this class cannot resolve are filled with 0.0. Deployed model
 * versions add and drop derived flags, so an unknown name is not an error.</p>
 */
@Log4j2
@Component
public class FeatureVectorizer {

    public static final double FEVER_HIGH_THRESHOLD = 38.5;
    public static final double TACHYCARDIA_THRESHOLD = 100.0;
    public static final double HYPOTENSION_THRESHOLD = 90.0;
    public static final double HYPOXIA_THRESHOLD = 90.0;

    public static final String FEVER_HIGH = "fever_high";
    public static final String TACHYCARDIA = "tachycardia";
    public static final String HYPOTENSION = "hypotension";
    public static final String HYPOXIA = "hypoxia";
    public static final String ACUITY = "acuity";
    public static final String SYMPTOM_PREFIX = "symptom_";
    public static final String GENDER_PREFIX = "gender_";

    public FeatureVector vectorize(PatientRecord record, List<String> schema) {
        Map<String, Double> resolved = resolveFeatures(record);

        double[] values = new double[schema.size()];
        int unresolved = 0;
        for (int i = 0; i < schema.size(); i++) {
            Double value = resolved.get(schema.get(i));
            if (value == null) {
                unresolved++;
                values[i] = 0.0;
            } else {
                values[i] = value;
            }
        }

        if (unresolved > 0) {
            log.debug("{} of {} schema features not resolvable from the record, defaulted to 0.0",
                    unresolved, schema.size());
        }
        return new FeatureVector(schema, values);
    }

    /**
     * Every feature value this vectorizer knows how to produce, keyed by name.
     */
    Map<String, Double> resolveFeatures(PatientRecord record) {
        Map<String, Double> data = new HashMap<>();

        // column names used at training time
        data.put("temperature", record.getTemperature());
        data.put("heartrate", record.getHeartRate());
        data.put("resprate", record.getRespiratoryRate());
        data.put("sbp", record.getSystolicBp());
        data.put("dbp", record.getDiastolicBp());
        data.put("o2sat", record.getOxygenSaturation());
        data.put("anchor_age", record.getAge());

        // record field names
        data.put("age", record.getAge());
        data.put("heart_rate", record.getHeartRate());
        data.put("respiratory_rate", record.getRespiratoryRate());
        data.put("systolic_bp", record.getSystolicBp());
        data.put("diastolic_bp", record.getDiastolicBp());
        data.put("oxygen_saturation", record.getOxygenSaturation());
        data.put("pain_score", record.getPainScore());

        data.put(FEVER_HIGH, flag(isFeverHigh(record)));
        data.put(TACHYCARDIA, flag(isTachycardic(record)));
        data.put(HYPOTENSION, flag(isHypotensive(record)));
        data.put(HYPOXIA, flag(isHypoxic(record)));
        data.put(ACUITY, (double) acuity(record));

        for (Gender gender : Gender.values()) {
            data.put(GENDER_PREFIX + gender.name().toLowerCase(Locale.ROOT),
                    flag(gender == record.getGender()));
        }
        for (String symptom : record.getSymptoms()) {
            String key = symptomFeatureName(symptom);
            if (!key.equals(SYMPTOM_PREFIX)) {
                data.put(key, 1.0);
            }
        }
        return data;
    }

    /**
     * ESI-style acuity estimate: 1 is most acute, 5 least.
     */
    public static int acuity(PatientRecord record) {
        if (isHypoxic(record) || isHypotensive(record)) {
            return 1;
        }
        if (isTachycardic(record) || isFeverHigh(record) || record.getPainScore() >= 7) {
            return 2;
        }
        if (!record.getSymptoms().isEmpty()) {
            return 3;
        }
        return record.getPainScore() > 0 ? 4 : 5;
    }

    public static String symptomFeatureName(String symptom) {
        String normalized = symptom == null ? "" : symptom.trim().toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "_")
                .replaceAll("^_+|_+$", "");
        return SYMPTOM_PREFIX + normalized;
    }

    static boolean isFeverHigh(PatientRecord r) {
        return r.getTemperature() > FEVER_HIGH_THRESHOLD;
    }

    static boolean isTachycardic(PatientRecord r) {
        return r.getHeartRate() > TACHYCARDIA_THRESHOLD;
    }

    static boolean isHypotensive(PatientRecord r) {
        return r.getSystolicBp() < HYPOTENSION_THRESHOLD;
    }

    static boolean isHypoxic(PatientRecord r) {
        return r.getOxygenSaturation() < HYPOXIA_THRESHOLD;
    }

    private static double flag(boolean condition) {
        return condition ? 1.0 : 0.0;
    }
}
