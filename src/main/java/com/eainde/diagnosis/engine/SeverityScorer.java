package com.eainde.diagnosis.engine;

import com.eainde.diagnosis.model.PatientRecord;
import com.eainde.diagnosis.model.SeverityAssessment;
import com.eainde.diagnosis.model.UrgencyLevel;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Deterministic, vitals-only severity. Neither the classifier nor the reviewer is
 * consulted, so the score is stable for a given record.
 *
 * <p>Each vital contributes the points of the highest tier it reaches; the sum is
 * divided by {@value #MAX_POINTS}.</p>
 */
@Component
public class SeverityScorer {

    static final int MAX_POINTS = 14;
    static final double EMERGENCY_THRESHOLD = 0.7;
    static final double URGENT_THRESHOLD = 0.4;

    public SeverityAssessment score(PatientRecord record) {
        int points = temperaturePoints(record.getTemperature())
                + heartRatePoints(record.getHeartRate())
                + systolicPoints(record.getSystolicBp())
                + respiratoryPoints(record.getRespiratoryRate())
                + saturationPoints(record.getOxygenSaturation())
                + painPoints(record.getPainScore());

        double raw = Math.max(0.0, Math.min(1.0, points / (double) MAX_POINTS));
        double score = BigDecimal.valueOf(raw).setScale(2, RoundingMode.HALF_UP).doubleValue();
        return new SeverityAssessment(points, score, urgencyFor(score));
    }

    public static UrgencyLevel urgencyFor(double severityScore) {
        if (severityScore >= EMERGENCY_THRESHOLD) {
            return UrgencyLevel.EMERGENCY;
        }
        if (severityScore >= URGENT_THRESHOLD) {
            return UrgencyLevel.URGENT;
        }
        return UrgencyLevel.ROUTINE;
    }

    static int temperaturePoints(double t) {
        if (t >= 39.0) return 2;
        if (t >= 38.5) return 1;
        // hypothermia
        if (t <= 35.0) return 2;
        return 0;
    }

    static int heartRatePoints(double hr) {
        if (hr >= 130 || hr <= 40) return 3;
        if (hr >= 110 || hr <= 50) return 2;
        if (hr >= 100) return 1;
        return 0;
    }

    static int systolicPoints(double sbp) {
        if (sbp < 90 || sbp >= 180) return 2;
        if (sbp >= 160) return 1;
        return 0;
    }

    static int respiratoryPoints(double rr) {
        if (rr > 25 || rr < 10) return 2;
        if (rr > 20) return 1;
        return 0;
    }

    static int saturationPoints(double spo2) {
        if (spo2 < 92) return 3;
        if (spo2 < 95) return 1;
        return 0;
    }

    static int painPoints(double pain) {
        if (pain >= 8) return 2;
        if (pain >= 5) return 1;
        return 0;
    }
}
