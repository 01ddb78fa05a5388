package com.eainde.diagnosis.workflow;

import com.eainde.diagnosis.classifier.DiseaseClassifier;
import com.eainde.diagnosis.exception.DiagnosisException;
import com.eainde.diagnosis.exception.ValidationException;
import com.eainde.diagnosis.model.FinalDiagnosis;
import com.eainde.diagnosis.model.PatientRecord;
import com.eainde.diagnosis.model.SystemStatus;
import com.eainde.diagnosis.reviewer.ClinicalReviewer;
import com.eainde.diagnosis.state.DiagnosisState;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.RunnableConfig;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Entry point of the diagnosis core.
 * <p>
 * Facade over the compiled LangGraph4j pipeline: callers hand in a
 * {@link PatientRecord} and get a {@link FinalDiagnosis} back without dealing with
 * graph state, thread ids or log correlation.
 * </p>
 *
 * <h3>Failure policy:</h3>
 * <ul>
 * <li>Out-of-range patient data is the only failure that reaches the caller, as a
 * {@link ValidationException} listing every violation.</li>
 * <li>A missing model, a failing model or an unreachable reviewer all degrade to a
 * result whose {@code source} says what actually contributed.</li>
 * </ul>
 */
@Log4j2
@Service
public class DiagnosisOrchestrator {

    public static final String REQUEST_ID = "requestId";

    private final CompiledGraph<DiagnosisState> workflow;
    private final DiseaseClassifier classifier;
    private final ClinicalReviewer reviewer;

    public DiagnosisOrchestrator(@Qualifier("diagnosisWorkflow") CompiledGraph<DiagnosisState> workflow,
                                 DiseaseClassifier classifier,
                                 ClinicalReviewer reviewer) {
        this.workflow = workflow;
        this.classifier = classifier;
        this.reviewer = reviewer;
    }

    /**
     * Runs one request through the pipeline on the calling thread.
     *
     * @throws ValidationException when the record is missing or out of clinical range
     */
    public FinalDiagnosis diagnose(PatientRecord record) {
        if (record == null) {
            throw new ValidationException(List.of("Patient record is required"));
        }

        String requestId = UUID.randomUUID().toString();
        MDC.put(REQUEST_ID, requestId);
        try {
            log.info("Diagnosis started");
            RunnableConfig config = RunnableConfig.builder()
                    .threadId(requestId)
                    .build();

            DiagnosisState state = workflow.invoke(Map.of(DiagnosisState.PATIENT, record), config)
                    .orElseThrow(() -> new DiagnosisException("Diagnosis workflow produced no state"));

            if (!state.violations().isEmpty()) {
                throw new ValidationException(state.violations());
            }
            FinalDiagnosis result = state.finalDiagnosis()
                    .orElseThrow(() -> new DiagnosisException(
                            "Diagnosis workflow stopped at stage '" + state.stage() + "'"));

            log.info("Diagnosis finished: '{}' ({}, confidence {}, {})", result.primaryDiagnosis(),
                    result.source().label(), result.confidence(), result.urgencyLevel().label());
            return result;
        } finally {
            MDC.remove(REQUEST_ID);
        }
    }

    public SystemStatus status() {
        return new SystemStatus(
                classifier.isAvailable(),
                classifier.featureSchema().size(),
                classifier.classCount(),
                reviewer.isConfigured());
    }
}
