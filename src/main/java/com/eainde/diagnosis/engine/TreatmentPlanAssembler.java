package com.eainde.diagnosis.engine;

import com.eainde.diagnosis.model.PatientRecord;
import com.eainde.diagnosis.model.TreatmentPlan;
import com.eainde.diagnosis.reviewer.ClinicalReviewer;
import lombok.extern.log4j.Log4j2;

import java.util.Optional;

/**
 * Produces the treatment plan for the final diagnosis: the reviewer's plan when it
 * can give one, otherwise the matching static protocol.
 */
@Log4j2
public class TreatmentPlanAssembler {

    private final ClinicalReviewer reviewer;
    private final TreatmentProtocolTable protocolTable;

    public TreatmentPlanAssembler(ClinicalReviewer reviewer, TreatmentProtocolTable protocolTable) {
        this.reviewer = reviewer;
        this.protocolTable = protocolTable;
    }

    /**
     * @param consultReviewer false skips the reviewer entirely (degraded runs)
     */
    public TreatmentPlan assemble(String finalDiagnosis, double severityScore,
                                  PatientRecord record, boolean consultReviewer) {
        if (consultReviewer) {
            Optional<TreatmentPlan> generated = requestPlan(finalDiagnosis, severityScore, record);
            if (generated.isPresent() && !generated.get().isEmpty()) {
                log.info("Using reviewer treatment plan ({} actions)", generated.get().actions().size());
                return generated.get();
            }
        }
        TreatmentProtocol protocol = protocolTable.select(finalDiagnosis);
        log.info("Using static protocol '{}' for '{}'", protocol.name(), finalDiagnosis);
        return new TreatmentPlan(TreatmentPlan.PROTOCOL_ORIGIN_PREFIX + protocol.name(), protocol.actions());
    }

    private Optional<TreatmentPlan> requestPlan(String finalDiagnosis, double severityScore, PatientRecord record) {
        try {
            return reviewer.planTreatment(finalDiagnosis, severityScore, record);
        } catch (RuntimeException e) {
            log.error("Reviewer could not produce a treatment plan, falling back to protocol", e);
            return Optional.empty();
        }
    }
}
