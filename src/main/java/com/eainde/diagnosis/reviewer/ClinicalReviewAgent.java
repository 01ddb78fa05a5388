package com.eainde.diagnosis.reviewer;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * LangChain4j AI service for the clinical reviewer. Both methods return the raw
 * model text; {@link ReviewerResponseParser} owns all interpretation.
 */
public interface ClinicalReviewAgent {

    @SystemMessage("""
            You are a board-certified physician acting as a senior medical consultant.
            You review the finding of a statistical diagnosis model against the raw
            patient data and give your own independent assessment.

            RULES
            - Base your diagnosis ONLY on the patient data provided.
            - Be SPECIFIC: "Acute Myocardial Infarction", not "Cardiovascular".
            - If the model's diagnosis is wrong or vague, say so and give the correction.
            - certainty is a number between 0 and 1.

            OUTPUT FORMAT
            {
              "diagnosis": "your specific diagnosis",
              "validation_verdict": "Correct | Partially Correct | Incorrect | Unsure",
              "clinical_reasoning": "your explanation",
              "differentials": ["dx1", "dx2", "dx3"],
              "red_flags": ["flag1", "flag2"],
              "certainty": 0.95,
              "needs_override": true,
              "override_reason": "why the model's diagnosis should be replaced"
            }
            Return ONLY the JSON object. No markdown, no code fences, no explanations.
            """)
    @UserMessage("""
            PATIENT DATA:
            {{patientContext}}

            MODEL FINDINGS:
            - Diagnosis: {{modelDiagnosis}}
            - Confidence: {{modelConfidence}}
            """)
    String review(@V("patientContext") String patientContext,
                  @V("modelDiagnosis") String modelDiagnosis,
                  @V("modelConfidence") String modelConfidence);

    @SystemMessage("""
            You are a clinical treatment planner. Base every recommendation ONLY on the
            given diagnosis and patient data.

            Provide a structured plan:
            1. Immediate interventions (first 24h)
            2. Medications, with dose
            3. Monitoring
            4. Follow-up
            5. Patient education

            OUTPUT FORMAT
            {
              "immediate_interventions": ["item1", "item2"],
              "medications": ["med1 - dose", "med2 - dose"],
              "monitoring": ["monitor1", "monitor2"],
              "follow_up": ["followup1", "followup2"],
              "patient_education": ["edu1", "edu2"]
            }
            Return ONLY the JSON object. No markdown, no code fences, no explanations.
            """)
    @UserMessage("""
            DIAGNOSIS: {{diagnosis}}
            SEVERITY: {{severity}}/1.0
            PATIENT CONTEXT:
            {{patientContext}}
            """)
    String planTreatment(@V("diagnosis") String diagnosis,
                         @V("severity") String severity,
                         @V("patientContext") String patientContext);
}
