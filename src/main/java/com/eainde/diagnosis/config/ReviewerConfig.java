package com.eainde.diagnosis.config;

import com.eainde.diagnosis.engine.TreatmentPlanAssembler;
import com.eainde.diagnosis.engine.TreatmentProtocolTable;
import com.eainde.diagnosis.reviewer.ClinicalReviewAgent;
import com.eainde.diagnosis.reviewer.ClinicalReviewer;
import com.eainde.diagnosis.reviewer.GeminiClinicalReviewer;
import com.eainde.diagnosis.reviewer.PatientContextFormatter;
import com.eainde.diagnosis.reviewer.ReviewerResponseParser;
import com.eainde.diagnosis.reviewer.ReviewerSettings;
import com.eainde.diagnosis.reviewer.UnavailableClinicalReviewer;
import com.eainde.diagnosis.thread.MdcAwareExecutor;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.service.AiServices;
import lombok.extern.log4j.Log4j2;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Chooses the reviewer once, at startup: Gemini when an API key is configured,
 * otherwise a reviewer that is never available.
 */
@Log4j2
@Configuration
public class ReviewerConfig {

    @Bean
    public ReviewerSettings reviewerSettings(DiagnosisProperties properties) {
        return properties.reviewer().toSettings();
    }

    @Bean(destroyMethod = "close")
    public MdcAwareExecutor reviewerExecutor() {
        return new MdcAwareExecutor("clinical-reviewer");
    }

    @Bean
    public ClinicalReviewer clinicalReviewer(ReviewerSettings settings, MdcAwareExecutor reviewerExecutor) {
        if (!settings.hasApiKey()) {
            log.warn("No Gemini API key configured, diagnoses will be classifier-only");
            return new UnavailableClinicalReviewer();
        }
        log.info("Clinical reviewer enabled: {}", settings);

        // retries are owned by GeminiClinicalReviewer, so the client must not retry on its own
        ChatModel chatModel = GoogleAiGeminiChatModel.builder()
                .apiKey(settings.apiKey())
                .modelName(settings.modelName())
                .temperature(settings.temperature())
                .maxOutputTokens(settings.maxOutputTokens())
                .timeout(settings.timeout())
                .maxRetries(0)
                .responseFormat(ResponseFormat.JSON)
                .listeners(List.of(new ObservabilityListener()))
                .build();

        ClinicalReviewAgent agent = AiServices.create(ClinicalReviewAgent.class, chatModel);
        return new GeminiClinicalReviewer(agent, settings, new ReviewerResponseParser(),
                new PatientContextFormatter(), reviewerExecutor);
    }

    @Bean
    public TreatmentProtocolTable treatmentProtocolTable(ObjectMapper objectMapper) {
        return TreatmentProtocolTable.fromClasspath(objectMapper, TreatmentProtocolTable.DEFAULT_RESOURCE);
    }

    @Bean
    public TreatmentPlanAssembler treatmentPlanAssembler(ClinicalReviewer clinicalReviewer,
                                                         TreatmentProtocolTable treatmentProtocolTable) {
        return new TreatmentPlanAssembler(clinicalReviewer, treatmentProtocolTable);
    }
}
