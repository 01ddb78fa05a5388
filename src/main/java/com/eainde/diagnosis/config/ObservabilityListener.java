package com.eainde.diagnosis.config;

import dev.langchain4j.model.chat.listener.ChatModelErrorContext;
import dev.langchain4j.model.chat.listener.ChatModelListener;
import dev.langchain4j.model.chat.listener.ChatModelRequestContext;
import dev.langchain4j.model.chat.listener.ChatModelResponseContext;
import dev.langchain4j.model.output.TokenUsage;
import lombok.extern.log4j.Log4j2;

/**
 * Logs latency and token usage of every reviewer call. Prompt content is not logged:
 * it carries patient data.
 */
@Log4j2
public class ObservabilityListener implements ChatModelListener {

    static final String START_TIME = "startTime";

    @Override
    public void onRequest(ChatModelRequestContext requestContext) {
        log.debug("Sending {} message(s) to the reviewer model", requestContext.chatRequest().messages().size());
        requestContext.attributes().put(START_TIME, System.currentTimeMillis());
    }

    @Override
    public void onResponse(ChatModelResponseContext responseContext) {
        Object startTime = responseContext.attributes().get(START_TIME);
        long duration = startTime instanceof Long start ? System.currentTimeMillis() - start : -1;

        TokenUsage usage = responseContext.chatResponse().tokenUsage();
        if (usage == null) {
            log.info("Reviewer model responded in {}ms", duration);
        } else {
            log.info("Reviewer model responded in {}ms, tokens in={} out={} total={}", duration,
                    usage.inputTokenCount(), usage.outputTokenCount(), usage.totalTokenCount());
        }
    }

    @Override
    public void onError(ChatModelErrorContext errorContext) {
        log.error("Reviewer model call failed", errorContext.error());
    }
}
