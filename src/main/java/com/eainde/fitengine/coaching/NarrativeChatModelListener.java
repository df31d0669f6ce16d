package com.eainde.fitengine.coaching;

import dev.langchain4j.model.chat.listener.ChatModelErrorContext;
import dev.langchain4j.model.chat.listener.ChatModelListener;
import dev.langchain4j.model.chat.listener.ChatModelRequestContext;
import dev.langchain4j.model.chat.listener.ChatModelResponseContext;
import dev.langchain4j.model.output.TokenUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs every narrative call: size and model on the way out, latency and tokens on the way back.
 * Prompt bodies carry candidate text and are logged at DEBUG only.
 */
public class NarrativeChatModelListener implements ChatModelListener {

    private static final Logger log = LoggerFactory.getLogger(NarrativeChatModelListener.class);

    static final String START_TIME = "startTime";

    @Override
    public void onRequest(ChatModelRequestContext requestContext) {
        log.info("Narrative request to model {} with {} message(s)",
                requestContext.chatRequest().parameters().modelName(),
                requestContext.chatRequest().messages().size());
        log.debug("Narrative request messages: {}", requestContext.chatRequest().messages());
        requestContext.attributes().put(START_TIME, System.currentTimeMillis());
    }

    @Override
    public void onResponse(ChatModelResponseContext responseContext) {
        Object start = responseContext.attributes().get(START_TIME);
        long duration = start instanceof Long s ? System.currentTimeMillis() - s : -1L;

        TokenUsage usage = responseContext.chatResponse().tokenUsage();
        if (usage != null) {
            log.info("Narrative response in {}ms, tokens in={} out={} total={}",
                    duration, usage.inputTokenCount(), usage.outputTokenCount(), usage.totalTokenCount());
        } else {
            log.info("Narrative response in {}ms", duration);
        }
    }

    @Override
    public void onError(ChatModelErrorContext errorContext) {
        log.error("Narrative provider call failed", errorContext.error());
    }
}
