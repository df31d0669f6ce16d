package com.eainde.fitengine.coaching;

import com.eainde.fitengine.exception.NarrativeGenerationException;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.request.ResponseFormatType;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * {@link NarrativeProvider} backed by a LangChain4j {@link ChatModel} in JSON-schema mode.
 */
@Slf4j
@Component
public class LangChainNarrativeProvider implements NarrativeProvider {

    private final ObjectProvider<ChatModel> chatModel;
    private final NarrativeSchema schema;

    public LangChainNarrativeProvider(ObjectProvider<ChatModel> chatModel, NarrativeSchema schema) {
        this.chatModel = chatModel;
        this.schema = schema;
    }

    @Override
    public String generate(NarrativePrompt prompt) {
        ChatModel model = chatModel.getIfAvailable();
        if (model == null) {
            throw new NarrativeGenerationException(
                    "No chat model configured; set fit-engine.provider.api-key", null);
        }

        ChatRequest request = ChatRequest.builder()
                .messages(SystemMessage.from(prompt.systemMessage()), UserMessage.from(prompt.userMessage()))
                .responseFormat(ResponseFormat.builder()
                        .type(ResponseFormatType.JSON)
                        .jsonSchema(schema.jsonSchema())
                        .build())
                .build();

        ChatResponse response = model.chat(request);
        if (response == null || response.aiMessage() == null) {
            return null;
        }
        log.debug("Narrative provider finished with {}", response.finishReason());
        return response.aiMessage().text();
    }
}
