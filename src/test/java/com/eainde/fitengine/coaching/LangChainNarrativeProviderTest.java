package com.eainde.fitengine.coaching;

import com.eainde.fitengine.exception.NarrativeGenerationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ResponseFormatType;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LangChainNarrativeProviderTest {

    @Mock
    private ObjectProvider<ChatModel> chatModelProvider;

    @Mock
    private ChatModel chatModel;

    private LangChainNarrativeProvider provider;

    @BeforeEach
    void setUp() {
        provider = new LangChainNarrativeProvider(chatModelProvider, new NarrativeSchema(new ObjectMapper()));
    }

    @Test
    @DisplayName("Sends both messages in JSON-schema mode and returns the raw text")
    void sendsStructuredRequest() {
        // Arrange
        when(chatModelProvider.getIfAvailable()).thenReturn(chatModel);
        when(chatModel.chat(any(ChatRequest.class)))
                .thenReturn(ChatResponse.builder().aiMessage(AiMessage.from("{\"summary\":\"ok\"}")).build());

        // Act
        String raw = provider.generate(new NarrativePrompt("system rules", "candidate evidence"));

        // Assert
        assertThat(raw).isEqualTo("{\"summary\":\"ok\"}");
        ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
        verify(chatModel).chat(captor.capture());
        ChatRequest request = captor.getValue();
        assertThat(request.messages()).hasSize(2);
        assertThat(request.messages().get(0)).isInstanceOf(SystemMessage.class);
        assertThat(request.responseFormat().type()).isEqualTo(ResponseFormatType.JSON);
        assertThat(request.responseFormat().jsonSchema().name()).isEqualTo("CoachingNarrative");
    }

    @Test
    @DisplayName("Missing chat model is a generation failure")
    void noModel() {
        when(chatModelProvider.getIfAvailable()).thenReturn(null);

        assertThatThrownBy(() -> provider.generate(new NarrativePrompt("s", "u")))
                .isInstanceOf(NarrativeGenerationException.class)
                .hasMessageContaining("api-key");
    }
}
