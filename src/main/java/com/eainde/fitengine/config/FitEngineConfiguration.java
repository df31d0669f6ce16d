package com.eainde.fitengine.config;

import com.eainde.fitengine.coaching.NarrativeChatModelListener;
import com.eainde.fitengine.thread.MdcAwareExecutorService;
import dev.langchain4j.model.chat.Capability;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;

@Slf4j
@Configuration
@EnableConfigurationProperties(FitEngineProperties.class)
public class FitEngineConfiguration {

    @Bean
    public GlobalConfigurationStore globalConfigurationStore(FitEngineProperties properties) {
        return new GlobalConfigurationStore(GlobalConfigurationFactory.fromProperties(properties));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "narrativeExecutor", destroyMethod = "shutdownNow")
    public ExecutorService narrativeExecutor(FitEngineProperties properties) {
        return new MdcAwareExecutorService(properties.getNarrative().getExecutorThreads(), "narrative");
    }

    /**
     * Only created when an API key is configured; without it the narrative step fails with a
     * generation error instead of the application refusing to start.
     */
    @Bean
    @ConditionalOnExpression("!'${fit-engine.provider.api-key:}'.isBlank()")
    public ChatModel narrativeChatModel(FitEngineProperties properties) {
        FitEngineProperties.Provider provider = properties.getProvider();
        Duration timeout = properties.providerCallTimeout();
        if (!timeout.equals(provider.getTimeout())) {
            log.warn("Provider timeout {} exceeds the narrative attempt timeout; using {}", provider.getTimeout(), timeout);
        }
        log.info("Configuring narrative chat model {}", provider.getModelName());
        return OpenAiChatModel.builder()
                .apiKey(provider.getApiKey())
                .baseUrl(provider.getBaseUrl())
                .modelName(provider.getModelName())
                .temperature(provider.getTemperature())
                .maxTokens(provider.getMaxTokens())
                .timeout(timeout)
                .logRequests(provider.isLogRequests())
                .logResponses(provider.isLogRequests())
                .supportedCapabilities(Set.of(Capability.RESPONSE_FORMAT_JSON_SCHEMA))
                .strictJsonSchema(true)
                .listeners(List.of(new NarrativeChatModelListener()))
                .build();
    }
}
