package com.linlay.taskrunner.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.taskrunner.llm.HistoryMessageConverter;
import com.linlay.taskrunner.llm.ReasoningEngine;
import com.linlay.taskrunner.llm.SpringAiReasoningEngine;
import io.netty.handler.logging.LogLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;
import reactor.netty.transport.logging.AdvancedByteBufFormat;

import java.time.Duration;

@Configuration
public class ReasoningConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ReasoningConfiguration.class);
    private static final String PROVIDER_WIRETAP_LOGGER = "com.linlay.taskrunner.llm.wiretap";

    @Bean(destroyMethod = "dispose")
    public ConnectionProvider providerConnectionProvider() {
        return ConnectionProvider.builder("provider-pool")
                .maxIdleTime(Duration.ofSeconds(30))
                .maxLifeTime(Duration.ofMinutes(5))
                .evictInBackground(Duration.ofSeconds(30))
                .build();
    }

    @Bean
    public ChatModel taskRunnerChatModel(AgentProviderProperties properties, ConnectionProvider providerConnectionProvider) {
        assertProviderConfig(properties);
        HttpClient httpClient = HttpClient.create(providerConnectionProvider);
        if (properties.isWiretap()) {
            httpClient = httpClient.wiretap(PROVIDER_WIRETAP_LOGGER, LogLevel.DEBUG, AdvancedByteBufFormat.TEXTUAL);
        }
        WebClient.Builder webClientBuilder = WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                        .build());

        OpenAiApi api = OpenAiApi.builder()
                .baseUrl(properties.getBaseUrl())
                .apiKey(properties.getApiKey())
                .restClientBuilder(RestClient.builder())
                .webClientBuilder(webClientBuilder)
                .build();

        OpenAiChatOptions options = OpenAiChatOptions.builder()
                .model(properties.getModel())
                .temperature(properties.getTemperature())
                .build();

        log.info("Using OpenAI-compatible provider {} with model {}", properties.getBaseUrl(), properties.getModel());
        return OpenAiChatModel.builder()
                .openAiApi(api)
                .defaultOptions(options)
                .build();
    }

    @Bean
    public HistoryMessageConverter historyMessageConverter(ObjectMapper objectMapper) {
        return new HistoryMessageConverter(objectMapper);
    }

    @Bean
    public ReasoningEngine reasoningEngine(
            ChatModel chatModel,
            AgentProviderProperties properties,
            HistoryMessageConverter historyMessageConverter,
            ObjectMapper objectMapper
    ) {
        return new SpringAiReasoningEngine(ChatClient.create(chatModel), properties, historyMessageConverter, objectMapper);
    }

    private void assertProviderConfig(AgentProviderProperties properties) {
        if (!StringUtils.hasText(properties.getBaseUrl())) {
            throw new IllegalStateException("Missing agent.provider.base-url");
        }
        if (!StringUtils.hasText(properties.getApiKey())) {
            throw new IllegalStateException("Missing agent.provider.api-key");
        }
        if (!StringUtils.hasText(properties.getModel())) {
            throw new IllegalStateException("Missing agent.provider.model");
        }
    }
}
