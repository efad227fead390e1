package com.sectune.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Duration;

@Configuration
public class ProviderConfig {

    /** Placeholder so the client can be built without a key; calls are refused before it is sent. */
    static final String UNCONFIGURED_API_KEY = "not-configured";

    @Bean
    @ConditionalOnMissingBean(FineTuningProvider.class)
    public FineTuningProvider openAiFineTuningProvider(ProviderProperties properties,
                                                       ObjectMapper objectMapper,
                                                       ObjectProvider<RestClient.Builder> restClientBuilder) {
        var httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(properties.getConnectTimeoutSeconds()))
                .build();
        var chatClient = fineTunedModelClient(properties, restClientBuilder.getIfAvailable(RestClient::builder));
        return new OpenAiFineTuningProvider(properties, httpClient, objectMapper, chatClient);
    }

    /**
     * Chat client bound to the provider's base URL and API key, so fine-tuned models
     * are invoked on the same endpoint their jobs were submitted to. The
     * {@code spring.ai.openai.*} settings do not apply here.
     */
    static ChatClient fineTunedModelClient(ProviderProperties properties, RestClient.Builder restClientBuilder) {
        var api = OpenAiApi.builder()
                .baseUrl(properties.getBaseUrl())
                .apiKey(properties.hasApiKey() ? properties.getApiKey() : UNCONFIGURED_API_KEY)
                .restClientBuilder(restClientBuilder)
                .build();
        return ChatClient.builder(OpenAiChatModel.builder().openAiApi(api).build()).build();
    }
}
