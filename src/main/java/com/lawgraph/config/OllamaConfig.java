package com.lawgraph.config;

import io.micrometer.observation.ObservationRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.ollama.OllamaChatModel;
import org.springframework.ai.ollama.api.OllamaApi;
import org.springframework.ai.ollama.api.OllamaOptions;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

/**
 * Chat model for the citation verifier. Only created when the verifier is enabled.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "law-graph.verifier", name = "enabled", havingValue = "true")
public class OllamaConfig {

    @Value("${spring.ai.ollama.base-url:http://localhost:11434}")
    private String baseUrl;

    // blocking socket reads ignore interrupts, so the HTTP call carries its own bound
    @Value("${law-graph.verifier.timeout-seconds:10}")
    private Integer timeoutSeconds;

    @Value("${spring.ai.ollama.chat.options.model:qwen2.5:7b}")
    private String model;

    @Value("${spring.ai.ollama.chat.options.temperature:0.0}")
    private Double temperature;

    @Value("${spring.ai.ollama.chat.options.num-predict:256}")
    private Integer numPredict;

    @Value("${spring.ai.ollama.chat.options.top-k:20}")
    private Integer topK;

    @Value("${spring.ai.ollama.chat.options.top-p:0.9}")
    private Double topP;

    @Value("${spring.ai.ollama.chat.options.repeat-penalty:1.1}")
    private Double repeatPenalty;

    @Bean
    public OllamaApi ollamaApi() {
        log.info("Initializing Ollama API with base URL: {} (read timeout {}s)", baseUrl, timeoutSeconds);
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(Duration.ofSeconds(timeoutSeconds));
        requestFactory.setReadTimeout(Duration.ofSeconds(timeoutSeconds));
        return OllamaApi.builder()
                .baseUrl(baseUrl)
                .restClientBuilder(RestClient.builder().requestFactory(requestFactory))
                .build();
    }

    @Bean
    public OllamaOptions verifierOllamaOptions() {
        return OllamaOptions.builder()
                .model(model)
                .temperature(temperature)
                .numPredict(numPredict) // answers are a short JSON object
                .topK(topK)
                .topP(topP)
                .repeatPenalty(repeatPenalty)
                .format("json")
                .build();
    }

    @Bean
    public ChatModel verifierChatModel(OllamaApi ollamaApi,
                                       OllamaOptions verifierOllamaOptions,
                                       ObjectProvider<ObservationRegistry> observationRegistry) {
        log.info("Verifier chat model: {}", model);
        return OllamaChatModel.builder()
                .ollamaApi(ollamaApi)
                .defaultOptions(verifierOllamaOptions)
                .observationRegistry(observationRegistry.getIfUnique(() -> ObservationRegistry.NOOP))
                .build();
    }
}
