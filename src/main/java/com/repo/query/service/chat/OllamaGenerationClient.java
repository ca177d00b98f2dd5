package com.repo.query.service.chat;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Map;

/**
 * calls Ollama's /api/generate endpoint without streaming. Every call is bounded by the configured timeout.
 */
@Slf4j
@Component
public class OllamaGenerationClient implements GenerationClient {
    static final String NO_RESPONSE = "No response generated.";

    private final RestClient restClient;
    private final String model;
    private final double temperature;
    private final int maxTokens;

    @Autowired
    public OllamaGenerationClient(
            RestClient.Builder restClientBuilder,
            @Value("${query.llm.base-url:http://localhost:11434}") String baseUrl,
            @Value("${query.llm.model:mistral}") String model,
            @Value("${query.llm.timeout:60s}") Duration timeout,
            @Value("${query.llm.temperature:0.2}") double temperature,
            @Value("${query.llm.max-tokens:512}") int maxTokens
    ) {
        this(restClientBuilder
                        .baseUrl(baseUrl)
                        .requestFactory(requestFactory(timeout))
                        .build(),
                model, temperature, maxTokens);
    }

    OllamaGenerationClient(RestClient restClient, String model, double temperature, int maxTokens) {
        this.restClient = restClient;
        this.model = model;
        this.temperature = temperature;
        this.maxTokens = maxTokens;
    }

    @Override
    public GenerationResult generate(String prompt) {
        Map<String, Object> body = Map.of(
                "model", model,
                "prompt", prompt,
                "stream", false,
                "options", Map.of(
                        "temperature", temperature,
                        "num_predict", maxTokens
                )
        );

        long start = System.currentTimeMillis();
        try {
            JsonNode response = restClient.post()
                    .uri("/api/generate")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(JsonNode.class);

            if (response == null || !response.isObject())
                return GenerationResult.failed("Malformed response from " + model);

            JsonNode text = response.path("response");
            log.info("LLM {} answered in {}ms", model, System.currentTimeMillis() - start);
            return GenerationResult.generated(text.isTextual() ? text.asText() : NO_RESPONSE);
        } catch (ResourceAccessException err) {
            //  connection refused, unknown host or timed out
            log.warn("LLM connection failed (backend unreachable): {}", err.getMessage());
            return GenerationResult.unreachable(err.getMessage());
        } catch (RestClientResponseException err) {
            log.error("LLM generation failed with status {}: {}", err.getStatusCode(), err.getMessage());
            return GenerationResult.failed(err.getMessage());
        } catch (RuntimeException err) {
            log.error("LLM generation failed: {}", err.getMessage());
            return GenerationResult.failed(err.getMessage());
        }
    }

    @Override
    public String modelName() {
        return model;
    }

    /**
     * the request timeout of the jdk client runs from sending until the response arrives, connecting
     * included, so it caps the whole call instead of each socket read
     *
     * @param timeout
     * @return
     */
    static JdkClientHttpRequestFactory requestFactory(Duration timeout) {
        HttpClient httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(timeout)
                .build();
        JdkClientHttpRequestFactory factory = new JdkClientHttpRequestFactory(httpClient);
        factory.setReadTimeout(timeout);
        return factory;
    }
}
