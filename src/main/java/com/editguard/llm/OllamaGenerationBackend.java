package com.editguard.llm;

import com.editguard.core.confidence.ChangeApproach;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Profile;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * OllamaGenerationBackend: production backend on a local Ollama server.
 *
 * Strategy → system prompt mapping is the single source of truth here; the
 * prompt builder renders only the task body. Temperature comes from
 * {@link GenerationBackend#temperatureFor} unless {@code ollama.temperature}
 * pins a value.
 *
 * Transport mapping:
 *   429                → RATE_LIMITED (Retry-After seconds honored when present)
 *   other 4xx          → PERMANENT_FAILURE
 *   5xx, I/O, timeout  → TRANSIENT_FAILURE
 *   unparseable body   → TRANSIENT_FAILURE
 */
@Component
@Profile("!mock")
public class OllamaGenerationBackend implements GenerationBackend {

    private static final Logger log = LoggerFactory.getLogger(OllamaGenerationBackend.class);

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final String       baseUrl;
    private final String       model;
    private final Double       temperatureOverride;   // null → per-strategy

    @Autowired
    public OllamaGenerationBackend(
            RestTemplateBuilder restTemplateBuilder,
            @Value("${ollama.base-url:http://localhost:11434}") String baseUrl,
            @Value("${ollama.model:llama3:8b}")                  String model,
            @Value("${ollama.temperature:}")                     String temperature,
            @Value("${ollama.timeout-ms:120000}")                long   timeoutMs
    ) {
        this(restTemplateBuilder
                        .setConnectTimeout(Duration.ofSeconds(10))
                        .setReadTimeout(Duration.ofMillis(timeoutMs))
                        .build(),
                baseUrl, model, temperature);
    }

    OllamaGenerationBackend(RestTemplate restTemplate, String baseUrl, String model, String temperature) {
        this.restTemplate        = restTemplate;
        this.baseUrl             = baseUrl;
        this.model               = model;
        this.temperatureOverride = temperature == null || temperature.isBlank() ? null : Double.valueOf(temperature.trim());
    }

    // =========================================================================
    // GenerationBackend contract
    // =========================================================================

    @Override
    public GenerationResult generate(GenerationRequest request) {
        ChangeApproach approach    = request.getApproach();
        double         temperature = temperatureOverride != null ? temperatureOverride : temperatureFor(approach);
        String         fullPrompt  = systemPromptFor(approach) + "\n\n" + request.getPrompt();

        log.debug("[Ollama] approach={} temperature={} promptLen={}", approach, temperature, fullPrompt.length());

        return callOllama(fullPrompt, temperature);
    }

    // =========================================================================
    // System prompts: one persona per strategy
    // =========================================================================

    private String systemPromptFor(ChangeApproach approach) {
        return switch (approach) {
            case HIGH_CONFIDENCE_DIRECT -> """
                    You are a precise front-end engineer editing an existing component.
                    Return the COMPLETE file with the requested change applied.
                    Output only the file inside a single fenced code block.
                    """;

            case MEDIUM_CONFIDENCE_GUIDED -> """
                    You are a careful front-end engineer working under explicit constraints.
                    Respect every preservation requirement and the stated change scope.
                    Return the COMPLETE file inside a single fenced code block.
                    """;

            case LOW_CONFIDENCE_CONSERVATIVE -> """
                    You are a cautious front-end engineer. Change as little as possible.
                    Never remove code that is unrelated to the requested change.
                    Return the COMPLETE file inside a single fenced code block.
                    """;

            case VERY_LOW_CONFIDENCE_HUMAN_REVIEW -> """
                    You are a senior front-end engineer writing a change proposal for a human reviewer.
                    Write the proposal as code comments. Do NOT modify the original code.
                    Return the proposal followed by the untouched original file.
                    """;
        };
    }

    // =========================================================================
    // HTTP client
    // =========================================================================

    private GenerationResult callOllama(String prompt, double temperature) {
        String url = baseUrl + "/api/generate";

        Map<String, Object> body = new HashMap<>();
        body.put("model",  model);
        body.put("prompt", prompt);
        body.put("stream", false);
        body.put("options", Map.of("temperature", temperature));

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        try {
            ResponseEntity<String> response =
                    restTemplate.postForEntity(url, new HttpEntity<>(body, headers), String.class);

            JsonNode root = objectMapper.readTree(response.getBody() != null ? response.getBody() : "");
            if (root == null || !root.has("response")) {
                log.warn("[Ollama] Response without 'response' field");
                return GenerationResult.transientFailure("Malformed Ollama response: missing 'response' field");
            }

            String result = root.get("response").asText();
            log.debug("[Ollama] responseLen={}", result.length());
            return GenerationResult.success(result);

        } catch (HttpClientErrorException.TooManyRequests e) {
            Duration retryAfter = parseRetryAfter(e.getResponseHeaders());
            log.warn("[Ollama] Rate limited, retryAfter={}", retryAfter);
            return GenerationResult.rateLimited(retryAfter, "Ollama rate limit: " + e.getStatusText());

        } catch (HttpClientErrorException e) {
            log.error("[Ollama] Request rejected: {} {}", e.getStatusCode().value(), e.getStatusText());
            return GenerationResult.permanentFailure("Ollama rejected request: " + e.getStatusCode().value());

        } catch (HttpServerErrorException e) {
            log.warn("[Ollama] Server error: {}", e.getStatusCode().value());
            return GenerationResult.transientFailure("Ollama server error: " + e.getStatusCode().value());

        } catch (ResourceAccessException e) {
            log.warn("[Ollama] I/O failure: {}", e.getMessage());
            return GenerationResult.transientFailure("Ollama unreachable: " + e.getMessage());

        } catch (JsonProcessingException e) {
            log.warn("[Ollama] Unparseable response: {}", e.getOriginalMessage());
            return GenerationResult.transientFailure("Malformed Ollama response: " + e.getOriginalMessage());

        } catch (RestClientException e) {
            log.error("[Ollama] Call failed: {}", e.getMessage());
            return GenerationResult.transientFailure("Ollama call failed: " + e.getMessage());
        }
    }

    private Duration parseRetryAfter(HttpHeaders headers) {
        if (headers == null) return null;
        String value = headers.getFirst(HttpHeaders.RETRY_AFTER);
        if (value == null || value.isBlank()) return null;
        try {
            return Duration.ofSeconds(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            // HTTP-date form; fall back to the engine's own backoff
            log.debug("[Ollama] Ignoring non-numeric Retry-After '{}'", value);
            return null;
        }
    }
}
