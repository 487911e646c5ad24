package com.homework.llm.client;

import com.homework.llm.model.ContentPart;
import com.homework.llm.model.GenerationResponse;
import com.homework.llm.oracle.ContentOracle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link ContentOracle} backed by the Gemini {@code generateContent} endpoint.
 *
 * <p>Each call is retried up to {@code gemini.max-retries} times with a fixed
 * {@code gemini.retry-delay} between attempts. Rate limits (429), server errors
 * and connection problems are retried; other HTTP 4xx errors and safety blocks
 * are not. When every attempt fails the client returns
 * {@link ContentOracle#FAILURE_SENTINEL}.
 */
@Component
@Slf4j
public class GeminiClient implements ContentOracle {

    private final GeminiProperties config;
    private final WebClient webClient;

    public GeminiClient(GeminiProperties config, WebClient.Builder webClientBuilder) {
        this.config = config;
        this.webClient = webClientBuilder
            .baseUrl(config.getBaseUrl())
            .defaultHeader("Content-Type", "application/json")
            .build();
    }

    @Override
    public String respond(String systemInstruction, List<ContentPart> parts) {
        if (!config.hasApiKey()) {
            log.error("[GEMINI] API key is not set. Please set GEMINI_API_KEY or gemini.api-key");
            return FAILURE_SENTINEL;
        }

        Map<String, Object> request = buildRequest(systemInstruction, parts);
        int maxRetries = config.getMaxRetries();

        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            long startTime = System.currentTimeMillis();
            try {
                String text = execute(request);
                log.info("[GEMINI] Content generated | model={} | attempt={} | durationMs={} | responseLength={}",
                    config.getGenerationModel(), attempt, System.currentTimeMillis() - startTime, text.length());
                return text;
            } catch (OracleCallException e) {
                log.warn("[GEMINI] Call failed (attempt {}/{}) | statusCode={} | retryable={} | error={}",
                    attempt, maxRetries, e.getStatusCode(), e.isRetryable(), e.getMessage());
                if (!e.isRetryable()) {
                    break;
                }
                if (attempt < maxRetries && !sleepBeforeRetry()) {
                    break;
                }
            }
        }

        log.error("[GEMINI] Giving up after retries | model={} | maxRetries={}", config.getGenerationModel(), maxRetries);
        return FAILURE_SENTINEL;
    }

    Map<String, Object> buildRequest(String systemInstruction, List<ContentPart> parts) {
        List<Map<String, Object>> requestParts = new ArrayList<>();
        for (ContentPart part : parts) {
            if (part.isImage()) {
                requestParts.add(Map.of("inlineData", Map.of(
                    "mimeType", part.getMimeType(),
                    "data", part.getData()
                )));
            } else {
                requestParts.add(Map.of("text", part.getText()));
            }
        }

        Map<String, Object> requestMap = new HashMap<>();
        requestMap.put("contents", List.of(
            Map.of("role", "user", "parts", requestParts)
        ));
        requestMap.put("systemInstruction", Map.of(
            "parts", List.of(Map.of("text", systemInstruction))
        ));
        requestMap.put("generationConfig", Map.of(
            "temperature", config.getTemperature(),
            "maxOutputTokens", config.getMaxOutputTokens()
        ));
        return Map.copyOf(requestMap);
    }

    private String execute(Map<String, Object> request) {
        String uri = String.format("/models/%s:generateContent?key=%s", config.getGenerationModel(), config.getApiKey());

        GenerationResponse response;
        try {
            response = webClient.post()
                .uri(uri)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(GenerationResponse.class)
                .timeout(config.getTimeout())
                .block();
        } catch (WebClientResponseException e) {
            int status = e.getStatusCode().value();
            boolean retryable = status == 429 || status >= 500;
            throw new OracleCallException("Gemini API error: " + status + " " + e.getStatusText(), status, retryable, e);
        } catch (Exception e) {
            throw new OracleCallException("Gemini request failed: " + e.getMessage(), 0, true, e);
        }

        if (response == null) {
            throw new OracleCallException("Gemini response was empty", 0, true);
        }
        if (response.getPromptFeedback() != null && response.getPromptFeedback().getBlockReason() != null) {
            throw new OracleCallException("Prompt blocked: " + response.getPromptFeedback().getBlockReason(), 200, false);
        }

        String finishReason = response.firstFinishReason();
        if ("SAFETY".equals(finishReason) || "RECITATION".equals(finishReason)) {
            throw new OracleCallException("Content generation blocked, finish reason " + finishReason, 200, false);
        }

        String text = response.firstCandidateText();
        if (text == null || text.isEmpty()) {
            throw new OracleCallException("Gemini returned no text, finish reason " + finishReason, 200, true);
        }
        if ("MAX_TOKENS".equals(finishReason)) {
            log.warn("[GEMINI] Response truncated at MAX_TOKENS ({} chars). Consider raising gemini.max-output-tokens",
                text.length());
        }
        return text;
    }

    private boolean sleepBeforeRetry() {
        try {
            Thread.sleep(config.getRetryDelay().toMillis());
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            log.warn("[GEMINI] Interrupted during retry delay");
            return false;
        }
    }
}
