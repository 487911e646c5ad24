package com.homework.llm.client;

import lombok.Getter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Gemini connection and retry settings, bound once from {@code gemini.*} and never mutated.
 */
@ConfigurationProperties(prefix = "gemini")
@Getter
public class GeminiProperties {

    private final String apiKey;
    private final String generationModel;
    private final String baseUrl;
    private final double temperature;
    private final int maxOutputTokens;
    private final int maxRetries;
    private final Duration retryDelay;
    private final Duration timeout;

    public GeminiProperties(
            String apiKey,
            @DefaultValue("gemini-2.5-flash") String generationModel,
            @DefaultValue("https://generativelanguage.googleapis.com/v1beta") String baseUrl,
            @DefaultValue("0.3") double temperature,
            @DefaultValue("8192") int maxOutputTokens,
            @DefaultValue("3") int maxRetries,
            @DefaultValue("2s") Duration retryDelay,
            @DefaultValue("120s") Duration timeout) {
        this.apiKey = apiKey;
        this.generationModel = generationModel;
        this.baseUrl = baseUrl;
        this.temperature = temperature;
        this.maxOutputTokens = maxOutputTokens;
        this.maxRetries = Math.max(1, maxRetries);
        this.retryDelay = retryDelay;
        this.timeout = timeout;
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }
}
