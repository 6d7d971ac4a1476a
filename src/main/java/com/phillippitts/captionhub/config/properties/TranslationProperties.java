package com.phillippitts.captionhub.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the translation fan-out and its LLM client.
 */
@Validated
@ConfigurationProperties(prefix = "translation")
public class TranslationProperties {

    /** Translation provider: {@code echo} (local, deterministic) or {@code openai}. */
    @NotBlank
    private String provider = "echo";

    /** Per-attempt timeout in milliseconds. */
    @Positive(message = "Translation timeout must be positive")
    private long timeoutMs = 4000;

    /** Retries after the first attempt for transient failures. */
    @PositiveOrZero
    private int maxRetries = 2;

    /** Base delay of the exponential backoff, in milliseconds. */
    @Positive
    private long backoffBaseMs = 250;

    /** Upper bound of a single backoff delay, in milliseconds. */
    @Positive
    private long backoffMaxMs = 2000;

    /** Fraction of each backoff delay randomized as jitter (0 = none, 1 = full). */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double jitterFactor = 0.5;

    /** Number of preceding source segments passed as context; 0 disables context. */
    @PositiveOrZero
    private int contextSize = 9;

    @Valid
    private OpenAi openai = new OpenAi();

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public void setTimeoutMs(long timeoutMs) {
        this.timeoutMs = timeoutMs;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public long getBackoffBaseMs() {
        return backoffBaseMs;
    }

    public void setBackoffBaseMs(long backoffBaseMs) {
        this.backoffBaseMs = backoffBaseMs;
    }

    public long getBackoffMaxMs() {
        return backoffMaxMs;
    }

    public void setBackoffMaxMs(long backoffMaxMs) {
        this.backoffMaxMs = backoffMaxMs;
    }

    public double getJitterFactor() {
        return jitterFactor;
    }

    public void setJitterFactor(double jitterFactor) {
        this.jitterFactor = jitterFactor;
    }

    public int getContextSize() {
        return contextSize;
    }

    public void setContextSize(int contextSize) {
        this.contextSize = contextSize;
    }

    public OpenAi getOpenai() {
        return openai;
    }

    public void setOpenai(OpenAi openai) {
        this.openai = openai;
    }

    /**
     * OpenAI-compatible chat-completions endpoint settings.
     */
    public static class OpenAi {
        @NotBlank
        private String baseUrl = "https://api.openai.com";
        private String apiKey = "";
        @NotBlank
        private String model = "gpt-4o-mini";
        @DecimalMin("0.0")
        @DecimalMax("2.0")
        private double temperature = 0.2;
        @Positive
        private long connectTimeoutMs = 2000;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public long getConnectTimeoutMs() {
            return connectTimeoutMs;
        }

        public void setConnectTimeoutMs(long connectTimeoutMs) {
            this.connectTimeoutMs = connectTimeoutMs;
        }
    }
}
