package com.phillippitts.voiceinventory.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Connection settings for the Gemini generateContent endpoint.
 *
 * <p>The API key may be blank at startup; extraction calls then fail fast and the
 * health indicator reports the model as not configured.
 */
@Validated
@ConfigurationProperties(prefix = "gemini")
public class GeminiProperties {

    private final String apiKey;

    @NotBlank
    private final String baseUrl;

    @NotBlank
    private final String model;

    @DecimalMin("0.0")
    @DecimalMax("2.0")
    private final double temperature;

    @Min(1)
    private final int connectTimeoutMs;

    @Min(1)
    private final int readTimeoutMs;

    @ConstructorBinding
    public GeminiProperties(String apiKey,
                            String baseUrl,
                            String model,
                            Double temperature,
                            Integer connectTimeoutMs,
                            Integer readTimeoutMs) {
        this.apiKey = apiKey == null ? "" : apiKey.trim();
        this.baseUrl = baseUrl == null ? "https://generativelanguage.googleapis.com/v1beta" : baseUrl;
        this.model = model == null ? "gemini-2.0-flash" : model;
        this.temperature = temperature == null ? 0.2 : temperature;
        this.connectTimeoutMs = connectTimeoutMs == null ? 5000 : connectTimeoutMs;
        this.readTimeoutMs = readTimeoutMs == null ? 30000 : readTimeoutMs;
    }

    public boolean isConfigured() {
        return !apiKey.isBlank();
    }

    public String getApiKey() {
        return apiKey;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public String getModel() {
        return model;
    }

    public double getTemperature() {
        return temperature;
    }

    public int getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public int getReadTimeoutMs() {
        return readTimeoutMs;
    }
}
