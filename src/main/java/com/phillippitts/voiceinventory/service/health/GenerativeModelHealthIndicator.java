package com.phillippitts.voiceinventory.service.health;

import com.phillippitts.voiceinventory.config.properties.GeminiProperties;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports whether the generative model used for extraction is configured.
 *
 * <p>Exposed via /actuator/health. The check is local: no request is sent to the model endpoint.
 */
@Component
public class GenerativeModelHealthIndicator implements HealthIndicator {

    private final GeminiProperties properties;

    public GenerativeModelHealthIndicator(GeminiProperties properties) {
        this.properties = properties;
    }

    @Override
    public Health health() {
        Health.Builder builder = properties.isConfigured() ? Health.up() : Health.down();
        return builder
                .withDetail("model", properties.getModel())
                .withDetail("status", properties.isConfigured() ? "configured" : "API key missing (gemini.api-key)")
                .build();
    }
}
