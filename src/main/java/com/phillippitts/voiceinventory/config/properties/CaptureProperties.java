package com.phillippitts.voiceinventory.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed properties for the operator-controlled capture session.
 */
@Validated
@ConfigurationProperties(prefix = "capture")
public class CaptureProperties {

    /**
     * Number of recoverable recognizer errors tolerated in a row. The next one escalates to a fatal error.
     * The counter resets whenever a chunk is recognized.
     */
    @Min(0)
    @Max(20)
    private final int maxConsecutiveErrors;

    /**
     * Delay before silently restarting the recognizer after a recoverable error.
     */
    @Min(0)
    @Max(5000)
    private final long restartDelayMs;

    /**
     * Known-term corrections applied to every finalized transcript (misheard form to canonical form).
     */
    private final Map<String, String> corrections;

    @ConstructorBinding
    public CaptureProperties(Integer maxConsecutiveErrors, Long restartDelayMs, Map<String, String> corrections) {
        this.maxConsecutiveErrors = maxConsecutiveErrors == null ? 3 : maxConsecutiveErrors;
        this.restartDelayMs = restartDelayMs == null ? 50L : restartDelayMs;
        this.corrections = corrections == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(corrections));
    }

    public int getMaxConsecutiveErrors() {
        return maxConsecutiveErrors;
    }

    public long getRestartDelayMs() {
        return restartDelayMs;
    }

    public Map<String, String> getCorrections() {
        return corrections;
    }
}
