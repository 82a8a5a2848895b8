package com.phillippitts.voiceinventory.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the extraction pipeline (model round-trips, retry policy, context window).
 */
@Validated
@ConfigurationProperties(prefix = "extraction")
public class ExtractionProperties {

    /**
     * Results below this confidence are still applied but flagged for operator review.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private final double lowConfidenceThreshold;

    /** Total attempts per transcript, including the first one. */
    @Min(1)
    @Max(10)
    private final int maxAttempts;

    @Min(0)
    private final long initialBackoffMs;

    @Min(0)
    private final long maxBackoffMs;

    /** Number of recent exchanges kept in the conversation context. */
    @Min(1)
    @Max(50)
    private final int historySize;

    @Min(1)
    private final int maxInputLength;

    @ConstructorBinding
    public ExtractionProperties(Double lowConfidenceThreshold,
                                Integer maxAttempts,
                                Long initialBackoffMs,
                                Long maxBackoffMs,
                                Integer historySize,
                                Integer maxInputLength) {
        this.lowConfidenceThreshold = lowConfidenceThreshold == null ? 0.7 : lowConfidenceThreshold;
        this.maxAttempts = maxAttempts == null ? 3 : maxAttempts;
        this.initialBackoffMs = initialBackoffMs == null ? 250L : initialBackoffMs;
        this.maxBackoffMs = maxBackoffMs == null ? 2000L : maxBackoffMs;
        this.historySize = historySize == null ? 6 : historySize;
        this.maxInputLength = maxInputLength == null ? 4000 : maxInputLength;
    }

    /**
     * Defaults for tests and manual wiring.
     */
    public static ExtractionProperties defaults() {
        return new ExtractionProperties(null, null, null, null, null, null);
    }

    public double getLowConfidenceThreshold() {
        return lowConfidenceThreshold;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public long getInitialBackoffMs() {
        return initialBackoffMs;
    }

    public long getMaxBackoffMs() {
        return maxBackoffMs;
    }

    public int getHistorySize() {
        return historySize;
    }

    public int getMaxInputLength() {
        return maxInputLength;
    }
}
