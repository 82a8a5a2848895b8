package com.phillippitts.voiceinventory.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Thresholds for tiered entity-name resolution.
 */
@Validated
@ConfigurationProperties(prefix = "resolution")
public class ResolutionProperties {

    /** Fuzzy candidates below this similarity are discarded. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private final double minSimilarity;

    /** A lone fuzzy candidate at or above this similarity resolves without confirmation. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private final double highConfidence;

    /** Top-two similarity gap above which the best fuzzy candidate is proposed alone. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private final double confidenceGap;

    /**
     * Weight applied to word-window similarity (a spoken name matching part of a longer stored name).
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private final double partialMatchWeight;

    @Min(2)
    private final int maxSubstringCandidates;

    @Min(1)
    private final int maxFuzzyCandidates;

    @ConstructorBinding
    public ResolutionProperties(Double minSimilarity,
                                Double highConfidence,
                                Double confidenceGap,
                                Double partialMatchWeight,
                                Integer maxSubstringCandidates,
                                Integer maxFuzzyCandidates) {
        this.minSimilarity = minSimilarity == null ? 0.6 : minSimilarity;
        this.highConfidence = highConfidence == null ? 0.8 : highConfidence;
        this.confidenceGap = confidenceGap == null ? 0.2 : confidenceGap;
        this.partialMatchWeight = partialMatchWeight == null ? 0.9 : partialMatchWeight;
        this.maxSubstringCandidates = maxSubstringCandidates == null ? 5 : maxSubstringCandidates;
        this.maxFuzzyCandidates = maxFuzzyCandidates == null ? 3 : maxFuzzyCandidates;
    }

    public static ResolutionProperties defaults() {
        return new ResolutionProperties(null, null, null, null, null, null);
    }

    public double getMinSimilarity() {
        return minSimilarity;
    }

    public double getHighConfidence() {
        return highConfidence;
    }

    public double getConfidenceGap() {
        return confidenceGap;
    }

    public double getPartialMatchWeight() {
        return partialMatchWeight;
    }

    public int getMaxSubstringCandidates() {
        return maxSubstringCandidates;
    }

    public int getMaxFuzzyCandidates() {
        return maxFuzzyCandidates;
    }
}
