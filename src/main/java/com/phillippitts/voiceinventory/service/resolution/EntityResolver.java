package com.phillippitts.voiceinventory.service.resolution;

import com.phillippitts.voiceinventory.config.properties.ResolutionProperties;
import com.phillippitts.voiceinventory.service.matching.SimilarityMatcher;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Tiered resolution of a spoken name against a candidate pool.
 *
 * <p>Tiers, each short-circuiting:
 * <ol>
 *   <li>Exact case-insensitive name equality: {@code Found}</li>
 *   <li>Substring containment in either direction: one match is {@code Found}, two up to
 *       {@code maxSubstringCandidates} is {@code Ambiguous}; more falls through</li>
 *   <li>Normalized edit-distance similarity (the better of the whole-name score and the weighted
 *       word-window score), keeping candidates at or above {@code minSimilarity}:
 *       none is {@code NotFound}; a lone candidate is {@code Found} at or above {@code highConfidence},
 *       otherwise {@code NeedsConfirmation}; several candidates whose top two differ by more than
 *       {@code confidenceGap} yield {@code NeedsConfirmation} of the best, otherwise {@code Ambiguous}
 *       of the best {@code maxFuzzyCandidates}</li>
 * </ol>
 *
 * <p>Pure and side-effect free: the same query and pool always yield the same outcome.
 * Ties in similarity keep pool order.
 */
public final class EntityResolver {

    private final double minSimilarity;
    private final double highConfidence;
    private final double confidenceGap;
    private final double partialMatchWeight;
    private final int maxSubstringCandidates;
    private final int maxFuzzyCandidates;

    /**
     * @throws IllegalArgumentException if a threshold is not in [0,1] or a candidate cap is too small
     */
    public EntityResolver(double minSimilarity,
                          double highConfidence,
                          double confidenceGap,
                          double partialMatchWeight,
                          int maxSubstringCandidates,
                          int maxFuzzyCandidates) {
        requireUnit(minSimilarity, "minSimilarity");
        requireUnit(highConfidence, "highConfidence");
        requireUnit(confidenceGap, "confidenceGap");
        requireUnit(partialMatchWeight, "partialMatchWeight");
        if (highConfidence < minSimilarity) {
            throw new IllegalArgumentException("highConfidence must be >= minSimilarity");
        }
        if (maxSubstringCandidates < 2 || maxFuzzyCandidates < 1) {
            throw new IllegalArgumentException("candidate caps too small");
        }
        this.minSimilarity = minSimilarity;
        this.highConfidence = highConfidence;
        this.confidenceGap = confidenceGap;
        this.partialMatchWeight = partialMatchWeight;
        this.maxSubstringCandidates = maxSubstringCandidates;
        this.maxFuzzyCandidates = maxFuzzyCandidates;
    }

    public EntityResolver(ResolutionProperties properties) {
        this(properties.getMinSimilarity(),
                properties.getHighConfidence(),
                properties.getConfidenceGap(),
                properties.getPartialMatchWeight(),
                properties.getMaxSubstringCandidates(),
                properties.getMaxFuzzyCandidates());
    }

    /**
     * Resolves {@code query} against {@code pool}, reading each candidate's name through {@code nameOf}.
     */
    public <T> Resolution<T> resolve(String query, Collection<T> pool, Function<T, String> nameOf) {
        Objects.requireNonNull(nameOf, "nameOf must not be null");
        String normalized = SimilarityMatcher.normalize(query);
        if (normalized.isEmpty() || pool == null || pool.isEmpty()) {
            return new Resolution.NotFound<>(query);
        }

        for (T candidate : pool) {
            if (SimilarityMatcher.normalize(nameOf.apply(candidate)).equals(normalized)) {
                return new Resolution.Found<>(candidate, query);
            }
        }

        List<T> containing = new ArrayList<>();
        for (T candidate : pool) {
            String name = SimilarityMatcher.normalize(nameOf.apply(candidate));
            if (!name.isEmpty() && (name.contains(normalized) || normalized.contains(name))) {
                containing.add(candidate);
            }
        }
        if (containing.size() == 1) {
            return new Resolution.Found<>(containing.get(0), query);
        }
        if (containing.size() > 1 && containing.size() <= maxSubstringCandidates) {
            return new Resolution.Ambiguous<>(containing, query);
        }

        return resolveFuzzy(query, normalized, pool, nameOf);
    }

    private <T> Resolution<T> resolveFuzzy(String query, String normalized, Collection<T> pool,
                                           Function<T, String> nameOf) {
        List<Scored<T>> scored = new ArrayList<>();
        for (T candidate : pool) {
            double similarity = score(nameOf.apply(candidate), normalized);
            if (similarity >= minSimilarity) {
                scored.add(new Scored<>(candidate, similarity));
            }
        }
        // List.sort is stable: equal scores keep pool order
        scored.sort(Comparator.comparingDouble((Scored<T> s) -> s.similarity).reversed());

        if (scored.isEmpty()) {
            return new Resolution.NotFound<>(query);
        }
        Scored<T> best = scored.get(0);
        if (scored.size() == 1) {
            return best.similarity >= highConfidence
                    ? new Resolution.Found<>(best.candidate, query)
                    : new Resolution.NeedsConfirmation<>(best.candidate, best.similarity, query);
        }
        if (best.similarity - scored.get(1).similarity > confidenceGap) {
            return new Resolution.NeedsConfirmation<>(best.candidate, best.similarity, query);
        }
        List<T> top = scored.stream()
                .limit(maxFuzzyCandidates)
                .map(s -> s.candidate)
                .toList();
        return new Resolution.Ambiguous<>(top, query);
    }

    /**
     * Similarity used by the fuzzy tier.
     */
    double score(String name, String normalizedQuery) {
        double whole = SimilarityMatcher.similarity(name, normalizedQuery);
        double partial = partialMatchWeight * SimilarityMatcher.partialSimilarity(name, normalizedQuery);
        return Math.max(whole, partial);
    }

    private static void requireUnit(double value, String name) {
        if (value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " in [0,1]");
        }
    }

    private record Scored<T>(T candidate, double similarity) {
    }
}
