package com.phillippitts.voiceinventory.service.matching;

import java.util.Arrays;
import java.util.Locale;

/**
 * Normalized edit-distance similarity between two names.
 *
 * <p>Similarity = 1 - levenshtein(a, b) / max(|a|, |b|), computed on lowercased, trimmed input.
 * Identical strings score 1.0; a blank side scores 0.0.
 */
public final class SimilarityMatcher {

    private SimilarityMatcher() {
    }

    /**
     * Lowercases (root locale) and trims; null becomes empty.
     */
    public static String normalize(String s) {
        return s == null ? "" : s.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * @return similarity in [0.0, 1.0]
     */
    public static double similarity(String a, String b) {
        String left = normalize(a);
        String right = normalize(b);
        if (left.equals(right)) {
            return left.isEmpty() ? 0.0 : 1.0;
        }
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        int maxLen = Math.max(left.length(), right.length());
        return 1.0 - (double) levenshtein(left, right) / maxLen;
    }

    /**
     * Best similarity between {@code query} and any run of consecutive words in {@code name} with the
     * same word count as the query. Returns 0.0 when the name has no more words than the query, since
     * the whole-name score already covers that case.
     */
    public static double partialSimilarity(String name, String query) {
        String[] nameWords = words(name);
        String[] queryWords = words(query);
        if (queryWords.length == 0 || nameWords.length <= queryWords.length) {
            return 0.0;
        }
        double best = 0.0;
        for (int start = 0; start + queryWords.length <= nameWords.length; start++) {
            String window = String.join(" ", Arrays.copyOfRange(nameWords, start, start + queryWords.length));
            best = Math.max(best, similarity(window, String.join(" ", queryWords)));
        }
        return best;
    }

    private static String[] words(String s) {
        String normalized = normalize(s);
        return normalized.isEmpty() ? new String[0] : normalized.split("\\s+");
    }

    /**
     * Classic two-row Levenshtein distance (insert, delete, substitute all cost 1).
     */
    public static int levenshtein(String a, String b) {
        if (a.isEmpty()) {
            return b.length();
        }
        if (b.isEmpty()) {
            return a.length();
        }
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            char ca = a.charAt(i - 1);
            for (int j = 1; j <= b.length(); j++) {
                int cost = ca == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
