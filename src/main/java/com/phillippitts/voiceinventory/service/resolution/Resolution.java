package com.phillippitts.voiceinventory.service.resolution;

import java.util.List;

/**
 * Outcome of resolving a spoken name against stored records.
 *
 * <p>Ambiguity and absence are normal outcomes: the caller offers a choice or an inline creation.
 *
 * @param <T> record type
 */
public sealed interface Resolution<T> {

    String query();

    /**
     * Single confident match.
     */
    record Found<T>(T record, String query) implements Resolution<T> {
    }

    /**
     * Several plausible matches; the operator picks one. Candidates are ordered best first.
     */
    record Ambiguous<T>(List<T> candidates, String query) implements Resolution<T> {
        public Ambiguous {
            candidates = List.copyOf(candidates);
        }
    }

    record NotFound<T>(String query) implements Resolution<T> {
    }

    /**
     * One fuzzy match that needs an explicit yes from the operator.
     */
    record NeedsConfirmation<T>(T candidate, double similarity, String query) implements Resolution<T> {
    }
}
