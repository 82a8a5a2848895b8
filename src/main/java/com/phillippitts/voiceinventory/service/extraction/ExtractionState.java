package com.phillippitts.voiceinventory.service.extraction;

import com.phillippitts.voiceinventory.exception.ExtractionException;

/**
 * Observable extraction progress.
 */
public sealed interface ExtractionState {

    record Idle() implements ExtractionState {
    }

    record Processing(String transcript) implements ExtractionState {
    }

    record Extracted(ResolvedData data) implements ExtractionState {
    }

    /**
     * @param transcript the utterance that failed, kept so the operator can retry without repeating it
     */
    record Error(ExtractionException.Kind kind, String message, String transcript, boolean retryable)
            implements ExtractionState {

        public static Error from(ExtractionException e) {
            return new Error(e.getKind(), e.getMessage(), e.getTranscript(), e.isRetryable());
        }
    }
}
