package com.phillippitts.voiceinventory.service.capture;

import com.phillippitts.voiceinventory.exception.CaptureException;

import java.util.UUID;

/**
 * Observable capture progress.
 */
public sealed interface CaptureState {

    record Idle() implements CaptureState {
    }

    record Listening(UUID sessionId) implements CaptureState {
    }

    /**
     * @param text accumulated text plus the chunk in progress
     */
    record PartialResult(UUID sessionId, String text) implements CaptureState {
    }

    /**
     * The finalized utterance. Emitted at most once per session.
     */
    record Result(UUID sessionId, String text, double confidence) implements CaptureState {
    }

    /**
     * @param retryable whether the operator may simply start capture again
     */
    record Error(UUID sessionId, CaptureException.Kind kind, String message, boolean retryable)
            implements CaptureState {
    }
}
