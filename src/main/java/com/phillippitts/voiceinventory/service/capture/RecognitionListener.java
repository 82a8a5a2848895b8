package com.phillippitts.voiceinventory.service.capture;

import com.phillippitts.voiceinventory.exception.CaptureException;

/**
 * Callbacks for one listen cycle of a {@link RecognitionEngine}. A cycle ends with exactly one
 * {@link #onResult} or {@link #onError}; partial results may precede it.
 */
public interface RecognitionListener {

    void onPartialResult(String text);

    /**
     * The recognizer detected a natural pause and finalized a chunk.
     *
     * @param confidence recognizer confidence in [0,1], or 0 if not reported
     */
    void onResult(String text, double confidence);

    void onError(CaptureException.Kind kind);
}
