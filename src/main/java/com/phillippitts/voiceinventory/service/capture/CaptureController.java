package com.phillippitts.voiceinventory.service.capture;

import java.util.UUID;

/**
 * Operator-controlled speech capture with no implicit timeout.
 *
 * <p>Listening continues across natural pauses: each time the recognizer finalizes a chunk it is
 * appended to one logical utterance and the recognizer is restarted. Only {@link #stopCapture()} ends
 * the utterance. State transitions are published as
 * {@link com.phillippitts.voiceinventory.service.capture.event.CaptureStateChangedEvent}s.
 *
 * <p>Implementations must be thread-safe. At most one session is live at a time.
 */
public interface CaptureController {

    /**
     * Starts a session. No-op if one is already live.
     *
     * @return the new session id, or {@code null} if a session was already live or the recognizer
     *         could not start
     */
    UUID startCapture();

    /**
     * Disables auto-restart and finalizes the accumulated text. Emits one {@code Result} (unless the
     * text is empty) followed by {@code Idle}. No-op if no session is live.
     *
     * @return the finalized text (possibly empty), or {@code null} if no session was live
     */
    String stopCapture();

    /**
     * Discards the live session without a {@code Result}.
     */
    void cancelCapture();

    boolean isCapturing();

    CaptureState currentState();
}
