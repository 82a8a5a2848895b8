package com.phillippitts.voiceinventory.service.capture;

/**
 * A speech recognizer that listens in cycles: each {@link #startListening} call runs until the
 * recognizer reports a result or an error through the given listener.
 */
public interface RecognitionEngine {

    /**
     * Starts one listen cycle.
     *
     * @throws com.phillippitts.voiceinventory.exception.CaptureException if the recognizer cannot start
     */
    void startListening(RecognitionListener listener);

    /**
     * Asks the recognizer to end the current cycle. Results delivered afterwards may be dropped.
     */
    void stopListening();

    /**
     * Aborts the current cycle and releases the microphone.
     */
    void cancel();

    boolean isAvailable();
}
