package com.phillippitts.voiceinventory.exception;

/**
 * Base exception for all voice-inventory application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class VoiceInventoryException extends RuntimeException {

    public VoiceInventoryException(String message) {
        super(message);
    }

    public VoiceInventoryException(String message, Throwable cause) {
        super(message, cause);
    }

    public VoiceInventoryException(Throwable cause) {
        super(cause);
    }
}
