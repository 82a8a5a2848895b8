package com.phillippitts.voiceinventory.exception;

/**
 * Thrown when the speech recognizer cannot be started or reports an unrecoverable condition.
 */
public class CaptureException extends VoiceInventoryException {

    /**
     * Recognizer error categories as reported by the client-side engine.
     */
    public enum Kind {
        NO_MATCH(true),
        SPEECH_TIMEOUT(true),
        BUSY(true),
        NETWORK(false),
        AUDIO(false),
        CLIENT(false),
        PERMISSION_DENIED(false),
        UNAVAILABLE(false);

        private final boolean recoverable;

        Kind(boolean recoverable) {
            this.recoverable = recoverable;
        }

        /**
         * Recoverable errors are retried silently by restarting the recognizer.
         */
        public boolean isRecoverable() {
            return recoverable;
        }

        /**
         * Whether the operator may retry after this error surfaced. Permission denial needs a settings change.
         */
        public boolean isRetryable() {
            return this != PERMISSION_DENIED;
        }
    }

    private final Kind kind;

    public CaptureException(Kind kind, String message) {
        super(message + " (kind: " + kind + ")");
        this.kind = kind;
    }

    public CaptureException(Kind kind, String message, Throwable cause) {
        super(message + " (kind: " + kind + ")", cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
