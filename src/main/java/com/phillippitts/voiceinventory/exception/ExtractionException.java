package com.phillippitts.voiceinventory.exception;

/**
 * Thrown when a transcript cannot be turned into field updates.
 *
 * <p>The original transcript travels with the exception so that the caller can offer a retry
 * without asking the operator to repeat themselves.
 */
public class ExtractionException extends VoiceInventoryException {

    public enum Kind {
        NETWORK,
        RATE_LIMITED,
        MALFORMED_RESPONSE,
        CONTENT_FILTERED,
        INVALID_INPUT,
        NOT_CONFIGURED,
        UPSTREAM_REJECTED,
        CANCELLED;

        /**
         * Transient kinds are retried with backoff before surfacing.
         */
        public boolean isTransient() {
            return this == NETWORK || this == RATE_LIMITED;
        }
    }

    private final Kind kind;
    private final String transcript;

    public ExtractionException(Kind kind, String message) {
        this(kind, message, null, null);
    }

    public ExtractionException(Kind kind, String message, String transcript) {
        this(kind, message, transcript, null);
    }

    public ExtractionException(Kind kind, String message, String transcript, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.transcript = transcript;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return the transcript being processed when the failure occurred, or {@code null} if not yet known
     */
    public String getTranscript() {
        return transcript;
    }

    public boolean isRetryable() {
        return kind.isTransient() || kind == Kind.MALFORMED_RESPONSE;
    }

    /**
     * Copies this exception with the transcript attached. Used once the failing round is known.
     */
    public ExtractionException withTranscript(String transcript) {
        if (transcript == null || transcript.equals(this.transcript)) {
            return this;
        }
        ExtractionException copy = new ExtractionException(kind, getMessage(), transcript, getCause());
        copy.setStackTrace(getStackTrace());
        return copy;
    }
}
