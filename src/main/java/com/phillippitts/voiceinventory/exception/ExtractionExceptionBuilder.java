package com.phillippitts.voiceinventory.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link ExtractionException} with contextual metadata in the message.
 *
 * <pre>
 * throw ExtractionExceptionBuilder.create("Model call failed")
 *         .kind(ExtractionException.Kind.RATE_LIMITED)
 *         .status(429)
 *         .attempt(2)
 *         .metadata("model", model)
 *         .build();
 * </pre>
 */
public final class ExtractionExceptionBuilder {

    private final String message;
    private ExtractionException.Kind kind = ExtractionException.Kind.NETWORK;
    private String transcript;
    private Throwable cause;
    private Integer status;
    private Integer attempt;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private ExtractionExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * @param message base error message (must not be null or empty)
     */
    public static ExtractionExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new ExtractionExceptionBuilder(message);
    }

    public ExtractionExceptionBuilder kind(ExtractionException.Kind kind) {
        if (kind != null) {
            this.kind = kind;
        }
        return this;
    }

    public ExtractionExceptionBuilder transcript(String transcript) {
        this.transcript = transcript;
        return this;
    }

    public ExtractionExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    /**
     * HTTP status returned by the model endpoint.
     */
    public ExtractionExceptionBuilder status(int status) {
        this.status = status;
        return this;
    }

    public ExtractionExceptionBuilder attempt(int attempt) {
        this.attempt = attempt;
        return this;
    }

    public ExtractionExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Message format: {@code {message} (kind={kind}, status={status}, attempt={n}, {key}={value}, ...)}
     */
    public ExtractionException build() {
        return new ExtractionException(kind, buildDetailedMessage(), transcript, cause);
    }

    private String buildDetailedMessage() {
        StringBuilder sb = new StringBuilder(message);
        sb.append(" (kind=").append(kind);
        if (status != null) {
            sb.append(", status=").append(status);
        }
        if (attempt != null) {
            sb.append(", attempt=").append(attempt);
        }
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            sb.append(", ").append(entry.getKey()).append("=").append(entry.getValue());
        }
        sb.append(")");
        return sb.toString();
    }
}
