package com.phillippitts.voiceinventory.service.capture;

import java.util.UUID;

/**
 * One logical utterance spanning any number of recognizer restarts.
 *
 * <p>Not thread-safe; guarded by the capture controller's lock.
 */
public final class CaptureSession {

    private final UUID id;
    private final StringBuilder accumulated = new StringBuilder();
    private boolean autoRestart = true;
    private int consecutiveErrors;
    private double confidenceSum;
    private int chunks;

    public CaptureSession(UUID id) {
        if (id == null) {
            throw new NullPointerException("id cannot be null");
        }
        this.id = id;
    }

    public UUID id() {
        return id;
    }

    /**
     * Appends a finalized chunk. Blank chunks are ignored.
     */
    public void append(String chunk, double confidence) {
        if (chunk == null || chunk.isBlank()) {
            return;
        }
        if (accumulated.length() > 0) {
            accumulated.append(' ');
        }
        accumulated.append(chunk.trim());
        confidenceSum += confidence;
        chunks++;
    }

    public String text() {
        return accumulated.toString();
    }

    /**
     * Accumulated text followed by the chunk the recognizer is still working on.
     */
    public String preview(String inProgress) {
        if (inProgress == null || inProgress.isBlank()) {
            return text();
        }
        return accumulated.length() == 0 ? inProgress.trim() : accumulated + " " + inProgress.trim();
    }

    /**
     * Mean confidence over recognized chunks, or 0 if none.
     */
    public double confidence() {
        return chunks == 0 ? 0.0 : confidenceSum / chunks;
    }

    public int recordError() {
        return ++consecutiveErrors;
    }

    public void resetErrors() {
        consecutiveErrors = 0;
    }

    public int consecutiveErrors() {
        return consecutiveErrors;
    }

    public boolean isAutoRestart() {
        return autoRestart;
    }

    public void disableAutoRestart() {
        autoRestart = false;
    }
}
