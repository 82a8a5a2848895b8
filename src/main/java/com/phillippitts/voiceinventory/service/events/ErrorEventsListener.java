package com.phillippitts.voiceinventory.service.events;

import com.phillippitts.voiceinventory.exception.CaptureException;
import com.phillippitts.voiceinventory.service.capture.CaptureState;
import com.phillippitts.voiceinventory.service.capture.event.CaptureStateChangedEvent;
import com.phillippitts.voiceinventory.service.extraction.ExtractionState;
import com.phillippitts.voiceinventory.service.extraction.event.ExtractionStateChangedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for operator-facing error states. Privacy-safe (no transcript text) and
 * throttled to avoid log spam.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onCaptureState(CaptureStateChangedEvent e) {
        if (!(e.state() instanceof CaptureState.Error error)) {
            return;
        }
        if (error.kind() == CaptureException.Kind.PERMISSION_DENIED) {
            if (shouldLog("capture-permission")) {
                LOG.warn("Microphone permission denied. Grant microphone access in the client and start again.");
            }
            return;
        }
        if (shouldLog("capture-" + error.kind())) {
            LOG.warn("Capture error: kind={}, retryable={}. Check the microphone and recognizer.",
                    error.kind(), error.retryable());
        }
    }

    @EventListener
    void onExtractionState(ExtractionStateChangedEvent e) {
        if (!(e.state() instanceof ExtractionState.Error error)) {
            return;
        }
        if (shouldLog("extraction-" + error.kind())) {
            LOG.warn("Extraction error: kind={}, retryable={}. Check gemini.* settings and quota.",
                    error.kind(), error.retryable());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
