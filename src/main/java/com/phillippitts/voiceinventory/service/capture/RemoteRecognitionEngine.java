package com.phillippitts.voiceinventory.service.capture;

import com.phillippitts.voiceinventory.exception.CaptureException;
import com.phillippitts.voiceinventory.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Recognition engine backed by a client-side recognizer (browser or device) that reports its
 * callbacks over HTTP.
 *
 * <p>The client polls {@link #isListening()} and {@link #cycle()} to know when to (re)start its
 * recognizer, and forwards every callback through the {@code deliver*} methods. A callback ends the
 * cycle before it is forwarded, so the controller may start the next cycle from inside the listener.
 */
public class RemoteRecognitionEngine implements RecognitionEngine {

    private static final Logger LOG = LogManager.getLogger(RemoteRecognitionEngine.class);

    private final AtomicReference<RecognitionListener> current = new AtomicReference<>();
    private final AtomicLong cycle = new AtomicLong();

    @Override
    public void startListening(RecognitionListener listener) {
        if (listener == null) {
            throw new CaptureException(CaptureException.Kind.CLIENT, "listener must not be null");
        }
        current.set(listener);
        long n = cycle.incrementAndGet();
        LOG.debug("Listen cycle {} started", n);
    }

    @Override
    public void stopListening() {
        current.set(null);
    }

    @Override
    public void cancel() {
        current.set(null);
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    public boolean isListening() {
        return current.get() != null;
    }

    public long cycle() {
        return cycle.get();
    }

    public void deliverPartial(String text) {
        RecognitionListener listener = current.get();
        if (listener == null) {
            LOG.debug("Dropped partial result outside a listen cycle");
            return;
        }
        listener.onPartialResult(text == null ? "" : text);
    }

    public void deliverResult(String text, double confidence) {
        RecognitionListener listener = current.getAndSet(null);
        if (listener == null) {
            LOG.debug("Dropped result outside a listen cycle: '{}'", LogSanitizer.preview(text));
            return;
        }
        listener.onResult(text == null ? "" : text, confidence);
    }

    public void deliverError(CaptureException.Kind kind) {
        RecognitionListener listener = current.getAndSet(null);
        if (listener == null) {
            LOG.debug("Dropped recognizer error {} outside a listen cycle", kind);
            return;
        }
        listener.onError(kind);
    }
}
