package com.phillippitts.voiceinventory.service.capture;

import com.phillippitts.voiceinventory.exception.CaptureException;
import com.phillippitts.voiceinventory.service.capture.event.CaptureStateChangedEvent;
import com.phillippitts.voiceinventory.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Default {@link CaptureController} driving a {@link RecognitionEngine} in restart cycles.
 *
 * <p><b>Threading:</b> recognizer callbacks are handed off to {@code callbackExecutor} and handled
 * under a single lock. Callbacks for a session that is no longer live are ignored. State events are
 * published after the lock is released, in the order they were produced, so listeners may call back
 * into the controller.
 *
 * <p><b>Error handling:</b> recoverable recognizer errors (no match, speech timeout, busy) restart
 * the recognizer after {@code restartExecutor}'s delay, up to {@code maxConsecutiveErrors} in a row.
 * Any other error, or one recoverable error too many, ends the session: accumulated text is emitted as
 * a {@code Result} before the {@code Error} so no dictation is lost.
 */
public class DefaultCaptureController implements CaptureController {

    private static final Logger LOG = LogManager.getLogger(DefaultCaptureController.class);

    private final RecognitionEngine engine;
    private final CaptureStateMachine stateMachine;
    private final ApplicationEventPublisher publisher;
    private final Executor callbackExecutor;
    private final Executor restartExecutor;
    private final TranscriptPostProcessor postProcessor;
    private final int maxConsecutiveErrors;

    private final ReentrantLock lock = new ReentrantLock();
    // Held across lock release and publication to keep event order.
    private final ReentrantLock publishLock = new ReentrantLock(true);
    private volatile CaptureState currentState = new CaptureState.Idle();

    /**
     * @param callbackExecutor runs recognizer callbacks off the recognizer's thread
     * @param restartExecutor runs delayed restarts after recoverable errors
     * @throws NullPointerException if any reference parameter is null
     * @throws IllegalArgumentException if maxConsecutiveErrors is negative
     */
    public DefaultCaptureController(RecognitionEngine engine,
                                    CaptureStateMachine stateMachine,
                                    ApplicationEventPublisher publisher,
                                    Executor callbackExecutor,
                                    Executor restartExecutor,
                                    TranscriptPostProcessor postProcessor,
                                    int maxConsecutiveErrors) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.stateMachine = Objects.requireNonNull(stateMachine, "stateMachine must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.callbackExecutor = Objects.requireNonNull(callbackExecutor, "callbackExecutor must not be null");
        this.restartExecutor = Objects.requireNonNull(restartExecutor, "restartExecutor must not be null");
        this.postProcessor = Objects.requireNonNull(postProcessor, "postProcessor must not be null");
        if (maxConsecutiveErrors < 0) {
            throw new IllegalArgumentException("maxConsecutiveErrors must be >= 0");
        }
        this.maxConsecutiveErrors = maxConsecutiveErrors;
    }

    @Override
    public UUID startCapture() {
        List<CaptureState> events = new ArrayList<>();
        UUID started = null;
        lock.lock();
        try {
            if (stateMachine.isActive()) {
                LOG.debug("startCapture ignored; session {} already live",
                        stateMachine.getActiveSession().id());
                return null;
            }
            CaptureSession session = new CaptureSession(UUID.randomUUID());
            stateMachine.startCapture(session);
            try {
                engine.startListening(listenerFor(session.id()));
                events.add(new CaptureState.Listening(session.id()));
                started = session.id();
                LOG.info("Capture session started (session={})", session.id());
            } catch (CaptureException e) {
                LOG.warn("Recognizer failed to start (session={}): {}", session.id(), e.getMessage());
                stateMachine.cancelCapture();
                events.add(new CaptureState.Error(session.id(), e.getKind(), e.getMessage(),
                        e.getKind().isRetryable()));
            }
        } finally {
            publishAndUnlock(events);
        }
        return started;
    }

    @Override
    public String stopCapture() {
        List<CaptureState> events = new ArrayList<>();
        lock.lock();
        try {
            CaptureSession session = stateMachine.getActiveSession();
            if (session == null) {
                LOG.debug("stopCapture called but no live session; ignoring");
                return null;
            }
            stateMachine.stopCapture(session.id());
            session.disableAutoRestart();
            engine.stopListening();
            String text = finalizeInto(session, events, true);
            events.add(new CaptureState.Idle());
            LOG.info("Capture session stopped (session={}, chars={})", session.id(), text.length());
            return text;
        } finally {
            publishAndUnlock(events);
        }
    }

    @Override
    public void cancelCapture() {
        List<CaptureState> events = new ArrayList<>();
        lock.lock();
        try {
            CaptureSession cancelled = stateMachine.cancelCapture();
            if (cancelled == null) {
                LOG.debug("cancelCapture called but no live session to cancel");
                return;
            }
            cancelled.disableAutoRestart();
            engine.cancel();
            events.add(new CaptureState.Idle());
            LOG.info("Cancelled capture session {}", cancelled.id());
        } finally {
            publishAndUnlock(events);
        }
    }

    @Override
    public boolean isCapturing() {
        return stateMachine.isActive();
    }

    @Override
    public CaptureState currentState() {
        return currentState;
    }

    private RecognitionListener listenerFor(UUID sessionId) {
        return new RecognitionListener() {
            @Override
            public void onPartialResult(String text) {
                callbackExecutor.execute(() -> handlePartial(sessionId, text));
            }

            @Override
            public void onResult(String text, double confidence) {
                callbackExecutor.execute(() -> handleResult(sessionId, text, confidence));
            }

            @Override
            public void onError(CaptureException.Kind kind) {
                callbackExecutor.execute(() -> handleError(sessionId, kind));
            }
        };
    }

    void handlePartial(UUID sessionId, String text) {
        List<CaptureState> events = new ArrayList<>();
        lock.lock();
        try {
            CaptureSession session = live(sessionId);
            if (session == null) {
                return;
            }
            events.add(new CaptureState.PartialResult(sessionId, session.preview(text)));
        } finally {
            publishAndUnlock(events);
        }
    }

    void handleResult(UUID sessionId, String text, double confidence) {
        List<CaptureState> events = new ArrayList<>();
        lock.lock();
        try {
            CaptureSession session = live(sessionId);
            if (session == null) {
                LOG.debug("Ignoring result for stale session {}", sessionId);
                return;
            }
            session.append(text, confidence);
            session.resetErrors();
            LOG.debug("Chunk appended (session={}, chunk='{}')", sessionId, LogSanitizer.preview(text));
            events.add(new CaptureState.PartialResult(sessionId, session.text()));
            restart(session, events);
        } finally {
            publishAndUnlock(events);
        }
    }

    void handleError(UUID sessionId, CaptureException.Kind kind) {
        List<CaptureState> events = new ArrayList<>();
        lock.lock();
        try {
            CaptureSession session = live(sessionId);
            if (session == null) {
                LOG.debug("Ignoring {} for stale session {}", kind, sessionId);
                return;
            }
            if (kind.isRecoverable()) {
                int errors = session.recordError();
                if (errors <= maxConsecutiveErrors) {
                    LOG.debug("Recoverable recognizer error {} ({}/{}), restarting (session={})",
                            kind, errors, maxConsecutiveErrors, sessionId);
                    restartExecutor.execute(() -> restartIfLive(sessionId));
                    return;
                }
                LOG.warn("Too many consecutive recognizer errors ({}), ending session {}", errors, sessionId);
                fail(session, kind, "Too many consecutive recognition errors", events);
                return;
            }
            LOG.warn("Recognizer error {} ended session {}", kind, sessionId);
            fail(session, kind, "Speech recognition failed", events);
        } finally {
            publishAndUnlock(events);
        }
    }

    private void restartIfLive(UUID sessionId) {
        List<CaptureState> events = new ArrayList<>();
        lock.lock();
        try {
            CaptureSession session = live(sessionId);
            if (session == null) {
                return;
            }
            restart(session, events);
        } finally {
            publishAndUnlock(events);
        }
    }

    private void restart(CaptureSession session, List<CaptureState> events) {
        if (!session.isAutoRestart()) {
            return;
        }
        try {
            engine.startListening(listenerFor(session.id()));
        } catch (CaptureException e) {
            LOG.warn("Recognizer restart failed (session={}): {}", session.id(), e.getMessage());
            fail(session, e.getKind(), e.getMessage(), events);
        }
    }

    private void fail(CaptureSession session, CaptureException.Kind kind, String message,
                      List<CaptureState> events) {
        stateMachine.stopCapture(session.id());
        session.disableAutoRestart();
        engine.cancel();
        finalizeInto(session, events, false);
        events.add(new CaptureState.Error(session.id(), kind, message, kind.isRetryable()));
    }

    /**
     * Adds the session's final Result. A stop always reports one, even when nothing was said;
     * a failed session only reports text it actually collected.
     */
    private String finalizeInto(CaptureSession session, List<CaptureState> events, boolean includeEmpty) {
        String text = postProcessor.process(session.text());
        if (includeEmpty || !text.isBlank()) {
            events.add(new CaptureState.Result(session.id(), text, session.confidence()));
        }
        return text;
    }

    private CaptureSession live(UUID sessionId) {
        CaptureSession session = stateMachine.getActiveSession();
        return session != null && session.id().equals(sessionId) ? session : null;
    }

    private void publishAndUnlock(List<CaptureState> events) {
        if (events.isEmpty()) {
            lock.unlock();
            return;
        }
        publishLock.lock();
        try {
            lock.unlock();
            for (CaptureState state : events) {
                currentState = state;
                publisher.publishEvent(new CaptureStateChangedEvent(state, Instant.now()));
            }
        } finally {
            publishLock.unlock();
        }
    }
}
