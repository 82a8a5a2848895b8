package com.phillippitts.voiceinventory.service.capture;

import java.util.UUID;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe holder of the single live capture session.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * IDLE → LIVE (via startCapture)
 * LIVE → IDLE (via stopCapture or cancelCapture)
 * </pre>
 */
public final class CaptureStateMachine {

    private final Lock lock = new ReentrantLock();
    private CaptureSession activeSession;

    /**
     * @return {@code true} if the session became live, {@code false} if another session is live
     * @throws NullPointerException if session is null
     */
    public boolean startCapture(CaptureSession session) {
        if (session == null) {
            throw new NullPointerException("session cannot be null");
        }

        lock.lock();
        try {
            if (activeSession != null) {
                return false;
            }
            activeSession = session;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Ends the live session if it has the expected id.
     *
     * @return the ended session, or {@code null} if no session is live or the id does not match
     */
    public CaptureSession stopCapture(UUID expectedSessionId) {
        lock.lock();
        try {
            if (activeSession == null || !activeSession.id().equals(expectedSessionId)) {
                return null;
            }
            CaptureSession stopped = activeSession;
            activeSession = null;
            return stopped;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Ends whatever session is live.
     *
     * @return the cancelled session, or {@code null} if none was live
     */
    public CaptureSession cancelCapture() {
        lock.lock();
        try {
            CaptureSession cancelled = activeSession;
            activeSession = null;
            return cancelled;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return the live session, or {@code null}
     */
    public CaptureSession getActiveSession() {
        lock.lock();
        try {
            return activeSession;
        } finally {
            lock.unlock();
        }
    }

    public boolean isActive() {
        lock.lock();
        try {
            return activeSession != null;
        } finally {
            lock.unlock();
        }
    }

    public boolean isSessionActive(UUID sessionId) {
        if (sessionId == null) {
            return false;
        }
        lock.lock();
        try {
            return activeSession != null && sessionId.equals(activeSession.id());
        } finally {
            lock.unlock();
        }
    }
}
