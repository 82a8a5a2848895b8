/**
 * Capture session management.
 *
 * <p>A recognizer delivers results in short cycles. The
 * {@link com.phillippitts.voiceinventory.service.capture.DefaultCaptureController} accumulates them
 * into one session, restarts the recognizer after each result and after recoverable errors, and
 * publishes {@link com.phillippitts.voiceinventory.service.capture.event.CaptureStateChangedEvent}s.
 */
package com.phillippitts.voiceinventory.service.capture;
