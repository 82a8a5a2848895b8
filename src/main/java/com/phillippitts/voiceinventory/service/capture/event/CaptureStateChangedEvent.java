package com.phillippitts.voiceinventory.service.capture.event;

import com.phillippitts.voiceinventory.service.capture.CaptureState;

import java.time.Instant;

/**
 * Published on every capture state transition.
 *
 * @param state the new state
 * @param timestamp when the transition happened
 */
public record CaptureStateChangedEvent(CaptureState state, Instant timestamp) {
}
