package com.phillippitts.voiceinventory.service.extraction.event;

import com.phillippitts.voiceinventory.service.extraction.ExtractionState;

import java.time.Instant;

/**
 * Published on every extraction state transition.
 */
public record ExtractionStateChangedEvent(ExtractionState state, Instant timestamp) {
}
