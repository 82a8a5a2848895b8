package com.phillippitts.voiceinventory.service.events;

import com.phillippitts.voiceinventory.exception.CaptureException;
import com.phillippitts.voiceinventory.exception.ExtractionException;
import com.phillippitts.voiceinventory.service.capture.CaptureState;
import com.phillippitts.voiceinventory.service.capture.event.CaptureStateChangedEvent;
import com.phillippitts.voiceinventory.service.extraction.ExtractionState;
import com.phillippitts.voiceinventory.service.extraction.event.ExtractionStateChangedEvent;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorEventsListenerTest {

    @Test
    void throttlesRepeatLogs() {
        ErrorEventsListener l = new ErrorEventsListener();

        assertThat(l.shouldLog("capture-permission")).isTrue();
        assertThat(l.shouldLog("capture-permission")).isFalse();
        assertThat(l.shouldLog("capture-AUDIO")).isTrue();
    }

    @Test
    void captureErrorConsumesThrottleSlot() {
        ErrorEventsListener l = new ErrorEventsListener();

        l.onCaptureState(new CaptureStateChangedEvent(new CaptureState.Error(UUID.randomUUID(),
                CaptureException.Kind.PERMISSION_DENIED, "denied", false), Instant.now()));

        assertThat(l.shouldLog("capture-permission")).isFalse();
    }

    @Test
    void extractionErrorConsumesThrottleSlotPerKind() {
        ErrorEventsListener l = new ErrorEventsListener();

        l.onExtractionState(new ExtractionStateChangedEvent(new ExtractionState.Error(
                ExtractionException.Kind.NETWORK, "timeout", "ward B", true), Instant.now()));

        assertThat(l.shouldLog("extraction-NETWORK")).isFalse();
        assertThat(l.shouldLog("extraction-RATE_LIMITED")).isTrue();
    }

    @Test
    void nonErrorStatesAreIgnored() {
        ErrorEventsListener l = new ErrorEventsListener();

        l.onCaptureState(new CaptureStateChangedEvent(new CaptureState.Idle(), Instant.now()));
        l.onExtractionState(new ExtractionStateChangedEvent(new ExtractionState.Idle(), Instant.now()));

        assertThat(l.shouldLog("capture-permission")).isTrue();
    }
}
