package com.phillippitts.voiceinventory.service.capture;

import com.phillippitts.voiceinventory.exception.CaptureException;
import com.phillippitts.voiceinventory.service.capture.event.CaptureStateChangedEvent;
import com.phillippitts.voiceinventory.testutil.EventCapturingPublisher;
import com.phillippitts.voiceinventory.testutil.QueuedExecutor;
import com.phillippitts.voiceinventory.testutil.ScriptedRecognitionEngine;
import com.phillippitts.voiceinventory.testutil.SyncExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class DefaultCaptureControllerTest {

    private ScriptedRecognitionEngine engine;
    private EventCapturingPublisher publisher;
    private QueuedExecutor restarts;
    private DefaultCaptureController controller;

    @BeforeEach
    void setUp() {
        engine = new ScriptedRecognitionEngine();
        publisher = new EventCapturingPublisher();
        restarts = new QueuedExecutor();
        controller = new DefaultCaptureController(engine, new CaptureStateMachine(), publisher,
                new SyncExecutor(), restarts, new TranscriptPostProcessor(Map.of("siemenz", "Siemens")), 3);
    }

    private List<CaptureState> states() {
        return publisher.eventsOfType(CaptureStateChangedEvent.class).stream()
                .map(CaptureStateChangedEvent::state)
                .toList();
    }

    private <T extends CaptureState> List<T> states(Class<T> type) {
        return states().stream().filter(type::isInstance).map(type::cast).toList();
    }

    @Test
    void shouldStartSessionAndPublishListening() {
        // Act
        UUID sessionId = controller.startCapture();

        // Assert
        assertThat(sessionId).isNotNull();
        assertThat(controller.isCapturing()).isTrue();
        assertThat(engine.startCount()).isEqualTo(1);
        assertThat(states()).containsExactly(new CaptureState.Listening(sessionId));
        assertThat(controller.currentState()).isEqualTo(new CaptureState.Listening(sessionId));
    }

    @Test
    void shouldIgnoreStartWhileSessionIsLive() {
        controller.startCapture();

        assertThat(controller.startCapture()).isNull();
        assertThat(engine.startCount()).isEqualTo(1);
        assertThat(states(CaptureState.Listening.class)).hasSize(1);
    }

    @Test
    void shouldAccumulateChunksAcrossPausesAndRestartRecognizer() {
        // Arrange
        UUID sessionId = controller.startCapture();

        // Act
        engine.emitResult("new suction pump", 0.8);
        engine.emitPartial("in ward");
        engine.emitResult("in ward B", 0.6);

        // Assert
        assertThat(engine.startCount()).isEqualTo(3);
        assertThat(controller.isCapturing()).isTrue();
        assertThat(states(CaptureState.PartialResult.class))
                .extracting(CaptureState.PartialResult::text)
                .containsExactly("new suction pump", "new suction pump in ward", "new suction pump in ward B");
        assertThat(states(CaptureState.Result.class)).isEmpty();
        assertThat(states(CaptureState.PartialResult.class))
                .allSatisfy(p -> assertThat(p.sessionId()).isEqualTo(sessionId));
    }

    @Test
    void shouldEmitExactlyOneResultWhenStoppedTwice() {
        // Arrange
        controller.startCapture();
        engine.emitResult("first part", 0.8);
        engine.emitResult("second part", 0.6);

        // Act
        String text = controller.stopCapture();
        String again = controller.stopCapture();

        // Assert
        assertThat(text).isEqualTo("first part second part");
        assertThat(again).isNull();
        List<CaptureState.Result> results = states(CaptureState.Result.class);
        assertThat(results).hasSize(1);
        assertThat(results.get(0).confidence()).isCloseTo(0.7, within(1e-9));
        List<CaptureState> all = states();
        assertThat(all.get(all.size() - 1)).isEqualTo(new CaptureState.Idle());
        assertThat(all.get(all.size() - 2)).isInstanceOf(CaptureState.Result.class);
        assertThat(engine.stopCount()).isEqualTo(1);
        assertThat(controller.isCapturing()).isFalse();
    }

    @Test
    void shouldApplyCorrectionsToFinalText() {
        controller.startCapture();
        engine.emitResult("monitor from Siemenz", 0.9);

        assertThat(controller.stopCapture()).isEqualTo("monitor from Siemens");
    }

    @Test
    void shouldEmitOneEmptyResultWhenStoppedBeforeAnythingWasSaid() {
        controller.startCapture();

        String text = controller.stopCapture();
        String again = controller.stopCapture();

        assertThat(text).isEmpty();
        assertThat(again).isNull();
        List<CaptureState.Result> results = states(CaptureState.Result.class);
        assertThat(results).hasSize(1);
        assertThat(results.get(0).text()).isEmpty();
        assertThat(results.get(0).confidence()).isZero();
        assertThat(controller.currentState()).isEqualTo(new CaptureState.Idle());
    }

    @Test
    void shouldRestartAfterThreeRecoverableErrorsAndEscalateOnFourth() {
        // Arrange
        UUID sessionId = controller.startCapture();

        // Act: three recoverable errors, each followed by the delayed restart
        for (int i = 0; i < 3; i++) {
            engine.emitError(CaptureException.Kind.NO_MATCH);
            restarts.runAll();
        }

        // Assert
        assertThat(engine.startCount()).isEqualTo(4);
        assertThat(controller.isCapturing()).isTrue();
        assertThat(states(CaptureState.Error.class)).isEmpty();

        // Act: the fourth in a row
        engine.emitError(CaptureException.Kind.SPEECH_TIMEOUT);

        // Assert
        assertThat(restarts.pendingCount()).isZero();
        assertThat(controller.isCapturing()).isFalse();
        assertThat(engine.cancelCount()).isEqualTo(1);
        assertThat(states(CaptureState.Error.class)).singleElement().satisfies(error -> {
            assertThat(error.sessionId()).isEqualTo(sessionId);
            assertThat(error.kind()).isEqualTo(CaptureException.Kind.SPEECH_TIMEOUT);
            assertThat(error.retryable()).isTrue();
        });
    }

    @Test
    void shouldResetErrorCountAfterSuccessfulChunk() {
        // Arrange
        controller.startCapture();
        for (int i = 0; i < 3; i++) {
            engine.emitError(CaptureException.Kind.NO_MATCH);
            restarts.runAll();
        }

        // Act
        engine.emitResult("still here", 0.9);
        engine.emitError(CaptureException.Kind.NO_MATCH);
        restarts.runAll();

        // Assert
        assertThat(controller.isCapturing()).isTrue();
        assertThat(states(CaptureState.Error.class)).isEmpty();
    }

    @Test
    void shouldKeepDictatedTextWhenFatalErrorEndsSession() {
        // Arrange
        controller.startCapture();
        engine.emitResult("replaced the battery", 0.9);

        // Act
        engine.emitError(CaptureException.Kind.NETWORK);

        // Assert
        List<CaptureState> all = states();
        assertThat(all.get(all.size() - 2)).isInstanceOf(CaptureState.Result.class);
        assertThat(((CaptureState.Result) all.get(all.size() - 2)).text()).isEqualTo("replaced the battery");
        assertThat(all.get(all.size() - 1)).isInstanceOf(CaptureState.Error.class);
        assertThat(controller.isCapturing()).isFalse();
    }

    @Test
    void shouldReportPermissionDenialAsNotRetryable() {
        controller.startCapture();

        engine.emitError(CaptureException.Kind.PERMISSION_DENIED);

        assertThat(states(CaptureState.Error.class)).singleElement()
                .satisfies(error -> assertThat(error.retryable()).isFalse());
    }

    @Test
    void shouldPublishErrorWhenRecognizerCannotStart() {
        // Arrange
        engine.failNextStart(CaptureException.Kind.UNAVAILABLE);

        // Act
        UUID sessionId = controller.startCapture();

        // Assert
        assertThat(sessionId).isNull();
        assertThat(controller.isCapturing()).isFalse();
        assertThat(states()).singleElement().isInstanceOf(CaptureState.Error.class);
    }

    @Test
    void shouldIgnoreCallbacksFromStaleSession() {
        // Arrange
        controller.startCapture();
        RecognitionListener stale = engine.lastListener();
        controller.stopCapture();
        UUID second = controller.startCapture();
        publisher.clear();

        // Act
        stale.onResult("late text", 1.0);
        stale.onError(CaptureException.Kind.NETWORK);

        // Assert
        assertThat(states()).isEmpty();
        assertThat(controller.isCapturing()).isTrue();
        assertThat(controller.stopCapture()).isEmpty();
        assertThat(second).isNotNull();
    }

    @Test
    void shouldNotRestartAfterStopWhileRestartIsPending() {
        controller.startCapture();
        engine.emitError(CaptureException.Kind.BUSY);
        controller.stopCapture();

        restarts.runAll();

        assertThat(engine.startCount()).isEqualTo(1);
    }

    @Test
    void shouldCancelWithoutResult() {
        // Arrange
        controller.startCapture();
        engine.emitResult("to be discarded", 0.9);

        // Act
        controller.cancelCapture();
        controller.cancelCapture();

        // Assert
        assertThat(states(CaptureState.Result.class)).isEmpty();
        assertThat(states(CaptureState.Idle.class)).hasSize(1);
        assertThat(engine.cancelCount()).isEqualTo(1);
        assertThat(controller.isCapturing()).isFalse();
    }

    @Test
    void rejectsNegativeErrorBudget() {
        assertThatThrownBy(() -> new DefaultCaptureController(engine, new CaptureStateMachine(), publisher,
                new SyncExecutor(), restarts, new TranscriptPostProcessor(Map.of()), -1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
