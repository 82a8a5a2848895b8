package com.phillippitts.voiceinventory.presentation.controller;

import com.phillippitts.voiceinventory.exception.CaptureException;
import com.phillippitts.voiceinventory.service.capture.CaptureController;
import com.phillippitts.voiceinventory.service.capture.RemoteRecognitionEngine;
import com.phillippitts.voiceinventory.service.extraction.ExtractionPipeline;
import com.phillippitts.voiceinventory.service.extraction.ResolvedData;
import com.phillippitts.voiceinventory.service.task.TaskKind;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * REST surface of the voice session: capture control, recognizer callback ingestion and task
 * operations.
 *
 * <p>The client runs the speech recognizer. It polls {@code GET /api/voice/capture} to know when a
 * listen cycle is open and posts the recognizer's partial results, final chunks and errors to the
 * {@code /recognizer/*} endpoints.
 */
@RestController
@RequestMapping("/api/voice")
class VoiceSessionController {

    private static final Logger LOG = LogManager.getLogger(VoiceSessionController.class);

    private final CaptureController captureController;
    private final RemoteRecognitionEngine recognitionEngine;
    private final ExtractionPipeline pipeline;

    VoiceSessionController(CaptureController captureController,
                           RemoteRecognitionEngine recognitionEngine,
                           ExtractionPipeline pipeline) {
        this.captureController = Objects.requireNonNull(captureController, "captureController must not be null");
        this.recognitionEngine = Objects.requireNonNull(recognitionEngine, "recognitionEngine must not be null");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline must not be null");
    }

    @PostMapping("/capture/start")
    ResponseEntity<Map<String, Object>> startCapture() {
        UUID sessionId = captureController.startCapture();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("started", sessionId != null);
        body.put("sessionId", sessionId != null ? sessionId.toString() : null);
        body.put("capture", VoiceResponses.captureState(captureController.currentState()));
        return ResponseEntity.ok(body);
    }

    @PostMapping("/capture/stop")
    ResponseEntity<Map<String, Object>> stopCapture() {
        String text = captureController.stopCapture();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("stopped", text != null);
        body.put("text", text != null ? text : "");
        return ResponseEntity.ok(body);
    }

    @PostMapping("/capture/cancel")
    ResponseEntity<Void> cancelCapture() {
        captureController.cancelCapture();
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/capture")
    ResponseEntity<Map<String, Object>> captureStatus() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("capturing", captureController.isCapturing());
        body.put("listening", recognitionEngine.isListening());
        body.put("cycle", recognitionEngine.cycle());
        body.put("capture", VoiceResponses.captureState(captureController.currentState()));
        return ResponseEntity.ok(body);
    }

    @PostMapping("/recognizer/partial")
    ResponseEntity<Void> recognizerPartial(@RequestBody RecognizerText request) {
        recognitionEngine.deliverPartial(request.text());
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/recognizer/result")
    ResponseEntity<Void> recognizerResult(@RequestBody RecognizerText request) {
        double confidence = request.confidence() != null ? request.confidence() : 0.0;
        recognitionEngine.deliverResult(request.text(), confidence);
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/recognizer/error")
    ResponseEntity<Void> recognizerError(@Valid @RequestBody RecognizerError request) {
        CaptureException.Kind kind;
        try {
            kind = CaptureException.Kind.valueOf(request.kind().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown recognizer error kind: " + request.kind(), e);
        }
        LOG.debug("Recognizer reported {}", kind);
        recognitionEngine.deliverError(kind);
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/task")
    ResponseEntity<Map<String, Object>> beginTask(@Valid @RequestBody BeginTask request) {
        ResolvedData data = pipeline.beginTask(request.kind(), request.initialValues());
        return ResponseEntity.status(HttpStatus.CREATED).body(VoiceResponses.resolvedData(data));
    }

    @PostMapping("/task/transcript")
    ResponseEntity<Map<String, Object>> submitTranscript(@Valid @RequestBody Transcript request) {
        pipeline.submit(request.transcript(), request.snapshot());
        return ResponseEntity.accepted().body(Map.of("accepted", true));
    }

    @GetMapping("/task/fields")
    ResponseEntity<Map<String, Object>> fields() {
        return ResponseEntity.ok(pipeline.currentFieldSnapshot());
    }

    @PutMapping("/task/fields")
    ResponseEntity<Map<String, Object>> updateFields(@RequestBody Map<String, Object> snapshot) {
        return ResponseEntity.ok(VoiceResponses.resolvedData(pipeline.applySnapshot(snapshot)));
    }

    @PostMapping("/task/references/select")
    ResponseEntity<Map<String, Object>> selectCandidate(@Valid @RequestBody SelectCandidate request) {
        ResolvedData data = pipeline.selectCandidate(request.field(), request.entityId());
        return ResponseEntity.ok(VoiceResponses.resolvedData(data));
    }

    @PostMapping("/task/references/create")
    ResponseEntity<Map<String, Object>> createMissingEntity(@Valid @RequestBody CreateEntity request) {
        return ResponseEntity.ok(VoiceResponses.resolvedData(pipeline.createMissingEntity(request.field())));
    }

    @PostMapping("/task/confirm")
    ResponseEntity<Map<String, Object>> confirm() {
        String recordId = pipeline.confirmActiveTask();
        return ResponseEntity.ok(Map.of("recordId", recordId));
    }

    @DeleteMapping("/task")
    ResponseEntity<Void> abandon() {
        pipeline.abandon();
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/extraction")
    ResponseEntity<Map<String, Object>> extractionState() {
        return ResponseEntity.ok(VoiceResponses.extractionState(pipeline.currentState()));
    }

    record RecognizerText(String text, Double confidence) {
    }

    record RecognizerError(@NotBlank String kind) {
    }

    record BeginTask(@NotNull TaskKind kind, Map<String, Object> initialValues) {
    }

    record Transcript(@NotBlank String transcript, Map<String, Object> snapshot) {
    }

    record SelectCandidate(@NotBlank String field, @NotBlank String entityId) {
    }

    record CreateEntity(@NotBlank String field) {
    }
}
