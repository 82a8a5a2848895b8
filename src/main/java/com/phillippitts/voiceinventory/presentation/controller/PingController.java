package com.phillippitts.voiceinventory.presentation.controller;

import com.phillippitts.voiceinventory.service.capture.CaptureController;
import com.phillippitts.voiceinventory.service.extraction.ExtractionPipeline;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Cheap liveness probe that also goes through the MDC filter, so the request and session ids in the
 * log pattern can be checked against a client.
 */
@RestController
class PingController {

    private static final Logger LOG = LogManager.getLogger(PingController.class);

    private final CaptureController captureController;
    private final ExtractionPipeline pipeline;

    PingController(CaptureController captureController, ExtractionPipeline pipeline) {
        this.captureController = Objects.requireNonNull(captureController, "captureController must not be null");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline must not be null");
    }

    @GetMapping("/ping")
    ResponseEntity<Map<String, Object>> ping() {
        boolean capturing = captureController.isCapturing();
        boolean taskActive = pipeline.isTaskActive();
        LOG.info("Ping (capturing={}, taskActive={})", capturing, taskActive);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("capturing", capturing);
        body.put("taskActive", taskActive);
        body.put("timestamp", Instant.now().toString());
        return ResponseEntity.ok(body);
    }
}
