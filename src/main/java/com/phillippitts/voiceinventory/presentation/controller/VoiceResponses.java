package com.phillippitts.voiceinventory.presentation.controller;

import com.phillippitts.voiceinventory.domain.NamedEntity;
import com.phillippitts.voiceinventory.service.capture.CaptureState;
import com.phillippitts.voiceinventory.service.extraction.ExtractionState;
import com.phillippitts.voiceinventory.service.extraction.ResolvedData;
import com.phillippitts.voiceinventory.service.resolution.Resolution;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON shapes for the voice API. Sealed state types are flattened to maps with an explicit
 * {@code state} or {@code outcome} discriminator.
 */
final class VoiceResponses {

    private VoiceResponses() {
    }

    static Map<String, Object> resolvedData(ResolvedData data) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("taskId", data.taskId().toString());
        body.put("kind", data.kind().name());
        body.put("fields", data.fields());
        Map<String, Object> resolutions = new LinkedHashMap<>();
        data.resolutions().forEach((field, resolution) -> resolutions.put(field, resolution(resolution)));
        body.put("resolutions", resolutions);
        body.put("settledReferences", data.settledReferences());
        body.put("missingFields", data.missingFields());
        body.put("unresolvedReferences", data.unresolvedReferences());
        body.put("confidence", data.confidence());
        body.put("lowConfidence", data.lowConfidence());
        body.put("warnings", data.warnings());
        body.put("reply", data.reply());
        body.put("readyForConfirmation", data.readyForConfirmation());
        return body;
    }

    static Map<String, Object> resolution(Resolution<NamedEntity> resolution) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("query", resolution.query());
        if (resolution instanceof Resolution.Found<NamedEntity> found) {
            body.put("outcome", "found");
            body.put("record", entity(found.record()));
        } else if (resolution instanceof Resolution.Ambiguous<NamedEntity> ambiguous) {
            body.put("outcome", "ambiguous");
            List<Map<String, Object>> candidates = new ArrayList<>();
            for (NamedEntity candidate : ambiguous.candidates()) {
                candidates.add(entity(candidate));
            }
            body.put("candidates", candidates);
        } else if (resolution instanceof Resolution.NeedsConfirmation<NamedEntity> confirm) {
            body.put("outcome", "needs_confirmation");
            body.put("candidate", entity(confirm.candidate()));
            body.put("similarity", confirm.similarity());
        } else {
            body.put("outcome", "not_found");
        }
        return body;
    }

    static Map<String, Object> entity(NamedEntity entity) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("id", entity.id());
        body.put("name", entity.name());
        body.put("kind", entity.kind().name());
        body.put("needsCompletion", entity.needsCompletion());
        return body;
    }

    static Map<String, Object> extractionState(ExtractionState state) {
        Map<String, Object> body = new LinkedHashMap<>();
        if (state instanceof ExtractionState.Processing processing) {
            body.put("state", "processing");
            body.put("transcript", processing.transcript());
        } else if (state instanceof ExtractionState.Extracted extracted) {
            body.put("state", "extracted");
            body.put("data", resolvedData(extracted.data()));
        } else if (state instanceof ExtractionState.Error error) {
            body.put("state", "error");
            body.put("kind", error.kind().name());
            body.put("message", error.message());
            body.put("transcript", error.transcript());
            body.put("retryable", error.retryable());
        } else {
            body.put("state", "idle");
        }
        return body;
    }

    static Map<String, Object> captureState(CaptureState state) {
        Map<String, Object> body = new LinkedHashMap<>();
        if (state instanceof CaptureState.Listening listening) {
            body.put("state", "listening");
            body.put("sessionId", listening.sessionId().toString());
        } else if (state instanceof CaptureState.PartialResult partial) {
            body.put("state", "partial");
            body.put("sessionId", partial.sessionId().toString());
            body.put("text", partial.text());
        } else if (state instanceof CaptureState.Result result) {
            body.put("state", "result");
            body.put("sessionId", result.sessionId().toString());
            body.put("text", result.text());
            body.put("confidence", result.confidence());
        } else if (state instanceof CaptureState.Error error) {
            body.put("state", "error");
            body.put("sessionId", error.sessionId().toString());
            body.put("kind", error.kind().name());
            body.put("message", error.message());
            body.put("retryable", error.retryable());
        } else {
            body.put("state", "idle");
        }
        return body;
    }
}
