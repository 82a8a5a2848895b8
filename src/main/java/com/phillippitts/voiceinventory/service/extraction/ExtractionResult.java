package com.phillippitts.voiceinventory.service.extraction;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parsed model response.
 *
 * @param updates field key to raw value; may be empty
 * @param reply conversational text for the operator
 * @param confidence model confidence clamped to [0,1]
 * @param missingFields required fields the model believes are still missing
 */
public record ExtractionResult(Map<String, Object> updates,
                               String reply,
                               double confidence,
                               List<String> missingFields) {

    public ExtractionResult {
        // values may be null, so no Map.copyOf
        updates = Collections.unmodifiableMap(new LinkedHashMap<>(updates));
        reply = reply == null ? "" : reply;
        missingFields = List.copyOf(missingFields);
    }
}
