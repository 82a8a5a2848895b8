package com.phillippitts.voiceinventory.service.extraction;

import com.phillippitts.voiceinventory.domain.NamedEntity;
import com.phillippitts.voiceinventory.service.resolution.Resolution;
import com.phillippitts.voiceinventory.service.task.TaskKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * The active task after a round: field values, how each spoken reference resolved, and what still
 * blocks confirmation.
 *
 * @param fields collected values by field key
 * @param resolutions outcome per pending reference field; settled references are not listed
 * @param settledReferences stored record id per settled reference field
 * @param missingFields required fields still empty
 * @param unresolvedReferences populated reference fields not yet settled
 * @param confidence model confidence of the round, 1.0 for rounds without a model call
 * @param warnings merge and confidence warnings for the operator
 * @param reply conversational text for the operator
 */
public record ResolvedData(UUID taskId,
                           TaskKind kind,
                           Map<String, Object> fields,
                           Map<String, Resolution<NamedEntity>> resolutions,
                           Map<String, String> settledReferences,
                           List<String> missingFields,
                           List<String> unresolvedReferences,
                           double confidence,
                           boolean lowConfidence,
                           List<String> warnings,
                           String reply) {

    public ResolvedData {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        resolutions = Collections.unmodifiableMap(new LinkedHashMap<>(resolutions));
        settledReferences = Map.copyOf(settledReferences);
        missingFields = List.copyOf(missingFields);
        unresolvedReferences = List.copyOf(unresolvedReferences);
        warnings = List.copyOf(warnings);
        reply = reply == null ? "" : reply;
    }

    /**
     * Every required field is filled and every spoken reference is settled.
     */
    public boolean readyForConfirmation() {
        return missingFields.isEmpty() && unresolvedReferences.isEmpty();
    }
}
