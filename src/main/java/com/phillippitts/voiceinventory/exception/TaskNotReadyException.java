package com.phillippitts.voiceinventory.exception;

import java.util.List;

/**
 * Thrown when confirmation is requested for a task that still lacks required fields
 * or has entity references that are not settled.
 */
public class TaskNotReadyException extends VoiceInventoryException {

    private final List<String> missingFields;
    private final List<String> unresolvedReferences;

    public TaskNotReadyException(List<String> missingFields, List<String> unresolvedReferences) {
        super("Task is not ready for confirmation (missing=" + missingFields
                + ", unresolved=" + unresolvedReferences + ")");
        this.missingFields = List.copyOf(missingFields);
        this.unresolvedReferences = List.copyOf(unresolvedReferences);
    }

    public List<String> getMissingFields() {
        return missingFields;
    }

    public List<String> getUnresolvedReferences() {
        return unresolvedReferences;
    }
}
