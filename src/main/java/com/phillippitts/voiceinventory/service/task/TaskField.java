package com.phillippitts.voiceinventory.service.task;

import com.phillippitts.voiceinventory.domain.EntityKind;

/**
 * Schema entry for one task field.
 *
 * @param key update-map key used by the model and the presentation layer
 * @param label human-readable label for summaries
 * @param type value type the raw update is coerced to
 * @param required whether the field is unconditionally required
 * @param reference entity kind the text value names, or {@code null} for plain fields
 */
public record TaskField(String key, String label, FieldType type, boolean required, EntityKind reference) {

    public static TaskField optional(String key, String label, FieldType type) {
        return new TaskField(key, label, type, false, null);
    }

    public static TaskField required(String key, String label, FieldType type) {
        return new TaskField(key, label, type, true, null);
    }

    public TaskField referencing(EntityKind kind) {
        return new TaskField(key, label, FieldType.TEXT, required, kind);
    }

    public boolean isReference() {
        return reference != null;
    }
}
