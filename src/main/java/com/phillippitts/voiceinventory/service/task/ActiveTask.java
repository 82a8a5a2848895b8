package com.phillippitts.voiceinventory.service.task;

import com.phillippitts.voiceinventory.domain.InventoryRecord;
import com.phillippitts.voiceinventory.service.context.SpeakerHint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * A voice data-entry task in progress: typed field values collected so far, the references the
 * operator has settled, and the lifecycle status.
 *
 * <p>Values only change through {@link #merge(Map)} (monotonic: an absent, null or blank update never
 * clears a value) or through {@link #applySnapshot(Map)} (authoritative manual edits, which may clear).
 * Instances are not thread-safe; the extraction pipeline serializes all access.
 */
public abstract sealed class ActiveTask
        permits EquipmentCreationTask, MaintenanceEventTask, VendorCreationTask, LocationCreationTask {

    static final String EMPTY_SUMMARY = "(no data collected yet)";

    private final UUID id = UUID.randomUUID();
    private final Map<String, TaskField> schema;
    private final Map<String, Object> values = new LinkedHashMap<>();
    private final Map<String, String> pinnedReferences = new HashMap<>();
    private TaskStatus status = TaskStatus.COLLECTING;
    private String storedRecordId;

    protected ActiveTask(List<TaskField> fields) {
        Map<String, TaskField> bySchemaKey = new LinkedHashMap<>();
        for (TaskField field : fields) {
            bySchemaKey.put(field.key(), field);
        }
        this.schema = Collections.unmodifiableMap(bySchemaKey);
    }

    public abstract TaskKind kind();

    /**
     * Builds the record to persist. Reference fields are read from the settled references.
     *
     * @throws IllegalStateException if a required reference is not settled
     */
    public abstract InventoryRecord toRecord();

    public UUID id() {
        return id;
    }

    public TaskStatus status() {
        return status;
    }

    public List<TaskField> fields() {
        return List.copyOf(schema.values());
    }

    public Optional<TaskField> field(String key) {
        return Optional.ofNullable(schema.get(key));
    }

    public List<TaskField> referenceFields() {
        return schema.values().stream().filter(TaskField::isReference).toList();
    }

    /**
     * Merges model-produced updates. Unknown keys and values that cannot be coerced are reported
     * as warnings and leave the task unchanged.
     */
    public MergeOutcome merge(Map<String, ?> updates) {
        requireCollecting();
        List<String> applied = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        if (updates == null) {
            return new MergeOutcome(applied, warnings);
        }
        for (Map.Entry<String, ?> entry : updates.entrySet()) {
            TaskField field = schema.get(entry.getKey());
            if (field == null) {
                warnings.add("Ignored unknown field '" + entry.getKey() + "'");
                continue;
            }
            if (FieldCoercion.isAbsent(entry.getValue())) {
                continue;
            }
            try {
                Object typed = FieldCoercion.coerce(field.type(), entry.getValue());
                if (put(field, typed)) {
                    applied.add(field.key());
                }
            } catch (IllegalArgumentException e) {
                warnings.add("Ignored value for '" + field.key() + "': " + e.getMessage());
            }
        }
        return new MergeOutcome(applied, warnings);
    }

    /**
     * Applies the presentation layer's current field state. Keys present in the snapshot are
     * authoritative, so a blank value clears the field; keys absent from the snapshot are kept.
     */
    public MergeOutcome applySnapshot(Map<String, ?> snapshot) {
        requireCollecting();
        List<String> applied = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        if (snapshot == null) {
            return new MergeOutcome(applied, warnings);
        }
        for (Map.Entry<String, ?> entry : snapshot.entrySet()) {
            TaskField field = schema.get(entry.getKey());
            if (field == null) {
                warnings.add("Ignored unknown field '" + entry.getKey() + "'");
                continue;
            }
            if (FieldCoercion.isAbsent(entry.getValue())) {
                if (values.remove(field.key()) != null) {
                    pinnedReferences.remove(field.key());
                    applied.add(field.key());
                }
                continue;
            }
            try {
                if (put(field, FieldCoercion.coerce(field.type(), entry.getValue()))) {
                    applied.add(field.key());
                }
            } catch (IllegalArgumentException e) {
                warnings.add("Ignored value for '" + field.key() + "': " + e.getMessage());
            }
        }
        return new MergeOutcome(applied, warnings);
    }

    private boolean put(TaskField field, Object typed) {
        Object previous = values.put(field.key(), typed);
        if (Objects.equals(previous, typed)) {
            return false;
        }
        // A changed name invalidates whatever record the operator settled on
        pinnedReferences.remove(field.key());
        return true;
    }

    public Object value(String key) {
        return values.get(key);
    }

    public String text(String key) {
        Object v = values.get(key);
        return v == null ? null : v.toString();
    }

    public boolean has(String key) {
        return values.containsKey(key);
    }

    public Map<String, Object> fieldValues() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * Required fields that are still empty, in schema order. Conditional requirements depend on who
     * appears to be speaking.
     */
    public List<String> missingRequiredFields(SpeakerHint hint) {
        List<String> missing = new ArrayList<>();
        for (TaskField field : schema.values()) {
            if (field.required() && !has(field.key())) {
                missing.add(field.key());
            }
        }
        return missing;
    }

    public boolean isComplete(SpeakerHint hint) {
        return missingRequiredFields(hint).isEmpty();
    }

    /**
     * One "Label: value" line per collected field, or a placeholder when nothing is collected.
     */
    public String collectedSummary() {
        if (values.isEmpty()) {
            return EMPTY_SUMMARY;
        }
        StringBuilder sb = new StringBuilder();
        for (TaskField field : schema.values()) {
            Object v = values.get(field.key());
            if (v == null) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append(field.label()).append(": ").append(v);
            if (pinnedReferences.containsKey(field.key())) {
                sb.append(" [matched]");
            }
        }
        return sb.toString();
    }

    /**
     * Records the stored entity the operator (or the resolver) settled on for a reference field.
     */
    public void pinReference(String key, String entityId) {
        requireCollecting();
        TaskField field = schema.get(key);
        if (field == null || !field.isReference()) {
            throw new IllegalArgumentException("Not a reference field: " + key);
        }
        if (!has(key)) {
            throw new IllegalStateException("Reference field '" + key + "' has no value");
        }
        pinnedReferences.put(key, Objects.requireNonNull(entityId, "entityId must not be null"));
    }

    public Optional<String> pinnedReference(String key) {
        return Optional.ofNullable(pinnedReferences.get(key));
    }

    public Map<String, String> pinnedReferences() {
        return Map.copyOf(pinnedReferences);
    }

    /**
     * Reference fields holding a spoken name that is not yet settled to a stored record.
     */
    public List<TaskField> pendingReferences() {
        return schema.values().stream()
                .filter(f -> f.isReference() && has(f.key()) && !pinnedReferences.containsKey(f.key()))
                .filter(this::referenceApplies)
                .toList();
    }

    public List<String> unresolvedReferences() {
        return pendingReferences().stream().map(TaskField::key).toList();
    }

    /**
     * Whether a populated reference field must be settled before the task can be saved.
     */
    protected boolean referenceApplies(TaskField field) {
        return true;
    }

    protected String requirePinned(String key) {
        return pinnedReference(key)
                .orElseThrow(() -> new IllegalStateException("Reference '" + key + "' is not settled"));
    }

    protected String pinnedOrNull(String key) {
        return pinnedReferences.get(key);
    }

    /**
     * Id of the record already written for this task by an earlier save attempt that failed afterwards.
     */
    public Optional<String> storedRecordId() {
        return Optional.ofNullable(storedRecordId);
    }

    public void recordStored(String recordId) {
        this.storedRecordId = Objects.requireNonNull(recordId, "recordId must not be null");
    }

    public void markConfirmed() {
        requireCollecting();
        status = TaskStatus.CONFIRMED;
    }

    public void markAbandoned() {
        if (status == TaskStatus.CONFIRMED) {
            throw new IllegalStateException("Task " + id + " is already confirmed");
        }
        status = TaskStatus.ABANDONED;
    }

    /**
     * Returns a confirmed task to collection after a failed save. Field values are untouched.
     */
    public void rollbackToCollecting() {
        if (status != TaskStatus.CONFIRMED) {
            throw new IllegalStateException("Only a confirmed task can be rolled back (status=" + status + ")");
        }
        status = TaskStatus.COLLECTING;
    }

    private void requireCollecting() {
        if (status != TaskStatus.COLLECTING) {
            throw new IllegalStateException("Task " + id + " is " + status);
        }
    }
}
