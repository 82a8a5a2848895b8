package com.phillippitts.voiceinventory.service.task;

import com.phillippitts.voiceinventory.domain.EntityKind;
import com.phillippitts.voiceinventory.domain.MaintenanceRecord;
import com.phillippitts.voiceinventory.domain.MaintenanceType;
import com.phillippitts.voiceinventory.service.context.SpeakerHint;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Registration of a maintenance intervention.
 *
 * <p>The equipment is either known up front ({@code equipmentId}, set when the task starts from an
 * equipment screen) or named in speech ({@code equipment}). The performer is required only when an
 * operator is reporting someone else's work; a technician dictating their own work may omit it.
 */
public final class MaintenanceEventTask extends ActiveTask {

    static final List<TaskField> FIELDS = List.of(
            TaskField.optional("equipmentId", "Equipment id", FieldType.TEXT),
            TaskField.optional("equipment", "Equipment", FieldType.TEXT).referencing(EntityKind.EQUIPMENT),
            TaskField.required("type", "Type", FieldType.MAINTENANCE_TYPE),
            TaskField.required("description", "Description", FieldType.TEXT),
            TaskField.optional("performedBy", "Performed by", FieldType.TEXT).referencing(EntityKind.VENDOR),
            TaskField.optional("cost", "Cost", FieldType.DECIMAL),
            TaskField.optional("durationMinutes", "Duration (minutes)", FieldType.INTEGER),
            TaskField.optional("date", "Date", FieldType.DATE),
            TaskField.optional("warranty", "Under warranty", FieldType.BOOLEAN)
    );

    public MaintenanceEventTask() {
        super(FIELDS);
    }

    @Override
    public TaskKind kind() {
        return TaskKind.MAINTENANCE_EVENT;
    }

    @Override
    public List<String> missingRequiredFields(SpeakerHint hint) {
        List<String> missing = new ArrayList<>();
        if (!has("equipmentId") && !has("equipment")) {
            missing.add("equipment");
        }
        missing.addAll(super.missingRequiredFields(hint));
        if (hint == SpeakerHint.LIKELY_OPERATOR && !has("performedBy")) {
            missing.add("performedBy");
        }
        return missing;
    }

    @Override
    protected boolean referenceApplies(TaskField field) {
        return !("equipment".equals(field.key()) && has("equipmentId"));
    }

    /**
     * The stored id of the serviced equipment, from the task start or from a settled reference.
     */
    public String equipmentId() {
        return has("equipmentId") ? text("equipmentId") : pinnedOrNull("equipment");
    }

    @Override
    public MaintenanceRecord toRecord() {
        String equipmentId = equipmentId();
        if (equipmentId == null) {
            throw new IllegalStateException("Reference 'equipment' is not settled");
        }
        LocalDate date = (LocalDate) value("date");
        return new MaintenanceRecord(
                null,
                equipmentId,
                (MaintenanceType) value("type"),
                text("description"),
                pinnedOrNull("performedBy"),
                (BigDecimal) value("cost"),
                (Integer) value("durationMinutes"),
                date != null ? date : LocalDate.now(),
                Boolean.TRUE.equals(value("warranty")));
    }
}
