package com.phillippitts.voiceinventory.service.task;

import java.util.Map;

/**
 * Creates empty tasks, optionally pre-filled with values known when the task starts
 * (for example the equipment id when registering maintenance from an equipment screen).
 */
public final class TaskFactory {

    private TaskFactory() {
    }

    public static ActiveTask create(TaskKind kind) {
        return switch (kind) {
            case EQUIPMENT_CREATION -> new EquipmentCreationTask();
            case MAINTENANCE_EVENT -> new MaintenanceEventTask();
            case VENDOR_CREATION -> new VendorCreationTask();
            case LOCATION_CREATION -> new LocationCreationTask();
        };
    }

    /**
     * @throws IllegalArgumentException if an initial value is for an unknown field or has the wrong type
     */
    public static ActiveTask create(TaskKind kind, Map<String, ?> initialValues) {
        ActiveTask task = create(kind);
        if (initialValues != null && !initialValues.isEmpty()) {
            MergeOutcome outcome = task.merge(initialValues);
            if (!outcome.warnings().isEmpty()) {
                throw new IllegalArgumentException("Invalid initial values: " + outcome.warnings());
            }
        }
        return task;
    }
}
