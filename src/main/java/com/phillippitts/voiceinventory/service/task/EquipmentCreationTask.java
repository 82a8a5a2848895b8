package com.phillippitts.voiceinventory.service.task;

import com.phillippitts.voiceinventory.domain.EntityKind;
import com.phillippitts.voiceinventory.domain.Equipment;

import java.time.LocalDate;
import java.util.List;

public final class EquipmentCreationTask extends ActiveTask {

    static final List<TaskField> FIELDS = List.of(
            TaskField.required("name", "Name", FieldType.TEXT),
            TaskField.required("category", "Category", FieldType.TEXT),
            TaskField.required("location", "Location", FieldType.TEXT).referencing(EntityKind.LOCATION),
            TaskField.optional("manufacturer", "Manufacturer", FieldType.TEXT),
            TaskField.optional("model", "Model", FieldType.TEXT),
            TaskField.optional("serialNumber", "Serial number", FieldType.TEXT),
            TaskField.optional("barcode", "Barcode", FieldType.TEXT),
            TaskField.optional("supplier", "Supplier", FieldType.TEXT).referencing(EntityKind.VENDOR),
            TaskField.optional("purchaseDate", "Purchase date", FieldType.DATE),
            TaskField.optional("warrantyMonths", "Warranty (months)", FieldType.INTEGER),
            TaskField.optional("warrantyMaintainer", "Warranty maintainer", FieldType.TEXT)
                    .referencing(EntityKind.VENDOR),
            TaskField.optional("maintenanceFrequencyMonths", "Maintenance every (months)", FieldType.INTEGER),
            TaskField.optional("notes", "Notes", FieldType.TEXT)
    );

    public EquipmentCreationTask() {
        super(FIELDS);
    }

    @Override
    public TaskKind kind() {
        return TaskKind.EQUIPMENT_CREATION;
    }

    @Override
    public Equipment toRecord() {
        return new Equipment(
                null,
                text("name"),
                text("category"),
                requirePinned("location"),
                text("manufacturer"),
                text("model"),
                text("serialNumber"),
                text("barcode"),
                pinnedOrNull("supplier"),
                (LocalDate) value("purchaseDate"),
                (Integer) value("warrantyMonths"),
                pinnedOrNull("warrantyMaintainer"),
                (Integer) value("maintenanceFrequencyMonths"),
                null,
                text("notes"),
                false,
                true);
    }
}
