package com.phillippitts.voiceinventory.domain;

import java.time.LocalDate;

/**
 * An inventoried piece of equipment. Location and vendor references hold storage ids.
 */
public record Equipment(
        String id,
        String name,
        String category,
        String locationId,
        String manufacturer,
        String model,
        String serialNumber,
        String barcode,
        String supplierId,
        LocalDate purchaseDate,
        Integer warrantyMonths,
        String warrantyMaintainerId,
        Integer maintenanceFrequencyMonths,
        LocalDate lastMaintenanceDate,
        String notes,
        boolean needsCompletion,
        boolean active
) implements NamedEntity {

    @Override
    public EntityKind kind() {
        return EntityKind.EQUIPMENT;
    }

    @Override
    public Equipment withId(String id) {
        return new Equipment(id, name, category, locationId, manufacturer, model, serialNumber, barcode,
                supplierId, purchaseDate, warrantyMonths, warrantyMaintainerId, maintenanceFrequencyMonths,
                lastMaintenanceDate, notes, needsCompletion, active);
    }

    public Equipment withLastMaintenanceDate(LocalDate date) {
        return new Equipment(id, name, category, locationId, manufacturer, model, serialNumber, barcode,
                supplierId, purchaseDate, warrantyMonths, warrantyMaintainerId, maintenanceFrequencyMonths,
                date, notes, needsCompletion, active);
    }
}
