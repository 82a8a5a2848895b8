package com.phillippitts.voiceinventory.domain;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A completed maintenance intervention on a piece of equipment.
 */
public record MaintenanceRecord(
        String id,
        String equipmentId,
        MaintenanceType type,
        String description,
        String performedById,
        BigDecimal cost,
        Integer durationMinutes,
        LocalDate date,
        boolean underWarranty
) implements InventoryRecord {

    @Override
    public MaintenanceRecord withId(String id) {
        return new MaintenanceRecord(id, equipmentId, type, description, performedById, cost,
                durationMinutes, date, underWarranty);
    }
}
