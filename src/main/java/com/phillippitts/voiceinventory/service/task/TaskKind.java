package com.phillippitts.voiceinventory.service.task;

/**
 * The kinds of voice-driven data entry tasks.
 */
public enum TaskKind {
    EQUIPMENT_CREATION("new equipment"),
    MAINTENANCE_EVENT("maintenance event"),
    VENDOR_CREATION("new vendor"),
    LOCATION_CREATION("new location");

    private final String description;

    TaskKind(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
