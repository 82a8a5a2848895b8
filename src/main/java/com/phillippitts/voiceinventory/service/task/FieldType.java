package com.phillippitts.voiceinventory.service.task;

public enum FieldType {
    TEXT,
    INTEGER,
    DECIMAL,
    BOOLEAN,
    DATE,
    MAINTENANCE_TYPE
}
