package com.phillippitts.voiceinventory.domain;

/**
 * Stored record kinds that spoken names can be resolved against.
 */
public enum EntityKind {
    EQUIPMENT,
    VENDOR,
    LOCATION
}
