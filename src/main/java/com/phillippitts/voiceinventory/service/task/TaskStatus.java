package com.phillippitts.voiceinventory.service.task;

/**
 * Task lifecycle. Completeness is a predicate evaluated while COLLECTING, not a separate state.
 */
public enum TaskStatus {
    COLLECTING,
    CONFIRMED,
    ABANDONED
}
