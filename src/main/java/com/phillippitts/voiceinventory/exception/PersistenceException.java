package com.phillippitts.voiceinventory.exception;

/**
 * Thrown by the storage collaborator when a record cannot be written.
 * The message is passed through to the operator unchanged.
 */
public class PersistenceException extends VoiceInventoryException {

    private final String recordType;

    public PersistenceException(String recordType, String message) {
        super(message);
        this.recordType = recordType;
    }

    public PersistenceException(String recordType, String message, Throwable cause) {
        super(message, cause);
        this.recordType = recordType;
    }

    public String getRecordType() {
        return recordType;
    }
}
