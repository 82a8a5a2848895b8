package com.phillippitts.voiceinventory.domain;

/**
 * A record handed to the storage collaborator. The id is {@code null} until the record is inserted.
 */
public interface InventoryRecord {

    String id();

    /**
     * @return a copy of this record carrying the given storage id
     */
    InventoryRecord withId(String id);
}
