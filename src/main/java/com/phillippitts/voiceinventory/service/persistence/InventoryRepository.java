package com.phillippitts.voiceinventory.service.persistence;

import com.phillippitts.voiceinventory.domain.InventoryRecord;

/**
 * Write side of the storage collaborator.
 */
public interface InventoryRepository {

    /**
     * @return the stored record's id
     * @throws com.phillippitts.voiceinventory.exception.PersistenceException on storage failure
     */
    String insert(InventoryRecord record);

    /**
     * @throws com.phillippitts.voiceinventory.exception.PersistenceException if the record does not exist
     *         or cannot be written
     */
    void update(InventoryRecord record);
}
