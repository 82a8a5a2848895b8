package com.phillippitts.voiceinventory.service.persistence;

import com.phillippitts.voiceinventory.domain.EntityKind;
import com.phillippitts.voiceinventory.domain.NamedEntity;

import java.util.List;
import java.util.Optional;

/**
 * Read side of the storage collaborator, plus inline creation of minimal records.
 */
public interface EntityDirectory {

    /**
     * @return active records of the given kind, in a stable order
     */
    List<NamedEntity> listActive(EntityKind kind);

    Optional<NamedEntity> findById(EntityKind kind, String id);

    /**
     * Stores a minimal record created during a voice task. The record is expected to carry
     * {@code needsCompletion=true}.
     *
     * @return the new record's id
     * @throws com.phillippitts.voiceinventory.exception.PersistenceException if the record cannot be stored
     */
    String create(NamedEntity minimal);
}
