package com.phillippitts.voiceinventory.service.persistence;

import com.phillippitts.voiceinventory.domain.EntityKind;
import com.phillippitts.voiceinventory.domain.Equipment;
import com.phillippitts.voiceinventory.domain.InventoryRecord;
import com.phillippitts.voiceinventory.domain.MaintenanceRecord;
import com.phillippitts.voiceinventory.service.task.ActiveTask;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Hands a confirmed task's record to the storage collaborator.
 *
 * <p>Registering maintenance also moves the equipment's last-maintenance date forward.
 * Storage errors propagate unchanged. Once the record itself is written its id stays on the task, so a
 * retry after a later failure overwrites that record instead of inserting a second one.
 */
public class TaskPersister {

    private static final Logger LOG = LogManager.getLogger(TaskPersister.class);

    private final InventoryRepository repository;
    private final EntityDirectory directory;

    public TaskPersister(InventoryRepository repository, EntityDirectory directory) {
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
    }

    /**
     * @return id of the stored record
     */
    public String persist(ActiveTask task) {
        InventoryRecord record = task.toRecord();
        String id;
        if (task.storedRecordId().isPresent()) {
            id = task.storedRecordId().get();
            repository.update(record.withId(id));
            LOG.info("Re-saved {} over earlier partial save (task={}, id={})", task.kind(), task.id(), id);
        } else {
            id = repository.insert(record);
            task.recordStored(id);
            LOG.info("Persisted {} (task={}, id={})", task.kind(), task.id(), id);
        }

        if (record instanceof MaintenanceRecord maintenance) {
            directory.findById(EntityKind.EQUIPMENT, maintenance.equipmentId())
                    .filter(Equipment.class::isInstance)
                    .map(Equipment.class::cast)
                    .filter(e -> e.lastMaintenanceDate() == null || e.lastMaintenanceDate().isBefore(maintenance.date()))
                    .ifPresent(e -> repository.update(e.withLastMaintenanceDate(maintenance.date())));
        }
        return id;
    }
}
