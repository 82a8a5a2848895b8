package com.phillippitts.voiceinventory.service.persistence;

import com.phillippitts.voiceinventory.domain.EntityKind;
import com.phillippitts.voiceinventory.domain.Equipment;
import com.phillippitts.voiceinventory.domain.InventoryRecord;
import com.phillippitts.voiceinventory.domain.Location;
import com.phillippitts.voiceinventory.exception.PersistenceException;
import com.phillippitts.voiceinventory.service.task.ActiveTask;
import com.phillippitts.voiceinventory.service.task.TaskFactory;
import com.phillippitts.voiceinventory.service.task.TaskKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskPersisterTest {

    private InMemoryInventoryStore store;
    private TaskPersister persister;

    @BeforeEach
    void setUp() {
        store = new InMemoryInventoryStore();
        persister = new TaskPersister(store, store);
    }

    private String storeEquipment(LocalDate lastMaintenance) {
        Equipment equipment = new Equipment(null, "Ventilator", "Respiratory", "loc-1", null, null, null, null,
                null, null, null, null, 12, lastMaintenance, null, false, true);
        return store.insert(equipment);
    }

    @Test
    void shouldPersistLocationTask() {
        // Arrange
        ActiveTask task = TaskFactory.create(TaskKind.LOCATION_CREATION, Map.of("name", "Ward B", "bedCount", 4));

        // Act
        String id = persister.persist(task);

        // Assert
        Location stored = (Location) store.findById(EntityKind.LOCATION, id).orElseThrow();
        assertThat(stored.name()).isEqualTo("Ward B");
        assertThat(stored.bedCount()).isEqualTo(4);
    }

    @Test
    void shouldAdvanceLastMaintenanceDate() {
        // Arrange
        String equipmentId = storeEquipment(LocalDate.of(2023, 1, 10));
        ActiveTask task = TaskFactory.create(TaskKind.MAINTENANCE_EVENT, Map.of(
                "equipmentId", equipmentId, "type", "inspection", "description", "Yearly", "date", "2024-06-01"));

        // Act
        persister.persist(task);

        // Assert
        Equipment updated = (Equipment) store.findById(EntityKind.EQUIPMENT, equipmentId).orElseThrow();
        assertThat(updated.lastMaintenanceDate()).isEqualTo(LocalDate.of(2024, 6, 1));
        assertThat(store.maintenanceFor(equipmentId)).hasSize(1);
    }

    @Test
    void shouldNotMoveLastMaintenanceDateBackwards() {
        String equipmentId = storeEquipment(LocalDate.of(2025, 1, 10));
        ActiveTask task = TaskFactory.create(TaskKind.MAINTENANCE_EVENT, Map.of(
                "equipmentId", equipmentId, "type", "repair", "description", "Late entry", "date", "2024-06-01"));

        persister.persist(task);

        Equipment unchanged = (Equipment) store.findById(EntityKind.EQUIPMENT, equipmentId).orElseThrow();
        assertThat(unchanged.lastMaintenanceDate()).isEqualTo(LocalDate.of(2025, 1, 10));
    }

    @Test
    void shouldNotDuplicateMaintenanceWhenRetryingAfterEquipmentUpdateFailed() {
        // Arrange
        String equipmentId = storeEquipment(LocalDate.of(2023, 1, 10));
        AtomicInteger failuresLeft = new AtomicInteger(1);
        InventoryRepository flaky = new InventoryRepository() {
            @Override
            public String insert(InventoryRecord record) {
                return store.insert(record);
            }

            @Override
            public void update(InventoryRecord record) {
                if (record instanceof Equipment && failuresLeft.getAndDecrement() > 0) {
                    throw new PersistenceException("Equipment", "disk full");
                }
                store.update(record);
            }
        };
        TaskPersister flakyPersister = new TaskPersister(flaky, store);
        ActiveTask task = TaskFactory.create(TaskKind.MAINTENANCE_EVENT, Map.of(
                "equipmentId", equipmentId, "type", "repair", "description", "Pump seal", "date", "2024-06-01"));

        // Act
        assertThatThrownBy(() -> flakyPersister.persist(task)).hasMessage("disk full");
        String firstId = task.storedRecordId().orElseThrow();
        String retriedId = flakyPersister.persist(task);

        // Assert
        assertThat(retriedId).isEqualTo(firstId);
        assertThat(store.maintenanceFor(equipmentId)).hasSize(1);
        Equipment updated = (Equipment) store.findById(EntityKind.EQUIPMENT, equipmentId).orElseThrow();
        assertThat(updated.lastMaintenanceDate()).isEqualTo(LocalDate.of(2024, 6, 1));
    }

    @Test
    void shouldPropagateStorageFailure() {
        // Arrange
        InventoryRepository failing = new InventoryRepository() {
            @Override
            public String insert(InventoryRecord record) {
                throw new PersistenceException("Location", "disk full");
            }

            @Override
            public void update(InventoryRecord record) {
            }
        };
        TaskPersister persisterWithFailingStore = new TaskPersister(failing, store);
        ActiveTask task = TaskFactory.create(TaskKind.LOCATION_CREATION, Map.of("name", "Ward B"));

        // Act & Assert
        assertThatThrownBy(() -> persisterWithFailingStore.persist(task))
                .isInstanceOf(PersistenceException.class)
                .hasMessage("disk full");
    }
}
