package com.phillippitts.voiceinventory.service.persistence;

import com.phillippitts.voiceinventory.domain.EntityKind;
import com.phillippitts.voiceinventory.domain.InventoryRecord;
import com.phillippitts.voiceinventory.domain.MaintenanceRecord;
import com.phillippitts.voiceinventory.domain.NamedEntity;
import com.phillippitts.voiceinventory.exception.PersistenceException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Process-local storage adapter so the service runs without an external database.
 * All methods are synchronized on the store.
 */
public class InMemoryInventoryStore implements EntityDirectory, InventoryRepository {

    private static final Logger LOG = LogManager.getLogger(InMemoryInventoryStore.class);

    private final Map<EntityKind, Map<String, NamedEntity>> entities = new EnumMap<>(EntityKind.class);
    private final Map<String, MaintenanceRecord> maintenance = new LinkedHashMap<>();

    public InMemoryInventoryStore() {
        for (EntityKind kind : EntityKind.values()) {
            entities.put(kind, new LinkedHashMap<>());
        }
    }

    @Override
    public synchronized List<NamedEntity> listActive(EntityKind kind) {
        return entities.get(kind).values().stream()
                .filter(NamedEntity::active)
                .sorted(Comparator.comparing(NamedEntity::name, Comparator.nullsLast(String::compareToIgnoreCase)))
                .toList();
    }

    @Override
    public synchronized Optional<NamedEntity> findById(EntityKind kind, String id) {
        return Optional.ofNullable(entities.get(kind).get(id));
    }

    @Override
    public synchronized String create(NamedEntity minimal) {
        if (minimal.name() == null || minimal.name().isBlank()) {
            throw new PersistenceException(minimal.kind().name(), "A name is required to create a "
                    + minimal.kind().name().toLowerCase(Locale.ROOT));
        }
        String id = insert(minimal);
        LOG.info("Created {} '{}' inline (id={}, needsCompletion={})",
                minimal.kind(), minimal.name(), id, minimal.needsCompletion());
        return id;
    }

    @Override
    public synchronized String insert(InventoryRecord record) {
        String id = UUID.randomUUID().toString();
        if (record instanceof NamedEntity entity) {
            entities.get(entity.kind()).put(id, entity.withId(id));
        } else if (record instanceof MaintenanceRecord m) {
            maintenance.put(id, m.withId(id));
        } else {
            throw new PersistenceException(record.getClass().getSimpleName(), "Unsupported record type");
        }
        return id;
    }

    @Override
    public synchronized void update(InventoryRecord record) {
        if (record.id() == null) {
            throw new PersistenceException(record.getClass().getSimpleName(), "Cannot update a record without id");
        }
        if (record instanceof NamedEntity entity) {
            Map<String, NamedEntity> byId = entities.get(entity.kind());
            if (!byId.containsKey(entity.id())) {
                throw new PersistenceException(entity.kind().name(), "No " + entity.kind() + " with id " + entity.id());
            }
            byId.put(entity.id(), entity);
        } else if (record instanceof MaintenanceRecord m) {
            if (!maintenance.containsKey(m.id())) {
                throw new PersistenceException("MaintenanceRecord", "No maintenance record with id " + m.id());
            }
            maintenance.put(m.id(), m);
        } else {
            throw new PersistenceException(record.getClass().getSimpleName(), "Unsupported record type");
        }
    }

    public synchronized List<MaintenanceRecord> maintenanceFor(String equipmentId) {
        List<MaintenanceRecord> result = new ArrayList<>();
        for (MaintenanceRecord m : maintenance.values()) {
            if (m.equipmentId().equals(equipmentId)) {
                result.add(m);
            }
        }
        return result;
    }
}
