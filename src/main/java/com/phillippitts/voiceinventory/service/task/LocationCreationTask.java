package com.phillippitts.voiceinventory.service.task;

import com.phillippitts.voiceinventory.domain.Location;

import java.util.List;

public final class LocationCreationTask extends ActiveTask {

    static final List<TaskField> FIELDS = List.of(
            TaskField.required("name", "Name", FieldType.TEXT),
            TaskField.optional("type", "Type", FieldType.TEXT),
            TaskField.optional("building", "Building", FieldType.TEXT),
            TaskField.optional("floor", "Floor", FieldType.TEXT),
            TaskField.optional("department", "Department", FieldType.TEXT),
            TaskField.optional("bedCount", "Beds", FieldType.INTEGER),
            TaskField.optional("oxygenOutlet", "Oxygen outlet", FieldType.BOOLEAN),
            TaskField.optional("notes", "Notes", FieldType.TEXT)
    );

    public LocationCreationTask() {
        super(FIELDS);
    }

    @Override
    public TaskKind kind() {
        return TaskKind.LOCATION_CREATION;
    }

    @Override
    public Location toRecord() {
        return new Location(
                null,
                text("name"),
                text("type"),
                text("building"),
                text("floor"),
                text("department"),
                (Integer) value("bedCount"),
                (Boolean) value("oxygenOutlet"),
                text("notes"),
                false,
                true);
    }
}
