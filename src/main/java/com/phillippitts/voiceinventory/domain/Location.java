package com.phillippitts.voiceinventory.domain;

/**
 * A room, ward or storage area where equipment lives.
 */
public record Location(
        String id,
        String name,
        String type,
        String building,
        String floor,
        String department,
        Integer bedCount,
        Boolean oxygenOutlet,
        String notes,
        boolean needsCompletion,
        boolean active
) implements NamedEntity {

    public static Location minimal(String name) {
        return new Location(null, name, null, null, null, null, null, null, null, true, true);
    }

    @Override
    public EntityKind kind() {
        return EntityKind.LOCATION;
    }

    @Override
    public Location withId(String id) {
        return new Location(id, name, type, building, floor, department, bedCount, oxygenOutlet,
                notes, needsCompletion, active);
    }
}
