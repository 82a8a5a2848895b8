package com.phillippitts.voiceinventory.domain;

/**
 * A stored record that operators refer to by name and that the resolver can match.
 */
public interface NamedEntity extends InventoryRecord {

    String name();

    EntityKind kind();

    boolean active();

    /**
     * Records created inline during a voice task carry only a name and are flagged for later completion.
     */
    boolean needsCompletion();

    @Override
    NamedEntity withId(String id);
}
