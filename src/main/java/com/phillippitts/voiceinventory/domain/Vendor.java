package com.phillippitts.voiceinventory.domain;

/**
 * A maintenance provider or supplier.
 */
public record Vendor(
        String id,
        String name,
        String company,
        String email,
        String phone,
        String address,
        String city,
        String specialization,
        boolean supplier,
        boolean needsCompletion,
        boolean active
) implements NamedEntity {

    public static Vendor minimal(String name) {
        return new Vendor(null, name, null, null, null, null, null, null, false, true, true);
    }

    @Override
    public EntityKind kind() {
        return EntityKind.VENDOR;
    }

    @Override
    public Vendor withId(String id) {
        return new Vendor(id, name, company, email, phone, address, city, specialization,
                supplier, needsCompletion, active);
    }
}
