package com.phillippitts.voiceinventory.service.task;

import com.phillippitts.voiceinventory.domain.Vendor;
import com.phillippitts.voiceinventory.service.context.SpeakerHint;

import java.util.ArrayList;
import java.util.List;

/**
 * Creation of a vendor. Requires a name or a company, and an email or a phone.
 */
public final class VendorCreationTask extends ActiveTask {

    static final String NAME_OR_COMPANY = "name or company";
    static final String EMAIL_OR_PHONE = "email or phone";

    static final List<TaskField> FIELDS = List.of(
            TaskField.optional("name", "Name", FieldType.TEXT),
            TaskField.optional("company", "Company", FieldType.TEXT),
            TaskField.optional("email", "Email", FieldType.TEXT),
            TaskField.optional("phone", "Phone", FieldType.TEXT),
            TaskField.optional("address", "Address", FieldType.TEXT),
            TaskField.optional("city", "City", FieldType.TEXT),
            TaskField.optional("specialization", "Specialization", FieldType.TEXT),
            TaskField.optional("supplier", "Also a supplier", FieldType.BOOLEAN)
    );

    public VendorCreationTask() {
        super(FIELDS);
    }

    @Override
    public TaskKind kind() {
        return TaskKind.VENDOR_CREATION;
    }

    @Override
    public List<String> missingRequiredFields(SpeakerHint hint) {
        List<String> missing = new ArrayList<>();
        if (!has("name") && !has("company")) {
            missing.add(NAME_OR_COMPANY);
        }
        if (!has("email") && !has("phone")) {
            missing.add(EMAIL_OR_PHONE);
        }
        return missing;
    }

    @Override
    public Vendor toRecord() {
        String name = has("name") ? text("name") : text("company");
        return new Vendor(
                null,
                name,
                text("company"),
                text("email"),
                text("phone"),
                text("address"),
                text("city"),
                text("specialization"),
                Boolean.TRUE.equals(value("supplier")),
                false,
                true);
    }
}
