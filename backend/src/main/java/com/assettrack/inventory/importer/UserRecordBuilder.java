package com.assettrack.inventory.importer;

import org.springframework.stereotype.Component;

import java.util.UUID;

import static com.assettrack.inventory.importer.FieldSlot.optional;
import static com.assettrack.inventory.importer.FieldSlot.withDefault;

@Component
public class UserRecordBuilder implements RecordBuilder<UserCandidate> {

    static final String ID_PREFIX = "import-";

    static final RecordSchema SCHEMA = RecordSchema.of(
            optional("name"),
            optional("email"),
            optional("department"),
            optional("jobTitle"),
            optional("employeeId"),
            optional("phone"),
            withDefault("role", "user"),
            optional("isActive")
    );

    @Override
    public RecordSchema schema() { return SCHEMA; }

    @Override
    public UserCandidate build(RawRow row) {
        // only the exact token counts as active; "TRUE", "yes" and blanks are inactive
        boolean active = "true".equals(SCHEMA.text(row, "isActive"));
        return new UserCandidate(
                ID_PREFIX + UUID.randomUUID(),
                SCHEMA.text(row, "name"),
                SCHEMA.text(row, "email"),
                SCHEMA.text(row, "department"),
                SCHEMA.text(row, "jobTitle"),
                SCHEMA.text(row, "employeeId"),
                SCHEMA.text(row, "phone"),
                SCHEMA.text(row, "role"),
                active
        );
    }
}
