package com.assettrack.inventory.importer;

import org.springframework.stereotype.Component;

import static com.assettrack.inventory.importer.FieldSlot.optional;

@Component
public class AssignmentRecordBuilder implements RecordBuilder<AssignmentCandidate> {

    static final RecordSchema SCHEMA = RecordSchema.of(
            optional("assetId"),
            optional("userId"),
            optional("purpose"),
            optional("expectedReturnAt"),
            optional("notes")
    );

    @Override
    public RecordSchema schema() { return SCHEMA; }

    @Override
    public AssignmentCandidate build(RawRow row) {
        return new AssignmentCandidate(
                ValueCoercion.toLongOrZero(SCHEMA.text(row, "assetId")),
                SCHEMA.text(row, "userId"),
                SCHEMA.text(row, "purpose"),
                ValueCoercion.toDateTime(SCHEMA.text(row, "expectedReturnAt")),
                SCHEMA.text(row, "notes")
        );
    }
}
