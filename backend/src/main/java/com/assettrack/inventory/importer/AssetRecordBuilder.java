package com.assettrack.inventory.importer;

import org.springframework.stereotype.Component;

import static com.assettrack.inventory.importer.FieldSlot.optional;
import static com.assettrack.inventory.importer.FieldSlot.withDefault;

@Component
public class AssetRecordBuilder implements RecordBuilder<AssetCandidate> {

    static final RecordSchema SCHEMA = RecordSchema.of(
            optional("assetTag"),
            optional("name"),
            withDefault("category", "other"),
            optional("subcategory"),
            optional("serialNumber"),
            optional("model"),
            optional("manufacturer"),
            optional("purchaseDate"),
            optional("purchasePrice"),
            optional("currentValue"),
            withDefault("status", "available"),
            withDefault("condition", "good"),
            optional("building"),
            optional("floor"),
            optional("room"),
            optional("desk"),
            optional("description"),
            optional("notes")
    );

    @Override
    public RecordSchema schema() { return SCHEMA; }

    @Override
    public AssetCandidate build(RawRow row) {
        return new AssetCandidate(
                SCHEMA.text(row, "assetTag"),
                SCHEMA.text(row, "name"),
                SCHEMA.text(row, "category"),
                SCHEMA.text(row, "subcategory"),
                SCHEMA.text(row, "serialNumber"),
                SCHEMA.text(row, "model"),
                SCHEMA.text(row, "manufacturer"),
                ValueCoercion.toDate(SCHEMA.text(row, "purchaseDate")),
                SCHEMA.text(row, "purchasePrice"),
                SCHEMA.text(row, "currentValue"),
                SCHEMA.text(row, "status"),
                SCHEMA.text(row, "condition"),
                SCHEMA.text(row, "building"),
                SCHEMA.text(row, "floor"),
                SCHEMA.text(row, "room"),
                SCHEMA.text(row, "desk"),
                SCHEMA.text(row, "description"),
                SCHEMA.text(row, "notes")
        );
    }
}
