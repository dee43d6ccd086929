package com.assettrack.inventory.importer;

/**
 * Builds a candidate record from one row. Implementations never throw on bad data: blank or
 * unparseable cells become defaults or missing markers and are left to validation.
 */
public interface RecordBuilder<C extends CandidateRecord> {

    RecordSchema schema();

    C build(RawRow row);
}
