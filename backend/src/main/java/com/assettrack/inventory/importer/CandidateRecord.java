package com.assettrack.inventory.importer;

/** A row after field mapping and defaulting, before validation. */
public interface CandidateRecord {
    ImportKind kind();
}
