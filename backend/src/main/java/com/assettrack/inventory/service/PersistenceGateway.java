package com.assettrack.inventory.service;

import com.assettrack.inventory.importer.CandidateRecord;

/**
 * Single write operation for one record kind. Called once per validated row and completes
 * before the next row is processed.
 */
public interface PersistenceGateway<C extends CandidateRecord> {

    /**
     * @param requestedBy caller identity, stored as creator; never used for authorization
     * @throws RecordPersistenceException when storage rules reject the record
     */
    void insert(C candidate, String requestedBy);
}
