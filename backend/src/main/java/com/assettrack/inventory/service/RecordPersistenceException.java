package com.assettrack.inventory.service;

/** Storage refused a record that passed validation (duplicate key, missing reference, ...). */
public class RecordPersistenceException extends RuntimeException {
    public RecordPersistenceException(String message) {
        super(message);
    }
}
