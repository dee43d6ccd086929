package com.assettrack.inventory.service;

/**
 * The import request itself is unusable, so no row was processed.
 */
public class InvalidImportRequestException extends IllegalArgumentException {

    public enum Reason { INVALID_KIND, MISSING_PAYLOAD, EMPTY_PAYLOAD }

    private final Reason reason;

    public InvalidImportRequestException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public static InvalidImportRequestException invalidKind(String importType) {
        return new InvalidImportRequestException(Reason.INVALID_KIND, "Invalid import type");
    }

    public static InvalidImportRequestException missingPayload() {
        return new InvalidImportRequestException(Reason.MISSING_PAYLOAD, "No file provided");
    }

    public static InvalidImportRequestException emptyPayload() {
        return new InvalidImportRequestException(Reason.EMPTY_PAYLOAD, "No data rows found in file");
    }

    public Reason getReason() { return reason; }
}
