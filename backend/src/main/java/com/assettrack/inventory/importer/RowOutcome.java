package com.assettrack.inventory.importer;

/**
 * Result of processing one data row. Outcomes are appended in row order and never changed.
 */
public record RowOutcome(int rowIndex, Status status, FailureKind failureKind, String reason) {

    public enum Status { IMPORTED, FAILED }

    /** Which stage rejected the row. Both count the same; they are logged and stored apart. */
    public enum FailureKind { VALIDATION, PERSISTENCE }

    public static RowOutcome imported(int rowIndex) {
        return new RowOutcome(rowIndex, Status.IMPORTED, null, null);
    }

    public static RowOutcome failed(int rowIndex, FailureKind kind, String reason) {
        return new RowOutcome(rowIndex, Status.FAILED, kind, reason);
    }

    public boolean isFailed() { return status == Status.FAILED; }

    /** {@code "Row 3: Asset tag is required"}, or {@code null} for an imported row. */
    public String message() {
        return isFailed() ? "Row " + rowIndex + ": " + reason : null;
    }
}
