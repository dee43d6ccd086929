package com.assettrack.inventory.importer;

/**
 * A typed value parsed from cell text. {@code raw == null} marks a missing cell; a present
 * cell that could not be parsed keeps its text with a {@code null} value.
 */
public record Coerced<T>(String raw, T value) {

    private static final Coerced<?> MISSING = new Coerced<>(null, null);

    @SuppressWarnings("unchecked")
    public static <T> Coerced<T> missing() {
        return (Coerced<T>) MISSING;
    }

    public boolean isMissing() { return raw == null; }

    public boolean isMalformed() { return raw != null && value == null; }
}
