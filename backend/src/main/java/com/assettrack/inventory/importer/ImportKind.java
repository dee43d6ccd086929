package com.assettrack.inventory.importer;

import java.util.Arrays;
import java.util.Optional;

/**
 * The record kinds a bulk import can target. The set is closed: every kind has exactly one
 * record builder, one validation rule set and one persistence gateway.
 */
public enum ImportKind {
    ASSETS("assets"),
    USERS("users"),
    ASSIGNMENTS("assignments");

    private final String requestValue;

    ImportKind(String requestValue) {
        this.requestValue = requestValue;
    }

    public String requestValue() { return requestValue; }

    public static Optional<ImportKind> fromRequestValue(String value) {
        if (value == null) return Optional.empty();
        String v = value.trim();
        return Arrays.stream(values()).filter(k -> k.requestValue.equals(v)).findFirst();
    }
}
