package com.assettrack.inventory.importer;

/**
 * A named column in a record schema. A blank cell resolves to {@code defaultValue},
 * which is {@code null} for optional slots.
 */
public record FieldSlot(String name, String defaultValue) {

    public static FieldSlot optional(String name) {
        return new FieldSlot(name, null);
    }

    public static FieldSlot withDefault(String name, String defaultValue) {
        return new FieldSlot(name, defaultValue);
    }
}
