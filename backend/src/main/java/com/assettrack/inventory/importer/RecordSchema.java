package com.assettrack.inventory.importer;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered column layout of one record kind. Builders look fields up by name, so adding a
 * column only means appending a slot.
 */
public final class RecordSchema {

    private final List<FieldSlot> slots;
    private final Map<String, Integer> positions = new HashMap<>();

    private RecordSchema(List<FieldSlot> slots) {
        this.slots = List.copyOf(slots);
        for (int i = 0; i < this.slots.size(); i++) {
            String name = this.slots.get(i).name();
            if (positions.putIfAbsent(name, i) != null) {
                throw new IllegalArgumentException("Duplicate slot name: " + name);
            }
        }
    }

    public static RecordSchema of(FieldSlot... slots) {
        return new RecordSchema(List.of(slots));
    }

    /** Trimmed cell text for the named slot, the slot default when the cell is blank. */
    public String text(RawRow row, String name) {
        Integer position = positions.get(name);
        if (position == null) throw new IllegalArgumentException("Unknown slot: " + name);
        String value = row.field(position);
        if (value == null || value.isEmpty()) return slots.get(position).defaultValue();
        return value;
    }

    public List<String> fieldNames() {
        return slots.stream().map(FieldSlot::name).toList();
    }

    public int size() { return slots.size(); }
}
