package com.assettrack.inventory.importer;

import java.util.List;

/**
 * Trimmed fields of one data line.
 *
 * @param index 1-based position among data rows (header and blank lines are not counted)
 * @param fields fields in column order
 * @param line the line as received, kept for error diagnostics
 */
public record RawRow(int index, List<String> fields, String line) {

    public RawRow {
        fields = List.copyOf(fields);
    }

    /** Field at {@code position}, or an empty string when the line has fewer columns. */
    public String field(int position) {
        if (position < 0 || position >= fields.size()) return "";
        return fields.get(position);
    }
}
