package com.assettrack.inventory.importer;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Turns a delimited-text payload into data rows.
 *
 * <p>Blank lines are dropped before numbering, the header (when present) is the first
 * non-blank line. Fields are split on the delimiter with no quoting or escaping, so a field
 * that contains the delimiter literally is split in two.
 */
@Component
public class FieldMapper {

    private static final Pattern LINE_BREAK = Pattern.compile("\\r\\n|\\n|\\r");
    private static final char BOM = '\uFEFF';

    private final CSVFormat format;

    public FieldMapper(@Value("${assettrack.import.delimiter:,}") char delimiter) {
        this.format = CSVFormat.DEFAULT.builder()
                .setDelimiter(delimiter)
                .setQuote(null)
                .setTrim(true)
                .build();
    }

    public List<RawRow> split(String rawPayload, boolean hasHeaders) {
        if (rawPayload == null || rawPayload.isEmpty()) return List.of();
        String text = rawPayload.charAt(0) == BOM ? rawPayload.substring(1) : rawPayload;

        List<String> lines = LINE_BREAK.splitAsStream(text)
                .filter(l -> !l.isBlank())
                .toList();
        int first = hasHeaders ? 1 : 0;
        if (lines.size() <= first) return List.of();

        List<RawRow> rows = new ArrayList<>(lines.size() - first);
        for (int i = first; i < lines.size(); i++) {
            String line = lines.get(i);
            rows.add(new RawRow(rows.size() + 1, splitFields(line.trim()), line));
        }
        return rows;
    }

    List<String> splitFields(String line) {
        List<String> fields = new ArrayList<>();
        try (CSVParser parser = CSVParser.parse(line, format)) {
            for (CSVRecord rec : parser) {
                for (String value : rec) {
                    fields.add(value == null ? "" : value);
                }
            }
        } catch (IOException e) {
            // reading from a String; only reachable on a parser defect
            throw new UncheckedIOException("Unable to split line into fields", e);
        }
        return fields;
    }
}
