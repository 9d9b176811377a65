package io.fuelpipelines.source;

import java.util.Map;

/**
 * One well-formed data line keyed by canonical column name. Values are the untouched field text;
 * columns the header did not carry read as the empty string.
 *
 * @param rowNumber 1-based position of the line among the data lines of the input
 */
public record RawRecord(long rowNumber, Map<String, String> fields) {
    public RawRecord {
        fields = Map.copyOf(fields);
    }

    public String get(String column) {
        return fields.getOrDefault(column, "");
    }
}
