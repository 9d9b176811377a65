package io.fuelpipelines.source;

import java.util.List;

/**
 * Consecutive data lines read as one unit. Chunks of a source partition its data lines in input
 * order; {@link #size()} counts well-formed and malformed lines alike.
 */
public record RowChunk(long index, List<RawRecord> records, List<MalformedLine> malformed) {
    public RowChunk {
        records = List.copyOf(records);
        malformed = List.copyOf(malformed);
    }

    public int size() {
        return records.size() + malformed.size();
    }
}
