package io.fuelpipelines.fuel;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * What loading one chunk did.
 *
 * @param rowsRead data lines in the chunk, malformed ones included
 */
public record BatchResult(long chunkIndex, int rowsRead, int loaded, Map<RejectionKind, Long> rejectedByKind) {
    public BatchResult {
        rejectedByKind = rejectedByKind.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(rejectedByKind));
    }

    public long rejected() {
        return rejectedByKind.values().stream().mapToLong(Long::longValue).sum();
    }
}
