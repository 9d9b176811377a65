package io.fuelpipelines.fuel;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Totals of one run. Immutable: the orchestrator folds each {@link BatchResult} in with
 * {@link #plus(BatchResult)} and keeps the new value.
 */
public record RunCounters(long rowsRead, long rowsLoaded, Map<RejectionKind, Long> rejectedByKind, long batches) {
    private static final RunCounters EMPTY = new RunCounters(0, 0, Map.of(), 0);

    public RunCounters {
        rejectedByKind = rejectedByKind.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(rejectedByKind));
    }

    public static RunCounters empty() { return EMPTY; }

    public RunCounters plus(BatchResult batch) {
        Map<RejectionKind, Long> merged = new EnumMap<>(RejectionKind.class);
        merged.putAll(rejectedByKind);
        batch.rejectedByKind().forEach((k, v) -> merged.merge(k, v, Long::sum));
        return new RunCounters(rowsRead + batch.rowsRead(), rowsLoaded + batch.loaded(), merged, batches + 1);
    }

    public long rowsRejected() {
        return rejectedByKind.values().stream().mapToLong(Long::longValue).sum();
    }

    public long rejected(RejectionKind kind) {
        return rejectedByKind.getOrDefault(kind, 0L);
    }
}
