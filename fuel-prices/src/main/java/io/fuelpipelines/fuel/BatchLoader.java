package io.fuelpipelines.fuel;

import io.fuelpipelines.error.DeadLetter;
import io.fuelpipelines.error.DeadLetterSink;
import io.fuelpipelines.source.MalformedLine;
import io.fuelpipelines.source.RawRecord;
import io.fuelpipelines.source.RowChunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Normalizes one chunk and persists its surviving sales as a single all-or-nothing insert.
 * Rejected rows are final: they are tallied and, when a dead-letter sink is configured, written out
 * for correction, but never retried.
 */
public class BatchLoader {
    private static final Logger log = LoggerFactory.getLogger(BatchLoader.class);

    private final FuelRecordNormalizer normalizer;
    private final FuelSaleStore store;
    private final DeadLetterSink deadLetters;

    public BatchLoader(FuelRecordNormalizer normalizer, FuelSaleStore store) {
        this(normalizer, store, null);
    }

    public BatchLoader(FuelRecordNormalizer normalizer, FuelSaleStore store, DeadLetterSink deadLetters) {
        this.normalizer = Objects.requireNonNull(normalizer);
        this.store = Objects.requireNonNull(store);
        this.deadLetters = deadLetters;
    }

    /**
     * @throws StoreUnavailableException when the insert fails; nothing of this chunk is stored then
     * @throws IllegalStateException     when the run is not streaming
     */
    public BatchResult load(RowChunk chunk, LoadRun run) throws StoreUnavailableException {
        run.require(RunState.STREAMING);
        Map<RejectionKind, Long> rejected = new EnumMap<>(RejectionKind.class);

        for (MalformedLine line : chunk.malformed()) {
            rejected.merge(RejectionKind.COLUMN_COUNT_MISMATCH, 1L, Long::sum);
            deadLetter(new DeadLetter(line.rowNumber(), RejectionKind.COLUMN_COUNT_MISMATCH.name(),
                    "expected " + line.expectedFields() + " fields, found " + line.actualFields(), line.text()));
        }

        List<FuelSale> staged = new ArrayList<>(chunk.records().size());
        for (RawRecord raw : chunk.records()) {
            NormalizationResult result = normalizer.normalize(raw);
            if (result.isAccepted()) {
                staged.add(result.sale());
            } else {
                Rejection r = result.rejection();
                rejected.merge(r.kind(), 1L, Long::sum);
                deadLetter(new DeadLetter(raw.rowNumber(), r.kind().name(), r.detail(), render(raw)));
            }
        }

        if (!staged.isEmpty()) {
            store.acceptBatch(staged);
        }
        BatchResult result = new BatchResult(chunk.index(), chunk.size(), staged.size(), rejected);
        log.debug("Chunk {}: read={} loaded={} rejected={}", chunk.index(), result.rowsRead(), result.loaded(), rejected);
        return result;
    }

    private void deadLetter(DeadLetter letter) {
        if (deadLetters == null) return;
        try {
            deadLetters.accept(letter);
        } catch (IOException e) {
            log.warn("Could not dead-letter row {}: {}", letter.rowNumber(), e.getMessage());
        }
    }

    private static String render(RawRecord raw) {
        return String.join(";", FuelColumns.ALL.stream().map(raw::get).toList());
    }
}
