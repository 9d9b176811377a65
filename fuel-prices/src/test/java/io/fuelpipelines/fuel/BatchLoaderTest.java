package io.fuelpipelines.fuel;

import io.fuelpipelines.error.DeadLetter;
import io.fuelpipelines.error.DeadLetterSink;
import io.fuelpipelines.source.MalformedLine;
import io.fuelpipelines.source.RawRecord;
import io.fuelpipelines.source.RowChunk;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static io.fuelpipelines.fuel.FuelTestData.*;
import static org.junit.jupiter.api.Assertions.*;

class BatchLoaderTest {
    private InMemoryFuelSaleStore store;
    private LoadRun run;

    @BeforeEach
    void setUp() {
        store = new InMemoryFuelSaleStore();
        run = new LoadRun();
        run.moveTo(RunState.REPLACING);
        run.moveTo(RunState.STREAMING);
    }

    @Test
    void bad_price_is_tallied_and_the_rest_inserted() throws Exception {
        RowChunk chunk = new RowChunk(0, List.of(
                raw(1, SP_ROW),
                raw(2, row("S", "PR", "33.444.555/0001-66", "ETANOL", "abc", "04/03/2024")),
                raw(3, row("S", "PR", "33.444.555/0001-66", "GASOLINA", "5,99", "04/03/2024"))), List.of());

        BatchResult result = new BatchLoader(new FuelRecordNormalizer(), store).load(chunk, run);

        assertEquals(3, result.rowsRead());
        assertEquals(2, result.loaded());
        assertEquals(1L, result.rejectedByKind().get(RejectionKind.BAD_DECIMAL));
        assertEquals(List.of(2), store.batchSizes);
        assertEquals(2, store.rows.size());
    }

    @Test
    void malformed_lines_are_rejected_without_normalizing() throws Exception {
        List<RawRecord> seen = new ArrayList<>();
        FuelRecordNormalizer counting = new FuelRecordNormalizer() {
            @Override
            public NormalizationResult normalize(RawRecord raw) {
                seen.add(raw);
                return super.normalize(raw);
            }
        };
        RowChunk chunk = new RowChunk(3, List.of(raw(1, SP_ROW)),
                List.of(new MalformedLine(2, 10, 9, "a;b;c;d;e;f;g;h;i")));

        BatchResult result = new BatchLoader(counting, store).load(chunk, run);

        assertEquals(1, seen.size());
        assertEquals(2, result.rowsRead());
        assertEquals(1, result.loaded());
        assertEquals(1L, result.rejectedByKind().get(RejectionKind.COLUMN_COUNT_MISMATCH));
        assertEquals(3, result.chunkIndex());
    }

    @Test
    void no_insert_when_every_row_is_rejected() throws Exception {
        RowChunk chunk = new RowChunk(0, List.of(raw(1, ";;;;;;;;;")), List.of());
        BatchResult result = new BatchLoader(new FuelRecordNormalizer(), store).load(chunk, run);
        assertEquals(0, result.loaded());
        assertEquals(1, result.rejected());
        assertTrue(store.batchSizes.isEmpty());
    }

    @Test
    void store_failure_propagates() {
        store.failOnBatch = 1;
        RowChunk chunk = new RowChunk(0, List.of(raw(1, SP_ROW)), List.of());
        BatchLoader loader = new BatchLoader(new FuelRecordNormalizer(), store);
        assertThrows(StoreUnavailableException.class, () -> loader.load(chunk, run));
        assertTrue(store.rows.isEmpty());
    }

    @Test
    void refuses_to_load_outside_streaming() {
        LoadRun fresh = new LoadRun();
        RowChunk chunk = new RowChunk(0, List.of(raw(1, SP_ROW)), List.of());
        BatchLoader loader = new BatchLoader(new FuelRecordNormalizer(), store);
        assertThrows(IllegalStateException.class, () -> loader.load(chunk, fresh));
        assertTrue(store.batchSizes.isEmpty());
    }

    @Test
    void rejected_rows_go_to_the_dead_letter_sink() throws Exception {
        List<DeadLetter> letters = new ArrayList<>();
        DeadLetterSink sink = letters::add;
        RowChunk chunk = new RowChunk(0,
                List.of(raw(1, SP_ROW), raw(2, row("SE", "RJ", "123", "GASOLINA", "6,19", "02/03/2024"))),
                List.of(new MalformedLine(3, 10, 2, "x;y")));

        new BatchLoader(new FuelRecordNormalizer(), store, sink).load(chunk, run);

        assertEquals(2, letters.size());
        assertEquals(3, letters.get(0).rowNumber());
        assertEquals("COLUMN_COUNT_MISMATCH", letters.get(0).reason());
        assertEquals("x;y", letters.get(0).payload());
        assertEquals(2, letters.get(1).rowNumber());
        assertEquals("BAD_TAX_ID", letters.get(1).reason());
        assertTrue(letters.get(1).payload().contains(";123;"));
    }

    @Test
    void failing_dead_letter_sink_does_not_stop_the_load() throws Exception {
        DeadLetterSink broken = letter -> { throw new IOException("no space"); };
        RowChunk chunk = new RowChunk(0, List.of(raw(1, SP_ROW), raw(2, ";;;;;;;;;")), List.of());
        BatchResult result = new BatchLoader(new FuelRecordNormalizer(), store, broken).load(chunk, run);
        assertEquals(1, result.loaded());
        assertEquals(1, result.rejected());
    }
}
