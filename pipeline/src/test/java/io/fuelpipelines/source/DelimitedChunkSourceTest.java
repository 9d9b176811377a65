package io.fuelpipelines.source;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class DelimitedChunkSourceTest {
    static final ColumnMapping MAPPING = ColumnMapping.builder()
            .column("name", true, "Full Name")
            .column("price", true, "Valor de Venda")
            .column("note", false)
            .build();

    static DelimitedChunkSource source(String text, int chunkSize) throws IOException {
        return new DelimitedChunkSource(new StringReader(text), ';', MAPPING, chunkSize);
    }

    static String rows(int n) {
        StringBuilder sb = new StringBuilder("name;price;note\n");
        for (int i = 1; i <= n; i++) sb.append("n").append(i).append(';').append(i).append(",00;x\n");
        return sb.toString();
    }

    static List<RowChunk> drain(DelimitedChunkSource src) throws IOException {
        List<RowChunk> out = new ArrayList<>();
        Optional<RowChunk> c;
        while ((c = src.poll()).isPresent()) out.add(c.get());
        return out;
    }

    @Test
    void five_rows_in_chunks_of_two_give_sizes_2_2_1() throws Exception {
        List<RowChunk> chunks = drain(source(rows(5), 2));
        assertEquals(List.of(2, 2, 1), chunks.stream().map(RowChunk::size).toList());
        assertEquals(List.of(0L, 1L, 2L), chunks.stream().map(RowChunk::index).toList());
    }

    @Test
    void chunks_partition_rows_in_order() throws Exception {
        int[][] cases = {{0, 3}, {1, 1}, {7, 7}, {10, 3}, {12, 5}, {100, 7}};
        for (int[] c : cases) {
            int r = c[0], n = c[1];
            DelimitedChunkSource src = source(rows(r), n);
            List<RowChunk> chunks = drain(src);
            assertEquals((r + n - 1) / n, chunks.size(), "chunks for R=" + r + " N=" + n);
            List<Long> seen = new ArrayList<>();
            for (RowChunk chunk : chunks) {
                assertTrue(chunk.size() <= n);
                chunk.records().forEach(rec -> seen.add(rec.rowNumber()));
            }
            assertEquals(r, seen.size());
            for (int i = 0; i < seen.size(); i++) assertEquals(i + 1L, seen.get(i));
            assertTrue(src.isFinished());
            assertEquals(r, src.rowsRead());
        }
    }

    @Test
    void line_with_wrong_field_count_is_kept_as_malformed() throws Exception {
        String text = "name;price;note\na;1,00;x\nb;2,00\nc;3,00;z\n";
        List<RowChunk> chunks = drain(source(text, 10));
        assertEquals(1, chunks.size());
        RowChunk chunk = chunks.get(0);
        assertEquals(3, chunk.size());
        assertEquals(List.of(1L, 3L), chunk.records().stream().map(RawRecord::rowNumber).toList());
        assertEquals(1, chunk.malformed().size());
        MalformedLine bad = chunk.malformed().get(0);
        assertEquals(2, bad.rowNumber());
        assertEquals(3, bad.expectedFields());
        assertEquals(2, bad.actualFields());
        assertEquals("b;2,00", bad.text());
    }

    @Test
    void header_aliases_bom_and_unknown_columns() throws Exception {
        String text = "\uFEFFFULL_NAME;Extra;valor de venda\nAna;ignored;5,79\n";
        RowChunk chunk = source(text, 5).poll().orElseThrow();
        RawRecord rec = chunk.records().get(0);
        assertEquals("Ana", rec.get("name"));
        assertEquals("5,79", rec.get("price"));
        assertEquals("", rec.get("note"));
        assertFalse(rec.fields().containsKey("Extra"));
    }

    @Test
    void values_are_not_trimmed_and_quotes_are_literal() throws Exception {
        RowChunk chunk = source("name;price;note\n  \"Ana\" ;5,79;a\"b\n", 5).poll().orElseThrow();
        RawRecord rec = chunk.records().get(0);
        assertEquals("  \"Ana\" ", rec.get("name"));
        assertEquals("a\"b", rec.get("note"));
    }

    @Test
    void blank_lines_are_skipped() throws Exception {
        List<RowChunk> chunks = drain(source("name;price;note\na;1;x\n\nb;2;y\n\n", 10));
        assertEquals(2, chunks.get(0).size());
        assertEquals(List.of(1L, 2L), chunks.get(0).records().stream().map(RawRecord::rowNumber).toList());
    }

    @Test
    void empty_input_is_a_finished_source() throws Exception {
        DelimitedChunkSource src = source("", 5);
        assertTrue(src.isFinished());
        assertTrue(src.poll().isEmpty());
    }

    @Test
    void header_only_input_yields_no_chunks() throws Exception {
        DelimitedChunkSource src = source("name;price\n", 5);
        assertTrue(src.poll().isEmpty());
        assertTrue(src.isFinished());
        assertEquals(0, src.rowsRead());
    }

    @Test
    void missing_required_column_fails_on_open() {
        SourceFormatException e = assertThrows(SourceFormatException.class, () -> source("name;note\na;b\n", 5));
        assertTrue(e.getMessage().contains("price"), e.getMessage());
    }

    @Test
    void rejects_non_positive_chunk_size() {
        assertThrows(IllegalArgumentException.class, () -> source(rows(1), 0));
    }
}
