package io.fuelpipelines.source;

import io.fuelpipelines.core.Source;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Streams a delimited text input as fixed-size chunks of data lines so the whole input is never held
 * in memory. The first line is the header; it is bound once through a {@link ColumnMapping} and fixes
 * field positions for the rest of the input. Quoting is off: every line is split on the delimiter,
 * and a line with a different field count than the header becomes a {@link MalformedLine}.
 * Blank lines are skipped and do not count as data lines.
 */
public class DelimitedChunkSource implements Source<RowChunk> {
    private static final Logger log = LoggerFactory.getLogger(DelimitedChunkSource.class);

    private final CSVParser parser;
    private final Iterator<CSVRecord> lines;
    private final ColumnMapping mapping;
    private final List<String> boundColumns;
    private final char delimiter;
    private final int chunkSize;
    private long chunkIndex = 0;
    private long rowNumber = 0;
    private boolean finished;

    /**
     * Reads and binds the header immediately, so a bad header fails here rather than on first poll.
     * An input without any line is a valid, already finished source.
     */
    public DelimitedChunkSource(Reader reader, char delimiter, ColumnMapping mapping, int chunkSize) throws IOException {
        if (chunkSize < 1) throw new IllegalArgumentException("chunkSize must be >= 1, was " + chunkSize);
        this.mapping = Objects.requireNonNull(mapping);
        this.delimiter = delimiter;
        this.chunkSize = chunkSize;
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setDelimiter(delimiter)
                .setQuote(null)
                .setIgnoreEmptyLines(true)
                .build();
        this.parser = format.parse(Objects.requireNonNull(reader));
        this.lines = parser.iterator();
        if (!hasNextLine()) {
            log.info("Input is empty, no header found");
            this.boundColumns = List.of();
            this.finished = true;
        } else {
            List<String> header = lines.next().toList();
            this.boundColumns = mapping.bind(header);
            log.debug("Bound header {} to {}", header, boundColumns);
        }
    }

    @Override
    public Optional<RowChunk> poll() throws IOException {
        if (finished) return Optional.empty();
        List<RawRecord> records = new ArrayList<>(Math.min(chunkSize, 1024));
        List<MalformedLine> malformed = new ArrayList<>();
        int taken = 0;
        while (taken < chunkSize && hasNextLine()) {
            CSVRecord line = lines.next();
            rowNumber++;
            taken++;
            if (line.size() != boundColumns.size()) {
                malformed.add(new MalformedLine(rowNumber, boundColumns.size(), line.size(),
                        String.join(String.valueOf(delimiter), line.toList())));
            } else {
                records.add(toRecord(line));
            }
        }
        if (taken < chunkSize) finished = true;
        if (taken == 0) return Optional.empty();
        return Optional.of(new RowChunk(chunkIndex++, records, malformed));
    }

    @Override
    public boolean isFinished() {
        return finished;
    }

    /** Data lines consumed so far. */
    public long rowsRead() {
        return rowNumber;
    }

    @Override
    public void close() throws IOException {
        finished = true;
        parser.close();
    }

    private RawRecord toRecord(CSVRecord line) {
        Map<String, String> fields = new HashMap<>();
        for (String column : mapping.columns()) fields.put(column, "");
        for (int i = 0; i < boundColumns.size(); i++) {
            String column = boundColumns.get(i);
            if (column != null) fields.put(column, line.get(i));
        }
        return new RawRecord(rowNumber, fields);
    }

    // CSVParser's iterator reports read failures unchecked; surface them as the IOException they are.
    private boolean hasNextLine() throws IOException {
        try {
            return lines.hasNext();
        } catch (UncheckedIOException e) {
            finished = true;
            throw e.getCause();
        }
    }
}
