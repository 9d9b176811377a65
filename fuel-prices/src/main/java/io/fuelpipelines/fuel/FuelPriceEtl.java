package io.fuelpipelines.fuel;

import com.codahale.metrics.Meter;
import com.codahale.metrics.Timer;
import io.fuelpipelines.metrics.Metrics;
import io.fuelpipelines.source.DelimitedChunkSource;
import io.fuelpipelines.source.RowChunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.Charset;
import java.sql.SQLException;
import java.util.Optional;

/**
 * Runs one full-replace load: open the input, replace the table, stream chunks through the
 * {@link BatchLoader}, then print the reports. Strictly sequential: a chunk is committed before the
 * next one is read, so memory is bounded by the batch size.
 *
 * <p>The table is emptied before the first chunk commits and never again during the run. Readers
 * querying mid-run can see it empty or partially loaded; killing the process leaves it as of the
 * last committed chunk.
 */
public class FuelPriceEtl {
    private static final Logger log = LoggerFactory.getLogger(FuelPriceEtl.class);

    static final char DELIMITER = ';';
    static final String LOAD_TIMER = "etl.batch.load.time";

    private final String source;
    private final InputOpener opener;
    private final Charset encoding;
    private final int batchSize;
    private final int progressEvery;
    private final FuelSaleStore store;
    private final BatchLoader loader;
    private final PriceReports reports;
    private final PrintStream reportOut;
    private final Metrics metrics;

    private final Timer loadTimer;
    private final Meter readMeter;
    private final Meter loadedMeter;
    private final Meter rejectedMeter;

    FuelPriceEtl(String source, InputOpener opener, Charset encoding, int batchSize, int progressEvery,
                 FuelSaleStore store, BatchLoader loader, PriceReports reports, PrintStream reportOut, Metrics metrics) {
        this.source = source;
        this.opener = opener;
        this.encoding = encoding;
        this.batchSize = batchSize;
        this.progressEvery = progressEvery;
        this.store = store;
        this.loader = loader;
        this.reports = reports;
        this.reportOut = reportOut;
        this.metrics = metrics;
        this.loadTimer = metrics.timer(LOAD_TIMER);
        this.readMeter = metrics.meter("etl.rows.read");
        this.loadedMeter = metrics.meter("etl.rows.loaded");
        this.rejectedMeter = metrics.meter("etl.rows.rejected");
    }

    public RunSummary run() {
        LoadRun run = new LoadRun();
        RunCounters counters = RunCounters.empty();
        log.info("Starting load of {} (batch size {})", source, batchSize);

        DelimitedChunkSource chunks;
        try {
            chunks = openChunks();
        } catch (SourceUnavailableException e) {
            return abort(run, counters, e);
        }

        try (chunks) {
            run.moveTo(RunState.REPLACING);
            store.replaceAll();
            run.moveTo(RunState.STREAMING);

            Optional<RowChunk> next;
            while ((next = chunks.poll()).isPresent()) {
                BatchResult result;
                try (Timer.Context ignored = loadTimer.time()) {
                    result = loader.load(next.get(), run);
                }
                counters = counters.plus(result);
                readMeter.mark(result.rowsRead());
                loadedMeter.mark(result.loaded());
                rejectedMeter.mark(result.rejected());
                if (counters.batches() % progressEvery == 0) {
                    log.info("Processed batch {}, rows loaded so far: {}", result.chunkIndex(), counters.rowsLoaded());
                }
            }
        } catch (StoreUnavailableException e) {
            return abort(run, counters, e);
        } catch (IOException e) {
            return abort(run, counters, new SourceUnavailableException("Reading " + source + " failed: " + e.getMessage(), e));
        }

        run.moveTo(RunState.REPORTING);
        report();
        run.moveTo(RunState.DONE);
        RunSummary summary = summary(run, counters, null);
        log.info(summary.describe());
        return summary;
    }

    private DelimitedChunkSource openChunks() throws SourceUnavailableException {
        InputStream in = opener.open(source);
        Reader reader = new BufferedReader(new InputStreamReader(in, encoding));
        try {
            return new DelimitedChunkSource(reader, DELIMITER, FuelColumns.MAPPING, batchSize);
        } catch (IOException e) {
            try {
                reader.close();
            } catch (IOException suppressed) {
                e.addSuppressed(suppressed);
            }
            throw new SourceUnavailableException("Cannot read header of " + source + ": " + e.getMessage(), e);
        }
    }

    // A failed report does not undo a completed load.
    private void report() {
        if (reports == null) {
            log.info("Reports skipped");
            return;
        }
        try {
            reports.printAll(reportOut);
        } catch (SQLException e) {
            log.error("Report generation failed: {}", e.getMessage(), e);
        }
    }

    private RunSummary abort(LoadRun run, RunCounters counters, Exception cause) {
        run.moveTo(RunState.ABORTED);
        RunSummary summary = summary(run, counters, cause);
        log.error("{}", summary.describe(), cause);
        return summary;
    }

    private RunSummary summary(LoadRun run, RunCounters counters, Exception cause) {
        return new RunSummary(run.state(), counters, run.elapsed(), metrics.meanMillis(LOAD_TIMER), cause);
    }
}
