package io.fuelpipelines.fuel;

import com.codahale.metrics.MetricRegistry;
import io.fuelpipelines.error.DeadLetterSink;
import io.fuelpipelines.metrics.Metrics;

import java.io.PrintStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

public class FuelPriceEtlBuilder {
    private String source;
    private InputOpener opener = new CsvInputOpener();
    private Charset encoding = StandardCharsets.UTF_8;
    private int batchSize = EtlConfig.DEFAULT_BATCH_SIZE;
    private int progressEvery = EtlConfig.DEFAULT_PROGRESS_EVERY;
    private FuelSaleStore store;
    private FuelRecordNormalizer normalizer = new FuelRecordNormalizer();
    private DeadLetterSink deadLetters;
    private PriceReports reports;
    private PrintStream reportOut = System.out;
    private MetricRegistry metricRegistry = new MetricRegistry();

    public FuelPriceEtlBuilder source(String location) { this.source = location; return this; }
    public FuelPriceEtlBuilder opener(InputOpener o) { this.opener = o; return this; }
    public FuelPriceEtlBuilder encoding(Charset c) { this.encoding = c; return this; }
    public FuelPriceEtlBuilder batchSize(int n) { this.batchSize = n; return this; }
    public FuelPriceEtlBuilder progressEvery(int n) { this.progressEvery = Math.max(1, n); return this; }
    public FuelPriceEtlBuilder store(FuelSaleStore s) { this.store = s; return this; }
    public FuelPriceEtlBuilder normalizer(FuelRecordNormalizer n) { this.normalizer = n; return this; }
    public FuelPriceEtlBuilder deadLetters(DeadLetterSink d) { this.deadLetters = d; return this; }
    /** Reports to print after a successful load; null skips reporting. */
    public FuelPriceEtlBuilder reports(PriceReports r) { this.reports = r; return this; }
    public FuelPriceEtlBuilder reportOut(PrintStream out) { this.reportOut = out; return this; }
    public FuelPriceEtlBuilder metrics(MetricRegistry r) { this.metricRegistry = r; return this; }

    public FuelPriceEtl build() {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(opener, "opener");
        Objects.requireNonNull(store, "store");
        Objects.requireNonNull(normalizer, "normalizer");
        if (batchSize < 1) throw new IllegalArgumentException("batchSize must be >= 1, was " + batchSize);
        BatchLoader loader = new BatchLoader(normalizer, store, deadLetters);
        return new FuelPriceEtl(source, opener, encoding, batchSize, progressEvery, store, loader, reports,
                reportOut, new Metrics(metricRegistry));
    }
}
