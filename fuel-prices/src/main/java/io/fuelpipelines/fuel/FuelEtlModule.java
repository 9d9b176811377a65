package io.fuelpipelines.fuel;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.fuelpipelines.error.DeadLetterSink;
import io.fuelpipelines.error.FileDeadLetterSink;

import java.io.IOException;
import java.io.PrintStream;
import java.util.Optional;

public class FuelEtlModule extends AbstractModule {
    private final EtlConfig config;
    private final PrintStream reportOut;

    public FuelEtlModule(EtlConfig config) { this(config, System.out); }

    public FuelEtlModule(EtlConfig config, PrintStream reportOut) {
        this.config = config;
        this.reportOut = reportOut;
    }

    @Override
    protected void configure() {
        bind(EtlConfig.class).toInstance(config);
        bind(InputOpener.class).to(CsvInputOpener.class);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton CsvInputOpener csvInputOpener() { return new CsvInputOpener(); }

    @Provides @Singleton JdbcFuelSaleStore jdbcStore() { return new JdbcFuelSaleStore(config.effectiveJdbcUrl()); }

    @Provides @Singleton FuelSaleStore store(JdbcFuelSaleStore jdbc) { return jdbc; }

    @Provides @Singleton FuelRecordNormalizer normalizer() { return new FuelRecordNormalizer(); }

    @Provides @Singleton PriceReports reports(JdbcFuelSaleStore jdbc) { return new PriceReports(jdbc::connect); }

    @Provides @Singleton Optional<DeadLetterSink> deadLetters() throws IOException {
        if (config.rejectsFile() == null) return Optional.empty();
        return Optional.of(new FileDeadLetterSink(config.rejectsFile()));
    }

    @Provides @Singleton FuelPriceEtl etl(InputOpener opener, FuelSaleStore store, FuelRecordNormalizer normalizer,
                                          PriceReports reports, Optional<DeadLetterSink> deadLetters, MetricRegistry registry) {
        return new FuelPriceEtlBuilder()
                .source(config.source())
                .opener(opener)
                .encoding(config.encoding())
                .batchSize(config.batchSize())
                .progressEvery(config.progressEvery())
                .store(store)
                .normalizer(normalizer)
                .deadLetters(deadLetters.orElse(null))
                .reports(config.reports() ? reports : null)
                .reportOut(reportOut)
                .metrics(registry)
                .build();
    }
}
