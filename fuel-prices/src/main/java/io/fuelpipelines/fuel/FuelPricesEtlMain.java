package io.fuelpipelines.fuel;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Key;
import com.google.inject.TypeLiteral;
import io.fuelpipelines.error.DeadLetterSink;
import picocli.CommandLine;

import java.io.PrintStream;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI that loads the ANP fuel price feed into {@code vendas_combustivel} and prints the price reports.
 * Exit code 0 when the run is done, 1 when it aborted, 2 on bad usage.
 */
@CommandLine.Command(name = "fuel-prices-etl", mixinStandardHelpOptions = true,
        description = "Load the ANP fuel price CSV into a table (full replace) and print price reports")
public final class FuelPricesEtlMain implements Callable<Integer> {
    static final int EXIT_USAGE = 2;

    @CommandLine.Option(names = {"-s", "--source"}, description = "CSV path or http(s) URL (default: ANP 2024-01 gasoline/ethanol file)")
    String source;

    @CommandLine.Option(names = {"-b", "--batch-size"}, description = "Rows per batch (default 5000)")
    Integer batchSize;

    @CommandLine.Option(names = {"-d", "--db-path"}, description = "H2 database file (default anp_2024.db)")
    Path dbPath;

    @CommandLine.Option(names = "--jdbc-url", description = "JDBC URL of the target store; overrides --db-path")
    String jdbcUrl;

    @CommandLine.Option(names = "--encoding", description = "Input character set (default UTF-8)")
    Charset encoding;

    @CommandLine.Option(names = "--rejects-file", description = "Write rejected rows as JSON lines to this file")
    Path rejectsFile;

    @CommandLine.Option(names = "--progress-every", description = "Log progress every N batches (default 5)")
    Integer progressEvery;

    @CommandLine.Option(names = "--skip-reports", description = "Load only, do not print reports")
    boolean skipReports;

    private final PrintStream out;
    private final PrintStream err;

    public FuelPricesEtlMain() { this(System.out, System.err); }

    FuelPricesEtlMain(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int code = new CommandLine(new FuelPricesEtlMain()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() throws Exception {
        EtlConfig config;
        try {
            config = resolve(EtlConfig.fromEnv());
        } catch (IllegalArgumentException e) {
            err.println("Invalid configuration: " + e.getMessage());
            return EXIT_USAGE;
        }

        Injector injector = Guice.createInjector(new FuelEtlModule(config, out));
        FuelPriceEtl etl = injector.getInstance(FuelPriceEtl.class);
        Optional<DeadLetterSink> deadLetters = injector.getInstance(Key.get(new TypeLiteral<Optional<DeadLetterSink>>() {}));

        RunSummary summary;
        try {
            summary = etl.run();
        } finally {
            if (deadLetters.isPresent()) deadLetters.get().close();
        }

        if (summary.succeeded()) {
            out.println(summary.describe());
        } else {
            err.println(summary.describe());
            err.println("Load aborted: " + summary.cause());
        }
        return summary.exitCode();
    }

    EtlConfig resolve(EtlConfig base) {
        EtlConfig c = base;
        if (source != null) c = c.withSource(source);
        if (batchSize != null) c = c.withBatchSize(batchSize);
        if (dbPath != null) c = c.withDbPath(dbPath);
        if (jdbcUrl != null) c = c.withJdbcUrl(jdbcUrl);
        if (encoding != null) c = c.withEncoding(encoding);
        if (rejectsFile != null) c = c.withRejectsFile(rejectsFile);
        if (progressEvery != null) c = c.withProgressEvery(progressEvery);
        if (skipReports) c = c.withReports(false);
        return c;
    }
}
