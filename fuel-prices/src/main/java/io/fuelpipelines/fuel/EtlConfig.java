package io.fuelpipelines.fuel;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * Settings of one load. {@link #fromEnv()} reads each value from a system property, then an
 * environment variable, then the default; command-line options override the result.
 *
 * @param jdbcUrl     explicit JDBC URL; null to use an H2 file database at {@code dbPath}
 * @param rejectsFile JSON-lines file for rejected rows; null to keep no such file
 */
public record EtlConfig(
        String source,
        int batchSize,
        Path dbPath,
        String jdbcUrl,
        Charset encoding,
        Path rejectsFile,
        int progressEvery,
        boolean reports
) {
    public static final String DEFAULT_SOURCE =
            "https://www.gov.br/anp/pt-br/centrais-de-conteudo/dados-abertos/arquivos/shpc/dsan/2024/precos-gasolina-etanol-01.csv";
    public static final int DEFAULT_BATCH_SIZE = 5000;
    public static final String DEFAULT_DB_PATH = "anp_2024.db";
    public static final int DEFAULT_PROGRESS_EVERY = 5;

    public EtlConfig {
        if (source == null || source.isBlank()) throw new IllegalArgumentException("source must be set");
        if (batchSize < 1) throw new IllegalArgumentException("batch size must be >= 1, was " + batchSize);
        if (progressEvery < 1) throw new IllegalArgumentException("progress interval must be >= 1, was " + progressEvery);
        if (dbPath == null) dbPath = Path.of(DEFAULT_DB_PATH);
        if (encoding == null) encoding = StandardCharsets.UTF_8;
        if (jdbcUrl != null && jdbcUrl.isBlank()) jdbcUrl = null;
    }

    public static EtlConfig fromEnv() {
        String source = setting("fuel.source", "FUEL_SOURCE", DEFAULT_SOURCE);
        int batchSize = Integer.parseInt(setting("fuel.batchSize", "FUEL_BATCH_SIZE", String.valueOf(DEFAULT_BATCH_SIZE)));
        Path dbPath = Path.of(setting("fuel.dbPath", "FUEL_DB_PATH", DEFAULT_DB_PATH));
        String jdbcUrl = setting("fuel.jdbcUrl", "FUEL_JDBC_URL", null);
        Charset encoding = Charset.forName(setting("fuel.encoding", "FUEL_ENCODING", "UTF-8"));
        String rejects = setting("fuel.rejectsFile", "FUEL_REJECTS_FILE", null);
        int progress = Integer.parseInt(setting("fuel.progressEvery", "FUEL_PROGRESS_EVERY", String.valueOf(DEFAULT_PROGRESS_EVERY)));
        return new EtlConfig(source, batchSize, dbPath, jdbcUrl, encoding, rejects == null ? null : Path.of(rejects), progress, true);
    }

    /**
     * The JDBC URL to load into: the explicit one, or an H2 file database at the db path that stays
     * open between the per-batch connections.
     */
    public String effectiveJdbcUrl() {
        return jdbcUrl != null ? jdbcUrl : "jdbc:h2:file:" + dbPath.toAbsolutePath() + ";DB_CLOSE_DELAY=-1";
    }

    public EtlConfig withSource(String s) { return new EtlConfig(s, batchSize, dbPath, jdbcUrl, encoding, rejectsFile, progressEvery, reports); }
    public EtlConfig withBatchSize(int n) { return new EtlConfig(source, n, dbPath, jdbcUrl, encoding, rejectsFile, progressEvery, reports); }
    public EtlConfig withDbPath(Path p) { return new EtlConfig(source, batchSize, p, jdbcUrl, encoding, rejectsFile, progressEvery, reports); }
    public EtlConfig withJdbcUrl(String u) { return new EtlConfig(source, batchSize, dbPath, u, encoding, rejectsFile, progressEvery, reports); }
    public EtlConfig withEncoding(Charset c) { return new EtlConfig(source, batchSize, dbPath, jdbcUrl, c, rejectsFile, progressEvery, reports); }
    public EtlConfig withRejectsFile(Path p) { return new EtlConfig(source, batchSize, dbPath, jdbcUrl, encoding, p, progressEvery, reports); }
    public EtlConfig withProgressEvery(int n) { return new EtlConfig(source, batchSize, dbPath, jdbcUrl, encoding, rejectsFile, n, reports); }
    public EtlConfig withReports(boolean r) { return new EtlConfig(source, batchSize, dbPath, jdbcUrl, encoding, rejectsFile, progressEvery, r); }

    private static String setting(String property, String env, String def) {
        String v = System.getProperty(property);
        if (v == null) v = System.getenv().getOrDefault(env, def);
        return v;
    }
}
