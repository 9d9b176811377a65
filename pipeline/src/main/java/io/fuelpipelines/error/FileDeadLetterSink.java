package io.fuelpipelines.error;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;

/**
 * Writes dead letters as JSON lines. The file is truncated on open so it only ever describes the
 * current run.
 */
public class FileDeadLetterSink implements DeadLetterSink {
    private final BufferedWriter out;

    public FileDeadLetterSink(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        this.out = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
    }

    @Override
    public synchronized void accept(DeadLetter letter) throws IOException {
        out.write(String.format(
                "{\"ts\":\"%s\",\"row\":%d,\"reason\":\"%s\",\"detail\":\"%s\",\"payload\":\"%s\"}%n",
                Instant.now(), letter.rowNumber(), escape(letter.reason()), escape(letter.detail()),
                escape(letter.payload())));
    }

    @Override
    public synchronized void close() throws IOException {
        out.close();
    }

    static String escape(String s) {
        if (s == null) return "";
        StringBuilder sb = new StringBuilder(s.length() + 8);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20) sb.append(String.format("\\u%04x", (int) c));
                    else sb.append(c);
                }
            }
        }
        return sb.toString();
    }
}
