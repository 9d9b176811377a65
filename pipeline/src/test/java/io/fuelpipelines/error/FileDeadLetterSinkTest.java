package io.fuelpipelines.error;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileDeadLetterSinkTest {
    @Test
    void writes_one_escaped_json_line_per_letter() throws Exception {
        Path dir = Files.createTempDirectory("dlq");
        Path file = dir.resolve("nested/rejects.jsonl");
        try (FileDeadLetterSink sink = new FileDeadLetterSink(file)) {
            sink.accept(new DeadLetter(3, "BAD_DECIMAL", "not a positive decimal: 'abc'", "a;\"b\";c\\d"));
            sink.accept(new DeadLetter(9, "BAD_DATE", "line\nbreak", null));
        }
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertEquals(2, lines.size());
        assertTrue(lines.get(0).contains("\"row\":3"));
        assertTrue(lines.get(0).contains("\"reason\":\"BAD_DECIMAL\""));
        assertTrue(lines.get(0).contains("\"payload\":\"a;\\\"b\\\";c\\\\d\""));
        assertTrue(lines.get(1).contains("\"detail\":\"line\\nbreak\""));
        assertTrue(lines.get(1).contains("\"payload\":\"\""));
    }

    @Test
    void reopening_truncates_previous_run() throws Exception {
        Path file = Files.createTempDirectory("dlq").resolve("rejects.jsonl");
        try (FileDeadLetterSink sink = new FileDeadLetterSink(file)) {
            sink.accept(new DeadLetter(1, "BAD_DATE", "x", "y"));
        }
        try (FileDeadLetterSink ignored = new FileDeadLetterSink(file)) {
            // nothing rejected this time
        }
        assertEquals(0, Files.readAllLines(file).size());
    }
}
