package io.fuelpipelines.fuel;

import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvInputOpenerTest {
    private final CsvInputOpener opener = new CsvInputOpener();

    @Test
    void opens_plain_paths_and_file_uris() throws Exception {
        Path file = FuelTestData.csv(List.of(FuelTestData.SP_ROW));
        try (InputStream in = opener.open(file.toString())) {
            assertTrue(new String(in.readAllBytes(), StandardCharsets.UTF_8).startsWith(FuelTestData.HEADER));
        }
        try (InputStream in = opener.open(file.toUri().toString())) {
            assertEquals(Files.size(file), in.readAllBytes().length);
        }
    }

    @Test
    void missing_or_blank_location_is_unavailable() {
        assertThrows(SourceUnavailableException.class, () -> opener.open("/no/such/precos.csv"));
        assertThrows(SourceUnavailableException.class, () -> opener.open(" "));
        assertThrows(SourceUnavailableException.class, () -> opener.open(null));
    }
}
