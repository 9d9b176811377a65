package io.fuelpipelines.source;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ColumnMappingTest {
    private final ColumnMapping mapping = ColumnMapping.builder()
            .column("regiao", false, "Regiao - Sigla")
            .column("cnpj", true, "CNPJ da Revenda")
            .build();

    @Test
    void matching_ignores_case_accents_and_separators() {
        assertEquals("regiao", mapping.resolve("REGIÃO_SIGLA").orElseThrow());
        assertEquals("regiao", mapping.resolve("  regiao   -  sigla ").orElseThrow());
        assertEquals("cnpj", mapping.resolve("cnpj-da-revenda").orElseThrow());
        assertTrue(mapping.resolve("Bairro").isEmpty());
        assertTrue(mapping.resolve(null).isEmpty());
    }

    @Test
    void bind_is_positional_with_nulls_for_unknown_fields() throws Exception {
        List<String> bound = mapping.bind(List.of("Bairro", "CNPJ da Revenda", "Regiao - Sigla"));
        assertEquals(Arrays.asList(null, "cnpj", "regiao"), bound);
    }

    @Test
    void bind_rejects_a_column_matched_twice() {
        assertThrows(SourceFormatException.class, () -> mapping.bind(List.of("cnpj", "CNPJ da Revenda")));
    }

    @Test
    void conflicting_aliases_are_refused() {
        assertThrows(IllegalArgumentException.class, () -> ColumnMapping.builder()
                .column("a", false, "same")
                .column("b", false, "Same"));
    }
}
