package io.fuelpipelines.fuel;

import io.fuelpipelines.source.ColumnMapping;

import java.util.List;

/**
 * Canonical column names of the fuel feed, which double as the column names of the target table.
 * Headers may use these names or the ones the ANP publishes its open-data files with.
 */
public final class FuelColumns {
    public static final String REGIAO = "regiao";
    public static final String UF = "uf";
    public static final String MUNICIPIO = "municipio";
    public static final String BAIRRO = "bairro";
    public static final String POSTO_NOME = "posto_nome";
    public static final String CNPJ = "cnpj";
    public static final String BANDEIRA = "bandeira";
    public static final String PRODUTO = "produto";
    public static final String VALOR_VENDA = "valor_venda";
    public static final String DATA_COLETA = "data_coleta";

    /** Table column order. */
    public static final List<String> ALL = List.of(
            REGIAO, UF, MUNICIPIO, BAIRRO, POSTO_NOME, CNPJ, BANDEIRA, PRODUTO, VALOR_VENDA, DATA_COLETA);

    /** Columns whose emptiness rejects a row, in the order they are checked. */
    public static final List<String> MANDATORY = List.of(CNPJ, PRODUTO, VALOR_VENDA, DATA_COLETA);

    public static final ColumnMapping MAPPING = ColumnMapping.builder()
            .column(REGIAO, false, "Regiao - Sigla", "Regiao")
            .column(UF, false, "Estado - Sigla", "Estado")
            .column(MUNICIPIO, false, "Municipio")
            .column(BAIRRO, false, "Bairro")
            .column(POSTO_NOME, false, "Revenda", "Nome da Revenda")
            .column(CNPJ, true, "CNPJ da Revenda")
            .column(BANDEIRA, false, "Bandeira")
            .column(PRODUTO, true, "Produto")
            .column(VALOR_VENDA, true, "Valor de Venda")
            .column(DATA_COLETA, true, "Data da Coleta")
            .build();

    private FuelColumns() {}
}
