package io.fuelpipelines.fuel;

import io.fuelpipelines.sink.JdbcBatchWriter;

import java.sql.Connection;
import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;

/** {@link FuelSaleStore} over any JDBC database; the default deployment is an embedded H2 file. */
public class JdbcFuelSaleStore implements FuelSaleStore {
    static final String CREATE_TABLE = "CREATE TABLE IF NOT EXISTS " + TABLE + " ("
            + "regiao VARCHAR NOT NULL, "
            + "uf VARCHAR(2) NOT NULL, "
            + "municipio VARCHAR NOT NULL, "
            + "bairro VARCHAR NOT NULL, "
            + "posto_nome VARCHAR NOT NULL, "
            + "cnpj VARCHAR(18) NOT NULL, "
            + "bandeira VARCHAR NOT NULL, "
            + "produto VARCHAR(32) NOT NULL, "
            + "valor_venda DECIMAL(" + FuelSale.PRICE_PRECISION + ", " + FuelSale.PRICE_SCALE + ") NOT NULL, "
            + "data_coleta DATE NOT NULL)";

    private final JdbcBatchWriter<FuelSale> writer;

    public JdbcFuelSaleStore(String jdbcUrl) {
        this(jdbcUrl, null, null);
    }

    public JdbcFuelSaleStore(String jdbcUrl, String user, String password) {
        this.writer = new JdbcBatchWriter<>(jdbcUrl, user, password, TABLE, FuelColumns.ALL, JdbcFuelSaleStore::bind);
    }

    @Override
    public void replaceAll() throws StoreUnavailableException {
        try {
            writer.replaceAll(CREATE_TABLE);
        } catch (SQLException e) {
            throw new StoreUnavailableException("Could not replace table " + TABLE + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void acceptBatch(List<FuelSale> sales) throws StoreUnavailableException {
        try {
            writer.acceptBatch(sales);
        } catch (SQLException e) {
            throw new StoreUnavailableException("Could not insert " + sales.size() + " rows into " + TABLE + ": " + e.getMessage(), e);
        }
    }

    /** Connection to the same database, for the report queries. */
    public Connection connect() throws SQLException {
        return writer.connect();
    }

    private static void bind(PreparedStatement ps, FuelSale s) throws SQLException {
        ps.setString(1, s.region());
        ps.setString(2, s.stateCode());
        ps.setString(3, s.municipality());
        ps.setString(4, s.neighborhood());
        ps.setString(5, s.stationName());
        ps.setString(6, s.taxId());
        ps.setString(7, s.brand());
        ps.setString(8, s.product().label());
        ps.setBigDecimal(9, s.salePrice());
        ps.setDate(10, Date.valueOf(s.collectionDate()));
    }
}
