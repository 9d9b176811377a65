package io.fuelpipelines.fuel;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JdbcFuelSaleStoreTest {
    private JdbcFuelSaleStore store;

    static FuelSale sale(String uf, String cnpj, Product product, String price) {
        return new FuelSale("SE", uf, "Cidade", "Centro", "Posto", cnpj, "Shell", product,
                new BigDecimal(price), LocalDate.of(2024, 3, 1));
    }

    @BeforeEach
    void setUp() {
        store = new JdbcFuelSaleStore(FuelTestData.memDb("store"));
    }

    private long count() throws SQLException {
        try (Connection c = store.connect(); Statement s = c.createStatement();
             ResultSet rs = s.executeQuery("SELECT COUNT(*) FROM " + FuelSaleStore.TABLE)) {
            rs.next();
            return rs.getLong(1);
        }
    }

    @Test
    void creates_table_and_stores_typed_values() throws Exception {
        store.replaceAll();
        store.acceptBatch(List.of(sale("SP", "12.345.678/0001-99", Product.DIESEL_S10, "5.79")));

        try (Connection c = store.connect(); Statement s = c.createStatement();
             ResultSet rs = s.executeQuery("SELECT uf, cnpj, produto, valor_venda, data_coleta FROM " + FuelSaleStore.TABLE)) {
            assertTrue(rs.next());
            assertEquals("SP", rs.getString(1));
            assertEquals("12.345.678/0001-99", rs.getString(2));
            assertEquals("DIESEL S10", rs.getString(3));
            assertEquals(0, new BigDecimal("5.79").compareTo(rs.getBigDecimal(4)));
            assertEquals(LocalDate.of(2024, 3, 1), rs.getDate(5).toLocalDate());
            assertFalse(rs.next());
        }
    }

    @Test
    void replace_discards_earlier_rows() throws Exception {
        store.replaceAll();
        store.acceptBatch(List.of(sale("SP", "12.345.678/0001-99", Product.GASOLINA, "5.79"),
                sale("RJ", "22.333.444/0001-55", Product.GASOLINA, "6.19")));
        assertEquals(2, count());
        store.replaceAll();
        assertEquals(0, count());
    }

    @Test
    void failed_batch_stores_nothing() throws Exception {
        store.replaceAll();
        FuelSale tooLong = sale("SP", "12.345.678/0001-99-EXTRA-TEXT", Product.GASOLINA, "5.79");
        StoreUnavailableException e = assertThrows(StoreUnavailableException.class, () ->
                store.acceptBatch(List.of(sale("SP", "12.345.678/0001-99", Product.GASOLINA, "5.79"), tooLong)));
        assertNotNull(e.getCause());
        assertEquals(0, count());
    }

    @Test
    void unreachable_database_is_a_store_error() {
        JdbcFuelSaleStore broken = new JdbcFuelSaleStore("jdbc:h2:mem:broken;NO_SUCH_SETTING=1");
        assertThrows(StoreUnavailableException.class, broken::replaceAll);
    }
}
