package io.fuelpipelines.fuel;

import java.io.PrintStream;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The three management reports over {@code vendas_combustivel}. Queries are plain aggregations;
 * averages are rounded half-up to two places after aggregation.
 */
public class PriceReports {
    static final int TOP_STATES = 5;

    static final String PRODUCT_SQL = "SELECT produto, COUNT(*), MIN(valor_venda), AVG(valor_venda), MAX(valor_venda) "
            + "FROM " + FuelSaleStore.TABLE + " GROUP BY produto ORDER BY produto";

    static final String REGION_SQL = "SELECT regiao, produto, COUNT(DISTINCT cnpj), AVG(valor_venda) "
            + "FROM " + FuelSaleStore.TABLE + " GROUP BY regiao, produto ORDER BY regiao, produto";

    static final String STATE_SQL = "SELECT uf, AVG(valor_venda) AS media "
            + "FROM " + FuelSaleStore.TABLE + " WHERE produto = ? GROUP BY uf "
            + "ORDER BY media DESC, uf FETCH FIRST " + TOP_STATES + " ROWS ONLY";

    private static final String RULE = "=======================================================";

    /** Where report queries get their connection from. */
    @FunctionalInterface
    public interface Connector {
        Connection connect() throws SQLException;
    }

    private final Connector connector;

    public PriceReports(Connector connector) {
        this.connector = Objects.requireNonNull(connector);
    }

    public List<ProductSummary> productSummary() throws SQLException {
        List<ProductSummary> out = new ArrayList<>();
        try (Connection c = connector.connect();
             PreparedStatement ps = c.prepareStatement(PRODUCT_SQL);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new ProductSummary(rs.getString(1), rs.getLong(2),
                        cents(rs.getBigDecimal(3)), cents(rs.getBigDecimal(4)), cents(rs.getBigDecimal(5))));
            }
        }
        return out;
    }

    public List<RegionProductSummary> regionSummary() throws SQLException {
        List<RegionProductSummary> out = new ArrayList<>();
        try (Connection c = connector.connect();
             PreparedStatement ps = c.prepareStatement(REGION_SQL);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new RegionProductSummary(rs.getString(1), rs.getString(2), rs.getLong(3), cents(rs.getBigDecimal(4))));
            }
        }
        return out;
    }

    /** States with the highest average gasoline price, most expensive first. */
    public List<StateAverage> topGasolineStates() throws SQLException {
        List<StateAverage> out = new ArrayList<>();
        try (Connection c = connector.connect();
             PreparedStatement ps = c.prepareStatement(STATE_SQL)) {
            ps.setString(1, Product.GASOLINA.label());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new StateAverage(rs.getString(1), cents(rs.getBigDecimal(2))));
                }
            }
        }
        return out;
    }

    /** Prints all three reports. Nothing is printed if any query fails. */
    public void printAll(PrintStream out) throws SQLException {
        List<ProductSummary> products = productSummary();
        List<RegionProductSummary> regions = regionSummary();
        List<StateAverage> states = topGasolineStates();
        out.print(renderProducts(products));
        out.print(renderRegions(regions));
        out.print(renderStates(states));
        out.flush();
    }

    static String renderProducts(List<ProductSummary> rows) {
        TextTable t = new TextTable("produto", "Qtd Amostras", "Min (R$)", "Média (R$)", "Max (R$)");
        for (ProductSummary r : rows) {
            t.row(r.product(), r.samples(), plain(r.minPrice()), plain(r.avgPrice()), plain(r.maxPrice()));
        }
        return title("RESUMO DE PREÇOS (R$ / Litro)") + t.render();
    }

    static String renderRegions(List<RegionProductSummary> rows) {
        TextTable t = new TextTable("regiao", "produto", "Qtd Postos", "Preço Médio Regional (R$)");
        for (RegionProductSummary r : rows) {
            t.row(r.region(), r.product(), r.stations(), plain(r.avgPrice()));
        }
        return "\n" + title("ANÁLISE REGIONAL (Onde há mais postos pesquisados?)") + t.render();
    }

    static String renderStates(List<StateAverage> rows) {
        TextTable t = new TextTable("uf", "Média Gasolina (R$)");
        for (StateAverage r : rows) {
            t.row(r.stateCode(), plain(r.avgPrice()));
        }
        return "\n" + title("TOP " + TOP_STATES + " ESTADOS MAIS CAROS - GASOLINA") + t.render();
    }

    private static String title(String text) {
        return "\n" + RULE + "\n   " + text + "\n" + RULE + "\n";
    }

    static BigDecimal cents(BigDecimal v) {
        return v == null ? null : v.setScale(2, RoundingMode.HALF_UP);
    }

    private static String plain(BigDecimal v) {
        return v == null ? "" : v.toPlainString();
    }
}
