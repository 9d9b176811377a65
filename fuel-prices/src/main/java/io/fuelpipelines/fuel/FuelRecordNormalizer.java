package io.fuelpipelines.fuel;

import io.fuelpipelines.source.RawRecord;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Converts raw feed rows, formatted the Brazilian way, into {@link FuelSale}s.
 * <ul>
 *   <li>prices use a comma as decimal separator ({@code 5,79}), must be positive and must fit the
 *       stored column: at most 8 integer and 4 fraction digits;</li>
 *   <li>dates are {@code dd/MM/yyyy} and must exist on the calendar;</li>
 *   <li>the tax id must be a punctuated CNPJ ({@code 12.345.678/0001-99});</li>
 *   <li>text is trimmed; only cnpj, produto, valor_venda and data_coleta may not be empty.</li>
 * </ul>
 * Normalization is total: any input, however broken, yields a {@link NormalizationResult}.
 * Checks run mandatory-emptiness first, then formats, and the first failure is reported.
 */
public class FuelRecordNormalizer {
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)");
    private static final Pattern CNPJ = Pattern.compile("\\d{2}\\.\\d{3}\\.\\d{3}/\\d{4}-\\d{2}");
    private static final Pattern STATE_CODE = Pattern.compile("[A-Z]{2}");
    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("dd/MM/uuuu", Locale.ROOT)
            .withResolverStyle(ResolverStyle.STRICT);

    public NormalizationResult normalize(RawRecord raw) {
        if (raw == null) {
            return NormalizationResult.rejected(RejectionKind.MISSING_MANDATORY_FIELD, null, "no record");
        }
        for (String column : FuelColumns.MANDATORY) {
            if (text(raw, column).isEmpty()) {
                return NormalizationResult.rejected(RejectionKind.MISSING_MANDATORY_FIELD, column,
                        column + " is empty");
            }
        }

        String taxId = text(raw, FuelColumns.CNPJ);
        if (!CNPJ.matcher(taxId).matches()) {
            return NormalizationResult.rejected(RejectionKind.BAD_TAX_ID, FuelColumns.CNPJ,
                    "not a CNPJ: '" + taxId + "'");
        }

        String productText = text(raw, FuelColumns.PRODUTO);
        Product product = Product.fromLabel(productText).orElse(null);
        if (product == null) {
            return NormalizationResult.rejected(RejectionKind.UNKNOWN_PRODUCT, FuelColumns.PRODUTO,
                    "unknown product: '" + productText + "'");
        }

        String priceText = text(raw, FuelColumns.VALOR_VENDA);
        BigDecimal price = parsePrice(priceText);
        if (price == null) {
            return NormalizationResult.rejected(RejectionKind.BAD_DECIMAL, FuelColumns.VALOR_VENDA,
                    "not a positive DECIMAL(12, 4) value: '" + priceText + "'");
        }

        String dateText = text(raw, FuelColumns.DATA_COLETA);
        LocalDate date = parseDate(dateText);
        if (date == null) {
            return NormalizationResult.rejected(RejectionKind.BAD_DATE, FuelColumns.DATA_COLETA,
                    "not a dd/MM/yyyy date: '" + dateText + "'");
        }

        String stateCode = text(raw, FuelColumns.UF).toUpperCase(Locale.ROOT);
        if (!stateCode.isEmpty() && !STATE_CODE.matcher(stateCode).matches()) {
            return NormalizationResult.rejected(RejectionKind.BAD_STATE_CODE, FuelColumns.UF,
                    "not a two-letter state code: '" + stateCode + "'");
        }

        return NormalizationResult.accepted(new FuelSale(
                text(raw, FuelColumns.REGIAO),
                stateCode,
                text(raw, FuelColumns.MUNICIPIO),
                text(raw, FuelColumns.BAIRRO),
                text(raw, FuelColumns.POSTO_NOME),
                taxId,
                text(raw, FuelColumns.BANDEIRA),
                product,
                price,
                date));
    }

    /** Comma-decimal text to a positive decimal that the price column holds exactly, or null. */
    static BigDecimal parsePrice(String text) {
        if (text == null) return null;
        String s = text.trim().replace(',', '.');
        if (!DECIMAL.matcher(s).matches()) return null;
        BigDecimal value = new BigDecimal(s);
        if (value.signum() <= 0) return null;
        BigDecimal significant = value.stripTrailingZeros();
        if (significant.scale() > FuelSale.PRICE_SCALE) return null;
        if (significant.precision() - significant.scale() > FuelSale.PRICE_PRECISION - FuelSale.PRICE_SCALE) return null;
        return value;
    }

    /** {@code dd/MM/yyyy} text to a date, or null when malformed or not on the calendar. */
    static LocalDate parseDate(String text) {
        if (text == null) return null;
        try {
            return LocalDate.parse(text.trim(), DATE);
        } catch (DateTimeException e) {
            return null;
        }
    }

    private static String text(RawRecord raw, String column) {
        String v = raw.get(column);
        return v == null ? "" : v.trim();
    }
}
