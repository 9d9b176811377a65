package io.fuelpipelines.fuel;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/**
 * A validated price sample, one row of {@code vendas_combustivel}. Only {@link FuelRecordNormalizer}
 * creates these, so every instance satisfies the field rules: optional text is never null, the tax id
 * is a formatted CNPJ, the price is positive and fits {@code DECIMAL(12, 4)}.
 */
public record FuelSale(
        String region,
        String stateCode,
        String municipality,
        String neighborhood,
        String stationName,
        String taxId,
        String brand,
        Product product,
        BigDecimal salePrice,
        LocalDate collectionDate
) {
    /** Digits kept after the decimal point of a sale price. */
    public static final int PRICE_SCALE = 4;
    /** Total digits of a sale price. */
    public static final int PRICE_PRECISION = 12;

    public FuelSale {
        Objects.requireNonNull(region);
        Objects.requireNonNull(stateCode);
        Objects.requireNonNull(municipality);
        Objects.requireNonNull(neighborhood);
        Objects.requireNonNull(stationName);
        Objects.requireNonNull(taxId);
        Objects.requireNonNull(brand);
        Objects.requireNonNull(product);
        Objects.requireNonNull(salePrice);
        Objects.requireNonNull(collectionDate);
    }
}
