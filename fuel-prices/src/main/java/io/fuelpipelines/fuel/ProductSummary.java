package io.fuelpipelines.fuel;

import java.math.BigDecimal;

/** Price spread of one product over the whole table; prices rounded to cents. */
public record ProductSummary(String product, long samples, BigDecimal minPrice, BigDecimal avgPrice, BigDecimal maxPrice) {}
