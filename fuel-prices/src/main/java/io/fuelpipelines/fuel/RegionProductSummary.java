package io.fuelpipelines.fuel;

import java.math.BigDecimal;

/** Stations surveyed and average price of one product within one region. */
public record RegionProductSummary(String region, String product, long stations, BigDecimal avgPrice) {}
