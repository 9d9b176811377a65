package io.fuelpipelines.fuel;

import java.math.BigDecimal;

public record StateAverage(String stateCode, BigDecimal avgPrice) {}
