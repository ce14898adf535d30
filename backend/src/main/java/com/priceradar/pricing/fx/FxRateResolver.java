package com.priceradar.pricing.fx;

import java.math.BigDecimal;

/**
 * Resolves the rate converting one unit of a foreign currency into CNY.
 */
public interface FxRateResolver {

    /**
     * @return rate to CNY; 1 for CNY itself. Never null; implementations fall back to configured defaults.
     */
    BigDecimal rateToCny(String currency);
}
