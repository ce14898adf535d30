package com.priceradar.pricing;

import com.priceradar.common.SymbolNormalizer;

/**
 * Normalized (identifier, currency, asset-type hint) triple. Use {@link #of} so every field is canonical.
 */
public record PriceQuery(String symbol, String currency, String assetHint) {

    public static PriceQuery of(String symbol, String currency, String assetHint) {
        return new PriceQuery(
                SymbolNormalizer.symbol(symbol),
                SymbolNormalizer.currency(currency),
                SymbolNormalizer.assetHint(assetHint));
    }

    public String cacheKey() {
        return symbol + "|" + currency + "|" + assetHint;
    }
}
