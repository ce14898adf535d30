package com.priceradar.pricing;

/**
 * Resolves the latest market price for a holding. Never throws for provider problems; failures are reported
 * in the returned result.
 */
public interface PriceResolver {

    PriceResolutionResult resolve(String symbol, String currency, String assetHint);
}
