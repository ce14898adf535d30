package com.priceradar.refresh;

import java.time.Instant;

/**
 * A held symbol as seen by batch refresh. lastPriceUpdatedAt is null when the symbol has never been priced.
 */
public record RefreshableSymbol(String symbol, String assetType, boolean autoUpdate, Instant lastPriceUpdatedAt) {
}
