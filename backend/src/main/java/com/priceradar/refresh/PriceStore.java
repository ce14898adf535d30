package com.priceradar.refresh;

import java.math.BigDecimal;
import java.util.List;

/**
 * Storage collaborator used by price updates. Implemented over MongoDB by
 * {@link com.priceradar.refresh.store.MongoPriceStore}.
 */
public interface PriceStore {

    /** Every held symbol in the currency, with its last price timestamp. */
    List<RefreshableSymbol> listRefreshableSymbols(String currency);

    /** Upsert the latest price for (symbol, currency). */
    void recordLatestPrice(String symbol, String currency, BigDecimal price);

    /** Best-effort audit append; implementations must not throw. */
    void appendOperationLog(OperationLogEntry entry);
}
