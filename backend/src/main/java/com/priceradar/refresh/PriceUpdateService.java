package com.priceradar.refresh;

import com.priceradar.common.SymbolNormalizer;
import com.priceradar.domain.OperationType;
import com.priceradar.pricing.PriceResolutionResult;
import com.priceradar.pricing.PriceResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;

/**
 * Single-symbol price update and manual override. Both write the latest price and an operation log entry.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PriceUpdateService {

    static final String MANUAL_UPDATE_DETAILS = "Manual price update";

    private final PriceResolver priceResolver;
    private final PriceStore priceStore;

    /**
     * Resolve and store the latest price. Provider failures are returned in the result and logged as
     * PRICE_UPDATE_FAILED; storage failures propagate.
     */
    public PriceResolutionResult updatePrice(String symbol, String currency, String assetType) {
        String sym = SymbolNormalizer.symbol(symbol);
        String ccy = SymbolNormalizer.currency(currency);
        PriceResolutionResult result = priceResolver.resolve(sym, ccy, assetType);
        if (!result.isResolved()) {
            priceStore.appendOperationLog(new OperationLogEntry(
                    OperationType.PRICE_UPDATE_FAILED, sym, ccy, result.getMessage(), null));
            return result;
        }
        BigDecimal price = result.getPrice().orElseThrow();
        priceStore.recordLatestPrice(sym, ccy, price);
        priceStore.appendOperationLog(new OperationLogEntry(
                OperationType.PRICE_UPDATE, sym, ccy, result.getMessage(), price));
        return result;
    }

    /**
     * Store a user-entered price without consulting any provider.
     *
     * @throws PriceRefreshException INVALID_SYMBOL for a blank symbol, INVALID_PRICE for a non-positive price
     */
    public void applyManualOverride(String symbol, String currency, BigDecimal price) {
        String sym = SymbolNormalizer.symbol(symbol);
        String ccy = SymbolNormalizer.currency(currency);
        if (sym.isEmpty()) {
            throw new PriceRefreshException(PriceRefreshException.INVALID_SYMBOL, "symbol is required");
        }
        if (price == null || price.signum() <= 0) {
            throw new PriceRefreshException(PriceRefreshException.INVALID_PRICE, "price must be greater than 0");
        }
        priceStore.recordLatestPrice(sym, ccy, price);
        priceStore.appendOperationLog(new OperationLogEntry(
                OperationType.MANUAL_PRICE_UPDATE, sym, ccy, MANUAL_UPDATE_DETAILS, price));
        log.info("Manual price override {} {} = {}", sym, ccy, price);
    }
}
