package com.priceradar.refresh.store;

import com.priceradar.domain.HoldingSymbol;
import com.priceradar.domain.HoldingSymbolRepository;
import com.priceradar.domain.LatestPrice;
import com.priceradar.domain.LatestPriceRepository;
import com.priceradar.domain.OperationLog;
import com.priceradar.domain.OperationLogRepository;
import com.priceradar.refresh.OperationLogEntry;
import com.priceradar.refresh.PriceStore;
import com.priceradar.refresh.RefreshableSymbol;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link PriceStore} over holding_symbols, latest_prices and operation_logs.
 * Latest prices are upserted by (symbol, currency).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MongoPriceStore implements PriceStore {

    private final HoldingSymbolRepository holdingSymbolRepository;
    private final LatestPriceRepository latestPriceRepository;
    private final OperationLogRepository operationLogRepository;
    private final Clock clock;

    @Override
    public List<RefreshableSymbol> listRefreshableSymbols(String currency) {
        List<HoldingSymbol> holdings = holdingSymbolRepository.findByCurrency(currency);
        if (holdings.isEmpty()) {
            return List.of();
        }
        Map<String, Instant> lastUpdated = new HashMap<>();
        for (LatestPrice price : latestPriceRepository.findByCurrency(currency)) {
            lastUpdated.put(price.getSymbol(), price.getUpdatedAt());
        }
        return holdings.stream()
                .map(h -> new RefreshableSymbol(h.getSymbol(), h.getAssetType(), h.isAutoUpdate(),
                        lastUpdated.get(h.getSymbol())))
                .toList();
    }

    @Override
    public void recordLatestPrice(String symbol, String currency, BigDecimal price) {
        LatestPrice latest = latestPriceRepository.findBySymbolAndCurrency(symbol, currency)
                .orElseGet(() -> {
                    LatestPrice created = new LatestPrice();
                    created.setSymbol(symbol);
                    created.setCurrency(currency);
                    return created;
                });
        latest.setPrice(price);
        latest.setUpdatedAt(clock.instant());
        latestPriceRepository.save(latest);
    }

    @Override
    public void appendOperationLog(OperationLogEntry entry) {
        OperationLog logEntry = new OperationLog();
        logEntry.setOperationType(entry.operationType());
        logEntry.setSymbol(entry.symbol());
        logEntry.setCurrency(entry.currency());
        logEntry.setDetails(entry.details());
        logEntry.setPriceFetched(entry.priceFetched());
        logEntry.setCreatedAt(clock.instant());
        try {
            operationLogRepository.save(logEntry);
        } catch (DataAccessException e) {
            log.warn("Operation log append failed for {} {} ({}): {}",
                    entry.symbol(), entry.currency(), entry.operationType(), e.getMessage());
        }
    }
}
