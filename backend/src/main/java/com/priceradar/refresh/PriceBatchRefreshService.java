package com.priceradar.refresh;

import com.priceradar.common.SymbolNormalizer;
import com.priceradar.pricing.PriceResolutionResult;
import com.priceradar.pricing.config.PricingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Refreshes every stale, auto-updating symbol of a currency on a bounded worker pool
 * (at most maxWorkers threads, never more than jobs). Blocks until every job has finished.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PriceBatchRefreshService {

    static final int DEFAULT_MAX_WORKERS = 4;
    static final Duration DEFAULT_RECENT_THRESHOLD = Duration.ofMinutes(5);

    private final PriceStore priceStore;
    private final PriceUpdateService priceUpdateService;
    private final PricingProperties pricingProperties;
    private final Clock clock;

    /**
     * @throws PriceRefreshException CURRENCY_NOT_FOUND when the currency has no holdings
     */
    public BatchRefreshResult refreshAll(String currency) {
        String ccy = SymbolNormalizer.currency(currency);
        List<RefreshableSymbol> holdings = priceStore.listRefreshableSymbols(ccy);
        if (holdings.isEmpty()) {
            throw new PriceRefreshException(PriceRefreshException.CURRENCY_NOT_FOUND, "currency not found: " + ccy);
        }
        List<RefreshableSymbol> jobs = selectJobs(holdings, clock.instant());
        if (jobs.isEmpty()) {
            log.debug("No stale symbols to refresh for {}", ccy);
            return new BatchRefreshResult(0, List.of());
        }

        int workers = Math.min(maxWorkers(), jobs.size());
        log.info("Refreshing {} of {} symbols for {} with {} workers", jobs.size(), holdings.size(), ccy, workers);
        ExecutorService pool = Executors.newFixedThreadPool(workers, new CustomizableThreadFactory("price-refresh-"));
        try {
            List<CompletableFuture<Optional<String>>> futures = new ArrayList<>(jobs.size());
            for (RefreshableSymbol job : jobs) {
                futures.add(CompletableFuture.supplyAsync(() -> refreshOne(job, ccy), pool));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

            List<String> errors = new ArrayList<>();
            for (CompletableFuture<Optional<String>> future : futures) {
                future.join().ifPresent(errors::add);
            }
            int updated = jobs.size() - errors.size();
            log.info("Refresh for {} done: {} updated, {} failed", ccy, updated, errors.size());
            return new BatchRefreshResult(updated, errors);
        } finally {
            pool.shutdown();
        }
    }

    List<RefreshableSymbol> selectJobs(List<RefreshableSymbol> holdings, Instant now) {
        Instant recentCutoff = now.minus(recentThreshold());
        List<RefreshableSymbol> jobs = new ArrayList<>();
        for (RefreshableSymbol holding : holdings) {
            if (!holding.autoUpdate()) {
                continue;
            }
            Instant last = holding.lastPriceUpdatedAt();
            if (last != null && last.isAfter(recentCutoff)) {
                continue;
            }
            jobs.add(holding);
        }
        return jobs;
    }

    /** Empty on success, otherwise the "symbol: message" error note. */
    private Optional<String> refreshOne(RefreshableSymbol job, String currency) {
        try {
            PriceResolutionResult result = priceUpdateService.updatePrice(job.symbol(), currency, job.assetType());
            if (result.isResolved()) {
                return Optional.empty();
            }
            log.warn("Refresh failed for {} {}: {}", job.symbol(), currency, result.getMessage());
            return Optional.of(job.symbol() + ": " + result.getMessage());
        } catch (RuntimeException e) {
            log.warn("Refresh failed for {} {}", job.symbol(), currency, e);
            return Optional.of(job.symbol() + ": " + e.getMessage());
        }
    }

    private int maxWorkers() {
        int configured = pricingProperties.getRefresh().getMaxWorkers();
        return configured > 0 ? configured : DEFAULT_MAX_WORKERS;
    }

    private Duration recentThreshold() {
        Duration configured = pricingProperties.getRefresh().getRecentThreshold();
        return configured == null || configured.isNegative() || configured.isZero()
                ? DEFAULT_RECENT_THRESHOLD
                : configured;
    }
}
