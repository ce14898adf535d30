package com.priceradar.refresh.job;

import com.priceradar.pricing.config.PricingProperties;
import com.priceradar.refresh.BatchRefreshResult;
import com.priceradar.refresh.PriceBatchRefreshService;
import com.priceradar.refresh.PriceRefreshException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic batch refresh of every configured currency. Off unless priceradar.pricing.refresh.scheduled-enabled is set.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PriceRefreshJob {

    private final PriceBatchRefreshService batchRefreshService;
    private final PricingProperties pricingProperties;

    @Scheduled(
            fixedRateString = "${priceradar.pricing.refresh.interval-ms:600000}",
            initialDelayString = "${priceradar.pricing.refresh.interval-ms:600000}")
    public void runScheduled() {
        if (!pricingProperties.getRefresh().isScheduledEnabled()) {
            return;
        }
        for (String currency : pricingProperties.getRefresh().getCurrencies()) {
            try {
                BatchRefreshResult result = batchRefreshService.refreshAll(currency);
                if (result.errors().isEmpty()) {
                    log.info("Scheduled refresh {}: {} updated", currency, result.updatedCount());
                } else {
                    log.warn("Scheduled refresh {}: {} updated, errors {}", currency, result.updatedCount(),
                            result.errors());
                }
            } catch (PriceRefreshException e) {
                log.debug("Scheduled refresh {} skipped: {}", currency, e.getMessage());
            }
        }
    }
}
