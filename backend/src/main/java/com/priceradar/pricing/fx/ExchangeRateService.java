package com.priceradar.pricing.fx;

import com.github.benmanes.caffeine.cache.Cache;
import com.priceradar.common.SymbolNormalizer;
import com.priceradar.domain.ExchangeRate;
import com.priceradar.domain.ExchangeRateRepository;
import com.priceradar.pricing.config.PricingProperties;
import com.priceradar.pricing.provider.QuoteFetchException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Maintained USD/CNY and HKD/CNY rates. Serves as the live rate resolver for Stock Connect and gold conversion;
 * falls back to the configured default rate (with a warning) when no maintained rate is available.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExchangeRateService implements FxRateResolver {

    static final String TARGET_CURRENCY = "CNY";
    private static final Set<String> SUPPORTED_SOURCES = Set.of("USD", "HKD");

    private final ExchangeRateRepository exchangeRateRepository;
    private final ExchangeRateFeedClient feedClient;
    private final PricingProperties pricingProperties;
    private final Clock clock;
    private final Cache<String, BigDecimal> fxRateCache;

    /** Outcome of {@link #refreshRates()}: pairs updated and one note per failed pair. */
    public record RefreshResult(int updated, List<String> errors) {}

    @Override
    public BigDecimal rateToCny(String currency) {
        String ccy = SymbolNormalizer.currency(currency);
        if (TARGET_CURRENCY.equals(ccy)) {
            return BigDecimal.ONE;
        }
        if (!SUPPORTED_SOURCES.contains(ccy)) {
            throw new IllegalArgumentException("invalid from_currency: " + ccy);
        }
        BigDecimal maintained = fxRateCache.get(ccy, this::loadMaintainedRate);
        if (maintained != null) {
            return maintained;
        }
        BigDecimal fallback = "USD".equals(ccy)
                ? pricingProperties.effectiveUsdToCnyRate()
                : pricingProperties.effectiveHkdToCnyRate();
        log.warn("No maintained {}/CNY rate; using configured default {}", ccy, fallback);
        return fallback;
    }

    /**
     * Insert or update a maintained rate. Only USD→CNY and HKD→CNY are accepted.
     */
    public ExchangeRate setRate(String fromCurrency, String toCurrency, BigDecimal rate, String source) {
        String from = SymbolNormalizer.currency(fromCurrency);
        String to = SymbolNormalizer.currency(toCurrency);
        validatePair(from, to);
        if (rate == null || rate.signum() <= 0) {
            throw new IllegalArgumentException("rate must be greater than 0");
        }
        ExchangeRate entity = exchangeRateRepository.findByFromCurrencyAndToCurrency(from, to)
                .orElseGet(ExchangeRate::new);
        entity.setFromCurrency(from);
        entity.setToCurrency(to);
        entity.setRate(rate);
        entity.setSource(normalizeSource(source));
        entity.setUpdatedAt(clock.instant());
        ExchangeRate saved = exchangeRateRepository.save(entity);
        fxRateCache.invalidate(from);
        log.info("Exchange rate {}/{} set to {} ({})", from, to, rate, saved.getSource());
        return saved;
    }

    /**
     * Fetch USD/CNY and HKD/CNY from the online feeds and store them as auto_fetch rates.
     */
    public RefreshResult refreshRates() {
        int updated = 0;
        List<String> errors = new ArrayList<>();
        for (String from : List.of("USD", "HKD")) {
            try {
                BigDecimal rate = feedClient.fetchRate(from, TARGET_CURRENCY);
                setRate(from, TARGET_CURRENCY, rate, ExchangeRate.SOURCE_AUTO_FETCH);
                updated++;
            } catch (QuoteFetchException e) {
                errors.add(from + "/" + TARGET_CURRENCY + ": " + e.getMessage());
            }
        }
        return new RefreshResult(updated, errors);
    }

    private BigDecimal loadMaintainedRate(String fromCurrency) {
        try {
            return exchangeRateRepository.findByFromCurrencyAndToCurrency(fromCurrency, TARGET_CURRENCY)
                    .map(ExchangeRate::getRate)
                    .filter(r -> r.signum() > 0)
                    .orElse(null);
        } catch (DataAccessException e) {
            log.warn("Reading {}/CNY rate failed: {}", fromCurrency, e.getMessage());
            return null;
        }
    }

    private static void validatePair(String from, String to) {
        if (!TARGET_CURRENCY.equals(to)) {
            throw new IllegalArgumentException("invalid to_currency: " + to);
        }
        if (!SUPPORTED_SOURCES.contains(from)) {
            throw new IllegalArgumentException("invalid from_currency: " + from);
        }
    }

    private static String normalizeSource(String source) {
        if (source == null || source.isBlank()) {
            return ExchangeRate.SOURCE_MANUAL;
        }
        return source.strip().toLowerCase(Locale.ROOT);
    }
}
