package com.priceradar.pricing.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Price resolution configuration. Documented in application.yml under priceradar.pricing.
 * Non-positive values fall back to the defaults below.
 */
@ConfigurationProperties(prefix = "priceradar.pricing")
@Getter
@Setter
public class PricingProperties {

    /** Hard upper bound for any provider response body (1 MiB). */
    public static final int MAX_RESPONSE_BYTES_LIMIT = 1 << 20;

    static final Duration DEFAULT_CACHE_TTL = Duration.ofSeconds(30);
    static final int DEFAULT_FAIL_THRESHOLD = 3;
    static final Duration DEFAULT_FAIL_WINDOW = Duration.ofSeconds(60);
    static final Duration DEFAULT_COOLDOWN = Duration.ofSeconds(120);
    static final Duration DEFAULT_HTTP_TIMEOUT = Duration.ofSeconds(10);
    static final BigDecimal DEFAULT_USD_TO_CNY = new BigDecimal("7.2");
    static final BigDecimal DEFAULT_HKD_TO_CNY = new BigDecimal("0.92");

    /** How long a fetched price is served from the in-process cache. */
    private Duration cacheTtl = DEFAULT_CACHE_TTL;

    /** Failures within failWindow that open a provider's circuit. */
    private int failThreshold = DEFAULT_FAIL_THRESHOLD;

    private Duration failWindow = DEFAULT_FAIL_WINDOW;

    /** How long an open circuit skips the provider. */
    private Duration cooldown = DEFAULT_COOLDOWN;

    /** Deadline of one outbound provider request. */
    private Duration httpTimeout = DEFAULT_HTTP_TIMEOUT;

    /** Response body cap in bytes; clamped to {@link #MAX_RESPONSE_BYTES_LIMIT}. */
    private int maxResponseBytes = MAX_RESPONSE_BYTES_LIMIT;

    /**
     * Local per-host request budget (requests per second) in front of the public quote endpoints.
     */
    private int providerRequestsPerSecond = 10;

    /** How long a request may wait for a local rate-limit permit before counting as a transport failure. */
    private Duration limiterTimeout = Duration.ofSeconds(2);

    /** Fallback USD→CNY rate when no maintained rate exists. */
    private BigDecimal usdToCnyRate = DEFAULT_USD_TO_CNY;

    /** Fallback HKD→CNY rate when no maintained rate exists. */
    private BigDecimal hkdToCnyRate = DEFAULT_HKD_TO_CNY;

    private RefreshProperties refresh = new RefreshProperties();

    private FxProperties fx = new FxProperties();

    public Duration effectiveCacheTtl() {
        return positiveOr(cacheTtl, DEFAULT_CACHE_TTL);
    }

    public int effectiveFailThreshold() {
        return failThreshold > 0 ? failThreshold : DEFAULT_FAIL_THRESHOLD;
    }

    public Duration effectiveFailWindow() {
        return positiveOr(failWindow, DEFAULT_FAIL_WINDOW);
    }

    public Duration effectiveCooldown() {
        return positiveOr(cooldown, DEFAULT_COOLDOWN);
    }

    public Duration effectiveHttpTimeout() {
        return positiveOr(httpTimeout, DEFAULT_HTTP_TIMEOUT);
    }

    public int effectiveMaxResponseBytes() {
        if (maxResponseBytes <= 0) {
            return MAX_RESPONSE_BYTES_LIMIT;
        }
        return Math.min(maxResponseBytes, MAX_RESPONSE_BYTES_LIMIT);
    }

    public BigDecimal effectiveUsdToCnyRate() {
        return positiveOr(usdToCnyRate, DEFAULT_USD_TO_CNY);
    }

    public BigDecimal effectiveHkdToCnyRate() {
        return positiveOr(hkdToCnyRate, DEFAULT_HKD_TO_CNY);
    }

    private static Duration positiveOr(Duration value, Duration fallback) {
        return value == null || value.isZero() || value.isNegative() ? fallback : value;
    }

    private static BigDecimal positiveOr(BigDecimal value, BigDecimal fallback) {
        return value == null || value.signum() <= 0 ? fallback : value;
    }

    @Getter
    @Setter
    public static class RefreshProperties {
        /** Symbols priced more recently than this are skipped by batch refresh. */
        private Duration recentThreshold = Duration.ofMinutes(5);
        /** Upper bound of concurrent batch workers; never more workers than jobs. */
        private int maxWorkers = 4;
        /** Enables PriceRefreshJob. */
        private boolean scheduledEnabled = false;
        /** Period of PriceRefreshJob in milliseconds. */
        private long intervalMs = 600_000L;
        /** Currencies refreshed by PriceRefreshJob. */
        private List<String> currencies = new ArrayList<>(List.of("CNY", "USD", "HKD"));
    }

    @Getter
    @Setter
    public static class FxProperties {
        private String frankfurterBaseUrl = "https://api.frankfurter.app";
        private String openErApiBaseUrl = "https://open.er-api.com/v6";
        /** How long a maintained rate read from storage is reused before re-reading. */
        private Duration rateCacheTtl = Duration.ofSeconds(60);
    }
}
