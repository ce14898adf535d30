package com.priceradar.pricing;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * TTL cache of the last fetched price per {@link PriceQuery#cacheKey()}, backed by Caffeine. An entry is fresh
 * while {@code now - observedAt <= ttl}; the cache ticker follows the injected clock.
 * Independent from {@link ProviderHealthTracker}.
 */
public class PriceCache {

    static final long MAXIMUM_SIZE = 10_000;

    /** Price, provider that produced it, and when it was observed. */
    public record CacheEntry(BigDecimal price, String providerName, Instant observedAt) {}

    private final Duration ttl;
    private final Clock clock;
    private final Cache<String, CacheEntry> entries;

    public PriceCache(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
        // Caffeine expires at age >= duration; one extra nano keeps an entry aged exactly ttl.
        this.entries = Caffeine.newBuilder()
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .expireAfterWrite(ttl.plusNanos(1))
                .maximumSize(MAXIMUM_SIZE)
                .build();
    }

    /**
     * Fresh entry for the key, or empty when absent or older than the TTL.
     */
    public Optional<CacheEntry> get(PriceQuery query) {
        return Optional.ofNullable(entries.getIfPresent(query.cacheKey()));
    }

    public void put(PriceQuery query, BigDecimal price, String providerName) {
        entries.put(query.cacheKey(), new CacheEntry(price, providerName, clock.instant()));
    }

    public Duration getTtl() {
        return ttl;
    }
}
