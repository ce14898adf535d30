package com.priceradar.pricing;

import com.priceradar.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class PriceCacheTest {

    private MutableClock clock;
    private PriceCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-02T01:30:00Z"));
        cache = new PriceCache(Duration.ofSeconds(30), clock);
    }

    @Test
    @DisplayName("entry is served until exactly TTL old, then ignored")
    void entryExpiresAfterTtl() {
        PriceQuery query = PriceQuery.of("AAPL", "USD", "stock");
        cache.put(query, new BigDecimal("189.5"), "Yahoo Finance");

        clock.advance(Duration.ofSeconds(30));
        assertThat(cache.get(query)).hasValueSatisfying(e -> {
            assertThat(e.price()).isEqualByComparingTo("189.5");
            assertThat(e.providerName()).isEqualTo("Yahoo Finance");
        });

        clock.advance(Duration.ofMillis(1));
        assertThat(cache.get(query)).isEmpty();
    }

    @Test
    @DisplayName("asset hint is part of the key")
    void hintIsPartOfKey() {
        cache.put(PriceQuery.of("600000", "CNY", "stock"), new BigDecimal("10"), "Eastmoney");

        assertThat(cache.get(PriceQuery.of("600000", "CNY", "fund"))).isEmpty();
        assertThat(cache.get(PriceQuery.of("600000", "cny", ""))).isPresent();
    }

    @Test
    @DisplayName("put overwrites a stale entry and restarts its age")
    void overwriteRestartsAge() {
        PriceQuery query = PriceQuery.of("AAPL", "USD", "");
        cache.put(query, new BigDecimal("100"), "Yahoo Finance");
        clock.advance(Duration.ofMinutes(5));
        cache.put(query, new BigDecimal("101"), "Sina Finance");

        assertThat(cache.get(query)).hasValueSatisfying(e -> {
            assertThat(e.price()).isEqualByComparingTo("101");
            assertThat(e.observedAt()).isEqualTo(clock.instant());
        });
    }
}
