package com.priceradar.pricing.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.priceradar.pricing.PriceCache;
import com.priceradar.pricing.ProviderHealthTracker;
import com.priceradar.pricing.provider.QuoteHttpClient;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.netty.channel.ChannelOption;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;

/**
 * Pricing module configuration: properties, shared HTTP client, price cache, provider breaker and FX rate cache.
 */
@Configuration
@EnableConfigurationProperties(PricingProperties.class)
public class PricingConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public QuoteHttpClient quoteHttpClient(WebClient.Builder webClientBuilder, PricingProperties pricingProperties) {
        Duration timeout = pricingProperties.effectiveHttpTimeout();
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) timeout.toMillis())
                .responseTimeout(timeout);
        int rps = Math.max(1, pricingProperties.getProviderRequestsPerSecond());
        RateLimiterConfig limiterConfig = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(pricingProperties.getLimiterTimeout() == null
                        ? Duration.ZERO
                        : pricingProperties.getLimiterTimeout())
                .build();
        return new QuoteHttpClient(
                webClientBuilder.clone().clientConnector(new ReactorClientHttpConnector(httpClient)),
                timeout,
                pricingProperties.effectiveMaxResponseBytes(),
                limiterConfig);
    }

    @Bean
    public PriceCache priceCache(PricingProperties pricingProperties, Clock clock) {
        return new PriceCache(pricingProperties.effectiveCacheTtl(), clock);
    }

    @Bean
    public ProviderHealthTracker providerHealthTracker(PricingProperties pricingProperties, Clock clock) {
        return new ProviderHealthTracker(
                pricingProperties.effectiveFailThreshold(),
                pricingProperties.effectiveFailWindow(),
                pricingProperties.effectiveCooldown(),
                clock);
    }

    @Bean
    public Cache<String, BigDecimal> fxRateCache(PricingProperties pricingProperties) {
        return Caffeine.newBuilder()
                .expireAfterWrite(pricingProperties.getFx().getRateCacheTtl())
                .maximumSize(16)
                .build();
    }
}
