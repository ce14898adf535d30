package com.priceradar.pricing.fx;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.priceradar.domain.ExchangeRate;
import com.priceradar.domain.ExchangeRateRepository;
import com.priceradar.pricing.config.PricingProperties;
import com.priceradar.pricing.provider.QuoteFetchException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ExchangeRateServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-02T01:30:00Z");

    @Mock
    ExchangeRateRepository repository;
    @Mock
    ExchangeRateFeedClient feedClient;

    private ExchangeRateService service;

    @BeforeEach
    void setUp() {
        service = new ExchangeRateService(repository, feedClient, new PricingProperties(),
                Clock.fixed(NOW, ZoneOffset.UTC), Caffeine.newBuilder().<String, BigDecimal>build());
    }

    private static ExchangeRate rate(String from, String value) {
        ExchangeRate r = new ExchangeRate();
        r.setFromCurrency(from);
        r.setToCurrency("CNY");
        r.setRate(new BigDecimal(value));
        r.setSource(ExchangeRate.SOURCE_MANUAL);
        return r;
    }

    @Test
    @DisplayName("CNY converts at 1 without a lookup")
    void cnyIsOne() {
        assertThat(service.rateToCny("cny")).isEqualByComparingTo("1");
        verifyNoInteractions(repository);
    }

    @Test
    @DisplayName("maintained rate is used and cached")
    void maintainedRateCached() {
        when(repository.findByFromCurrencyAndToCurrency("USD", "CNY")).thenReturn(Optional.of(rate("USD", "7.13")));

        assertThat(service.rateToCny("USD")).isEqualByComparingTo("7.13");
        assertThat(service.rateToCny("usd")).isEqualByComparingTo("7.13");
        verify(repository, times(1)).findByFromCurrencyAndToCurrency("USD", "CNY");
    }

    @Test
    @DisplayName("missing maintained rate falls back to the configured default")
    void fallsBackToDefault() {
        when(repository.findByFromCurrencyAndToCurrency("HKD", "CNY")).thenReturn(Optional.empty());

        assertThat(service.rateToCny("HKD")).isEqualByComparingTo("0.92");
    }

    @Test
    @DisplayName("unsupported currency is rejected")
    void unsupportedCurrency() {
        assertThatThrownBy(() -> service.rateToCny("EUR")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("setRate validates the pair and the rate")
    void setRateValidation() {
        assertThatThrownBy(() -> service.setRate("EUR", "CNY", BigDecimal.ONE, null))
                .hasMessage("invalid from_currency: EUR");
        assertThatThrownBy(() -> service.setRate("USD", "HKD", BigDecimal.ONE, null))
                .hasMessage("invalid to_currency: HKD");
        assertThatThrownBy(() -> service.setRate("USD", "CNY", BigDecimal.ZERO, null))
                .hasMessage("rate must be greater than 0");
        verifyNoInteractions(repository);
    }

    @Test
    @DisplayName("setRate upserts, defaults the source to manual and invalidates the cached rate")
    void setRateUpserts() {
        ExchangeRate existing = rate("USD", "7.10");
        when(repository.findByFromCurrencyAndToCurrency("USD", "CNY")).thenReturn(Optional.of(existing));
        when(repository.save(any(ExchangeRate.class))).thenAnswer(inv -> inv.getArgument(0));

        assertThat(service.rateToCny("USD")).isEqualByComparingTo("7.10");
        ExchangeRate saved = service.setRate("usd", "cny", new BigDecimal("7.25"), " ");

        assertThat(saved).isSameAs(existing);
        assertThat(saved.getSource()).isEqualTo("manual");
        assertThat(saved.getUpdatedAt()).isEqualTo(NOW);
        assertThat(service.rateToCny("USD")).isEqualByComparingTo("7.25");
    }

    @Test
    @DisplayName("refreshRates stores fetched rates as auto_fetch and reports failed pairs")
    void refreshRates() {
        when(feedClient.fetchRate("USD", "CNY")).thenReturn(new BigDecimal("7.19"));
        when(feedClient.fetchRate("HKD", "CNY"))
                .thenThrow(new QuoteFetchException(QuoteFetchException.Kind.TRANSPORT, "all providers failed (x)"));
        when(repository.findByFromCurrencyAndToCurrency("USD", "CNY")).thenReturn(Optional.empty());
        when(repository.save(any(ExchangeRate.class))).thenAnswer(inv -> inv.getArgument(0));

        ExchangeRateService.RefreshResult result = service.refreshRates();

        assertThat(result.updated()).isEqualTo(1);
        assertThat(result.errors()).containsExactly("HKD/CNY: all providers failed (x)");
        ArgumentCaptor<ExchangeRate> captor = ArgumentCaptor.forClass(ExchangeRate.class);
        verify(repository).save(captor.capture());
        assertThat(captor.getValue().getSource()).isEqualTo(ExchangeRate.SOURCE_AUTO_FETCH);
        assertThat(captor.getValue().getRate()).isEqualByComparingTo("7.19");
    }
}
