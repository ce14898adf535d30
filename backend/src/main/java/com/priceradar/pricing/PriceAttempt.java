package com.priceradar.pricing;

import com.priceradar.domain.InstrumentCategory;

/**
 * One entry of an attempt chain: which adapter call to make, for which code.
 * The provider name is also the circuit-breaker key. quoteCurrency is the currency the adapter reports in;
 * when convertToCny is set the fetched price is multiplied by the live quoteCurrency→CNY rate.
 */
public record PriceAttempt(String providerName, InstrumentCategory category, QuoteSource source, String code,
                           String quoteCurrency, boolean convertToCny) {

    public static PriceAttempt of(String providerName, InstrumentCategory category, QuoteSource source, String code,
                                  String quoteCurrency) {
        return new PriceAttempt(providerName, category, source, code, quoteCurrency, false);
    }

    /** Same call, result converted to CNY. */
    public PriceAttempt convertedToCny() {
        return new PriceAttempt(providerName, category, source, code, quoteCurrency, true);
    }
}
