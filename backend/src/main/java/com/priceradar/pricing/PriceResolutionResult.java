package com.priceradar.pricing;

import lombok.Getter;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Result of one price resolution: a price plus status message on success, or a message and per-provider notes on failure.
 * The message is always suitable for display.
 */
@Getter
public class PriceResolutionResult {

    public enum Outcome {
        RESOLVED,
        CACHED,
        CASH,
        INVALID_SYMBOL,
        UNSUPPORTED_INSTRUMENT,
        ALL_PROVIDERS_FAILED;

        public boolean isSuccess() {
            return this == RESOLVED || this == CACHED || this == CASH;
        }
    }

    private static final String FAILURE_PREFIX = "Price fetch failed: ";
    private static final String NO_PROVIDER_AVAILABLE = "all data sources unavailable";

    private final Outcome outcome;
    private final BigDecimal price;
    private final String providerName;
    private final String message;
    private final List<ProviderNote> notes;

    private PriceResolutionResult(Outcome outcome, BigDecimal price, String providerName, String message,
                                  List<ProviderNote> notes) {
        this.outcome = outcome;
        this.price = price;
        this.providerName = providerName;
        this.message = message;
        this.notes = List.copyOf(notes);
    }

    public static PriceResolutionResult resolved(BigDecimal price, String providerName, List<ProviderNote> notes) {
        return new PriceResolutionResult(Outcome.RESOLVED, price, providerName,
                "Price fetched (source: " + providerName + ")", notes);
    }

    public static PriceResolutionResult cached(BigDecimal price, String providerName) {
        return new PriceResolutionResult(Outcome.CACHED, price, providerName,
                "Price fetched (cached, source: " + providerName + ")", List.of());
    }

    public static PriceResolutionResult cash() {
        return new PriceResolutionResult(Outcome.CASH, BigDecimal.ONE, null, "Cash price is fixed at 1.0", List.of());
    }

    public static PriceResolutionResult invalidSymbol(String symbol) {
        return new PriceResolutionResult(Outcome.INVALID_SYMBOL, null, null,
                "Unrecognized instrument: " + symbol, List.of());
    }

    public static PriceResolutionResult unsupportedBond() {
        return new PriceResolutionResult(Outcome.UNSUPPORTED_INSTRUMENT, null, null,
                "Bond prices are not supported for automatic fetching", List.of());
    }

    /**
     * Aggregated failure; the message embeds every note in attempt order.
     */
    public static PriceResolutionResult allProvidersFailed(List<ProviderNote> notes) {
        String joined = notes.isEmpty()
                ? NO_PROVIDER_AVAILABLE
                : notes.stream().map(ProviderNote::render).collect(Collectors.joining("; "));
        return new PriceResolutionResult(Outcome.ALL_PROVIDERS_FAILED, null, null, FAILURE_PREFIX + joined, notes);
    }

    public boolean isResolved() {
        return outcome.isSuccess() && price != null;
    }

    public Optional<BigDecimal> getPrice() {
        return Optional.ofNullable(price);
    }

    public Optional<String> getProviderName() {
        return Optional.ofNullable(providerName);
    }
}
