package com.priceradar.pricing.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.priceradar.pricing.fx.FxRateResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriUtils;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;

/**
 * Yahoo Finance v8 chart API. Gold uses the COMEX future (GC=F, USD per troy ounce) converted to CNY per gram.
 */
@Component
@RequiredArgsConstructor
public class YahooFinanceClient {

    static final String CHART_URL = "https://query1.finance.yahoo.com/v8/finance/chart/%s?interval=1d&range=1d";
    static final String GOLD_FUTURE = "GC=F";
    static final BigDecimal GRAMS_PER_TROY_OUNCE = new BigDecimal("31.1035");

    private static final Map<String, String> HEADERS = Map.of("User-Agent", QuoteHttpClient.BROWSER_USER_AGENT);

    private final QuoteHttpClient httpClient;
    private final FxRateResolver fxRateResolver;

    public Optional<BigDecimal> fetchStock(String symbol, String currency) {
        String ticker = MarketCodes.yahooSymbol(symbol, currency);
        if (ticker.isBlank()) {
            return Optional.empty();
        }
        String url = String.format(CHART_URL, UriUtils.encodePathSegment(ticker, StandardCharsets.UTF_8));
        return parseChartPrice(httpClient.get(url, HEADERS));
    }

    /**
     * Gold in CNY per gram, rounded to 2 decimals.
     */
    public Optional<BigDecimal> fetchGold() {
        return fetchStock(GOLD_FUTURE, "USD")
                .filter(perOunce -> perOunce.signum() > 0)
                .map(perOunce -> toCnyPerGram(perOunce, fxRateResolver.rateToCny("USD")));
    }

    static BigDecimal toCnyPerGram(BigDecimal usdPerOunce, BigDecimal usdToCny) {
        return usdPerOunce.multiply(usdToCny).divide(GRAMS_PER_TROY_OUNCE, 2, RoundingMode.HALF_UP);
    }

    /**
     * meta.regularMarketPrice when positive, otherwise the last close of the day's series.
     */
    static Optional<BigDecimal> parseChartPrice(String json) {
        JsonNode results = QuoteValues.readTree(json).path("chart").path("result");
        if (!results.isArray() || results.isEmpty()) {
            return Optional.empty();
        }
        JsonNode result = results.get(0);
        JsonNode regular = result.path("meta").path("regularMarketPrice");
        if (regular.isNumber() && regular.decimalValue().signum() > 0) {
            return Optional.of(regular.decimalValue());
        }
        JsonNode closes = result.path("indicators").path("quote").path(0).path("close");
        if (!closes.isArray() || closes.isEmpty()) {
            return Optional.empty();
        }
        return QuoteValues.number(closes.get(closes.size() - 1));
    }
}
