package com.priceradar.pricing.provider;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;

/**
 * Eastmoney push2 quote API (field f43 = last price).
 * Domestic quotes come back scaled by 100 once above 1000; Stock Connect quotes are always scaled by 1000 (HKD).
 */
@Component
@RequiredArgsConstructor
public class EastmoneyQuoteClient {

    static final String QUOTE_URL =
            "http://push2.eastmoney.com/api/qt/stock/get?secid=%s.%s&fields=f43&ut=fa5fd1943c7b386f172d6893dbfba10b";
    static final BigDecimal SCALE_THRESHOLD = new BigDecimal("1000");
    private static final String HK_CONNECT_MARKET = "128";
    private static final Map<String, String> HEADERS = Map.of(
            "User-Agent", QuoteHttpClient.BROWSER_USER_AGENT,
            "Referer", "http://quote.eastmoney.com/");

    private final QuoteHttpClient httpClient;

    public Optional<BigDecimal> fetchAShare(String symbol) {
        MarketCodes.ExchangeCode exchangeCode = MarketCodes.exchangeCode(symbol);
        if (!MarketCodes.isSixDigit(exchangeCode.code())) {
            return Optional.empty();
        }
        String market = exchangeCode.isShanghai() ? "1" : "0";
        String body = httpClient.get(String.format(QUOTE_URL, market, exchangeCode.code()), HEADERS);
        return parseLastPrice(body).map(EastmoneyQuoteClient::descaleDomestic);
    }

    /**
     * Last price in HKD for a five-digit Hong Kong code.
     */
    public Optional<BigDecimal> fetchHkConnect(String hkCode) {
        String body = httpClient.get(String.format(QUOTE_URL, HK_CONNECT_MARKET, hkCode), HEADERS);
        return parseLastPrice(body).map(p -> p.movePointLeft(3));
    }

    static Optional<BigDecimal> parseLastPrice(String json) {
        JsonNode data = QuoteValues.readTree(json).path("data");
        if (!data.isObject()) {
            return Optional.empty();
        }
        return QuoteValues.number(data.get("f43"));
    }

    static BigDecimal descaleDomestic(BigDecimal raw) {
        return raw.compareTo(SCALE_THRESHOLD) > 0 ? raw.movePointLeft(2) : raw;
    }
}
