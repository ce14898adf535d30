package com.priceradar.pricing.provider;

import com.priceradar.common.SymbolNormalizer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriUtils;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;

/**
 * Tencent qt.gtimg.cn quote API: tilde-delimited flat text, field 3 is the last price for every market.
 */
@Component
@RequiredArgsConstructor
public class TencentFinanceClient {

    static final String QUOTE_URL = "http://qt.gtimg.cn/q=%s";
    static final int PRICE_FIELD = 3;

    private static final Map<String, String> HEADERS = Map.of("User-Agent", QuoteHttpClient.BROWSER_USER_AGENT);

    private final QuoteHttpClient httpClient;

    public Optional<BigDecimal> fetchAShare(String symbol) {
        MarketCodes.ExchangeCode exchangeCode = MarketCodes.exchangeCode(symbol);
        return fetch(exchangeCode.exchange() + exchangeCode.code());
    }

    public Optional<BigDecimal> fetchHkStock(String symbol) {
        return fetch("hk" + MarketCodes.hkCode(symbol));
    }

    public Optional<BigDecimal> fetchUsStock(String symbol) {
        return fetch("us" + SymbolNormalizer.symbol(symbol));
    }

    private Optional<BigDecimal> fetch(String qualifiedCode) {
        String url = String.format(QUOTE_URL, UriUtils.encodeQueryParam(qualifiedCode, StandardCharsets.UTF_8));
        return parsePrice(httpClient.get(url, HEADERS));
    }

    static Optional<BigDecimal> parsePrice(String body) {
        return QuoteValues.field(body.split("~"), PRICE_FIELD);
    }
}
