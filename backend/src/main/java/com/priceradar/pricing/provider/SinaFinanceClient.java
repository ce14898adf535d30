package com.priceradar.pricing.provider;

import com.priceradar.common.SymbolNormalizer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriUtils;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Sina hq API: {@code var hq_str_xxx="f0,f1,f2,...";}. Price field index differs by market.
 * Requests without the Sina referer are rejected.
 */
@Component
@RequiredArgsConstructor
public class SinaFinanceClient {

    static final String QUOTE_URL = "http://hq.sinajs.cn/list=%s";
    static final int A_SHARE_PRICE_FIELD = 3;
    static final int HK_PRICE_FIELD = 6;
    static final int US_PRICE_FIELD = 1;

    private static final Map<String, String> HEADERS = Map.of(
            "User-Agent", QuoteHttpClient.BROWSER_USER_AGENT,
            "Referer", "http://finance.sina.com.cn");

    private final QuoteHttpClient httpClient;

    public Optional<BigDecimal> fetchAShare(String symbol) {
        MarketCodes.ExchangeCode exchangeCode = MarketCodes.exchangeCode(symbol);
        String body = httpClient.get(quoteUrl(exchangeCode.exchange() + exchangeCode.code()), HEADERS);
        return parseField(body, A_SHARE_PRICE_FIELD);
    }

    public Optional<BigDecimal> fetchHkStock(String symbol) {
        String body = httpClient.get(quoteUrl("hk" + MarketCodes.hkCode(symbol)), HEADERS);
        return parseField(body, HK_PRICE_FIELD);
    }

    public Optional<BigDecimal> fetchUsStock(String symbol) {
        String code = SymbolNormalizer.symbol(symbol).toLowerCase(Locale.ROOT);
        String body = httpClient.get(quoteUrl("gb_" + code), HEADERS);
        return parseField(body, US_PRICE_FIELD);
    }

    private static String quoteUrl(String listCode) {
        return String.format(QUOTE_URL, UriUtils.encodeQueryParam(listCode, StandardCharsets.UTF_8));
    }

    static Optional<BigDecimal> parseField(String body, int index) {
        int marker = body.indexOf("=\"");
        if (marker == -1) {
            return Optional.empty();
        }
        String[] fields = body.substring(marker + 2).split(",");
        return QuoteValues.field(fields, index);
    }
}
