package com.priceradar.pricing.provider;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Eastmoney fund endpoints: intraday estimate (JSONP), net worth trend script, NAV history table.
 */
@Component
@RequiredArgsConstructor
public class EastmoneyFundClient {

    static final String ESTIMATE_URL = "http://fundgz.1234567.com.cn/js/%s.js";
    static final String NET_WORTH_URL = "http://fund.eastmoney.com/pingzhongdata/%s.js";
    static final String NAV_HISTORY_URL = "http://fund.eastmoney.com/f10/F10DataApi.aspx?type=lsjz&code=%s&page=1&per=1";

    private static final String NET_WORTH_MARKER = "var Data_netWorthTrend =";
    private static final Pattern NAV_CELL = Pattern.compile(
            "<td[^>]*>\\d{4}-\\d{2}-\\d{2}</td>\\s*<td[^>]*>([\\d.]+)</td>");
    private static final Map<String, String> HEADERS = Map.of(
            "User-Agent", QuoteHttpClient.BROWSER_USER_AGENT,
            "Referer", "http://fund.eastmoney.com/");

    private final QuoteHttpClient httpClient;

    /**
     * Intraday estimate {@code gsz}, falling back to last published NAV {@code dwjz}.
     */
    public Optional<BigDecimal> fetchEstimate(String code) {
        if (!MarketCodes.isSixDigit(code)) {
            return Optional.empty();
        }
        return parseEstimate(httpClient.get(String.format(ESTIMATE_URL, code), HEADERS));
    }

    public Optional<BigDecimal> fetchNetWorthTrend(String code) {
        if (!MarketCodes.isSixDigit(code)) {
            return Optional.empty();
        }
        return parseNetWorthTrend(httpClient.get(String.format(NET_WORTH_URL, code), HEADERS));
    }

    public Optional<BigDecimal> fetchNavHistory(String code) {
        if (!MarketCodes.isSixDigit(code)) {
            return Optional.empty();
        }
        return parseNavHistory(httpClient.get(String.format(NAV_HISTORY_URL, code), HEADERS));
    }

    static Optional<BigDecimal> parseEstimate(String text) {
        int start = text.indexOf('(');
        int end = text.lastIndexOf(')');
        if (start == -1 || end <= start) {
            return Optional.empty();
        }
        String json = text.substring(start + 1, end).strip();
        if (json.isEmpty()) {
            return Optional.empty();
        }
        JsonNode data = QuoteValues.readTree(json);
        Optional<BigDecimal> estimate = QuoteValues.number(data.get("gsz"));
        return estimate.isPresent() ? estimate : QuoteValues.number(data.get("dwjz"));
    }

    /**
     * Last point of {@code Data_netWorthTrend}: either {"x": ts, "y": nav, ...} or [ts, nav].
     */
    static Optional<BigDecimal> parseNetWorthTrend(String text) {
        int idx = text.indexOf(NET_WORTH_MARKER);
        if (idx == -1) {
            return Optional.empty();
        }
        int bracketStart = text.indexOf('[', idx);
        int bracketEnd = bracketStart == -1 ? -1 : text.indexOf("];", bracketStart);
        if (bracketStart == -1 || bracketEnd == -1) {
            return Optional.empty();
        }
        JsonNode points = QuoteValues.readTree(text.substring(bracketStart, bracketEnd + 1));
        if (!points.isArray() || points.isEmpty()) {
            return Optional.empty();
        }
        JsonNode last = points.get(points.size() - 1);
        if (last.isObject()) {
            return QuoteValues.number(last.get("y"));
        }
        if (last.isArray() && last.size() >= 2) {
            return QuoteValues.number(last.get(1));
        }
        return Optional.empty();
    }

    static Optional<BigDecimal> parseNavHistory(String html) {
        Matcher m = NAV_CELL.matcher(html);
        if (!m.find()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new BigDecimal(m.group(1)));
        } catch (NumberFormatException e) {
            throw QuoteFetchException.parse("invalid NAV cell '" + m.group(1) + "'", e);
        }
    }
}
