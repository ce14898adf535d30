package com.priceradar.pricing.provider;

import com.priceradar.common.SymbolNormalizer;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Identifier rewrites shared by the quote adapters (exchange prefixes, padding, Yahoo tickers).
 */
final class MarketCodes {

    private static final Pattern SIX_DIGIT = Pattern.compile("^\\d{6}$");

    private MarketCodes() {}

    /** Exchange-qualified domestic code: lowercase "sh"/"sz" plus the six digits. */
    record ExchangeCode(String exchange, String code) {

        boolean isShanghai() {
            return "sh".equals(exchange);
        }
    }

    /**
     * Splits an explicit SH/SZ prefix, otherwise infers the exchange from the leading digit
     * (5, 6 and 9 list in Shanghai; the rest in Shenzhen).
     */
    static ExchangeCode exchangeCode(String symbol) {
        String code = SymbolNormalizer.symbol(symbol);
        if (code.startsWith("SH") || code.startsWith("SZ")) {
            return new ExchangeCode(code.substring(0, 2).toLowerCase(Locale.ROOT), code.substring(2));
        }
        boolean shanghai = code.startsWith("5") || code.startsWith("6") || code.startsWith("9");
        return new ExchangeCode(shanghai ? "sh" : "sz", code);
    }

    static boolean isSixDigit(String code) {
        return code != null && SIX_DIGIT.matcher(code).matches();
    }

    /** Hong Kong code left-padded with zeros to five digits. */
    static String hkCode(String symbol) {
        return leftPad(SymbolNormalizer.symbol(symbol), 5);
    }

    /**
     * Yahoo chart ticker: 600000 → 600000.SS, 000001 → 000001.SZ, 700 (HKD) → 0700.HK, US tickers unchanged.
     * Returns empty string when no ticker can be built.
     */
    static String yahooSymbol(String symbol, String currency) {
        String code = SymbolNormalizer.symbol(symbol);
        String ccy = SymbolNormalizer.currency(currency);
        if ("CNY".equals(ccy)) {
            if (code.startsWith("SH") || code.startsWith("SZ")) {
                code = code.substring(2);
            }
            if (code.startsWith("6")) {
                return code + ".SS";
            }
            if (isSixDigit(code)) {
                return code + ".SZ";
            }
        }
        if ("HKD".equals(ccy)) {
            if (code.startsWith("HK")) {
                code = code.substring(2);
            }
            if (code.length() > 4 && code.startsWith("0")) {
                code = code.substring(code.length() - 4);
            }
            return leftPad(code, 4) + ".HK";
        }
        return code;
    }

    private static String leftPad(String code, int width) {
        if (code.length() >= width) {
            return code;
        }
        return "0".repeat(width - code.length()) + code;
    }
}
