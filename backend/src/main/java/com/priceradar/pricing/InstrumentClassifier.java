package com.priceradar.pricing;

import com.priceradar.common.SymbolNormalizer;
import com.priceradar.domain.InstrumentCategory;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Maps (identifier, currency, asset-type hint) to an {@link InstrumentCategory}. Total and side-effect free.
 * <p>
 * Rules are evaluated in a fixed order and the first match wins: exchange prefix, six-digit domestic code,
 * Stock Connect code, Hong Kong, gold marker, cash marker, US, bond marker, unknown.
 * Unmatched six-digit CNY codes default to {@code etf}: most of them are thinly traded OTC funds.
 */
public final class InstrumentClassifier {

    public static final String DOMESTIC_CURRENCY = "CNY";
    public static final String HK_CURRENCY = "HKD";
    public static final String US_CURRENCY = "USD";
    public static final String CASH_MARKER = "CASH";

    private static final Pattern SIX_DIGIT = Pattern.compile("^\\d{6}$");
    private static final Pattern HK_CONNECT = Pattern.compile("^H\\d{5}$");
    private static final Pattern HK_STOCK = Pattern.compile("^0\\d{4}$");
    private static final Pattern ALL_LETTERS = Pattern.compile("^[A-Z]+$");

    /** Shenzhen main/SME (000-003), ChiNext (300, 301), Shanghai main (600-605), STAR (688, 689). */
    private static final List<String> A_SHARE_PREFIXES = List.of(
            "000", "001", "002", "003",
            "300", "301",
            "600", "601", "603", "605",
            "688", "689");

    /** Shanghai ETF/LOF (510, 513, 588, 501, 502), Shenzhen ETF (159) and LOF (160-166). */
    private static final List<String> ETF_LOF_PREFIXES = List.of(
            "510", "513", "588", "501", "502",
            "159", "160", "161", "162", "163", "164", "165", "166");

    private static final List<String> GOLD_MARKERS = List.of("AU", "GOLD");
    private static final String BOND_MARKER = "BOND";

    private InstrumentClassifier() {}

    public static InstrumentCategory classify(String symbol, String currency, String assetHint) {
        String code = SymbolNormalizer.symbol(symbol);
        String ccy = SymbolNormalizer.currency(currency);
        String hint = SymbolNormalizer.assetHint(assetHint);

        if (code.startsWith("SH") || code.startsWith("SZ")) {
            return InstrumentCategory.A_SHARE;
        }
        if (DOMESTIC_CURRENCY.equals(ccy) && SIX_DIGIT.matcher(code).matches()) {
            return classifyDomesticSixDigit(code, hint);
        }
        if (HK_CONNECT.matcher(code).matches()) {
            return InstrumentCategory.HK_CONNECT;
        }
        if (HK_CURRENCY.equals(ccy) || HK_STOCK.matcher(code).matches()) {
            return InstrumentCategory.HK_STOCK;
        }
        if (GOLD_MARKERS.stream().anyMatch(code::contains)) {
            return InstrumentCategory.GOLD;
        }
        if (CASH_MARKER.equals(code)) {
            return InstrumentCategory.CASH;
        }
        if (US_CURRENCY.equals(ccy) || ALL_LETTERS.matcher(code).matches()) {
            return InstrumentCategory.US_STOCK;
        }
        if (code.contains(BOND_MARKER)) {
            return InstrumentCategory.BOND;
        }
        return InstrumentCategory.UNKNOWN;
    }

    public static InstrumentCategory classify(PriceQuery query) {
        return classify(query.symbol(), query.currency(), query.assetHint());
    }

    static boolean isAShareCode(String code) {
        return hasAnyPrefix(code, A_SHARE_PREFIXES);
    }

    static boolean isEtfLofCode(String code) {
        return hasAnyPrefix(code, ETF_LOF_PREFIXES);
    }

    private static InstrumentCategory classifyDomesticSixDigit(String code, String hint) {
        if ("etf".equals(hint) || "fund".equals(hint)) {
            return InstrumentCategory.ETF;
        }
        if (isEtfLofCode(code)) {
            return InstrumentCategory.ETF;
        }
        if (isAShareCode(code)) {
            return InstrumentCategory.A_SHARE;
        }
        return InstrumentCategory.ETF;
    }

    private static boolean hasAnyPrefix(String code, List<String> prefixes) {
        for (String p : prefixes) {
            if (code.startsWith(p)) {
                return true;
            }
        }
        return false;
    }
}
