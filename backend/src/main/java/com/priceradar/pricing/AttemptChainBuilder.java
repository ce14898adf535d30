package com.priceradar.pricing;

import com.priceradar.common.SymbolNormalizer;
import com.priceradar.domain.InstrumentCategory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Fixed, ordered provider list per instrument category. Pure mapping, no I/O. Bond, cash and unknown have no chain.
 */
@Component
public class AttemptChainBuilder {

    public static final String EASTMONEY = "Eastmoney";
    public static final String EASTMONEY_FUND = "Eastmoney Fund";
    public static final String EASTMONEY_FUND_ESTIMATE = "Eastmoney Fund GZ";
    public static final String EASTMONEY_FUND_NET_WORTH = "Eastmoney Fund PZ";
    public static final String EASTMONEY_FUND_HISTORY = "Eastmoney Fund LSJZ";
    public static final String EASTMONEY_HK_CONNECT = "Eastmoney HK Connect";
    public static final String TENCENT = "Tencent Finance";
    public static final String SINA = "Sina Finance";
    public static final String YAHOO = "Yahoo Finance";
    public static final String YAHOO_HK_CONNECT = "Yahoo Finance (HK Connect)";
    public static final String SINA_HK_CONNECT = "Sina Finance (HK Connect)";
    public static final String TENCENT_HK_CONNECT = "Tencent Finance (HK Connect)";

    private static final String HK_CURRENCY = "HKD";

    public List<PriceAttempt> buildChain(InstrumentCategory category, PriceQuery query) {
        String symbol = query.symbol();
        String currency = query.currency();
        return switch (category) {
            case A_SHARE -> aShareChain(symbol, currency, preferFunds(query.assetHint()));
            case ETF -> List.of(
                    PriceAttempt.of(EASTMONEY_FUND_ESTIMATE, category, QuoteSource.EASTMONEY_FUND_ESTIMATE, symbol, currency),
                    PriceAttempt.of(EASTMONEY_FUND_NET_WORTH, category, QuoteSource.EASTMONEY_FUND_NET_WORTH, symbol, currency),
                    PriceAttempt.of(EASTMONEY_FUND_HISTORY, category, QuoteSource.EASTMONEY_FUND_HISTORY, symbol, currency),
                    PriceAttempt.of(EASTMONEY, category, QuoteSource.EASTMONEY_A_SHARE, symbol, currency));
            case HK_CONNECT -> hkConnectChain(hkConnectCode(symbol));
            case HK_STOCK -> List.of(
                    PriceAttempt.of(YAHOO, category, QuoteSource.YAHOO_CHART, symbol, currency),
                    PriceAttempt.of(SINA, category, QuoteSource.SINA_HK_STOCK, symbol, currency),
                    PriceAttempt.of(TENCENT, category, QuoteSource.TENCENT_HK_STOCK, symbol, currency));
            case US_STOCK -> List.of(
                    PriceAttempt.of(YAHOO, category, QuoteSource.YAHOO_CHART, symbol, currency),
                    PriceAttempt.of(SINA, category, QuoteSource.SINA_US_STOCK, symbol, currency),
                    PriceAttempt.of(TENCENT, category, QuoteSource.TENCENT_US_STOCK, symbol, currency));
            case GOLD -> List.of(PriceAttempt.of(YAHOO, category, QuoteSource.YAHOO_GOLD, symbol, currency));
            case CASH, BOND, UNKNOWN -> List.of();
        };
    }

    private static List<PriceAttempt> aShareChain(String symbol, String currency, boolean preferFunds) {
        InstrumentCategory category = InstrumentCategory.A_SHARE;
        PriceAttempt eastmoney = PriceAttempt.of(EASTMONEY, category, QuoteSource.EASTMONEY_A_SHARE, symbol, currency);
        PriceAttempt tencent = PriceAttempt.of(TENCENT, category, QuoteSource.TENCENT_A_SHARE, symbol, currency);
        PriceAttempt sina = PriceAttempt.of(SINA, category, QuoteSource.SINA_A_SHARE, symbol, currency);
        PriceAttempt fund = PriceAttempt.of(EASTMONEY_FUND, category, QuoteSource.EASTMONEY_FUND_NET_WORTH, symbol, currency);
        PriceAttempt yahoo = PriceAttempt.of(YAHOO, category, QuoteSource.YAHOO_CHART, symbol, currency);
        return preferFunds
                ? List.of(fund, eastmoney, tencent, sina, yahoo)
                : List.of(eastmoney, tencent, sina, fund, yahoo);
    }

    /** Connect-market sources quote in HKD; every entry is converted to CNY. */
    private static List<PriceAttempt> hkConnectChain(String hkCode) {
        InstrumentCategory category = InstrumentCategory.HK_CONNECT;
        return List.of(
                PriceAttempt.of(EASTMONEY_HK_CONNECT, category, QuoteSource.EASTMONEY_HK_CONNECT, hkCode, HK_CURRENCY)
                        .convertedToCny(),
                PriceAttempt.of(YAHOO_HK_CONNECT, category, QuoteSource.YAHOO_CHART, hkCode, HK_CURRENCY)
                        .convertedToCny(),
                PriceAttempt.of(SINA_HK_CONNECT, category, QuoteSource.SINA_HK_STOCK, hkCode, HK_CURRENCY)
                        .convertedToCny(),
                PriceAttempt.of(TENCENT_HK_CONNECT, category, QuoteSource.TENCENT_HK_STOCK, hkCode, HK_CURRENCY)
                        .convertedToCny());
    }

    static boolean preferFunds(String assetHint) {
        return assetHint != null && !assetHint.isEmpty() && !SymbolNormalizer.DEFAULT_ASSET_HINT.equals(assetHint);
    }

    /** "H00700" → "00700". */
    static String hkConnectCode(String symbol) {
        return symbol.startsWith("H") ? symbol.substring(1) : symbol;
    }
}
