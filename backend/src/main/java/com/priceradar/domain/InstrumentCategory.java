package com.priceradar.domain;

/**
 * Instrument category derived from (identifier, currency, asset-type hint). Never stored; recomputed per resolution.
 */
public enum InstrumentCategory {
    A_SHARE("a_share"),
    ETF("etf"),
    HK_CONNECT("hk_connect"),
    HK_STOCK("hk_stock"),
    US_STOCK("us_stock"),
    GOLD("gold"),
    CASH("cash"),
    BOND("bond"),
    UNKNOWN("unknown");

    private final String code;

    InstrumentCategory(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
