package com.priceradar.pricing;

/**
 * Adapter call behind an attempt-chain entry.
 */
public enum QuoteSource {
    EASTMONEY_A_SHARE,
    EASTMONEY_HK_CONNECT,
    EASTMONEY_FUND_ESTIMATE,
    EASTMONEY_FUND_NET_WORTH,
    EASTMONEY_FUND_HISTORY,
    SINA_A_SHARE,
    SINA_HK_STOCK,
    SINA_US_STOCK,
    TENCENT_A_SHARE,
    TENCENT_HK_STOCK,
    TENCENT_US_STOCK,
    YAHOO_CHART,
    YAHOO_GOLD
}
