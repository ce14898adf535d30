package com.priceradar.pricing;

import com.priceradar.pricing.fx.FxRateResolver;
import com.priceradar.pricing.provider.EastmoneyFundClient;
import com.priceradar.pricing.provider.EastmoneyQuoteClient;
import com.priceradar.pricing.provider.SinaFinanceClient;
import com.priceradar.pricing.provider.TencentFinanceClient;
import com.priceradar.pricing.provider.YahooFinanceClient;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Runs one {@link PriceAttempt} against its adapter. Empty means the provider answered without a usable price;
 * transport and parse failures propagate as {@link com.priceradar.pricing.provider.QuoteFetchException}.
 */
@Component
@RequiredArgsConstructor
public class PriceAttemptExecutor {

    private final EastmoneyQuoteClient eastmoneyQuoteClient;
    private final EastmoneyFundClient eastmoneyFundClient;
    private final SinaFinanceClient sinaFinanceClient;
    private final TencentFinanceClient tencentFinanceClient;
    private final YahooFinanceClient yahooFinanceClient;
    private final FxRateResolver fxRateResolver;

    public Optional<BigDecimal> execute(PriceAttempt attempt) {
        Optional<BigDecimal> price = fetch(attempt);
        if (attempt.convertToCny()) {
            return price.map(p -> p.multiply(fxRateResolver.rateToCny(attempt.quoteCurrency())));
        }
        return price;
    }

    private Optional<BigDecimal> fetch(PriceAttempt attempt) {
        String code = attempt.code();
        return switch (attempt.source()) {
            case EASTMONEY_A_SHARE -> eastmoneyQuoteClient.fetchAShare(code);
            case EASTMONEY_HK_CONNECT -> eastmoneyQuoteClient.fetchHkConnect(code);
            case EASTMONEY_FUND_ESTIMATE -> eastmoneyFundClient.fetchEstimate(code);
            case EASTMONEY_FUND_NET_WORTH -> eastmoneyFundClient.fetchNetWorthTrend(code);
            case EASTMONEY_FUND_HISTORY -> eastmoneyFundClient.fetchNavHistory(code);
            case SINA_A_SHARE -> sinaFinanceClient.fetchAShare(code);
            case SINA_HK_STOCK -> sinaFinanceClient.fetchHkStock(code);
            case SINA_US_STOCK -> sinaFinanceClient.fetchUsStock(code);
            case TENCENT_A_SHARE -> tencentFinanceClient.fetchAShare(code);
            case TENCENT_HK_STOCK -> tencentFinanceClient.fetchHkStock(code);
            case TENCENT_US_STOCK -> tencentFinanceClient.fetchUsStock(code);
            case YAHOO_CHART -> yahooFinanceClient.fetchStock(code, attempt.quoteCurrency());
            case YAHOO_GOLD -> yahooFinanceClient.fetchGold();
        };
    }
}
