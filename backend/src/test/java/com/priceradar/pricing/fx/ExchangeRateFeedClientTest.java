package com.priceradar.pricing.fx;

import com.priceradar.pricing.config.PricingProperties;
import com.priceradar.pricing.provider.QuoteFetchException;
import com.priceradar.pricing.provider.StubQuoteHttp;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExchangeRateFeedClientTest {

    private final PricingProperties properties = new PricingProperties();

    @Test
    @DisplayName("Frankfurter answer is used when present")
    void frankfurterFirst() {
        StubQuoteHttp stub = StubQuoteHttp.ok("{\"amount\":1.0,\"base\":\"USD\",\"rates\":{\"CNY\":7.1842}}");
        ExchangeRateFeedClient client = new ExchangeRateFeedClient(stub.client, properties);

        assertThat(client.fetchRate("USD", "CNY")).isEqualByComparingTo("7.1842");
        assertThat(stub.lastUrl()).isEqualTo("https://api.frankfurter.app/latest?from=USD&to=CNY");
        assertThat(stub.requests).hasSize(1);
    }

    @Test
    @DisplayName("falls back to open.er-api when Frankfurter fails")
    void fallsBackToOpenErApi() {
        StubQuoteHttp stub = new StubQuoteHttp(req -> "api.frankfurter.app".equals(req.url().getHost())
                ? StubQuoteHttp.response(HttpStatus.BAD_GATEWAY, "")
                : StubQuoteHttp.response(HttpStatus.OK,
                "{\"result\":\"success\",\"base_code\":\"HKD\",\"rates\":{\"CNY\":0.9213}}"));
        ExchangeRateFeedClient client = new ExchangeRateFeedClient(stub.client, properties);

        assertThat(client.fetchRate("HKD", "CNY")).isEqualByComparingTo("0.9213");
        assertThat(stub.lastUrl()).isEqualTo("https://open.er-api.com/v6/latest/HKD");
    }

    @Test
    @DisplayName("both feeds failing reports each error")
    void bothFail() {
        StubQuoteHttp stub = new StubQuoteHttp(req -> "api.frankfurter.app".equals(req.url().getHost())
                ? StubQuoteHttp.response(HttpStatus.OK, "{\"rates\":{}}")
                : StubQuoteHttp.response(HttpStatus.OK, "{\"result\":\"error\"}"));
        ExchangeRateFeedClient client = new ExchangeRateFeedClient(stub.client, properties);

        assertThatThrownBy(() -> client.fetchRate("USD", "CNY"))
                .isInstanceOf(QuoteFetchException.class)
                .hasMessage("all providers failed (frankfurter: rate missing in response; "
                        + "open_er_api: provider status: error)");
    }
}
