package com.priceradar.pricing.provider;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SinaFinanceClientTest {

    @Test
    @DisplayName("A-share price is field 3 after the marker")
    void aShare() {
        StubQuoteHttp stub = StubQuoteHttp.ok("var hq_str_sh600000=\"PUFA,10.10,10.05,10.21,10.30,10.00\";");
        SinaFinanceClient client = new SinaFinanceClient(stub.client);

        assertThat(client.fetchAShare("600000")).hasValueSatisfying(p -> assertThat(p).isEqualByComparingTo("10.21"));
        assertThat(stub.lastUrl()).isEqualTo("http://hq.sinajs.cn/list=sh600000");
        assertThat(stub.requests.get(0).headers().getFirst("Referer")).isEqualTo("http://finance.sina.com.cn");
    }

    @Test
    @DisplayName("Hong Kong price is field 6 and the code is padded")
    void hkStock() {
        StubQuoteHttp stub = StubQuoteHttp.ok(
                "var hq_str_hk00700=\"TENCENT,TENCENT,380.0,381.0,386.0,379.0,385.2,5.2\";");
        SinaFinanceClient client = new SinaFinanceClient(stub.client);

        assertThat(client.fetchHkStock("700")).hasValueSatisfying(p -> assertThat(p).isEqualByComparingTo("385.2"));
        assertThat(stub.lastUrl()).endsWith("list=hk00700");
    }

    @Test
    @DisplayName("US price is field 1 with a lower-case gb_ code")
    void usStock() {
        StubQuoteHttp stub = StubQuoteHttp.ok("var hq_str_gb_aapl=\"Apple,189.84,0.52\";");
        SinaFinanceClient client = new SinaFinanceClient(stub.client);

        assertThat(client.fetchUsStock("AAPL")).hasValueSatisfying(p -> assertThat(p).isEqualByComparingTo("189.84"));
        assertThat(stub.lastUrl()).endsWith("list=gb_aapl");
    }

    @Test
    @DisplayName("empty quote, short field list and missing marker are no data")
    void noData() {
        assertThat(SinaFinanceClient.parseField("var hq_str_sh600000=\"\";", 3)).isEmpty();
        assertThat(SinaFinanceClient.parseField("var hq_str_gb_x=\"X\";", 1)).isEmpty();
        assertThat(SinaFinanceClient.parseField("Forbidden", 1)).isEmpty();
    }
}
