package com.priceradar.pricing;

import com.priceradar.domain.InstrumentCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class InstrumentClassifierTest {

    @ParameterizedTest(name = "{0} {1} {2} -> {3}")
    @CsvSource({
            "SH600000, CNY, stock, A_SHARE",
            "sz000001, '', '', A_SHARE",
            "600000, CNY, stock, A_SHARE",
            "300750, CNY, '', A_SHARE",
            "688981, CNY, stock, A_SHARE",
            "510300, CNY, stock, ETF",
            "159915, CNY, '', ETF",
            "161725, CNY, stock, ETF",
            "600000, CNY, etf, ETF",
            "000001, CNY, fund, ETF",
            "H00700, CNY, '', HK_CONNECT",
            "00700, HKD, '', HK_STOCK",
            "00700, '', '', HK_STOCK",
            "9988, HKD, stock, HK_STOCK",
            "AU9999, CNY, '', GOLD",
            "GOLD, USD, '', GOLD",
            "CASH, CNY, '', CASH",
            "cash, '', '', CASH",
            "AAPL, USD, stock, US_STOCK",
            "MSFT, '', '', US_STOCK",
            "BRK.B, USD, '', US_STOCK",
            "CN-BOND-2030, CNY, '', BOND",
            "ABC123, CNY, '', UNKNOWN",
            "'', '', '', UNKNOWN"
    })
    @DisplayName("classification follows the first matching rule")
    void classifies(String symbol, String currency, String hint, InstrumentCategory expected) {
        assertThat(InstrumentClassifier.classify(symbol, currency, hint)).isEqualTo(expected);
    }

    @Test
    @DisplayName("six-digit CNY code outside every known prefix defaults to etf")
    void unmatchedSixDigitDefaultsToEtf() {
        assertThat(InstrumentClassifier.classify("700001", "CNY", "stock")).isEqualTo(InstrumentCategory.ETF);
    }

    @Test
    @DisplayName("six-digit code in a non-domestic currency is not treated as a domestic code")
    void sixDigitUsdIsNotDomestic() {
        assertThat(InstrumentClassifier.classify("600000", "USD", "")).isEqualTo(InstrumentCategory.US_STOCK);
    }

    @Test
    @DisplayName("cash marker in HKD is caught by the Hong Kong rule first")
    void cashInHkdIsHkStock() {
        assertThat(InstrumentClassifier.classify("CASH", "HKD", "")).isEqualTo(InstrumentCategory.HK_STOCK);
    }

    @Test
    @DisplayName("classification is deterministic for equal input")
    void deterministic() {
        PriceQuery query = PriceQuery.of("510300", "cny", "");
        assertThat(InstrumentClassifier.classify(query)).isEqualTo(InstrumentClassifier.classify(query));
    }
}
