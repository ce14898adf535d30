package com.priceradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Maintained FX rate (fromCurrency → toCurrency). Source is "manual", "auto_fetch" or "default".
 */
@Document(collection = "exchange_rates")
@CompoundIndex(name = "from_to", def = "{'fromCurrency': 1, 'toCurrency': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ExchangeRate {

    public static final String SOURCE_MANUAL = "manual";
    public static final String SOURCE_AUTO_FETCH = "auto_fetch";

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String fromCurrency;
    private String toCurrency;
    private BigDecimal rate;
    private String source;
    private Instant updatedAt;
}
