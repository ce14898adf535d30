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
 * Last known price per (symbol, currency). Upserted by automatic refresh and manual override.
 */
@Document(collection = "latest_prices")
@CompoundIndex(name = "symbol_currency", def = "{'symbol': 1, 'currency': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class LatestPrice {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String symbol;
    private String currency;
    private BigDecimal price;
    private Instant updatedAt;
}
