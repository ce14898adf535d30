package com.priceradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Symbol held in some account, as seen by price refresh. Owned by the holdings side; read-only here.
 */
@Document(collection = "holding_symbols")
@CompoundIndex(name = "symbol_currency", def = "{'symbol': 1, 'currency': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class HoldingSymbol {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String symbol;
    private String currency;
    /** Lowercase asset type (stock, etf, fund, gold, cash, bond, ...). */
    private String assetType;
    private boolean autoUpdate = true;
}
