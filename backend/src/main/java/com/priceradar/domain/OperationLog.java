package com.priceradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Append-only audit record of price updates.
 */
@Document(collection = "operation_logs")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class OperationLog {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private OperationType operationType;
    private String symbol;
    private String currency;
    private String details;
    private BigDecimal priceFetched;
    @Indexed
    private Instant createdAt;
}
