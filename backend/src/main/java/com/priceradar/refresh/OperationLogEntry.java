package com.priceradar.refresh;

import com.priceradar.domain.OperationType;

import java.math.BigDecimal;

/**
 * Audit record of a price update attempt. priceFetched is null for failures.
 */
public record OperationLogEntry(OperationType operationType, String symbol, String currency, String details,
                                BigDecimal priceFetched) {
}
