package com.priceradar.domain;

/**
 * Audit operation types written to operation_logs by the price update paths.
 */
public enum OperationType {
    PRICE_UPDATE,
    PRICE_UPDATE_FAILED,
    MANUAL_PRICE_UPDATE
}
