package com.priceradar.refresh;

import lombok.Getter;

/**
 * Thrown by price refresh and manual override when the request cannot be carried out.
 */
@Getter
public class PriceRefreshException extends RuntimeException {

    public static final String CURRENCY_NOT_FOUND = "CURRENCY_NOT_FOUND";
    public static final String INVALID_SYMBOL = "INVALID_SYMBOL";
    public static final String INVALID_PRICE = "INVALID_PRICE";

    /** CURRENCY_NOT_FOUND, INVALID_SYMBOL or INVALID_PRICE. */
    private final String errorCode;

    public PriceRefreshException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
