package com.priceradar.pricing.provider;

import lombok.Getter;

/**
 * Thrown by a provider adapter when the request or its payload fails. "No data" is not an exception:
 * adapters return an empty Optional for that.
 */
@Getter
public class QuoteFetchException extends RuntimeException {

    public enum Kind {
        /** Network error, timeout, non-2xx status, local rate-limit denial. */
        TRANSPORT,
        /** Payload did not match the provider's expected shape. */
        PARSE,
        /** Body over the response cap; a transport-class failure. */
        SIZE_EXCEEDED
    }

    private final Kind kind;

    public QuoteFetchException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public QuoteFetchException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static QuoteFetchException parse(String message, Throwable cause) {
        return new QuoteFetchException(Kind.PARSE, message, cause);
    }
}
