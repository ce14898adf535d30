package com.priceradar.pricing;

/**
 * Why a provider in the attempt chain did not produce the price.
 */
public enum NoteKind {
    /** Skipped: provider is cooling down after repeated failures. Not counted as a new failure. */
    CIRCUIT_OPEN,
    /** Reachable but no usable value (empty field, dash, unknown code). */
    NO_DATA,
    /** Network error, timeout, non-2xx status or local rate-limit denial. */
    TRANSPORT,
    /** Payload did not have the expected shape. */
    PARSE,
    /** Response body over the size cap. */
    SIZE_EXCEEDED,
    /** Adapter failed in a way it did not classify. Counted as a failure like the others. */
    ERROR
}
