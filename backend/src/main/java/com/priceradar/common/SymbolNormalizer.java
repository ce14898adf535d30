package com.priceradar.common;

import java.util.Locale;

/**
 * Canonical forms for instrument identifiers, currencies and asset-type hints.
 * Every entry point normalizes through here before touching caches, classifiers or storage.
 */
public final class SymbolNormalizer {

    /** Asset-type hint assumed when the caller gives none. */
    public static final String DEFAULT_ASSET_HINT = "stock";

    private SymbolNormalizer() {}

    public static String symbol(String symbol) {
        return symbol == null ? "" : symbol.strip().toUpperCase(Locale.ROOT);
    }

    public static String currency(String currency) {
        return currency == null ? "" : currency.strip().toUpperCase(Locale.ROOT);
    }

    /**
     * Lowercased hint; blank becomes {@link #DEFAULT_ASSET_HINT}.
     */
    public static String assetHint(String assetHint) {
        if (assetHint == null || assetHint.isBlank()) {
            return DEFAULT_ASSET_HINT;
        }
        return assetHint.strip().toLowerCase(Locale.ROOT);
    }
}
