package com.priceradar.pricing;

/**
 * One provider's entry in a failed or partially failed resolution.
 */
public record ProviderNote(String providerName, NoteKind kind, String detail) {

    public static ProviderNote circuitOpen(String providerName) {
        return new ProviderNote(providerName, NoteKind.CIRCUIT_OPEN, "circuit open, cooling down");
    }

    public static ProviderNote noData(String providerName) {
        return new ProviderNote(providerName, NoteKind.NO_DATA, "no data returned");
    }

    public static ProviderNote error(String providerName, RuntimeException e) {
        String detail = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return new ProviderNote(providerName, NoteKind.ERROR, detail);
    }

    public String render() {
        return providerName + ": " + detail;
    }
}
