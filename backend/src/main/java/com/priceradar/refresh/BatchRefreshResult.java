package com.priceradar.refresh;

import java.util.List;

/**
 * Outcome of a batch refresh: symbols updated and one "symbol: message" note per failed symbol.
 */
public record BatchRefreshResult(int updatedCount, List<String> errors) {

    public BatchRefreshResult {
        errors = List.copyOf(errors);
    }
}
