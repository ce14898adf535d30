package com.priceradar.pricing;

import com.priceradar.domain.InstrumentCategory;
import com.priceradar.pricing.provider.QuoteFetchException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Cache check → classify → terminal outcome or attempt loop. First provider success wins; every skipped or failed
 * provider leaves a note. Cache and breaker state change only inside the attempt loop.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PriceResolutionService implements PriceResolver {

    private final PriceCache priceCache;
    private final ProviderHealthTracker healthTracker;
    private final AttemptChainBuilder attemptChainBuilder;
    private final PriceAttemptExecutor attemptExecutor;

    @Override
    public PriceResolutionResult resolve(String symbol, String currency, String assetHint) {
        PriceQuery query = PriceQuery.of(symbol, currency, assetHint);
        Optional<PriceCache.CacheEntry> cached = priceCache.get(query);
        if (cached.isPresent()) {
            return PriceResolutionResult.cached(cached.get().price(), cached.get().providerName());
        }

        InstrumentCategory category = InstrumentClassifier.classify(query);
        log.info("Resolving price symbol={} currency={} assetType={} category={}",
                query.symbol(), query.currency(), query.assetHint(), category.code());
        switch (category) {
            case BOND:
                return PriceResolutionResult.unsupportedBond();
            case CASH:
                return PriceResolutionResult.cash();
            case UNKNOWN:
                return PriceResolutionResult.invalidSymbol(query.symbol());
            default:
                return attemptChain(query, attemptChainBuilder.buildChain(category, query));
        }
    }

    private PriceResolutionResult attemptChain(PriceQuery query, List<PriceAttempt> chain) {
        List<ProviderNote> notes = new ArrayList<>();
        for (PriceAttempt attempt : chain) {
            String provider = attempt.providerName();
            if (!healthTracker.isAvailable(provider)) {
                log.debug("Skipping {} for {}: circuit open", provider, query.symbol());
                notes.add(ProviderNote.circuitOpen(provider));
                continue;
            }
            Optional<BigDecimal> price;
            try {
                price = attemptExecutor.execute(attempt);
            } catch (QuoteFetchException e) {
                log.warn("{} failed for {}: {}", provider, query.symbol(), e.getMessage());
                healthTracker.recordFailure(provider);
                notes.add(new ProviderNote(provider, toNoteKind(e.getKind()), e.getMessage()));
                continue;
            } catch (RuntimeException e) {
                log.warn("{} failed unexpectedly for {}", provider, query.symbol(), e);
                healthTracker.recordFailure(provider);
                notes.add(ProviderNote.error(provider, e));
                continue;
            }
            if (price.isPresent()) {
                healthTracker.recordSuccess(provider);
                priceCache.put(query, price.get(), provider);
                log.info("Resolved {} {} = {} via {}", query.symbol(), query.currency(), price.get(), provider);
                return PriceResolutionResult.resolved(price.get(), provider, notes);
            }
            log.debug("{} returned no data for {}", provider, query.symbol());
            healthTracker.recordFailure(provider);
            notes.add(ProviderNote.noData(provider));
        }
        return PriceResolutionResult.allProvidersFailed(notes);
    }

    static NoteKind toNoteKind(QuoteFetchException.Kind kind) {
        return switch (kind) {
            case TRANSPORT -> NoteKind.TRANSPORT;
            case PARSE -> NoteKind.PARSE;
            case SIZE_EXCEEDED -> NoteKind.SIZE_EXCEEDED;
        };
    }
}
