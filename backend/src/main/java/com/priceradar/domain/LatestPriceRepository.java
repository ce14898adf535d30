package com.priceradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for latest_prices keyed by (symbol, currency).
 */
public interface LatestPriceRepository extends MongoRepository<LatestPrice, String> {

    Optional<LatestPrice> findBySymbolAndCurrency(String symbol, String currency);

    List<LatestPrice> findByCurrency(String currency);
}
