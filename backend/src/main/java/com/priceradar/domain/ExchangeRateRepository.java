package com.priceradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

public interface ExchangeRateRepository extends MongoRepository<ExchangeRate, String> {

    Optional<ExchangeRate> findByFromCurrencyAndToCurrency(String fromCurrency, String toCurrency);
}
