package com.priceradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface OperationLogRepository extends MongoRepository<OperationLog, String> {

    List<OperationLog> findBySymbolAndCurrencyOrderByCreatedAtDesc(String symbol, String currency);
}
