package com.priceradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface HoldingSymbolRepository extends MongoRepository<HoldingSymbol, String> {

    List<HoldingSymbol> findByCurrency(String currency);
}
