package com.vestpod.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface PriceHistoryRepository extends MongoRepository<PriceHistoryRecord, String> {

    List<PriceHistoryRecord> findByAssetIdOrderByObservedAtDesc(String assetId);
}
