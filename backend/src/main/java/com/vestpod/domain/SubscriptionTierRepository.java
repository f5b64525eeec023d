package com.vestpod.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

public interface SubscriptionTierRepository extends MongoRepository<SubscriptionTier, String> {
}
