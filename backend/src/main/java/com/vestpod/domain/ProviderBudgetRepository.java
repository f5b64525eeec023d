package com.vestpod.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

public interface ProviderBudgetRepository extends MongoRepository<ProviderBudgetDocument, String> {
}
