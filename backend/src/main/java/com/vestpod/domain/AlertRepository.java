package com.vestpod.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Persistence for alerts. The alert check job reads ACTIVE alerts and saves check/trigger state.
 */
public interface AlertRepository extends MongoRepository<Alert, String> {

    List<Alert> findByState(AlertState state);
}
