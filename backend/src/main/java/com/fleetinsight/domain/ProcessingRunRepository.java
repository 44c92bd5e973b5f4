package com.fleetinsight.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

/**
 * Persistence for processing_runs. Used by the processing job tracker and the status endpoint.
 */
public interface ProcessingRunRepository extends MongoRepository<ProcessingRun, String> {

    Optional<ProcessingRun> findFirstByOrderByStartedAtDesc();
}
