package com.snapshotclaim.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

/**
 * Persistence for claims keyed by sourceAddress (unique).
 */
public interface ClaimRepository extends MongoRepository<Claim, String>, ClaimRepositoryCustom {

    Optional<Claim> findBySourceAddress(String sourceAddress);
}
