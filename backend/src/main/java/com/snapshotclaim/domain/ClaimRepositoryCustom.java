package com.snapshotclaim.domain;

import org.springframework.data.domain.Sort;

import java.math.BigInteger;
import java.util.List;

/**
 * Custom claim queries using MongoTemplate (aggregation, offset paging, snapshot reads).
 */
public interface ClaimRepositoryCustom {

    /** Exact sum of claimedBalance over all claims; zero when there are none. */
    BigInteger sumClaimedBalances();

    /** Claims in the given order; null offset or limit means unbounded. */
    List<Claim> findSlice(Sort sort, Long offset, Integer limit);

    /**
     * All claims read at a single point in time. With snapshotSession the read runs in a MongoDB
     * snapshot session (replica set, MongoDB 5.0+); otherwise it is one plain query.
     */
    List<Claim> findAllConsistent(Sort sort, boolean snapshotSession);
}
