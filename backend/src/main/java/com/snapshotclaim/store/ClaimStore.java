package com.snapshotclaim.store;

import com.snapshotclaim.domain.Claim;
import com.snapshotclaim.domain.ClaimRepository;
import com.snapshotclaim.store.config.ClaimStoreProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Append-only store of verified claims. The unique index on sourceAddress decides duplicates;
 * callers may pre-check with {@link #findBySourceAddress} but must handle {@link DuplicateClaimException} on insert.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ClaimStore {

    public static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "createdAt")
            .and(Sort.by(Sort.Direction.DESC, "id"));
    public static final Sort BY_DESTINATION = Sort.by(Sort.Direction.ASC, "destinationAddress")
            .and(Sort.by(Sort.Direction.ASC, Claim.SOURCE_ADDRESS_FIELD));

    private final ClaimRepository repository;
    private final ClaimStoreProperties properties;
    private final AtomicLong generation = new AtomicLong();

    public Optional<Claim> findBySourceAddress(String sourceAddress) {
        return repository.findBySourceAddress(sourceAddress);
    }

    /**
     * Inserts a new claim. Never updates an existing document.
     *
     * @throws DuplicateClaimException if a claim for the same source address is already stored
     */
    public Claim insert(Claim claim) {
        if (claim.getId() != null) {
            throw new IllegalArgumentException("Claims are immutable; insert requires a new claim without id");
        }
        Claim saved;
        try {
            saved = repository.insert(claim);
        } catch (DuplicateKeyException e) {
            throw new DuplicateClaimException(claim.getSourceAddress(), e);
        }
        generation.incrementAndGet();
        return saved;
    }

    /**
     * Count of inserts committed by this instance. Bumped after the write returns, so a value read
     * before {@link #snapshot()} never labels data older than itself.
     */
    public long generation() {
        return generation.get();
    }

    public List<Claim> listAll(Sort orderBy, Long pageOffset, Integer pageLimit) {
        return repository.findSlice(orderBy, pageOffset, pageLimit);
    }

    /**
     * One page of claims, newest first. page is 1-based; pageSize is clamped to the configured maximum.
     */
    public List<Claim> listNewestFirst(int page, int pageSize) {
        int size = Math.max(1, Math.min(pageSize, properties.getMaxPageSize()));
        long offset = (long) (Math.max(1, page) - 1) * size;
        return listAll(NEWEST_FIRST, offset, size);
    }

    public BigInteger sumBalances() {
        return repository.sumClaimedBalances();
    }

    public long count() {
        return repository.count();
    }

    /**
     * Full claim set read at one point in time, ordered by destination then source address.
     */
    public List<Claim> snapshot() {
        List<Claim> claims = repository.findAllConsistent(BY_DESTINATION, properties.isSnapshotReads());
        log.debug("Claim snapshot read {} claims", claims.size());
        return claims;
    }
}
