package com.snapshotclaim.store;

import lombok.Getter;

/**
 * Thrown when the unique source-address index rejects an insert.
 */
@Getter
public class DuplicateClaimException extends RuntimeException {

    private final String sourceAddress;

    public DuplicateClaimException(String sourceAddress, Throwable cause) {
        super("Claim already exists for source address " + sourceAddress, cause);
        this.sourceAddress = sourceAddress;
    }
}
