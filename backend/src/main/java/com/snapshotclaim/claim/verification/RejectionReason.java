package com.snapshotclaim.claim.verification;

/**
 * Machine-readable reasons for a rejected claim. The enum name is the API error code.
 */
public enum RejectionReason {
    SIGNATURE_REQUIRED("signature required"),
    INVALID_REQUEST("invalid request"),
    WRONG_BLOCK_HEIGHT("wrong block height"),
    CLAIM_PERIOD_ENDED("claim period ended"),
    DUPLICATE_ADDRESS("duplicate address"),
    BALANCE_MISMATCH("balance mismatch"),
    SIGNATURE_VERIFICATION_FAILED("signature verification failed");

    private final String description;

    RejectionReason(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
