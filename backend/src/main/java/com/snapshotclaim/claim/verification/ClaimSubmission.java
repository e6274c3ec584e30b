package com.snapshotclaim.claim.verification;

/**
 * One claim submission as received. Fields are null when absent or of the wrong JSON type.
 *
 * @param canonicalPayload the request body re-serialized as compact JSON in its original key order;
 *                         this is the message the signature must cover
 */
public record ClaimSubmission(
        String sourceAddress,
        String destinationAddress,
        Long claimedBalance,
        String signature,
        String canonicalPayload
) {
}
