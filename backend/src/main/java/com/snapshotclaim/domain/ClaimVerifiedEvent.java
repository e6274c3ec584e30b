package com.snapshotclaim.domain;

/**
 * Application event: a claim was verified and committed. Consumed asynchronously by the notification listener.
 */
public record ClaimVerifiedEvent(String claimId, String sourceAddress, String destinationAddress, long claimedBalance) {
}
