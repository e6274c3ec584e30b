package com.snapshotclaim.claim.notification;

/**
 * Best-effort receiver of claim notifications. Implementations must not throw.
 */
public interface NotificationSink {

    /**
     * @return true if the notification was delivered, false if skipped or failed
     */
    boolean notifyClaimVerified(String destinationAddress, long claimedBalance);
}
