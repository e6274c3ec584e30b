package com.snapshotclaim.claim.verification;

import lombok.Getter;

/**
 * Thrown by ClaimVerifier when a submission fails a validation step. Client-correctable; maps to 400.
 */
@Getter
public class ClaimRejectedException extends RuntimeException {

    private final RejectionReason reason;

    public ClaimRejectedException(RejectionReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public ClaimRejectedException(RejectionReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
}
