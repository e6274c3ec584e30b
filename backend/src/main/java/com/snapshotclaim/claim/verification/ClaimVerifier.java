package com.snapshotclaim.claim.verification;

import com.snapshotclaim.chain.ChainClient;
import com.snapshotclaim.chain.IndexerTip;
import com.snapshotclaim.claim.config.ClaimProperties;
import com.snapshotclaim.domain.Claim;
import com.snapshotclaim.domain.ClaimVerifiedEvent;
import com.snapshotclaim.store.ClaimStore;
import com.snapshotclaim.store.DuplicateClaimException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.OptionalLong;

/**
 * Verifies one claim submission and commits it.
 * Steps run in a fixed order and the first failing step ends the submission:
 * signature present, payload shape, snapshot height, deadline, duplicate pre-check, on-chain balance,
 * signature, insert, then an asynchronous notification.
 * <p>
 * Rejections throw {@link ClaimRejectedException}. Chain faults propagate as
 * {@link com.snapshotclaim.chain.ChainUnavailableException} and storage faults as Spring DataAccessException.
 * Nothing is retried.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ClaimVerifier {

    private final ChainClient chainClient;
    private final ClaimStore claimStore;
    private final ClaimProperties claimProperties;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;

    /**
     * @return the committed claim
     * @throws ClaimRejectedException on any failed validation step
     */
    public Claim verify(ClaimSubmission submission) {
        if (submission.signature() == null || submission.signature().isBlank()) {
            throw reject(RejectionReason.SIGNATURE_REQUIRED, "Signature is required");
        }
        requireWellFormed(submission);
        String sourceAddress = submission.sourceAddress();

        IndexerTip tip = chainClient.getIndexerTip();
        if (tip.tipHeight() != claimProperties.getSnapshotHeight()) {
            throw reject(RejectionReason.WRONG_BLOCK_HEIGHT,
                    "Block height must be at " + claimProperties.getSnapshotHeight() + " blocks, node is at " + tip.tipHeight());
        }

        Instant deadline = claimProperties.getDeadline();
        if (deadline != null && clock.instant().isAfter(deadline)) {
            throw reject(RejectionReason.CLAIM_PERIOD_ENDED, "Claim period ended at " + deadline);
        }

        if (claimStore.findBySourceAddress(sourceAddress).isPresent()) {
            throw reject(RejectionReason.DUPLICATE_ADDRESS, "Duplicate address. Snapshot was already verified.");
        }

        OptionalLong onChainBalance = chainClient.getBalance(sourceAddress, claimProperties.getMinConfirmations());
        if (onChainBalance.isEmpty()) {
            throw reject(RejectionReason.BALANCE_MISMATCH, "No indexed balance for source address");
        }
        if (onChainBalance.getAsLong() != submission.claimedBalance()) {
            throw reject(RejectionReason.BALANCE_MISMATCH, "Balance verification failed");
        }

        if (!chainClient.verifySignature(sourceAddress, submission.canonicalPayload(), submission.signature())) {
            throw reject(RejectionReason.SIGNATURE_VERIFICATION_FAILED, "Signature verification failed");
        }

        Claim saved;
        try {
            saved = claimStore.insert(Claim.of(
                    sourceAddress,
                    submission.destinationAddress(),
                    submission.claimedBalance(),
                    submission.signature(),
                    submission.canonicalPayload(),
                    clock.instant()));
        } catch (DuplicateClaimException e) {
            log.info("Concurrent claim for {} lost the insert race", sourceAddress);
            throw new ClaimRejectedException(RejectionReason.DUPLICATE_ADDRESS,
                    "Duplicate address. Snapshot was already verified.", e);
        }
        log.info("Claim {} committed: {} -> {} ({} units)",
                saved.getId(), sourceAddress, saved.getDestinationAddress(), saved.getClaimedBalance());

        // committed; a refused or failed dispatch must not change the response
        try {
            applicationEventPublisher.publishEvent(new ClaimVerifiedEvent(
                    saved.getId(), sourceAddress, saved.getDestinationAddress(), saved.getClaimedBalance()));
        } catch (RuntimeException e) {
            log.error("Notification dispatch for claim {} failed; claim stays committed", saved.getId(), e);
        }
        return saved;
    }

    private static void requireWellFormed(ClaimSubmission submission) {
        if (submission.canonicalPayload() == null) {
            throw reject(RejectionReason.INVALID_REQUEST, "Request body must be a JSON object");
        }
        if (submission.sourceAddress() == null) {
            throw reject(RejectionReason.INVALID_REQUEST, "sourceAddress is required");
        }
        if (submission.destinationAddress() == null) {
            throw reject(RejectionReason.INVALID_REQUEST, "destinationAddress is required");
        }
        if (submission.claimedBalance() == null || submission.claimedBalance() < 0) {
            throw reject(RejectionReason.INVALID_REQUEST, "claimedBalance must be a non-negative integer");
        }
    }

    private static ClaimRejectedException reject(RejectionReason reason, String message) {
        log.debug("Claim rejected ({}): {}", reason, message);
        return new ClaimRejectedException(reason, message);
    }
}
