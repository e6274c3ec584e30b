package com.snapshotclaim.claim.notification;

import com.snapshotclaim.config.AsyncConfig;
import com.snapshotclaim.domain.ClaimVerifiedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Dispatches claim notifications off the request path. The claim is already committed; failures are only logged.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ClaimNotificationListener {

    private final NotificationSink notificationSink;

    @Async(AsyncConfig.NOTIFICATION_EXECUTOR)
    @EventListener
    public void onClaimVerified(ClaimVerifiedEvent event) {
        try {
            boolean delivered = notificationSink.notifyClaimVerified(event.destinationAddress(), event.claimedBalance());
            if (!delivered) {
                log.warn("Notification for claim {} was not delivered", event.claimId());
            }
        } catch (RuntimeException e) {
            log.error("Notification sink failed for claim {}", event.claimId(), e);
        }
    }
}
