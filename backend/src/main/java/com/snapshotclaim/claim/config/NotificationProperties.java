package com.snapshotclaim.claim.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Webhook notification settings. An empty webhook URL disables notifications.
 */
@ConfigurationProperties(prefix = "snapshotclaim.notification")
@NoArgsConstructor
@Getter
@Setter
public class NotificationProperties {

    private String webhookUrl;

    /** Public URL of the claim site, linked from each notification. */
    private String publicBaseUrl;

    private Duration timeout = Duration.ofSeconds(10);
}
