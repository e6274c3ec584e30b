package com.snapshotclaim.claim.notification;

import com.snapshotclaim.claim.config.NotificationProperties;
import com.snapshotclaim.common.UnitAmountFormatter;
import com.snapshotclaim.config.CoinProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Posts a Discord embed for each verified claim. Skips with a warning when no webhook URL is configured;
 * delivery errors are logged and reported as false.
 */
@Component
@Slf4j
public class DiscordWebhookNotifier implements NotificationSink {

    static final int EMBED_COLOR = 3447003;

    private final WebClient webClient;
    private final NotificationProperties properties;
    private final CoinProperties coinProperties;
    private final Clock clock;

    public DiscordWebhookNotifier(WebClient.Builder webClientBuilder, NotificationProperties properties,
                                  CoinProperties coinProperties, Clock clock) {
        this.webClient = webClientBuilder.build();
        this.properties = properties;
        this.coinProperties = coinProperties;
        this.clock = clock;
    }

    @Override
    public boolean notifyClaimVerified(String destinationAddress, long claimedBalance) {
        String webhookUrl = properties.getWebhookUrl();
        if (webhookUrl == null || webhookUrl.isBlank()) {
            log.warn("Webhook URL not configured, skipping claim notification");
            return false;
        }
        try {
            webClient.post()
                    .uri(webhookUrl)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(buildMessage(destinationAddress, claimedBalance))
                    .retrieve()
                    .toBodilessEntity()
                    .timeout(properties.getTimeout())
                    .block();
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to send claim notification for {}", destinationAddress, e);
            return false;
        }
    }

    Map<String, Object> buildMessage(String destinationAddress, long claimedBalance) {
        String amount = UnitAmountFormatter.format(claimedBalance, coinProperties.getDecimals())
                + " " + coinProperties.getTicker();
        StringBuilder description = new StringBuilder("A user has claimed their snapshotted balance successfully.");
        if (properties.getPublicBaseUrl() != null && !properties.getPublicBaseUrl().isBlank()) {
            description.append("\n\nCheck the claim details at ").append(properties.getPublicBaseUrl());
        }

        Map<String, Object> embed = new LinkedHashMap<>();
        embed.put("title", "New Claim Verified!");
        embed.put("description", description.toString());
        embed.put("fields", List.of(
                field("Destination Address", destinationAddress),
                field("Amount", amount)));
        embed.put("color", EMBED_COLOR);
        embed.put("timestamp", clock.instant().toString());
        return Map.of("embeds", List.of(embed));
    }

    private static Map<String, Object> field(String name, String value) {
        Map<String, Object> field = new LinkedHashMap<>();
        field.put("name", name);
        field.put("value", value);
        field.put("inline", true);
        return field;
    }
}
