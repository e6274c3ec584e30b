package com.snapshotclaim.chain.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Chain-indexing node connection and throttling settings.
 */
@ConfigurationProperties(prefix = "snapshotclaim.chain")
@NoArgsConstructor
@Getter
@Setter
public class ChainNodeProperties {

    /** Node REST API base URL, e.g. http://localhost:42220. */
    private String baseUrl = "http://localhost:42220";

    /** Upper bound for a single node call; a hanging call fails as unavailable after this. */
    private Duration timeout = Duration.ofSeconds(10);

    /** Node request budget (requests per second) for this service instance. */
    private int maxRequestsPerSecond = 50;

    /** How long a call may wait for a local limiter permit before failing. */
    private Duration limiterTimeout = Duration.ofSeconds(2);

    /** Log local limiter waits longer than this threshold. */
    private long limiterLogThresholdMs = 100;
}
