package com.snapshotclaim.claim.config;

import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Instant;

/**
 * Claim window settings: the node must sit exactly at the snapshot height, and claims are accepted until the deadline.
 */
@ConfigurationProperties(prefix = "snapshotclaim.claim")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class ClaimProperties {

    /** Indexer tip height the node must report while claims are verified. */
    @Min(0)
    private long snapshotHeight = 3_000_000L;

    /** Claims submitted after this instant are rejected. Null means no deadline. */
    private Instant deadline;

    /** Confirmations required for the balance lookup. */
    @Min(0)
    private int minConfirmations = 1;
}
