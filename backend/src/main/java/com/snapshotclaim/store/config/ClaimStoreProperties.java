package com.snapshotclaim.store.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Claim store read settings.
 */
@ConfigurationProperties(prefix = "snapshotclaim.store")
@NoArgsConstructor
@Getter
@Setter
public class ClaimStoreProperties {

    /**
     * Read the full claim set for redistribution inside a MongoDB snapshot session.
     * Off by default for a standalone server; enable only against a replica set on MongoDB 5.0+.
     */
    private boolean snapshotReads = false;

    /** Upper bound for the claims listing page size. */
    private int maxPageSize = 100;
}
