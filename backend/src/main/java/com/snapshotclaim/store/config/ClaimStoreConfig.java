package com.snapshotclaim.store.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ClaimStoreProperties.class)
public class ClaimStoreConfig {
}
