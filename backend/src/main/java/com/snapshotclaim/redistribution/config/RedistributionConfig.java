package com.snapshotclaim.redistribution.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(RedistributionProperties.class)
public class RedistributionConfig {
}
