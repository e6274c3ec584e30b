package com.snapshotclaim.claim.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties({ ClaimProperties.class, NotificationProperties.class })
public class ClaimConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
