package com.snapshotclaim.chain.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.snapshotclaim.chain.ChainClient;
import com.snapshotclaim.chain.WebClientChainClient;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Wires the WebClient-based chain node client and its local rate limiter.
 */
@Configuration
@EnableConfigurationProperties(ChainNodeProperties.class)
public class ChainClientConfig {

    @Bean(name = "chainNodeRateLimiter")
    public RateLimiter chainNodeRateLimiter(ChainNodeProperties properties) {
        int rps = Math.max(1, properties.getMaxRequestsPerSecond());
        Duration timeout = properties.getLimiterTimeout() != null ? properties.getLimiterTimeout() : Duration.ZERO;
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(timeout)
                .build();
        return RateLimiter.of("chain-node", config);
    }

    @Bean
    public ChainClient chainClient(WebClient.Builder webClientBuilder,
                                   ObjectMapper objectMapper,
                                   @Qualifier("chainNodeRateLimiter") RateLimiter rateLimiter,
                                   ChainNodeProperties properties) {
        return new WebClientChainClient(webClientBuilder, objectMapper, rateLimiter, properties);
    }
}
