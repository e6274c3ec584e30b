package com.snapshotclaim.chain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.snapshotclaim.chain.config.ChainNodeProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalLong;
import java.util.function.Supplier;

/**
 * Chain node client over the node's REST API using WebClient. Each call acquires a local limiter permit,
 * blocks with a timeout and parses the body with Jackson. No call is retried.
 */
@Slf4j
public class WebClientChainClient implements ChainClient {

    static final String INDEXER_TIP_PATH = "/api/BlockStore/addressindexertip";
    static final String BALANCES_PATH = "/api/BlockStore/getaddressesbalances";
    static final String VERIFY_MESSAGE_PATH = "/api/Wallet/verifymessage";
    static final String VALIDATE_ADDRESS_PATH = "/api/Node/validateaddress";

    /** The node's verifymessage endpoint only accepts this content type. */
    static final MediaType JSON_PATCH = MediaType.parseMediaType("application/json-patch+json");

    private static final String AFFIRMATIVE = "True";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final RateLimiter rateLimiter;
    private final Duration timeout;
    private final long limiterLogThresholdMs;

    public WebClientChainClient(WebClient.Builder builder, ObjectMapper objectMapper,
                                RateLimiter rateLimiter, ChainNodeProperties properties) {
        this.webClient = builder.baseUrl(properties.getBaseUrl()).build();
        this.objectMapper = objectMapper;
        this.rateLimiter = rateLimiter;
        this.timeout = properties.getTimeout();
        this.limiterLogThresholdMs = properties.getLimiterLogThresholdMs();
    }

    @Override
    public IndexerTip getIndexerTip() {
        JsonNode root = readObject("addressindexertip", () -> webClient.get()
                .uri(INDEXER_TIP_PATH)
                .retrieve()
                .bodyToMono(String.class));
        JsonNode height = root.get("tipHeight");
        if (height == null || !height.isIntegralNumber() || !height.canConvertToLong()) {
            throw new ChainUnavailableException("addressindexertip response has no integral tipHeight");
        }
        JsonNode hash = root.get("tipHash");
        return new IndexerTip(hash != null && !hash.isNull() ? hash.asText() : null, height.asLong());
    }

    @Override
    public OptionalLong getBalance(String address, int minConfirmations) {
        JsonNode root = readObject("getaddressesbalances", () -> webClient.get()
                .uri(uri -> uri.path(BALANCES_PATH)
                        .queryParam("addresses", address)
                        .queryParam("minConfirmations", minConfirmations)
                        .build())
                .retrieve()
                .bodyToMono(String.class));
        JsonNode balances = root.get("balances");
        if (balances == null || !balances.isArray()) {
            throw new ChainUnavailableException("getaddressesbalances response has no balances array");
        }
        if (balances.isEmpty()) {
            return OptionalLong.empty();
        }
        JsonNode balance = balances.get(0).get("balance");
        if (balance == null || balance.isNull()) {
            return OptionalLong.empty();
        }
        if (!balance.isIntegralNumber() || !balance.canConvertToLong()) {
            throw new ChainUnavailableException("getaddressesbalances returned a non-integral balance: " + balance);
        }
        return OptionalLong.of(balance.asLong());
    }

    @Override
    public boolean verifySignature(String address, String message, String signature) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("signature", signature);
        body.put("externalAddress", address);
        body.put("message", message);
        String response = exchange("verifymessage", () -> webClient.post()
                .uri(VERIFY_MESSAGE_PATH)
                .contentType(JSON_PATCH)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class));
        return AFFIRMATIVE.equals(unquote(response));
    }

    @Override
    public AddressValidation validateAddress(String address) {
        JsonNode root = readObject("validateaddress", () -> webClient.get()
                .uri(uri -> uri.path(VALIDATE_ADDRESS_PATH).queryParam("address", address).build())
                .retrieve()
                .bodyToMono(String.class));
        JsonNode valid = root.get("isvalid");
        if (valid == null || !valid.isBoolean()) {
            throw new ChainUnavailableException("validateaddress response has no boolean isvalid");
        }
        return new AddressValidation(valid.booleanValue(), root.path("iswitness").asBoolean(false));
    }

    private JsonNode readObject(String operation, Supplier<Mono<String>> request) {
        String body = exchange(operation, request);
        try {
            JsonNode root = objectMapper.readTree(body);
            if (root == null || !root.isObject()) {
                throw new ChainUnavailableException(operation + " returned a non-object body");
            }
            return root;
        } catch (ChainUnavailableException e) {
            throw e;
        } catch (Exception e) {
            throw new ChainUnavailableException(operation + " returned malformed JSON", e);
        }
    }

    private String exchange(String operation, Supplier<Mono<String>> request) {
        acquirePermit(operation);
        String body;
        try {
            body = request.get().timeout(timeout).block();
        } catch (WebClientResponseException e) {
            throw new ChainUnavailableException(operation + " failed with HTTP " + e.getStatusCode().value(), e);
        } catch (RuntimeException e) {
            throw new ChainUnavailableException(operation + " failed: " + messageOf(e), e);
        }
        if (body == null || body.isBlank()) {
            throw new ChainUnavailableException(operation + " returned an empty body");
        }
        return body;
    }

    private void acquirePermit(String operation) {
        long acquireStart = System.nanoTime();
        boolean permitted = rateLimiter.acquirePermission();
        long waitedMs = (System.nanoTime() - acquireStart) / 1_000_000L;
        if (!permitted) {
            throw new ChainUnavailableException("Local limiter timeout before " + operation);
        }
        if (waitedMs >= Math.max(1L, limiterLogThresholdMs)) {
            log.info("Local chain node limiter delayed {} ms before {}", waitedMs, operation);
        }
    }

    /** The node answers verifymessage with either a JSON string ("True") or bare text (True). */
    private String unquote(String body) {
        String trimmed = body.trim();
        if (trimmed.startsWith("\"")) {
            try {
                return objectMapper.readTree(trimmed).asText();
            } catch (Exception e) {
                throw new ChainUnavailableException("verifymessage returned malformed JSON", e);
            }
        }
        return trimmed;
    }

    private static String messageOf(Throwable e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
