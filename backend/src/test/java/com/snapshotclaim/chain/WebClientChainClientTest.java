package com.snapshotclaim.chain;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.snapshotclaim.chain.config.ChainNodeProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebClientChainClientTest {

    private static final String BASE_URL = "http://node.test:42220";

    ChainNodeProperties properties;
    AtomicReference<ClientRequest> lastRequest;

    @BeforeEach
    void setUp() {
        properties = new ChainNodeProperties();
        properties.setBaseUrl(BASE_URL);
        properties.setTimeout(Duration.ofMillis(200));
        lastRequest = new AtomicReference<>();
    }

    @Test
    @DisplayName("indexer tip is read from addressindexertip")
    void indexerTip() {
        ChainClient client = client(json("{\"tipHash\":\"abc\",\"tipHeight\":3000000}"));

        IndexerTip tip = client.getIndexerTip();

        assertThat(tip).isEqualTo(new IndexerTip("abc", 3_000_000L));
        assertThat(lastRequest.get().url().getPath()).isEqualTo(WebClientChainClient.INDEXER_TIP_PATH);
    }

    @Test
    @DisplayName("tip without a height is unavailable")
    void indexerTip_missingHeight() {
        ChainClient client = client(json("{\"tipHash\":\"abc\"}"));

        assertThatThrownBy(client::getIndexerTip).isInstanceOf(ChainUnavailableException.class);
    }

    @Test
    @DisplayName("balance query passes address and confirmations and reads the first balance")
    void balance() {
        ChainClient client = client(json("{\"balances\":[{\"address\":\"XSrc\",\"balance\":150000000}]}"));

        OptionalLong balance = client.getBalance("XSrc", 1);

        assertThat(balance).hasValue(150_000_000L);
        assertThat(lastRequest.get().url().getPath()).isEqualTo(WebClientChainClient.BALANCES_PATH);
        assertThat(lastRequest.get().url().getQuery()).isEqualTo("addresses=XSrc&minConfirmations=1");
    }

    @Test
    @DisplayName("empty balances array means no indexed balance")
    void balance_empty() {
        ChainClient client = client(json("{\"balances\":[]}"));

        assertThat(client.getBalance("XSrc", 1)).isEmpty();
    }

    @Test
    @DisplayName("response without balances array is unavailable")
    void balance_malformed() {
        ChainClient client = client(json("{\"error\":\"indexer disabled\"}"));

        assertThatThrownBy(() -> client.getBalance("XSrc", 1)).isInstanceOf(ChainUnavailableException.class);
    }

    @Test
    @DisplayName("verifymessage posts json-patch and accepts quoted or bare True")
    void verifySignature() {
        assertThat(client(json("\"True\"")).verifySignature("XSrc", "{}", "sig")).isTrue();
        assertThat(lastRequest.get().method()).isEqualTo(HttpMethod.POST);
        assertThat(lastRequest.get().url().getPath()).isEqualTo(WebClientChainClient.VERIFY_MESSAGE_PATH);
        assertThat(lastRequest.get().headers().getContentType()).isEqualTo(WebClientChainClient.JSON_PATCH);

        assertThat(client(text("True")).verifySignature("XSrc", "{}", "sig")).isTrue();
        assertThat(client(json("\"False\"")).verifySignature("XSrc", "{}", "sig")).isFalse();
    }

    @Test
    @DisplayName("validateaddress maps isvalid and iswitness")
    void validateAddress() {
        ChainClient client = client(json("{\"isvalid\":true,\"iswitness\":true,\"address\":\"XSrc\"}"));

        assertThat(client.validateAddress("XSrc")).isEqualTo(new AddressValidation(true, true));
        assertThat(lastRequest.get().url().getQuery()).isEqualTo("address=XSrc");
        assertThat(client(json("{\"isvalid\":false}")).validateAddress("bad"))
                .isEqualTo(new AddressValidation(false, false));
    }

    @Test
    @DisplayName("non-2xx status is unavailable")
    void errorStatus() {
        ChainClient client = client(request -> Mono.just(ClientResponse.create(HttpStatus.INTERNAL_SERVER_ERROR).build()));

        assertThatThrownBy(client::getIndexerTip)
                .isInstanceOf(ChainUnavailableException.class)
                .hasMessageContaining("500");
    }

    @Test
    @DisplayName("hanging node is cut off by the timeout")
    void timeout() {
        ChainClient client = client(request -> Mono.never());

        assertThatThrownBy(client::getIndexerTip).isInstanceOf(ChainUnavailableException.class);
    }

    @Test
    @DisplayName("malformed JSON is unavailable")
    void malformedJson() {
        ChainClient client = client(json("{oops"));

        assertThatThrownBy(client::getIndexerTip).isInstanceOf(ChainUnavailableException.class);
    }

    @Test
    @DisplayName("local limiter denial is unavailable and sends nothing")
    void limiterDenied() {
        RateLimiter oneShot = RateLimiter.of("one-shot", RateLimiterConfig.custom()
                .limitForPeriod(1)
                .limitRefreshPeriod(Duration.ofHours(1))
                .timeoutDuration(Duration.ZERO)
                .build());
        ChainClient client = client(json("{\"tipHash\":\"abc\",\"tipHeight\":1}"), oneShot);

        client.getIndexerTip();
        lastRequest.set(null);

        assertThatThrownBy(client::getIndexerTip)
                .isInstanceOf(ChainUnavailableException.class)
                .hasMessageContaining("limiter");
        assertThat(lastRequest.get()).isNull();
    }

    private ChainClient client(ExchangeFunction exchange) {
        return client(exchange, RateLimiter.of("test", RateLimiterConfig.custom()
                .limitForPeriod(1000)
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .timeoutDuration(Duration.ZERO)
                .build()));
    }

    private ChainClient client(ExchangeFunction exchange, RateLimiter rateLimiter) {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            lastRequest.set(request);
            return exchange.exchange(request);
        });
        return new WebClientChainClient(builder, new ObjectMapper(), rateLimiter, properties);
    }

    private static ExchangeFunction json(String body) {
        return respond(MediaType.APPLICATION_JSON_VALUE, body);
    }

    private static ExchangeFunction text(String body) {
        return respond(MediaType.TEXT_PLAIN_VALUE, body);
    }

    private static ExchangeFunction respond(String contentType, String body) {
        return request -> Mono.just(ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, contentType)
                .body(body)
                .build());
    }
}
