package com.snapshotclaim.api.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.snapshotclaim.api.dto.ClaimListItemResponse;
import com.snapshotclaim.api.dto.TotalClaimedResponse;
import com.snapshotclaim.api.dto.VerifySnapshotResponse;
import com.snapshotclaim.claim.verification.ClaimSubmissionParser;
import com.snapshotclaim.claim.verification.ClaimVerifier;
import com.snapshotclaim.domain.Claim;
import com.snapshotclaim.store.ClaimStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * POST /verify-snapshot, GET /total-claimed, GET /claims.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class ClaimController {

    static final int DEFAULT_PAGE = 1;
    static final int DEFAULT_PAGE_SIZE = 10;

    private final ClaimSubmissionParser submissionParser;
    private final ClaimVerifier claimVerifier;
    private final ClaimStore claimStore;
    private final ObjectMapper objectMapper;

    /**
     * The body is taken as text so the signed payload can be re-serialized exactly as submitted.
     */
    @PostMapping("/verify-snapshot")
    public Mono<ResponseEntity<VerifySnapshotResponse>> verifySnapshot(
            @RequestBody(required = false) String body,
            @RequestHeader(name = "signature", required = false) String signature) {
        return BlockingCalls.offload(() -> {
            claimVerifier.verify(submissionParser.parse(body, signature));
            return ResponseEntity.ok(new VerifySnapshotResponse("Snapshot verified and stored successfully"));
        });
    }

    @GetMapping("/total-claimed")
    public Mono<ResponseEntity<TotalClaimedResponse>> totalClaimed() {
        return BlockingCalls.offload(() ->
                ResponseEntity.ok(new TotalClaimedResponse(claimStore.sumBalances(), claimStore.count())));
    }

    @GetMapping("/claims")
    public Mono<ResponseEntity<List<ClaimListItemResponse>>> claims(
            @RequestParam(required = false) String page,
            @RequestParam(required = false) String pageSize) {
        int pageNumber = positiveOrDefault(page, DEFAULT_PAGE);
        int size = positiveOrDefault(pageSize, DEFAULT_PAGE_SIZE);
        return BlockingCalls.offload(() -> ResponseEntity.ok(claimStore.listNewestFirst(pageNumber, size).stream()
                .map(this::toListItem)
                .toList()));
    }

    private ClaimListItemResponse toListItem(Claim claim) {
        return new ClaimListItemResponse(payloadTree(claim), claim.getSignature());
    }

    private JsonNode payloadTree(Claim claim) {
        if (claim.getRawPayload() == null) {
            return null;
        }
        try {
            return objectMapper.readTree(claim.getRawPayload());
        } catch (JsonProcessingException e) {
            log.warn("Stored payload of claim {} is not valid JSON; returning it as text", claim.getId());
            return objectMapper.getNodeFactory().textNode(claim.getRawPayload());
        }
    }

    static int positiveOrDefault(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            return parsed > 0 ? parsed : defaultValue;
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }
}
