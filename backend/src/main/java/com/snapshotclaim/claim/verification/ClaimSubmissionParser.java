package com.snapshotclaim.claim.verification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Turns a raw verify-snapshot body into a {@link ClaimSubmission}.
 * The body is parsed as a tree (key order kept) and written back compact, matching what the claimant signed.
 * A body that is not a JSON object yields a submission with null fields, which the verifier rejects.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ClaimSubmissionParser {

    static final String SOURCE_ADDRESS = "sourceAddress";
    static final String DESTINATION_ADDRESS = "destinationAddress";
    static final String CLAIMED_BALANCE = "claimedBalance";

    private final ObjectMapper objectMapper;

    public ClaimSubmission parse(String body, String signature) {
        JsonNode root = readObject(body);
        if (root == null) {
            return new ClaimSubmission(null, null, null, signature, null);
        }
        return new ClaimSubmission(
                text(root.get(SOURCE_ADDRESS)),
                text(root.get(DESTINATION_ADDRESS)),
                integral(root.get(CLAIMED_BALANCE)),
                signature,
                canonical(root));
    }

    private JsonNode readObject(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            return root != null && root.isObject() ? root : null;
        } catch (JsonProcessingException e) {
            log.debug("Claim body is not valid JSON: {}", e.getOriginalMessage());
            return null;
        }
    }

    private String canonical(JsonNode root) {
        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Parsed JSON tree could not be written back", e);
        }
    }

    private static String text(JsonNode node) {
        if (node == null || !node.isTextual()) {
            return null;
        }
        String value = node.textValue().trim();
        return value.isEmpty() ? null : value;
    }

    private static Long integral(JsonNode node) {
        if (node == null || !node.isIntegralNumber() || !node.canConvertToLong()) {
            return null;
        }
        return node.longValue();
    }
}
