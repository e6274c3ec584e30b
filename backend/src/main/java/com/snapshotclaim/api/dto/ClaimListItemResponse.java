package com.snapshotclaim.api.dto;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One stored claim as listed by GET /claims. rawPayload is the signed body as a JSON object.
 */
public record ClaimListItemResponse(JsonNode rawPayload, String signature) {
}
