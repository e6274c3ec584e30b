package com.snapshotclaim.api.dto;

public record VerifySnapshotResponse(String message) {
}
