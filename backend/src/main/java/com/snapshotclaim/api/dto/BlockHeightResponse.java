package com.snapshotclaim.api.dto;

public record BlockHeightResponse(String tipHash, long tipHeight) {
}
