package com.snapshotclaim.api.dto;

/**
 * On-chain balance in smallest units.
 */
public record BalanceResponse(long balance) {
}
