package com.snapshotclaim.api.dto;

import java.math.BigInteger;

/**
 * Dashboard totals. totalClaimed is the exact sum of claimed balances in smallest units.
 */
public record TotalClaimedResponse(BigInteger totalClaimed, long totalClaims) {
}
