package com.snapshotclaim.api.dto;

import java.util.List;

/**
 * Redistribution summary behind the CSV export. All amounts are whole-coin decimal strings.
 */
public record RedistributionResponse(
        String targetCap,
        String totalOriginal,
        String totalFinal,
        String multiplier,
        String deductionPercentage,
        List<DestinationEntry> destinations
) {

    public record DestinationEntry(String destinationAddress, String originalBalance, String finalBalance) {
    }
}
