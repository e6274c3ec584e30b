package com.snapshotclaim.redistribution;

import com.snapshotclaim.domain.Claim;

import java.math.BigInteger;
import java.util.List;

/**
 * Final payout for one destination address. claims are the source claims consolidated into it, sorted by source address.
 */
public record DestinationAllocation(
        String destinationAddress,
        BigInteger originalBalance,
        BigInteger finalBalance,
        List<Claim> claims
) {

    /** Amount removed from this destination as a whole, not from any single source claim. */
    public BigInteger deductedAmount() {
        return originalBalance.subtract(finalBalance);
    }
}
