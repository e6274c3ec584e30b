package com.snapshotclaim.redistribution;

import com.snapshotclaim.domain.Claim;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Supply-capped proportional redistribution over a claim set. Stateless; all arithmetic is BigInteger.
 * <p>
 * Balances are grouped per destination and scaled by one global fixed-point multiplier
 * {@code floor(targetCap * scale / totalOriginal)}. Each destination's share is floored; the last destination in
 * ascending address order absorbs the remainder so the final balances sum to the target cap exactly.
 * When the total is at or below the cap nothing is scaled and final equals original.
 */
@Component
@Slf4j
public class RedistributionEngine {

    public RedistributionResult compute(Collection<Claim> claims, BigInteger targetCapUnits, BigInteger scale) {
        if (scale == null || scale.signum() <= 0) {
            throw new IllegalArgumentException("scale must be positive");
        }
        if (targetCapUnits == null || targetCapUnits.signum() < 0) {
            throw new IllegalArgumentException("targetCapUnits must not be negative");
        }

        TreeMap<String, List<Claim>> byDestination = groupByDestination(claims);
        Map<String, BigInteger> originals = new TreeMap<>();
        BigInteger totalOriginal = BigInteger.ZERO;
        for (Map.Entry<String, List<Claim>> entry : byDestination.entrySet()) {
            BigInteger original = entry.getValue().stream()
                    .map(c -> BigInteger.valueOf(c.getClaimedBalance()))
                    .reduce(BigInteger.ZERO, BigInteger::add);
            originals.put(entry.getKey(), original);
            totalOriginal = totalOriginal.add(original);
        }

        if (totalOriginal.compareTo(targetCapUnits) <= 0) {
            List<DestinationAllocation> unscaled = new ArrayList<>(byDestination.size());
            for (Map.Entry<String, List<Claim>> entry : byDestination.entrySet()) {
                BigInteger original = originals.get(entry.getKey());
                unscaled.add(new DestinationAllocation(entry.getKey(), original, original, entry.getValue()));
            }
            return new RedistributionResult(targetCapUnits, totalOriginal, scale, scale, List.copyOf(unscaled));
        }

        BigInteger multiplier = targetCapUnits.multiply(scale).divide(totalOriginal);
        List<DestinationAllocation> allocations = new ArrayList<>(byDestination.size());
        BigInteger allocatedToOthers = BigInteger.ZERO;
        String last = byDestination.lastKey();
        for (Map.Entry<String, List<Claim>> entry : byDestination.entrySet()) {
            String destination = entry.getKey();
            BigInteger original = originals.get(destination);
            BigInteger scaled = original.multiply(multiplier).divide(scale);
            BigInteger finalBalance;
            if (destination.equals(last)) {
                finalBalance = targetCapUnits.subtract(allocatedToOthers);
                if (finalBalance.signum() < 0) {
                    log.warn("Negative remainder {} for last destination {}; clamping to scaled balance {}",
                            finalBalance, destination, scaled);
                    finalBalance = scaled;
                }
            } else {
                finalBalance = scaled;
                allocatedToOthers = allocatedToOthers.add(scaled);
            }
            allocations.add(new DestinationAllocation(destination, original, finalBalance, entry.getValue()));
        }

        RedistributionResult result = new RedistributionResult(
                targetCapUnits, totalOriginal, multiplier, scale, List.copyOf(allocations));
        BigInteger totalFinal = result.totalFinalUnits();
        if (!totalFinal.equals(targetCapUnits)) {
            throw new RedistributionConsistencyException(
                    "Final balances sum to " + totalFinal + " but target cap is " + targetCapUnits);
        }
        return result;
    }

    private static TreeMap<String, List<Claim>> groupByDestination(Collection<Claim> claims) {
        TreeMap<String, List<Claim>> byDestination = new TreeMap<>();
        for (Claim claim : claims) {
            if (claim.getClaimedBalance() < 0) {
                throw new IllegalArgumentException("Negative claimed balance for " + claim.getSourceAddress());
            }
            byDestination.computeIfAbsent(claim.getDestinationAddress(), k -> new ArrayList<>()).add(claim);
        }
        byDestination.replaceAll((destination, group) -> {
            List<Claim> sorted = new ArrayList<>(group);
            sorted.sort(Comparator.comparing(Claim::getSourceAddress, Comparator.nullsFirst(Comparator.naturalOrder())));
            return List.copyOf(sorted);
        });
        return byDestination;
    }
}
