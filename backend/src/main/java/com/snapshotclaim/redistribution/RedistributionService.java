package com.snapshotclaim.redistribution;

import com.snapshotclaim.common.UnitAmountFormatter;
import com.snapshotclaim.config.CaffeineConfig;
import com.snapshotclaim.config.CoinProperties;
import com.snapshotclaim.redistribution.config.RedistributionProperties;
import com.snapshotclaim.store.ClaimStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Runs the redistribution engine over a consistent snapshot of the claim store.
 * Results are cached under the store generation they were computed at, so a computation that
 * raced a commit is never served after that commit.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RedistributionService {

    private final ClaimStore claimStore;
    private final RedistributionEngine engine;
    private final RedistributionProperties properties;
    private final CoinProperties coinProperties;
    private final CacheManager cacheManager;

    public RedistributionResult currentResult() {
        Cache cache = Objects.requireNonNull(cacheManager.getCache(CaffeineConfig.REDISTRIBUTION_CACHE),
                "cache " + CaffeineConfig.REDISTRIBUTION_CACHE + " is not configured");
        // generation must be read before the snapshot
        long generation = claimStore.generation();
        return cache.get(generation, this::compute);
    }

    private RedistributionResult compute() {
        RedistributionResult result = engine.compute(claimStore.snapshot(), targetCapUnits(), coinProperties.unitScale());
        logTotals(result);
        return result;
    }

    /** round(totalSupply * capRatio * 10^decimals), HALF_UP. */
    public BigInteger targetCapUnits() {
        return properties.getTotalSupply()
                .multiply(properties.getCapRatio())
                .multiply(new BigDecimal(coinProperties.unitScale()))
                .setScale(0, RoundingMode.HALF_UP)
                .toBigIntegerExact();
    }

    private void logTotals(RedistributionResult result) {
        int decimals = coinProperties.getDecimals();
        BigInteger totalFinal = result.totalFinalUnits();
        log.info("Redistribution over {} destinations: original {} {}, final {} {}, target {} {}, difference {} {}",
                result.allocations().size(),
                UnitAmountFormatter.format(result.totalOriginalUnits(), decimals), coinProperties.getTicker(),
                UnitAmountFormatter.format(totalFinal, decimals), coinProperties.getTicker(),
                UnitAmountFormatter.format(result.targetCapUnits(), decimals), coinProperties.getTicker(),
                UnitAmountFormatter.format(result.targetCapUnits().subtract(totalFinal), decimals),
                coinProperties.getTicker());
    }
}
