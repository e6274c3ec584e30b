package com.snapshotclaim.redistribution.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

/**
 * Redistribution pool (snapshotclaim.redistribution.*). The target cap is totalSupply * capRatio whole coins.
 */
@ConfigurationProperties(prefix = "snapshotclaim.redistribution")
@Validated
@Getter
@Setter
public class RedistributionProperties {

    /** Total coin supply in whole coins. Required. */
    @NotNull
    @Positive
    private BigDecimal totalSupply;

    @NotNull
    @DecimalMin("0")
    @DecimalMax("1")
    private BigDecimal capRatio = new BigDecimal("0.5");
}
