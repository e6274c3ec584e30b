package com.snapshotclaim.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigInteger;

/**
 * Unit definition of the snapshotted coin. Balances are integers in the smallest unit; one whole coin is
 * 10^decimals units.
 */
@ConfigurationProperties(prefix = "snapshotclaim.coin")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class CoinProperties {

    /** Ticker shown next to whole-coin amounts. */
    @NotBlank
    private String ticker = "x42";

    /** Digits after the decimal point; 8 means 100,000,000 units per coin. */
    @Min(0)
    @Max(18)
    private int decimals = 8;

    public BigInteger unitScale() {
        return BigInteger.TEN.pow(decimals);
    }
}
