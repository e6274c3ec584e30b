package com.snapshotclaim.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;

/**
 * Aggregation output for the claimed balance sum. The server computes it as Decimal128.
 */
@NoArgsConstructor
@Getter
@Setter
public class ClaimBalanceTotal {

    private BigDecimal total;
}
