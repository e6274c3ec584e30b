package com.snapshotclaim.redistribution;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.snapshotclaim.common.UnitAmountFormatter;
import com.snapshotclaim.config.CoinProperties;
import com.snapshotclaim.domain.Claim;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * CSV views of a redistribution result. Amounts are whole-coin strings; quoting follows RFC 4180.
 * <ul>
 *   <li>compact: {@code destination_address,final_balance} per destination, no header</li>
 *   <li>detailed: header plus one row per source claim</li>
 * </ul>
 */
@Component
public class ClaimCsvExporter {

    private final CsvMapper csvMapper;
    private final CsvSchema compactSchema;
    private final CsvSchema detailedSchema;
    private final CoinProperties coinProperties;

    public ClaimCsvExporter(CoinProperties coinProperties) {
        this.coinProperties = coinProperties;
        this.csvMapper = CsvMapper.builder()
                .enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
                .build();
        this.compactSchema = csvMapper.schemaFor(CompactRow.class).withoutHeader();
        this.detailedSchema = csvMapper.schemaFor(DetailedRow.class).withHeader();
    }

    public String exportCompact(RedistributionResult result) {
        List<CompactRow> rows = new ArrayList<>(result.allocations().size());
        for (DestinationAllocation allocation : result.allocations()) {
            rows.add(new CompactRow(allocation.destinationAddress(), units(allocation.finalBalance())));
        }
        return write(compactSchema, rows);
    }

    public String exportDetailed(RedistributionResult result) {
        String deductionPercentage = result.deductionPercentage().toPlainString();
        List<DetailedRow> rows = new ArrayList<>();
        for (DestinationAllocation allocation : result.allocations()) {
            String original = units(allocation.originalBalance());
            String finalBalance = units(allocation.finalBalance());
            String deducted = units(allocation.deductedAmount());
            for (Claim claim : allocation.claims()) {
                rows.add(new DetailedRow(
                        allocation.destinationAddress(),
                        claim.getSourceAddress(),
                        units(BigInteger.valueOf(claim.getClaimedBalance())),
                        original,
                        finalBalance,
                        deducted,
                        deductionPercentage,
                        claim.getSignature(),
                        claim.getRawPayload()));
            }
        }
        return write(detailedSchema, rows);
    }

    private String units(BigInteger amount) {
        return UnitAmountFormatter.format(amount, coinProperties.getDecimals());
    }

    private String write(CsvSchema schema, List<?> rows) {
        try {
            return csvMapper.writer(schema).writeValueAsString(rows);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to write claims CSV", e);
        }
    }

    @JsonPropertyOrder({ "destination_address", "final_balance" })
    record CompactRow(
            @JsonProperty("destination_address") String destinationAddress,
            @JsonProperty("final_balance") String finalBalance
    ) {
    }

    @JsonPropertyOrder({ "destination_address", "source_address", "claimed_balance", "original_balance",
            "final_balance", "destination_deducted_amount", "deduction_percentage", "signature", "raw_payload" })
    record DetailedRow(
            @JsonProperty("destination_address") String destinationAddress,
            @JsonProperty("source_address") String sourceAddress,
            @JsonProperty("claimed_balance") String claimedBalance,
            @JsonProperty("original_balance") String originalBalance,
            @JsonProperty("final_balance") String finalBalance,
            @JsonProperty("destination_deducted_amount") String deductedAmount,
            @JsonProperty("deduction_percentage") String deductionPercentage,
            @JsonProperty("signature") String signature,
            @JsonProperty("raw_payload") String rawPayload
    ) {
    }
}
