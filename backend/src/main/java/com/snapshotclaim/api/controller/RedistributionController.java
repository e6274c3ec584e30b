package com.snapshotclaim.api.controller;

import com.snapshotclaim.api.dto.RedistributionResponse;
import com.snapshotclaim.common.UnitAmountFormatter;
import com.snapshotclaim.config.CoinProperties;
import com.snapshotclaim.redistribution.ClaimCsvExporter;
import com.snapshotclaim.redistribution.RedistributionResult;
import com.snapshotclaim.redistribution.RedistributionService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

/**
 * GET /download-csv and GET /redistribution.
 */
@RestController
@RequiredArgsConstructor
public class RedistributionController {

    static final MediaType TEXT_CSV = new MediaType("text", "csv", StandardCharsets.UTF_8);
    static final String CSV_FILENAME = "snapshots.csv";

    private final RedistributionService redistributionService;
    private final ClaimCsvExporter csvExporter;
    private final CoinProperties coinProperties;

    @GetMapping("/download-csv")
    public Mono<ResponseEntity<String>> downloadCsv(@RequestParam(required = false, defaultValue = "false") boolean detailed) {
        return BlockingCalls.offload(() -> {
            RedistributionResult result = redistributionService.currentResult();
            String csv = detailed ? csvExporter.exportDetailed(result) : csvExporter.exportCompact(result);
            return ResponseEntity.ok()
                    .contentType(TEXT_CSV)
                    .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=" + CSV_FILENAME)
                    .body(csv);
        });
    }

    @GetMapping("/redistribution")
    public Mono<ResponseEntity<RedistributionResponse>> redistribution() {
        return BlockingCalls.offload(() -> ResponseEntity.ok(toResponse(redistributionService.currentResult())));
    }

    private RedistributionResponse toResponse(RedistributionResult result) {
        return new RedistributionResponse(
                coins(result.targetCapUnits()),
                coins(result.totalOriginalUnits()),
                coins(result.totalFinalUnits()),
                coins(result.multiplier()),
                result.deductionPercentage().toPlainString(),
                result.allocations().stream()
                        .map(a -> new RedistributionResponse.DestinationEntry(
                                a.destinationAddress(), coins(a.originalBalance()), coins(a.finalBalance())))
                        .toList());
    }

    private String coins(BigInteger units) {
        return UnitAmountFormatter.format(units, coinProperties.getDecimals());
    }
}
