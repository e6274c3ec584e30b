package com.snapshotclaim.api.controller;

import com.snapshotclaim.api.dto.AddressValidationResponse;
import com.snapshotclaim.api.dto.BalanceResponse;
import com.snapshotclaim.api.dto.BlockHeightResponse;
import com.snapshotclaim.api.dto.ErrorBody;
import com.snapshotclaim.chain.AddressValidation;
import com.snapshotclaim.chain.ChainClient;
import com.snapshotclaim.chain.IndexerTip;
import com.snapshotclaim.claim.config.ClaimProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.OptionalLong;

/**
 * Chain node passthroughs: GET /check-balance, GET /verify-address, GET /get-blockheight.
 */
@RestController
@RequiredArgsConstructor
public class ChainController {

    private final ChainClient chainClient;
    private final ClaimProperties claimProperties;

    @GetMapping("/check-balance")
    public Mono<ResponseEntity<?>> checkBalance(@RequestParam(required = false) String address) {
        if (address == null || address.isBlank()) {
            return Mono.just(addressRequired());
        }
        String addr = address.trim();
        return BlockingCalls.<ResponseEntity<?>>offload(() -> {
            OptionalLong balance = chainClient.getBalance(addr, claimProperties.getMinConfirmations());
            if (balance.isEmpty()) {
                return ResponseEntity.badRequest().body(
                        ErrorBody.of("BALANCE_UNAVAILABLE", "Unable to retrieve balance for the given address"));
            }
            return ResponseEntity.ok(new BalanceResponse(balance.getAsLong()));
        });
    }

    @GetMapping("/verify-address")
    public Mono<ResponseEntity<?>> verifyAddress(@RequestParam(required = false) String address) {
        if (address == null || address.isBlank()) {
            return Mono.just(addressRequired());
        }
        String addr = address.trim();
        return BlockingCalls.<ResponseEntity<?>>offload(() -> {
            AddressValidation validation = chainClient.validateAddress(addr);
            return ResponseEntity.ok(new AddressValidationResponse(validation.valid(), validation.witness()));
        });
    }

    @GetMapping("/get-blockheight")
    public Mono<ResponseEntity<BlockHeightResponse>> blockHeight() {
        return BlockingCalls.offload(() -> {
            IndexerTip tip = chainClient.getIndexerTip();
            return ResponseEntity.ok(new BlockHeightResponse(tip.tipHash(), tip.tipHeight()));
        });
    }

    private static ResponseEntity<ErrorBody> addressRequired() {
        return ResponseEntity.badRequest().body(ErrorBody.of("ADDRESS_REQUIRED", "Address is required"));
    }
}
