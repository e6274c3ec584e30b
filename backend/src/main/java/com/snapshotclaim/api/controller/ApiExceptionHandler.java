package com.snapshotclaim.api.controller;

import com.snapshotclaim.api.dto.ErrorBody;
import com.snapshotclaim.chain.ChainUnavailableException;
import com.snapshotclaim.claim.verification.ClaimRejectedException;
import com.snapshotclaim.redistribution.RedistributionConsistencyException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

/**
 * Maps rejections to 400 with the reason code and operational faults to 500 INTERNAL_ERROR.
 * Fault detail is logged, never returned.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    @ExceptionHandler(ClaimRejectedException.class)
    public ResponseEntity<ErrorBody> handleRejection(ClaimRejectedException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of(ex.getReason().name(), ex.getMessage()));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorBody> handleInput(ServerWebInputException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_REQUEST", "Malformed request"));
    }

    @ExceptionHandler(ChainUnavailableException.class)
    public ResponseEntity<ErrorBody> handleChainUnavailable(ChainUnavailableException ex) {
        log.error("Chain node unavailable: {}", ex.getMessage(), ex);
        return internalError();
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorBody> handleDataAccess(DataAccessException ex) {
        log.error("Claim store failure", ex);
        return internalError();
    }

    @ExceptionHandler(RedistributionConsistencyException.class)
    public ResponseEntity<ErrorBody> handleConsistency(RedistributionConsistencyException ex) {
        log.error("Redistribution consistency check failed: {}", ex.getMessage());
        return internalError();
    }

    private static ResponseEntity<ErrorBody> internalError() {
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorBody.of(INTERNAL_ERROR, "Internal server error"));
    }
}
