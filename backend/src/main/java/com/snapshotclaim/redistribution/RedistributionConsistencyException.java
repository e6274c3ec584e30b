package com.snapshotclaim.redistribution;

/**
 * Final balances do not sum to the target cap after remainder absorption.
 */
public class RedistributionConsistencyException extends RuntimeException {

    public RedistributionConsistencyException(String message) {
        super(message);
    }
}
