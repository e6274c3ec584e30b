package com.snapshotclaim.chain;

public record AddressValidation(boolean valid, boolean witness) {
}
