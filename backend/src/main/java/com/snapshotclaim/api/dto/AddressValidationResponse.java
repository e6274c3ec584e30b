package com.snapshotclaim.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record AddressValidationResponse(
        @JsonProperty("isValid") boolean valid,
        @JsonProperty("isWitness") boolean witness
) {
}
