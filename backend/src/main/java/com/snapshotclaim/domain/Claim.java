package com.snapshotclaim.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One verified snapshot claim. Written once by the claim verifier, never updated or deleted.
 * sourceAddress is the natural key; the unique index is the only guarantee of one claim per source address.
 */
@Document(collection = "claims")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Claim {

    public static final String SOURCE_ADDRESS_FIELD = "sourceAddress";
    public static final String SOURCE_ADDRESS_INDEX = "source_address_unique";

    @Id
    @EqualsAndHashCode.Include
    private String id;

    @Indexed(name = SOURCE_ADDRESS_INDEX, unique = true)
    private String sourceAddress;

    @Indexed
    private String destinationAddress;

    /** Verified on-chain balance at snapshot height, in smallest units. */
    private long claimedBalance;

    private String signature;

    /** Submitted request body as compact JSON, kept verbatim for audit and export. */
    private String rawPayload;

    private Instant createdAt;

    public static Claim of(String sourceAddress, String destinationAddress, long claimedBalance,
                           String signature, String rawPayload, Instant createdAt) {
        Claim claim = new Claim();
        claim.setSourceAddress(sourceAddress);
        claim.setDestinationAddress(destinationAddress);
        claim.setClaimedBalance(claimedBalance);
        claim.setSignature(signature);
        claim.setRawPayload(rawPayload);
        claim.setCreatedAt(createdAt);
        return claim;
    }
}
