package com.snapshotclaim.chain;

import java.util.OptionalLong;

/**
 * Chain-indexing node queries. Every call is a blocking request/response with a bounded timeout.
 * A well-formed negative answer is returned as a value; anything else (timeout, non-2xx, malformed body)
 * throws {@link ChainUnavailableException}.
 */
public interface ChainClient {

    /**
     * Current address-indexer tip.
     */
    IndexerTip getIndexerTip();

    /**
     * Indexed balance of an address in smallest units.
     *
     * @return empty when the node knows no balance entry for the address
     */
    OptionalLong getBalance(String address, int minConfirmations);

    /**
     * Verifies that {@code signature} signs {@code message} with the key behind {@code address}.
     *
     * @return true only for an affirmative node answer
     */
    boolean verifySignature(String address, String message, String signature);

    AddressValidation validateAddress(String address);
}
