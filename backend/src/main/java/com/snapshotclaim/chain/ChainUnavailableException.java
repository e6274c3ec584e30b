package com.snapshotclaim.chain;

/**
 * Thrown when the chain node cannot give a usable answer: timeout, transport error, non-2xx status,
 * malformed body or local rate-limit denial.
 */
public class ChainUnavailableException extends RuntimeException {

    public ChainUnavailableException(String message) {
        super(message);
    }

    public ChainUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
