package com.snapshotclaim.chain;

/**
 * Address-indexer tip reported by the node.
 */
public record IndexerTip(String tipHash, long tipHeight) {
}
