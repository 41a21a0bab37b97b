package com.tracechain.ledger.substrate;

/**
 * Runtime identity every signed extrinsic commits to. Cached per node; refreshed when the cache entry expires.
 */
public record SubstrateRuntime(long specVersion, long transactionVersion, byte[] genesisHash) {
}
