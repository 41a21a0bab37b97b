package com.tracechain.ledger.substrate;

import net.jpountz.xxhash.XXHash64;
import net.jpountz.xxhash.XXHashFactory;
import org.bouncycastle.crypto.digests.Blake2bDigest;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * Hashers used by Substrate runtimes for storage keys and extrinsic hashes.
 */
public final class SubstrateHashing {

    private static final XXHash64 XX_HASH_64 = XXHashFactory.fastestJavaInstance().hash64();

    private SubstrateHashing() {
    }

    public static byte[] blake2b256(byte[] input) {
        return blake2b(input, 256);
    }

    public static byte[] blake2b128(byte[] input) {
        return blake2b(input, 128);
    }

    public static byte[] blake2b512(byte[] input) {
        return blake2b(input, 512);
    }

    /** Two xxHash64 rounds (seeds 0 and 1), little-endian: the storage prefix hasher. */
    public static byte[] twox128(String input) {
        byte[] data = input.getBytes(StandardCharsets.UTF_8);
        ByteBuffer out = ByteBuffer.allocate(16).order(ByteOrder.LITTLE_ENDIAN);
        out.putLong(XX_HASH_64.hash(data, 0, data.length, 0L));
        out.putLong(XX_HASH_64.hash(data, 0, data.length, 1L));
        return out.array();
    }

    /** blake2b-128 of the key followed by the key itself, so map keys can be recovered from storage keys. */
    public static byte[] blake2128Concat(byte[] key) {
        byte[] hash = blake2b128(key);
        byte[] out = new byte[hash.length + key.length];
        System.arraycopy(hash, 0, out, 0, hash.length);
        System.arraycopy(key, 0, out, hash.length, key.length);
        return out;
    }

    private static byte[] blake2b(byte[] input, int bits) {
        Blake2bDigest digest = new Blake2bDigest(bits);
        digest.update(input, 0, input.length);
        byte[] out = new byte[bits / 8];
        digest.doFinal(out, 0);
        return out;
    }
}
