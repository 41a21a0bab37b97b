package com.tracechain.ledger.substrate;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

/**
 * SS58 account address encoding: base58(prefix || publicKey || blake2b-512("SS58PRE" || prefix || publicKey)[0..2]).
 */
public final class Ss58 {

    private static final char[] ALPHABET = "123456789ABCDEFGHJKLMNPQRSTUVWXYZabcdefghijkmnopqrstuvwxyz".toCharArray();
    private static final BigInteger BASE = BigInteger.valueOf(58);
    private static final byte[] CHECKSUM_PREFIX = "SS58PRE".getBytes(StandardCharsets.US_ASCII);

    private Ss58() {
    }

    public static String encode(byte[] publicKey, int networkPrefix) {
        if (networkPrefix < 0 || networkPrefix > 16383) {
            throw new IllegalArgumentException("SS58 prefix out of range: " + networkPrefix);
        }
        ByteArrayOutputStream payload = new ByteArrayOutputStream();
        if (networkPrefix < 64) {
            payload.write(networkPrefix);
        } else {
            payload.write(((networkPrefix & 0b1111_1100) >> 2) | 0b0100_0000);
            payload.write((networkPrefix >> 8) | ((networkPrefix & 0b11) << 6));
        }
        payload.write(publicKey, 0, publicKey.length);
        byte[] body = payload.toByteArray();

        byte[] checksumInput = new byte[CHECKSUM_PREFIX.length + body.length];
        System.arraycopy(CHECKSUM_PREFIX, 0, checksumInput, 0, CHECKSUM_PREFIX.length);
        System.arraycopy(body, 0, checksumInput, CHECKSUM_PREFIX.length, body.length);
        byte[] checksum = SubstrateHashing.blake2b512(checksumInput);

        byte[] full = new byte[body.length + 2];
        System.arraycopy(body, 0, full, 0, body.length);
        full[body.length] = checksum[0];
        full[body.length + 1] = checksum[1];
        return base58(full);
    }

    static String base58(byte[] input) {
        StringBuilder sb = new StringBuilder();
        BigInteger value = new BigInteger(1, input);
        while (value.signum() > 0) {
            BigInteger[] divRem = value.divideAndRemainder(BASE);
            sb.append(ALPHABET[divRem[1].intValue()]);
            value = divRem[0];
        }
        for (int i = 0; i < input.length && input[i] == 0; i++) {
            sb.append(ALPHABET[0]);
        }
        return sb.reverse().toString();
    }
}
