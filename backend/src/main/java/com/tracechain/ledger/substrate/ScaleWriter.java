package com.tracechain.ledger.substrate;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

/**
 * Minimal SCALE encoder: fixed-width little-endian integers, compact integers, byte vectors and strings.
 */
public class ScaleWriter {

    private static final BigInteger FOUR_BYTE_LIMIT = BigInteger.ONE.shiftLeft(30);

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();

    public ScaleWriter writeByte(int value) {
        out.write(value & 0xff);
        return this;
    }

    public ScaleWriter writeBytes(byte[] bytes) {
        out.write(bytes, 0, bytes.length);
        return this;
    }

    public ScaleWriter writeU32(long value) {
        for (int i = 0; i < 4; i++) {
            out.write((int) (value >>> (8 * i)) & 0xff);
        }
        return this;
    }

    public ScaleWriter writeU64(long value) {
        for (int i = 0; i < 8; i++) {
            out.write((int) (value >>> (8 * i)) & 0xff);
        }
        return this;
    }

    public ScaleWriter writeCompact(long value) {
        return writeCompact(BigInteger.valueOf(value));
    }

    /**
     * Compact integer: single byte below 2^6, two bytes below 2^14, four bytes below 2^30, then big-integer mode
     * (length prefix followed by the minimal little-endian bytes).
     */
    public ScaleWriter writeCompact(BigInteger value) {
        if (value.signum() < 0) {
            throw new IllegalArgumentException("Compact integers are unsigned: " + value);
        }
        long v = value.bitLength() < 63 ? value.longValue() : -1L;
        if (v >= 0 && v < 64) {
            return writeByte((int) (v << 2));
        }
        if (v >= 0 && v < (1 << 14)) {
            long encoded = (v << 2) | 0b01;
            return writeByte((int) encoded).writeByte((int) (encoded >>> 8));
        }
        if (value.compareTo(FOUR_BYTE_LIMIT) < 0) {
            return writeU32((v << 2) | 0b10);
        }
        byte[] be = value.toByteArray();
        int start = be[0] == 0 ? 1 : 0;
        int length = be.length - start;
        writeByte(((length - 4) << 2) | 0b11);
        for (int i = be.length - 1; i >= start; i--) {
            out.write(be[i]);
        }
        return this;
    }

    /** Vec&lt;u8&gt;: compact length prefix followed by the bytes. */
    public ScaleWriter writeVec(byte[] bytes) {
        writeCompact(bytes.length);
        return writeBytes(bytes);
    }

    public ScaleWriter writeString(String value) {
        return writeVec((value == null ? "" : value).getBytes(StandardCharsets.UTF_8));
    }

    public byte[] toByteArray() {
        return out.toByteArray();
    }

    public static byte[] encodeString(String value) {
        return new ScaleWriter().writeString(value).toByteArray();
    }
}
