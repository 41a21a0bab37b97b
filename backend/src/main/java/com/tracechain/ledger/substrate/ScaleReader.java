package com.tracechain.ledger.substrate;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Cursor-based SCALE decoder, the counterpart of {@link ScaleWriter}.
 */
public class ScaleReader {

    private final byte[] data;
    private int position;

    public ScaleReader(byte[] data) {
        this.data = data;
    }

    public int readByte() {
        require(1);
        return data[position++] & 0xff;
    }

    public byte[] readBytes(int length) {
        require(length);
        byte[] out = Arrays.copyOfRange(data, position, position + length);
        position += length;
        return out;
    }

    public long readU32() {
        long value = 0;
        for (int i = 0; i < 4; i++) {
            value |= (long) readByte() << (8 * i);
        }
        return value;
    }

    public long readU64() {
        long value = 0;
        for (int i = 0; i < 8; i++) {
            value |= (long) readByte() << (8 * i);
        }
        return value;
    }

    public BigInteger readCompactBig() {
        int first = readByte();
        switch (first & 0b11) {
            case 0b00:
                return BigInteger.valueOf(first >>> 2);
            case 0b01:
                return BigInteger.valueOf(((long) readByte() << 6) | (first >>> 2));
            case 0b10:
                long rest = readByte() | ((long) readByte() << 8) | ((long) readByte() << 16);
                return BigInteger.valueOf((rest << 6) | (first >>> 2));
            default:
                int length = (first >>> 2) + 4;
                byte[] le = readBytes(length);
                byte[] be = new byte[length];
                for (int i = 0; i < length; i++) {
                    be[i] = le[length - 1 - i];
                }
                return new BigInteger(1, be);
        }
    }

    /**
     * @throws IllegalArgumentException when the value does not fit in a long
     */
    public long readCompact() {
        BigInteger value = readCompactBig();
        if (value.bitLength() > 63) {
            throw new IllegalArgumentException("Compact value too large: " + value);
        }
        return value.longValue();
    }

    public byte[] readVec() {
        long length = readCompact();
        if (length > remaining()) {
            throw new IllegalArgumentException("Vector length " + length + " exceeds remaining " + remaining());
        }
        return readBytes((int) length);
    }

    public String readString() {
        return new String(readVec(), StandardCharsets.UTF_8);
    }

    public int remaining() {
        return data.length - position;
    }

    public int position() {
        return position;
    }

    private void require(int length) {
        if (length < 0 || position + length > data.length) {
            throw new IllegalArgumentException("Unexpected end of SCALE input at " + position);
        }
    }
}
