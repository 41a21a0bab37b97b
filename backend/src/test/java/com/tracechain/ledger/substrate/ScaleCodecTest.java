package com.tracechain.ledger.substrate;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.HexFormat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScaleCodecTest {

    private static String compactHex(long value) {
        return HexFormat.of().formatHex(new ScaleWriter().writeCompact(value).toByteArray());
    }

    @Test
    void writeCompact_modeBoundaries() {
        assertThat(compactHex(0)).isEqualTo("00");
        assertThat(compactHex(1)).isEqualTo("04");
        assertThat(compactHex(63)).isEqualTo("fc");
        assertThat(compactHex(64)).isEqualTo("0101");
        assertThat(compactHex(16383)).isEqualTo("fdff");
        assertThat(compactHex(16384)).isEqualTo("02000100");
        assertThat(compactHex(1L << 30)).isEqualTo("0300000040");
    }

    @Test
    void readCompact_decodesEveryMode() {
        for (long value : new long[]{0, 42, 64, 16383, 16384, (1L << 30) - 1, 1L << 30, 1L << 40}) {
            byte[] encoded = new ScaleWriter().writeCompact(value).toByteArray();
            assertThat(new ScaleReader(encoded).readCompact()).as("compact %d", value).isEqualTo(value);
        }
    }

    @Test
    void writeCompact_negative_rejected() {
        assertThatThrownBy(() -> new ScaleWriter().writeCompact(BigInteger.valueOf(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void fixedWidthIntegers_areLittleEndian() {
        byte[] encoded = new ScaleWriter().writeU32(1).writeU64(0x0102030405060708L).toByteArray();

        assertThat(HexFormat.of().formatHex(encoded)).isEqualTo("010000000807060504030201");
        ScaleReader reader = new ScaleReader(encoded);
        assertThat(reader.readU32()).isEqualTo(1L);
        assertThat(reader.readU64()).isEqualTo(0x0102030405060708L);
        assertThat(reader.remaining()).isZero();
    }

    @Test
    void strings_areLengthPrefixedUtf8() {
        byte[] encoded = ScaleWriter.encodeString("Hà Nội");

        assertThat(encoded[0] & 0xff).isEqualTo(("Hà Nội".getBytes(StandardCharsets.UTF_8).length) << 2);
        assertThat(new ScaleReader(encoded).readString()).isEqualTo("Hà Nội");
        assertThat(ScaleWriter.encodeString(null)).containsExactly(0);
    }

    @Test
    void readVec_lengthBeyondInput_rejected() {
        byte[] truncated = {(byte) (10 << 2), 1, 2};

        assertThatThrownBy(() -> new ScaleReader(truncated).readVec())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("exceeds remaining");
        assertThatThrownBy(() -> new ScaleReader(new byte[0]).readByte())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
