package com.tracechain.ledger.substrate;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HexFormat;

import static org.assertj.core.api.Assertions.assertThat;

class SubstrateHashingTest {

    private static String hex(byte[] bytes) {
        return HexFormat.of().formatHex(bytes);
    }

    @Test
    void twox128_matchesWellKnownStoragePrefixes() {
        assertThat(hex(SubstrateHashing.twox128("System"))).isEqualTo("26aa394eea5630e07c48ae0c9558cef7");
        assertThat(hex(SubstrateHashing.twox128("Account"))).isEqualTo("b99d880ec681799c0cf30e8886371da9");
    }

    @Test
    void blake2b256_emptyInput() {
        assertThat(hex(SubstrateHashing.blake2b256(new byte[0])))
                .isEqualTo("0e5751c026e543b2e8ab2eb06099daa1d1e5df47778f7787faab45cdf12fe3a8");
    }

    @Test
    void blake2128Concat_appendsRawKey() {
        byte[] key = {1, 2, 3};

        byte[] hashed = SubstrateHashing.blake2128Concat(key);

        assertThat(hashed).hasSize(19);
        assertThat(Arrays.copyOfRange(hashed, 0, 16)).isEqualTo(SubstrateHashing.blake2b128(key));
        assertThat(Arrays.copyOfRange(hashed, 16, 19)).isEqualTo(key);
    }
}
