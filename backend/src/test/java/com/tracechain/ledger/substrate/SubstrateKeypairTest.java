package com.tracechain.ledger.substrate;

import com.tracechain.ledger.LedgerConfigurationException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.HexFormat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SubstrateKeypairTest {

    private static final HexFormat HEX = HexFormat.of();

    @Test
    void fromSeed_rfc8032Vector() {
        SubstrateKeypair keypair = SubstrateKeypair.fromSeed(
                HEX.parseHex("9d61b19deffd5a60ba844af492ec2cc44449c5697b326919703bac031cae7f60"));

        assertThat(HEX.formatHex(keypair.getPublicKey()))
                .isEqualTo("d75a980182b10ab7d54bfed3c964073a0ee172f3daa62325af021a68f707511a");
        assertThat(HEX.formatHex(keypair.sign(new byte[0]))).isEqualTo(
                "e5564300c360ac729086e2cc806e828a84877f1eb8e5d974d873e065224901555fb8821590a33bacc61e39701cf9b46bd25bf5f0595bbe24655141438e7a100b");
    }

    @Test
    void sign_verifiesAndDetectsTampering() {
        SubstrateKeypair keypair = SubstrateKeypair.fromSeed(new byte[32]);
        byte[] message = "register_event".getBytes(StandardCharsets.UTF_8);

        byte[] signature = keypair.sign(message);

        assertThat(keypair.verify(message, signature)).isTrue();
        message[0] ^= 1;
        assertThat(keypair.verify(message, signature)).isFalse();
    }

    @Test
    void fromMnemonic_isDeterministicAndPasswordSensitive() {
        String mnemonic = "bottom drive obey lake curtain smoke basket hold race lonely fit walk";

        SubstrateKeypair a = SubstrateKeypair.fromMnemonic(mnemonic, null);
        SubstrateKeypair b = SubstrateKeypair.fromMnemonic("  " + mnemonic + " ", "");
        SubstrateKeypair withPassword = SubstrateKeypair.fromMnemonic(mnemonic, "secret");

        assertThat(a.getPublicKey()).isEqualTo(b.getPublicKey());
        assertThat(a.getPublicKey()).isNotEqualTo(withPassword.getPublicKey());
        assertThat(a.ss58Address(42)).startsWith("5");
    }

    @Test
    void invalidKeyMaterial_isConfigurationError() {
        assertThatThrownBy(() -> SubstrateKeypair.fromMnemonic(" ", null))
                .isInstanceOf(LedgerConfigurationException.class)
                .hasMessageContaining("not configured");
        assertThatThrownBy(() -> SubstrateKeypair.fromMnemonic("definitely not a phrase", null))
                .isInstanceOf(LedgerConfigurationException.class);
        assertThatThrownBy(() -> SubstrateKeypair.fromSeed(new byte[31]))
                .isInstanceOf(LedgerConfigurationException.class);
    }

    @Test
    void ss58_encodesKnownAccount() {
        byte[] alice = HEX.parseHex("d43593c715fdd31c61141abd04a99fd6822c8558854ccde39a5684e7a56da27d");

        assertThat(Ss58.encode(alice, 42)).isEqualTo("5GrwvaEF5zXb26Fz9rcQpDWS57CtERHpNehXCPcNoHGKutQY");
    }
}
