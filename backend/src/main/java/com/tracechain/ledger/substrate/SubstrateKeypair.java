package com.tracechain.ledger.substrate;

import com.tracechain.ledger.LedgerConfigurationException;
import org.bouncycastle.crypto.digests.SHA512Digest;
import org.bouncycastle.crypto.generators.PKCS5S2ParametersGenerator;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.math.ec.rfc8032.Ed25519;
import org.web3j.crypto.MnemonicUtils;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Ed25519 signing key of the submitting account. Derived from a BIP-39 mnemonic the way Substrate tooling does:
 * the mnemonic's entropy (not its seed) goes through PBKDF2-HMAC-SHA512 and the first 32 bytes are the secret seed.
 */
public final class SubstrateKeypair {

    private static final int PBKDF2_ROUNDS = 2048;

    private final byte[] seed;
    private final byte[] publicKey;

    private SubstrateKeypair(byte[] seed) {
        this.seed = seed.clone();
        this.publicKey = new byte[Ed25519.PUBLIC_KEY_SIZE];
        Ed25519.generatePublicKey(this.seed, 0, this.publicKey, 0);
    }

    public static SubstrateKeypair fromSeed(byte[] seed) {
        if (seed == null || seed.length != Ed25519.SECRET_KEY_SIZE) {
            throw new LedgerConfigurationException("Ed25519 seed must be 32 bytes");
        }
        return new SubstrateKeypair(seed);
    }

    /**
     * @throws LedgerConfigurationException when the mnemonic is missing or not a valid BIP-39 phrase
     */
    public static SubstrateKeypair fromMnemonic(String mnemonic, String password) {
        if (mnemonic == null || mnemonic.isBlank()) {
            throw new LedgerConfigurationException("Substrate mnemonic not configured");
        }
        byte[] entropy;
        try {
            entropy = MnemonicUtils.generateEntropy(mnemonic.trim());
        } catch (RuntimeException e) {
            throw new LedgerConfigurationException("Substrate mnemonic is not a valid BIP-39 phrase", e);
        }
        byte[] salt = ("mnemonic" + (password == null ? "" : password)).getBytes(StandardCharsets.UTF_8);
        PKCS5S2ParametersGenerator generator = new PKCS5S2ParametersGenerator(new SHA512Digest());
        generator.init(entropy, salt, PBKDF2_ROUNDS);
        byte[] derived = ((KeyParameter) generator.generateDerivedParameters(512)).getKey();
        return new SubstrateKeypair(Arrays.copyOf(derived, Ed25519.SECRET_KEY_SIZE));
    }

    public byte[] sign(byte[] message) {
        byte[] signature = new byte[Ed25519.SIGNATURE_SIZE];
        Ed25519.sign(seed, 0, message, 0, message.length, signature, 0);
        return signature;
    }

    public boolean verify(byte[] message, byte[] signature) {
        return Ed25519.verify(signature, 0, publicKey, 0, message, 0, message.length);
    }

    public byte[] getPublicKey() {
        return publicKey.clone();
    }

    /** SS58 address of the public key for the given network prefix (42 = generic Substrate). */
    public String ss58Address(int networkPrefix) {
        return Ss58.encode(publicKey, networkPrefix);
    }
}
