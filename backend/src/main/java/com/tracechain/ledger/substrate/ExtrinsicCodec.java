package com.tracechain.ledger.substrate;

import java.util.HexFormat;
import java.util.Optional;

/**
 * Builds and parses version 4 signed extrinsics with an Ed25519 MultiSignature and an immortal era.
 *
 * <pre>
 * compact(len) | 0x84 | 0x00 accountId[32] | 0x00 signature[64] | era | compact(nonce) | compact(tip) [| mode] | call
 * </pre>
 * The signed payload is {@code call | extra | specVersion | txVersion | genesis | genesis [| 0x00]}, replaced by its
 * blake2b-256 hash when longer than 256 bytes.
 */
public final class ExtrinsicCodec {

    static final int SIGNED_V4 = 0x84;
    private static final int MULTI_ADDRESS_ID = 0x00;
    private static final int ED25519 = 0x00;
    private static final int SR25519 = 0x01;
    private static final int ECDSA = 0x02;
    private static final int IMMORTAL_ERA = 0x00;
    private static final int MAX_UNHASHED_PAYLOAD = 256;

    private ExtrinsicCodec() {
    }

    public static byte[] sign(byte[] call, SubstrateKeypair keypair, long nonce, SubstrateRuntime runtime,
                              boolean metadataHashExtension) {
        byte[] extra = extra(nonce, metadataHashExtension);
        ScaleWriter payload = new ScaleWriter()
                .writeBytes(call)
                .writeBytes(extra)
                .writeU32(runtime.specVersion())
                .writeU32(runtime.transactionVersion())
                .writeBytes(runtime.genesisHash())
                .writeBytes(runtime.genesisHash());
        if (metadataHashExtension) {
            payload.writeByte(0x00);
        }
        byte[] toSign = payload.toByteArray();
        if (toSign.length > MAX_UNHASHED_PAYLOAD) {
            toSign = SubstrateHashing.blake2b256(toSign);
        }
        byte[] signature = keypair.sign(toSign);

        byte[] body = new ScaleWriter()
                .writeByte(SIGNED_V4)
                .writeByte(MULTI_ADDRESS_ID)
                .writeBytes(keypair.getPublicKey())
                .writeByte(ED25519)
                .writeBytes(signature)
                .writeBytes(extra)
                .writeBytes(call)
                .toByteArray();
        return new ScaleWriter().writeVec(body).toByteArray();
    }

    /**
     * Call bytes of a signed v4 extrinsic with the given extension layout. Empty for unsigned extrinsics, other
     * versions or address kinds this codec does not model.
     */
    public static Optional<byte[]> signedCall(byte[] extrinsic, boolean metadataHashExtension) {
        try {
            ScaleReader reader = new ScaleReader(extrinsic);
            reader.readCompact();
            if (reader.readByte() != SIGNED_V4 || reader.readByte() != MULTI_ADDRESS_ID) {
                return Optional.empty();
            }
            reader.readBytes(32);
            int signatureType = reader.readByte();
            if (signatureType == ED25519 || signatureType == SR25519) {
                reader.readBytes(64);
            } else if (signatureType == ECDSA) {
                reader.readBytes(65);
            } else {
                return Optional.empty();
            }
            if (reader.readByte() != IMMORTAL_ERA) {
                reader.readByte();
            }
            reader.readCompact();
            reader.readCompactBig();
            if (metadataHashExtension) {
                reader.readByte();
            }
            return Optional.of(reader.readBytes(reader.remaining()));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /** 0x-hex blake2b-256 of the full encoding, the hash nodes report for an extrinsic. */
    public static String hash(byte[] extrinsic) {
        return "0x" + HexFormat.of().formatHex(SubstrateHashing.blake2b256(extrinsic));
    }

    private static byte[] extra(long nonce, boolean metadataHashExtension) {
        ScaleWriter writer = new ScaleWriter()
                .writeByte(IMMORTAL_ERA)
                .writeCompact(nonce)
                .writeCompact(0);
        if (metadataHashExtension) {
            writer.writeByte(0x00);
        }
        return writer.toByteArray();
    }
}
