package com.tracechain.ledger.substrate;

import com.tracechain.domain.EntityKind;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;

/**
 * Call and storage layout of the LogisticsTraceability pallet. All ids, hashes and metadata are stored as
 * UTF-8 byte vectors; maps are keyed with Blake2_128Concat.
 */
public class LogisticsPallet {

    public static final String SHIPMENTS = "Shipments";
    public static final String EVENTS = "Events";
    public static final String DOCUMENTS = "Documents";

    private static final int PREFIX_LENGTH = 32;
    private static final int BLAKE2_128_LENGTH = 16;

    private final SubstrateSettings settings;

    public LogisticsPallet(SubstrateSettings settings) {
        this.settings = settings;
    }

    public byte[] registerShipmentCall(String shipmentId, String trackingNumber, String dataHash, String metadata) {
        return call(settings.registerShipmentCallIndex(), shipmentId, trackingNumber, dataHash, metadata);
    }

    public byte[] registerEventCall(String shipmentId, String eventId, String eventType, String dataHash, String metadata) {
        return call(settings.registerEventCallIndex(), shipmentId, eventId, eventType, dataHash, metadata);
    }

    public byte[] registerDocumentCall(String documentId, String documentHash, String metadata) {
        return call(settings.registerDocumentCallIndex(), documentId, documentHash, metadata);
    }

    /**
     * Decodes a call of this pallet. Empty for calls to other pallets or unknown call indices.
     */
    public Optional<DecodedCall> decodeCall(byte[] call) {
        if (call.length < 2 || (call[0] & 0xff) != settings.palletIndex()) {
            return Optional.empty();
        }
        int callIndex = call[1] & 0xff;
        EntityKind kind;
        int argCount;
        if (callIndex == settings.registerShipmentCallIndex()) {
            kind = EntityKind.SHIPMENT;
            argCount = 4;
        } else if (callIndex == settings.registerEventCallIndex()) {
            kind = EntityKind.EVENT;
            argCount = 5;
        } else if (callIndex == settings.registerDocumentCallIndex()) {
            kind = EntityKind.DOCUMENT;
            argCount = 3;
        } else {
            return Optional.empty();
        }
        ScaleReader reader = new ScaleReader(Arrays.copyOfRange(call, 2, call.length));
        List<String> args = new ArrayList<>(argCount);
        for (int i = 0; i < argCount; i++) {
            args.add(reader.readString());
        }
        return Optional.of(new DecodedCall(kind, args));
    }

    /** Full storage key of a map entry, 0x-hex. */
    public String storageKey(String item, String key) {
        byte[] prefix = storagePrefixBytes(item);
        byte[] hashedKey = SubstrateHashing.blake2128Concat(ScaleWriter.encodeString(key));
        byte[] out = Arrays.copyOf(prefix, prefix.length + hashedKey.length);
        System.arraycopy(hashedKey, 0, out, prefix.length, hashedKey.length);
        return "0x" + HexFormat.of().formatHex(out);
    }

    /** twox128(pallet) ++ twox128(item), 0x-hex; the common prefix of all entries of a map. */
    public String storagePrefix(String item) {
        return "0x" + HexFormat.of().formatHex(storagePrefixBytes(item));
    }

    /** Recovers the SCALE-encoded string key from a Blake2_128Concat storage key. */
    public String keyFromStorageKey(byte[] storageKey) {
        int offset = PREFIX_LENGTH + BLAKE2_128_LENGTH;
        return new ScaleReader(Arrays.copyOfRange(storageKey, offset, storageKey.length)).readString();
    }

    public StoredShipment decodeShipment(byte[] value) {
        ScaleReader reader = new ScaleReader(value);
        return new StoredShipment(reader.readString(), reader.readString(), reader.readString(), reader.readU64(),
                registrar(reader));
    }

    public StoredEvent decodeEvent(byte[] value) {
        ScaleReader reader = new ScaleReader(value);
        return new StoredEvent(reader.readString(), reader.readString(), reader.readString(), reader.readString(),
                reader.readU64(), registrar(reader));
    }

    public StoredDocument decodeDocument(byte[] value) {
        ScaleReader reader = new ScaleReader(value);
        return new StoredDocument(reader.readString(), reader.readString(), reader.readU64(), registrar(reader));
    }

    private String registrar(ScaleReader reader) {
        return Ss58.encode(reader.readBytes(32), settings.ss58Prefix());
    }

    private byte[] storagePrefixBytes(String item) {
        byte[] pallet = SubstrateHashing.twox128(settings.palletName());
        byte[] storage = SubstrateHashing.twox128(item);
        byte[] out = Arrays.copyOf(pallet, PREFIX_LENGTH);
        System.arraycopy(storage, 0, out, pallet.length, storage.length);
        return out;
    }

    private byte[] call(int callIndex, String... args) {
        ScaleWriter writer = new ScaleWriter()
                .writeByte(settings.palletIndex())
                .writeByte(callIndex);
        for (String arg : args) {
            writer.writeString(arg);
        }
        return writer.toByteArray();
    }

    /**
     * A decoded pallet call; args in declaration order.
     */
    public record DecodedCall(EntityKind kind, List<String> args) {

        /** Shipment id, event id or document hash, matching what the register call anchors. */
        public String entityId() {
            return switch (kind) {
                case SHIPMENT -> args.get(0);
                case EVENT -> args.get(1);
                case DOCUMENT -> args.get(1);
            };
        }
    }

    public record StoredShipment(String trackingNumber, String dataHash, String metadata, long timestamp, String registrar) {
    }

    public record StoredEvent(String shipmentId, String eventType, String dataHash, String metadata, long timestamp,
                              String registrar) {
    }

    public record StoredDocument(String documentHash, String metadata, long timestamp, String registrar) {
    }
}
