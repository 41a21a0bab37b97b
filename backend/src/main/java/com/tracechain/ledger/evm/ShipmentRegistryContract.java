package com.tracechain.ledger.evm;

import org.web3j.abi.EventEncoder;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Event;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.Utf8String;
import org.web3j.abi.datatypes.generated.Uint256;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * ABI encoding for the ShipmentRegistry contract:
 * {@code registerShipment(string,string,string,string)}, {@code getShipment(string)} and the
 * {@code ShipmentRegistered(string indexed,string,string)} event.
 */
public class ShipmentRegistryContract {

    public static final String FUNC_REGISTER_SHIPMENT = "registerShipment";
    public static final String FUNC_GET_SHIPMENT = "getShipment";

    public static final Event SHIPMENT_REGISTERED_EVENT = new Event("ShipmentRegistered",
            Arrays.<TypeReference<?>>asList(
                    new TypeReference<Utf8String>(true) {},
                    new TypeReference<Utf8String>() {},
                    new TypeReference<Utf8String>() {}));

    private static final Function REGISTER_SHIPMENT_INPUTS = new Function(FUNC_REGISTER_SHIPMENT,
            Collections.emptyList(),
            Arrays.<TypeReference<?>>asList(
                    new TypeReference<Utf8String>() {},
                    new TypeReference<Utf8String>() {},
                    new TypeReference<Utf8String>() {},
                    new TypeReference<Utf8String>() {}));

    private static final String REGISTER_SHIPMENT_SELECTOR = FunctionEncoder.encode(new Function(FUNC_REGISTER_SHIPMENT,
            Arrays.<Type>asList(new Utf8String(""), new Utf8String(""), new Utf8String(""), new Utf8String("")),
            Collections.emptyList())).substring(0, 10);

    private final String address;

    public ShipmentRegistryContract(String address) {
        this.address = address;
    }

    public String getAddress() {
        return address;
    }

    public String encodeRegisterShipment(String shipmentId, String trackingNumber, String dataHash, String metadata) {
        Function function = new Function(FUNC_REGISTER_SHIPMENT,
                Arrays.<Type>asList(
                        new Utf8String(shipmentId),
                        new Utf8String(nullToEmpty(trackingNumber)),
                        new Utf8String(dataHash),
                        new Utf8String(nullToEmpty(metadata))),
                Collections.emptyList());
        return FunctionEncoder.encode(function);
    }

    public String encodeGetShipment(String shipmentId) {
        return FunctionEncoder.encode(getShipmentFunction(shipmentId));
    }

    /**
     * Decodes {@code getShipment} output. Empty when the contract returned the zero struct (unknown shipment).
     */
    @SuppressWarnings("rawtypes")
    public Optional<StoredShipment> decodeGetShipment(String shipmentId, String output) {
        List<Type> values = FunctionReturnDecoder.decode(output, getShipmentFunction(shipmentId).getOutputParameters());
        if (values.size() < 4) {
            return Optional.empty();
        }
        String trackingNumber = ((Utf8String) values.get(0)).getValue();
        String dataHash = ((Utf8String) values.get(1)).getValue();
        BigInteger timestamp = ((Uint256) values.get(2)).getValue();
        String metadata = ((Utf8String) values.get(3)).getValue();
        if (timestamp.signum() == 0 && trackingNumber.isEmpty() && dataHash.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new StoredShipment(trackingNumber, dataHash, timestamp.longValue(), metadata));
    }

    /** Decodes a registerShipment transaction input; empty for any other call. */
    @SuppressWarnings("rawtypes")
    public Optional<String> decodeRegisteredShipmentId(String input) {
        if (input == null || !input.startsWith(REGISTER_SHIPMENT_SELECTOR)) {
            return Optional.empty();
        }
        List<Type> args = FunctionReturnDecoder.decode("0x" + input.substring(10), REGISTER_SHIPMENT_INPUTS.getOutputParameters());
        return args.isEmpty() ? Optional.empty() : Optional.of(((Utf8String) args.get(0)).getValue());
    }

    public static String shipmentRegisteredTopic() {
        return EventEncoder.encode(SHIPMENT_REGISTERED_EVENT);
    }

    private static Function getShipmentFunction(String shipmentId) {
        return new Function(FUNC_GET_SHIPMENT,
                Arrays.<Type>asList(new Utf8String(shipmentId)),
                Arrays.<TypeReference<?>>asList(
                        new TypeReference<Utf8String>() {},
                        new TypeReference<Utf8String>() {},
                        new TypeReference<Uint256>() {},
                        new TypeReference<Utf8String>() {}));
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    public record StoredShipment(String trackingNumber, String dataHash, long timestamp, String metadata) {
    }
}
