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
 * ABI encoding for the EventLog contract: {@code logEvent}, {@code logDocument}, {@code getEvent},
 * {@code getDocument} and the {@code EventLogged} / {@code DocumentLogged} events.
 *
 * <p>Both events index their id strings, so logs only carry keccak hashes of them. The ids are recovered from the
 * calling transaction's input with {@link #decodeLogEventInput(String)}.
 */
public class EventLogContract {

    public static final String FUNC_LOG_EVENT = "logEvent";
    public static final String FUNC_LOG_DOCUMENT = "logDocument";
    public static final String FUNC_GET_EVENT = "getEvent";
    public static final String FUNC_GET_DOCUMENT = "getDocument";

    public static final Event EVENT_LOGGED_EVENT = new Event("EventLogged",
            Arrays.<TypeReference<?>>asList(
                    new TypeReference<Utf8String>(true) {},
                    new TypeReference<Utf8String>(true) {},
                    new TypeReference<Utf8String>() {}));

    public static final Event DOCUMENT_LOGGED_EVENT = new Event("DocumentLogged",
            Arrays.<TypeReference<?>>asList(
                    new TypeReference<Utf8String>(true) {},
                    new TypeReference<Utf8String>() {}));

    private static final Function LOG_EVENT_INPUTS = new Function(FUNC_LOG_EVENT,
            Collections.emptyList(),
            Arrays.<TypeReference<?>>asList(
                    new TypeReference<Utf8String>() {},
                    new TypeReference<Utf8String>() {},
                    new TypeReference<Utf8String>() {},
                    new TypeReference<Utf8String>() {},
                    new TypeReference<Utf8String>() {}));

    private static final Function LOG_DOCUMENT_INPUTS = new Function(FUNC_LOG_DOCUMENT,
            Collections.emptyList(),
            Arrays.<TypeReference<?>>asList(
                    new TypeReference<Utf8String>() {},
                    new TypeReference<Utf8String>() {},
                    new TypeReference<Utf8String>() {}));

    private static final String LOG_EVENT_SELECTOR = selector(FUNC_LOG_EVENT, 5);
    private static final String LOG_DOCUMENT_SELECTOR = selector(FUNC_LOG_DOCUMENT, 3);

    private final String address;

    public EventLogContract(String address) {
        this.address = address;
    }

    public String getAddress() {
        return address;
    }

    public String encodeLogEvent(String shipmentId, String eventId, String eventType, String dataHash, String metadata) {
        return FunctionEncoder.encode(new Function(FUNC_LOG_EVENT,
                Arrays.<Type>asList(
                        new Utf8String(nullToEmpty(shipmentId)),
                        new Utf8String(eventId),
                        new Utf8String(nullToEmpty(eventType)),
                        new Utf8String(dataHash),
                        new Utf8String(nullToEmpty(metadata))),
                Collections.emptyList()));
    }

    public String encodeLogDocument(String documentId, String documentHash, String metadata) {
        return FunctionEncoder.encode(new Function(FUNC_LOG_DOCUMENT,
                Arrays.<Type>asList(
                        new Utf8String(documentId),
                        new Utf8String(documentHash),
                        new Utf8String(nullToEmpty(metadata))),
                Collections.emptyList()));
    }

    public String encodeGetEvent(String eventId) {
        return FunctionEncoder.encode(getEventFunction(eventId));
    }

    public String encodeGetDocument(String documentHash) {
        return FunctionEncoder.encode(getDocumentFunction(documentHash));
    }

    /** Empty when the contract returned the zero struct (unknown event). */
    @SuppressWarnings("rawtypes")
    public Optional<StoredEvent> decodeGetEvent(String eventId, String output) {
        List<Type> values = FunctionReturnDecoder.decode(output, getEventFunction(eventId).getOutputParameters());
        if (values.size() < 5) {
            return Optional.empty();
        }
        BigInteger timestamp = ((Uint256) values.get(3)).getValue();
        if (timestamp.signum() == 0) {
            return Optional.empty();
        }
        return Optional.of(new StoredEvent(
                ((Utf8String) values.get(0)).getValue(),
                ((Utf8String) values.get(1)).getValue(),
                ((Utf8String) values.get(2)).getValue(),
                timestamp.longValue(),
                ((Utf8String) values.get(4)).getValue()));
    }

    /** Empty when the contract returned the zero struct (unknown document). */
    @SuppressWarnings("rawtypes")
    public Optional<StoredDocument> decodeGetDocument(String documentHash, String output) {
        List<Type> values = FunctionReturnDecoder.decode(output, getDocumentFunction(documentHash).getOutputParameters());
        if (values.size() < 2) {
            return Optional.empty();
        }
        BigInteger timestamp = ((Uint256) values.get(0)).getValue();
        if (timestamp.signum() == 0) {
            return Optional.empty();
        }
        return Optional.of(new StoredDocument(timestamp.longValue(), ((Utf8String) values.get(1)).getValue()));
    }

    /** Decodes a logEvent transaction input; empty for any other call. */
    @SuppressWarnings("rawtypes")
    public Optional<LoggedEventCall> decodeLogEventInput(String input) {
        if (input == null || !input.startsWith(LOG_EVENT_SELECTOR)) {
            return Optional.empty();
        }
        List<Type> args = FunctionReturnDecoder.decode("0x" + input.substring(10), LOG_EVENT_INPUTS.getOutputParameters());
        if (args.size() < 5) {
            return Optional.empty();
        }
        return Optional.of(new LoggedEventCall(
                ((Utf8String) args.get(0)).getValue(),
                ((Utf8String) args.get(1)).getValue(),
                ((Utf8String) args.get(2)).getValue(),
                ((Utf8String) args.get(3)).getValue()));
    }

    /** Decodes a logDocument transaction input to the document hash; empty for any other call. */
    @SuppressWarnings("rawtypes")
    public Optional<String> decodeLoggedDocumentHash(String input) {
        if (input == null || !input.startsWith(LOG_DOCUMENT_SELECTOR)) {
            return Optional.empty();
        }
        List<Type> args = FunctionReturnDecoder.decode("0x" + input.substring(10), LOG_DOCUMENT_INPUTS.getOutputParameters());
        return args.size() < 2 ? Optional.empty() : Optional.of(((Utf8String) args.get(1)).getValue());
    }

    public static String documentLoggedTopic() {
        return EventEncoder.encode(DOCUMENT_LOGGED_EVENT);
    }

    public static String eventLoggedTopic() {
        return EventEncoder.encode(EVENT_LOGGED_EVENT);
    }

    private static Function getEventFunction(String eventId) {
        return new Function(FUNC_GET_EVENT,
                Arrays.<Type>asList(new Utf8String(eventId)),
                Arrays.<TypeReference<?>>asList(
                        new TypeReference<Utf8String>() {},
                        new TypeReference<Utf8String>() {},
                        new TypeReference<Utf8String>() {},
                        new TypeReference<Uint256>() {},
                        new TypeReference<Utf8String>() {}));
    }

    private static Function getDocumentFunction(String documentHash) {
        return new Function(FUNC_GET_DOCUMENT,
                Arrays.<Type>asList(new Utf8String(documentHash)),
                Arrays.<TypeReference<?>>asList(
                        new TypeReference<Uint256>() {},
                        new TypeReference<Utf8String>() {}));
    }

    @SuppressWarnings("rawtypes")
    private static String selector(String name, int stringArgs) {
        Type[] args = new Type[stringArgs];
        Arrays.fill(args, new Utf8String(""));
        return FunctionEncoder.encode(new Function(name, Arrays.asList(args), Collections.emptyList())).substring(0, 10);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    public record StoredEvent(String shipmentId, String eventType, String dataHash, long timestamp, String metadata) {
    }

    public record StoredDocument(long timestamp, String metadata) {
    }

    public record LoggedEventCall(String shipmentId, String eventId, String eventType, String dataHash) {
    }
}
