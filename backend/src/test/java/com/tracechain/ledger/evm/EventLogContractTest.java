package com.tracechain.ledger.evm;

import org.junit.jupiter.api.Test;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.Utf8String;
import org.web3j.abi.datatypes.generated.Uint256;

import java.util.Arrays;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class EventLogContractTest {

    private final EventLogContract contract = new EventLogContract("0x00000000000000000000000000000000000000e1");

    @Test
    void decodeLogEventInput_recoversIdsFromCalldata() {
        String input = contract.encodeLogEvent("SHP-1", "EVT-9", "DELIVERED", "ab12", "{\"k\":1}");

        Optional<EventLogContract.LoggedEventCall> call = contract.decodeLogEventInput(input);

        assertThat(call).contains(new EventLogContract.LoggedEventCall("SHP-1", "EVT-9", "DELIVERED", "ab12"));
    }

    @Test
    void decodeLogEventInput_otherFunction_isEmpty() {
        String documentCall = contract.encodeLogDocument("doc_1", "ffee", "{}");

        assertThat(contract.decodeLogEventInput(documentCall)).isEmpty();
        assertThat(contract.decodeLogEventInput(null)).isEmpty();
        assertThat(contract.decodeLoggedDocumentHash(documentCall)).contains("ffee");
    }

    @Test
    void encodeLogEvent_nullOptionalFields_encodedAsEmpty() {
        String input = contract.encodeLogEvent(null, "EVT-1", null, "00", null);

        assertThat(contract.decodeLogEventInput(input))
                .get()
                .satisfies(c -> {
                    assertThat(c.shipmentId()).isEmpty();
                    assertThat(c.eventType()).isEmpty();
                });
    }

    @Test
    @SuppressWarnings("rawtypes")
    void decodeGetEvent_storedEvent() {
        String output = "0x" + FunctionEncoder.encodeConstructor(Arrays.<Type>asList(
                new Utf8String("SHP-1"),
                new Utf8String("PICKED_UP"),
                new Utf8String("beef"),
                new Uint256(1_700_000_000L),
                new Utf8String("{}")));

        assertThat(contract.decodeGetEvent("EVT-1", output))
                .contains(new EventLogContract.StoredEvent("SHP-1", "PICKED_UP", "beef", 1_700_000_000L, "{}"));
    }

    @Test
    @SuppressWarnings("rawtypes")
    void decodeGetEvent_zeroTimestamp_isUnknown() {
        String output = "0x" + FunctionEncoder.encodeConstructor(Arrays.<Type>asList(
                new Utf8String(""),
                new Utf8String(""),
                new Utf8String(""),
                new Uint256(0),
                new Utf8String("")));

        assertThat(contract.decodeGetEvent("EVT-unknown", output)).isEmpty();
    }

    @Test
    void topics_areKeccakOfEventSignature() {
        assertThat(EventLogContract.eventLoggedTopic()).startsWith("0x").hasSize(66);
        assertThat(EventLogContract.eventLoggedTopic()).isNotEqualTo(EventLogContract.documentLoggedTopic());
    }
}
