package com.tracechain.bridge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tracechain.common.Hashes;
import com.tracechain.domain.LedgerId;
import com.tracechain.ledger.BridgeEvent;
import com.tracechain.ledger.LedgerConnectivityException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChainBridgeTest {

    private final Clock clock = Clock.fixed(Instant.parse("2025-03-01T10:00:00Z"), ZoneOffset.UTC);
    private final ObjectMapper objectMapper = new ObjectMapper();

    private FakeLedgerClient source;
    private FakeLedgerClient target;
    private InMemoryRelayRecorder recorder;

    @BeforeEach
    void setUp() {
        source = new FakeLedgerClient(LedgerId.ETHEREUM, 100);
        target = new FakeLedgerClient(LedgerId.VIETNAMCHAIN, 5_000);
        recorder = new InMemoryRelayRecorder();
    }

    private ChainBridge bridge(Set<String> eventTypes) {
        return bridge(eventTypes, new ProcessedEventSet());
    }

    private ChainBridge bridge(Set<String> eventTypes, ProcessedEventSet processed) {
        BridgeSettings settings = new BridgeSettings(LedgerId.ETHEREUM, LedgerId.VIETNAMCHAIN, eventTypes, 5,
                Duration.ofSeconds(300), 1000);
        return new ChainBridge(settings, source, target, new BridgeIdGenerator(clock), recorder, objectMapper,
                processed, clock);
    }

    @Test
    @DisplayName("event inside the confirmation window is fetched, event beyond it is not")
    void fetchData_confirmationGate() {
        source.ignoreRangeOnFetch = true;
        source.addEvent("e-confirmed", "s1", "DEPARTURE", 94);
        source.addEvent("e-fresh", "s1", "ARRIVAL", 97);
        ChainBridge bridge = bridge(Set.of());

        BridgeEventBatch batch = bridge.fetchData();

        assertThat(batch.events()).extracting(BridgeEvent::originalEventId).containsExactly("e-confirmed");
        assertThat(batch.toInclusive()).isEqualTo(95);
        assertThat(batch.events()).allMatch(e -> e.sourceBlockReference() <= 100 - 5);
    }

    @Test
    @DisplayName("first cycle starts lookback blocks behind the head, floored at zero")
    void fetchData_firstCycleUsesLookback() {
        source.setHead(5_000);
        bridge(Set.of()).fetchData();
        assertThat(source.fetchedRanges.get(0)).containsExactly(4_000L, 4_995L);

        FakeLedgerClient young = new FakeLedgerClient(LedgerId.ETHEREUM, 50);
        source = young;
        bridge(Set.of()).fetchData();
        assertThat(young.fetchedRanges.get(0)).containsExactly(0L, 45L);
    }

    @Test
    @DisplayName("cursor advances on empty ranges and never moves backwards")
    void fetchData_cursorIsMonotonic() {
        ChainBridge bridge = bridge(Set.of());

        BridgeEventBatch first = bridge.fetchData();
        assertThat(first.isEmpty()).isTrue();
        assertThat(bridge.getLastProcessedBlock()).isEqualTo(95L);

        bridge.fetchData();
        assertThat(source.fetchedRanges).hasSize(1);
        assertThat(bridge.getLastProcessedBlock()).isEqualTo(95L);

        source.setHead(120);
        bridge.fetchData();
        assertThat(source.fetchedRanges.get(1)).containsExactly(95L, 115L);
        assertThat(bridge.getLastProcessedBlock()).isEqualTo(115L);

        source.setHead(110);
        bridge.fetchData();
        assertThat(source.fetchedRanges).hasSize(2);
        assertThat(bridge.getLastProcessedBlock()).isEqualTo(115L);
    }

    @Test
    void fetchData_dropsEventTypesOutsideAllowList() {
        source.addEvent("e1", "s1", "DEPARTURE", 90);
        source.addEvent("e2", "s1", "TEMPERATURE_ALERT", 91);

        BridgeEventBatch batch = bridge(Set.of("DEPARTURE", "ARRIVAL")).fetchData();

        assertThat(batch.events()).extracting(BridgeEvent::originalEventId).containsExactly("e1");
    }

    @Test
    @DisplayName("source failure propagates and leaves the cursor untouched")
    void runOnce_sourceUnreachable_throwsWithoutAdvancing() {
        ChainBridge bridge = bridge(Set.of());
        bridge.runOnce();
        source.setHead(200);
        source.unreachable = true;

        assertThatThrownBy(bridge::runOnce).isInstanceOf(LedgerConnectivityException.class);
        assertThat(bridge.getLastProcessedBlock()).isEqualTo(95L);
        assertThat(bridge.getStatus().consecutiveFailures()).isEqualTo(1);
    }

    @Test
    @DisplayName("relayed event carries BRIDGED_ type, bridge id, provenance metadata and recomputed hash")
    void processData_relaysWithProvenance() throws Exception {
        source.addEvent("e1", "s1", "DEPARTURE", 90);
        ChainBridge bridge = bridge(Set.of());

        BridgeBatchResult result = bridge.runOnce();

        assertThat(result.processedCount()).isEqualTo(1);
        RelayResult relay = result.results().get(0);
        assertThat(relay.isSuccess()).isTrue();
        assertThat(relay.bridgeId()).startsWith("bridge_ethereum_").hasSize("bridge_ethereum_".length() + 16);
        assertThat(relay.targetTxHandle()).isEqualTo("0xtarget-1");

        FakeLedgerClient.Registration registration = target.registrations.get(0);
        assertThat(registration.shipmentId()).isEqualTo("s1");
        assertThat(registration.eventId()).isEqualTo(relay.bridgeId());
        assertThat(registration.eventType()).isEqualTo("BRIDGED_DEPARTURE");
        assertThat(registration.dataHash())
                .isEqualTo(Hashes.sha256Hex("s1", "e1", "DEPARTURE", relay.bridgeId()));

        JsonNode metadata = objectMapper.readTree(registration.metadataJson());
        assertThat(metadata.path("source_chain").asText()).isEqualTo("ethereum");
        assertThat(metadata.path("source_tx_hash").asText()).isEqualTo("0xtx-e1");
        assertThat(metadata.path("source_block").asLong()).isEqualTo(90L);
        assertThat(metadata.path("bridge_id").asText()).isEqualTo(relay.bridgeId());
        assertThat(metadata.path("original_event_id").asText()).isEqualTo("e1");
        assertThat(metadata.path("bridged_at").asText()).isEqualTo("2025-03-01T10:00:00Z");

        assertThat(recorder.findByBridgeId(relay.bridgeId())).isPresent();
        assertThat(bridge.getProcessedEvents().contains("e1")).isTrue();
    }

    @Test
    @DisplayName("reprocessing the same batch registers nothing new")
    void processData_dedupIsIdempotent() {
        source.addEvent("e1", "s1", "DEPARTURE", 90);
        source.addEvent("e2", "s2", "ARRIVAL", 91);
        ChainBridge bridge = bridge(Set.of());
        BridgeEventBatch batch = bridge.fetchData();

        BridgeBatchResult first = bridge.processData(batch);
        BridgeBatchResult second = bridge.processData(batch);

        assertThat(first.processedCount()).isEqualTo(2);
        assertThat(second.processedCount()).isZero();
        assertThat(second.results()).isEmpty();
        assertThat(target.registrations).hasSize(2);
    }

    @Test
    @DisplayName("one failed relay is reported and the rest of the batch still goes through")
    void processData_failureIsIsolatedPerEvent() {
        source.addEvent("x", "s-broken", "DEPARTURE", 90);
        source.addEvent("y", "s-ok", "DEPARTURE", 91);
        target.failRegistrationForShipments.add("s-broken");
        ChainBridge bridge = bridge(Set.of());

        BridgeBatchResult result = bridge.runOnce();

        assertThat(result.processedCount()).isEqualTo(2);
        assertThat(result.errorCount()).isEqualTo(1);
        RelayResult failed = result.results().get(0);
        assertThat(failed.originalEventId()).isEqualTo("x");
        assertThat(failed.status()).isEqualTo(RelayResult.Status.ERROR);
        assertThat(failed.error()).contains("unreachable");
        assertThat(result.results().get(1).isSuccess()).isTrue();
        assertThat(bridge.getProcessedEvents().contains("y")).isTrue();
        assertThat(bridge.getProcessedEvents().contains("x")).isFalse();
    }

    @Test
    void processData_recorderFailureDoesNotFailRelay() {
        source.addEvent("e1", "s1", "DEPARTURE", 90);
        recorder.failing = true;

        BridgeBatchResult result = bridge(Set.of()).runOnce();

        assertThat(result.results()).singleElement().matches(RelayResult::isSuccess);
    }

    @Test
    @DisplayName("processed set above 10,000 is trimmed to the 5,000 most recent after a cycle")
    void processData_trimsProcessedSet() {
        ProcessedEventSet processed = new ProcessedEventSet();
        for (int i = 0; i < 10_000; i++) {
            processed.add("old-" + i);
        }
        source.addEvent("new", "s1", "DEPARTURE", 90);
        ChainBridge bridge = bridge(Set.of(), processed);

        bridge.runOnce();

        assertThat(processed.size()).isEqualTo(5_000);
        assertThat(processed.contains("new")).isTrue();
        assertThat(processed.contains("old-9999")).isTrue();
        assertThat(processed.contains("old-5001")).isTrue();
        assertThat(processed.contains("old-5000")).isFalse();
        assertThat(processed.contains("old-0")).isFalse();
    }

    @Test
    @DisplayName("verification fails on the target side when the relay never happened")
    void verifyBridgedEvent_targetMissing() {
        source.addEvent("e1", "s1", "DEPARTURE", 90);

        BridgeVerification verification = bridge(Set.of()).verifyBridgedEvent("bridge_ethereum_0123456789abcdef", "e1");

        assertThat(verification.sourceVerified()).isTrue();
        assertThat(verification.targetVerified()).isFalse();
        assertThat(verification.verified()).isFalse();
        assertThat(verification.targetDetails().reason()).contains("not found");
    }

    @Test
    void verifyBridgedEvent_afterRelay_bothSidesVerifiedWithRecordedShipment() {
        source.addEvent("e1", "s1", "DEPARTURE", 90);
        ChainBridge bridge = bridge(Set.of());
        String bridgeId = bridge.runOnce().results().get(0).bridgeId();

        BridgeVerification verification = bridge.verifyBridgedEvent(bridgeId, "e1");

        assertThat(verification.verified()).isTrue();
        assertThat(verification.sourceChain()).isEqualTo(LedgerId.ETHEREUM);
        assertThat(verification.targetChain()).isEqualTo(LedgerId.VIETNAMCHAIN);
        assertThat(verification.targetDetails().details()).containsEntry("shipment_id", "s1");
    }

    @Test
    void verifyBridgedEvent_ledgerUnreachable_reportsError() {
        source.unreachable = true;

        BridgeVerification verification = bridge(Set.of()).verifyBridgedEvent("bridge_ethereum_x", "e1");

        assertThat(verification.verified()).isFalse();
        assertThat(verification.error()).contains("unreachable");
    }

    @Test
    void constructor_mismatchedClients_throws() {
        BridgeSettings settings = BridgeSettings.of(LedgerId.SUBSTRATE, LedgerId.VIETNAMCHAIN);
        assertThatThrownBy(() -> new ChainBridge(settings, source, target, new BridgeIdGenerator(clock), recorder,
                objectMapper, new ProcessedEventSet(), clock))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void describe_reportsBridgeState() {
        source.addEvent("e1", "s1", "DEPARTURE", 90);
        ChainBridge bridge = bridge(Set.of("DEPARTURE"));
        bridge.runOnce();

        BridgeStatus status = bridge.describe(false);

        assertThat(status.name()).isEqualTo("ChainBridge_ethereum_to_vietnamchain");
        assertThat(status.lastProcessedBlock()).isEqualTo(95L);
        assertThat(status.processedEventCount()).isEqualTo(1);
        assertThat(status.intervalSeconds()).isEqualTo(300);
        assertThat(status.lastRun()).isEqualTo(clock.instant());
        assertThat(status.eventTypes()).containsExactly("DEPARTURE");
        assertThat(status.running()).isFalse();
    }
}
