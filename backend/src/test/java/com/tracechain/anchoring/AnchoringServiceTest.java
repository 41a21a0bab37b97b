package com.tracechain.anchoring;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tracechain.common.Hashes;
import com.tracechain.domain.AnchorRecord;
import com.tracechain.domain.AnchorRecordRepository;
import com.tracechain.domain.EntityKind;
import com.tracechain.domain.LedgerId;
import com.tracechain.domain.UnifiedTransactionStatus;
import com.tracechain.ledger.LedgerClient;
import com.tracechain.ledger.LedgerClientRegistry;
import com.tracechain.ledger.LedgerConfigurationException;
import com.tracechain.ledger.TransactionStatusReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AnchoringServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    @Mock
    AnchorTargetLookup targetLookup;
    @Mock
    AnchorRecordRepository anchorRecordRepository;
    @Mock
    AnchorResultRecorder resultRecorder;
    @Mock
    LedgerClient ethereum;

    private AnchoringService service;

    @BeforeEach
    void setUp() {
        when(ethereum.ledgerId()).thenReturn(LedgerId.ETHEREUM);
        service = new AnchoringService(targetLookup, anchorRecordRepository, resultRecorder,
                new LedgerClientRegistry(List.of(ethereum)), new ObjectMapper(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("event anchor hashes the sorted-key JSON of its fields and records PENDING")
    void anchor_event() {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("shipment_id", "SHP-1");
        input.put("event_id", "EVT-1");
        input.put("event_type", "DELIVERED");
        when(targetLookup.lookup(EntityKind.EVENT, "EVT-1")).thenReturn(Optional.of(
                new AnchorTarget(EntityKind.EVENT, "EVT-1", "SHP-1", "TRK-1", "DELIVERED", null, input)));
        when(ethereum.anchor(any(), anyString())).thenCallRealMethod();
        String metadata = "{\"event_id\":\"EVT-1\",\"event_type\":\"DELIVERED\",\"shipment_id\":\"SHP-1\"}";
        String expectedHash = Hashes.sha256Hex(metadata);
        when(ethereum.registerEvent("SHP-1", "EVT-1", "DELIVERED", expectedHash, metadata)).thenReturn("0xtx");

        AnchorOutcome outcome = service.anchor(EntityKind.EVENT, "EVT-1", LedgerId.ETHEREUM);

        assertThat(outcome.txHandle()).isEqualTo("0xtx");
        assertThat(outcome.dataHash()).isEqualTo(expectedHash);
        assertThat(outcome.status()).isEqualTo(UnifiedTransactionStatus.PENDING);
        assertThat(outcome.submittedAt()).isEqualTo(NOW);
        verify(resultRecorder).record(EntityKind.EVENT, "EVT-1", "0xtx", LedgerId.ETHEREUM, UnifiedTransactionStatus.PENDING);
    }

    @Test
    @DisplayName("document anchor commits the stored content hash")
    void anchor_document() {
        when(targetLookup.lookup(EntityKind.DOCUMENT, "doc-1")).thenReturn(Optional.of(
                new AnchorTarget(EntityKind.DOCUMENT, "doc-1", "SHP-1", null, null, "c0ffee",
                        Map.of("document_id", "doc-1"))));
        when(ethereum.anchor(any(), anyString())).thenCallRealMethod();
        when(ethereum.registerDocument("c0ffee", "{\"document_id\":\"doc-1\"}")).thenReturn("0xdoc");

        AnchorOutcome outcome = service.anchor(EntityKind.DOCUMENT, "doc-1", LedgerId.ETHEREUM);

        assertThat(outcome.dataHash()).isEqualTo("c0ffee");
        assertThat(outcome.txHandle()).isEqualTo("0xdoc");
    }

    @Test
    @DisplayName("missing record is reported and nothing is submitted or stored")
    void anchor_targetNotFound() {
        when(targetLookup.lookup(EntityKind.SHIPMENT, "SHP-404")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.anchor(EntityKind.SHIPMENT, "SHP-404", LedgerId.ETHEREUM))
                .isInstanceOf(AnchorTargetNotFoundException.class)
                .hasMessage("shipment not found: SHP-404");
        verify(ethereum, never()).anchor(any(), any());
        verifyNoInteractions(resultRecorder);
    }

    @Test
    @DisplayName("ledger that is not enabled fails before the record lookup")
    void anchor_ledgerNotConfigured() {
        assertThatThrownBy(() -> service.anchor(EntityKind.SHIPMENT, "SHP-1", LedgerId.SUBSTRATE))
                .isInstanceOf(LedgerConfigurationException.class);
        verifyNoInteractions(targetLookup, resultRecorder);
    }

    @Test
    void refreshStatus_recordsReportedStatus() {
        AnchorRecord record = record(LedgerId.ETHEREUM, "0xtx");
        TransactionStatusReport report = new TransactionStatusReport(LedgerId.ETHEREUM, "0xtx",
                UnifiedTransactionStatus.CONFIRMED, 100L, 12L, EntityKind.EVENT, "EVT-1", null);
        when(ethereum.getTransactionStatus("0xtx")).thenReturn(report);

        assertThat(service.refreshStatus(record)).isEqualTo(report);
        verify(resultRecorder).recordStatus(EntityKind.EVENT, "EVT-1", report);
    }

    @Test
    void refreshStatus_disabledLedgerOrMissingHandle_isSkipped() {
        assertThat(service.refreshStatus(record(LedgerId.VIETNAMCHAIN, "vn-1"))).isNull();
        assertThat(service.refreshStatus(record(LedgerId.ETHEREUM, null))).isNull();
        verifyNoInteractions(resultRecorder);
    }

    @Test
    void findAnchors_readsRepository() {
        AnchorRecord record = record(LedgerId.ETHEREUM, "0xtx");
        when(anchorRecordRepository.findByEntityKindAndEntityId(EntityKind.EVENT, "EVT-1")).thenReturn(List.of(record));

        assertThat(service.findAnchors(EntityKind.EVENT, "EVT-1")).containsExactly(record);
    }

    private static AnchorRecord record(LedgerId ledger, String txHandle) {
        AnchorRecord record = new AnchorRecord();
        record.setEntityKind(EntityKind.EVENT);
        record.setEntityId("EVT-1");
        record.setLedger(ledger);
        record.setTxHandle(txHandle);
        record.setStatus(UnifiedTransactionStatus.PENDING);
        record.setCreatedAt(NOW);
        return record;
    }
}
