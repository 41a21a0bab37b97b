package com.tracechain.bridge;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tracechain.ledger.LedgerClientRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Builds bridges from settings using the configured ledger clients. Every bridge gets its own processed-event set.
 */
@Component
@RequiredArgsConstructor
public class ChainBridgeFactory {

    private final LedgerClientRegistry ledgerClients;
    private final BridgeRelayRecorder relayRecorder;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * @throws com.tracechain.ledger.LedgerConfigurationException when either ledger is not enabled
     */
    public ChainBridge create(BridgeSettings settings) {
        return new ChainBridge(settings,
                ledgerClients.require(settings.source()),
                ledgerClients.require(settings.target()),
                new BridgeIdGenerator(clock),
                relayRecorder,
                objectMapper,
                new ProcessedEventSet(),
                clock);
    }

    /** {@code settings} direction first, then the reverse. */
    public List<ChainBridge> createTwoWay(BridgeSettings settings) {
        return List.of(create(settings), create(settings.reversed()));
    }
}
