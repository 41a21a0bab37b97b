package com.tracechain.bridge.config;

import com.tracechain.bridge.BridgeManager;
import com.tracechain.bridge.BridgeSettings;
import com.tracechain.bridge.ChainBridge;
import com.tracechain.bridge.ChainBridgeFactory;
import com.tracechain.domain.LedgerId;
import com.tracechain.ledger.LedgerConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BridgeBootstrapTest {

    @Mock
    ChainBridgeFactory factory;
    @Mock
    BridgeManager manager;

    private static BridgeProperties.Definition definition(String source, String target, boolean twoWay) {
        BridgeProperties.Definition definition = new BridgeProperties.Definition();
        definition.setSource(source);
        definition.setTarget(target);
        definition.setTwoWay(twoWay);
        return definition;
    }

    @Test
    @DisplayName("a definition on a disabled ledger is skipped and the others are added and started")
    void onApplicationReady_skipsBrokenDefinition() {
        BridgeProperties properties = new BridgeProperties();
        properties.setDefinitions(List.of(
                definition("ethereum", "vietnamchain", true),
                definition("substrate", "ethereum", false),
                definition("ethereum", "bitcoin", false)));
        ChainBridge forward = mock(ChainBridge.class);
        ChainBridge reverse = mock(ChainBridge.class);
        when(factory.createTwoWay(any())).thenReturn(List.of(forward, reverse));
        when(factory.create(any())).thenThrow(new LedgerConfigurationException("Ledger client not configured: substrate"));
        when(manager.startAllBridges()).thenReturn(2);

        new BridgeBootstrap(properties, factory, manager).onApplicationReady();

        verify(manager).addBridge(forward);
        verify(manager).addBridge(reverse);
        verify(manager).startAllBridges();
    }

    @Test
    void onApplicationReady_autoStartOff_onlyAdds() {
        BridgeProperties properties = new BridgeProperties();
        properties.setAutoStart(false);
        properties.setDefinitions(List.of(definition("ethereum", "substrate", false)));
        ChainBridge bridge = mock(ChainBridge.class);
        when(factory.create(any())).thenReturn(bridge);

        new BridgeBootstrap(properties, factory, manager).onApplicationReady();

        verify(manager).addBridge(bridge);
        verify(manager, never()).startAllBridges();
    }

    @Test
    void onApplicationReady_disabled_createsNothing() {
        BridgeProperties properties = new BridgeProperties();
        properties.setEnabled(false);
        properties.setDefinitions(List.of(definition("ethereum", "substrate", false)));

        new BridgeBootstrap(properties, factory, manager).onApplicationReady();

        verifyNoInteractions(factory, manager);
    }

    @Test
    void shutdown_stopsAllBridges() {
        new BridgeBootstrap(new BridgeProperties(), factory, manager).shutdown();

        verify(manager).stopAllBridges();
    }

    @Test
    void definition_toSettings_appliesDefaults() {
        BridgeProperties.Definition definition = definition("Ethereum", "substrate", false);
        definition.setEventTypes(List.of("DELIVERED", "PICKED_UP"));

        BridgeSettings settings = definition.toSettings();

        assertThat(settings.source()).isEqualTo(LedgerId.ETHEREUM);
        assertThat(settings.target()).isEqualTo(LedgerId.SUBSTRATE);
        assertThat(settings.eventTypes()).containsExactlyInAnyOrder("DELIVERED", "PICKED_UP");
        assertThat(settings.confirmationBlocks()).isEqualTo(5);
        assertThat(settings.pollInterval()).isEqualTo(Duration.ofSeconds(300));
        assertThat(settings.lookbackBlocks()).isEqualTo(1000L);
    }
}
