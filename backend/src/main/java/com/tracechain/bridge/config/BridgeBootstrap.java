package com.tracechain.bridge.config;

import com.tracechain.bridge.BridgeManager;
import com.tracechain.bridge.BridgeSettings;
import com.tracechain.bridge.ChainBridge;
import com.tracechain.bridge.ChainBridgeFactory;
import com.tracechain.ledger.BlockchainException;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Registers the configured bridges when the application is ready, optionally starts them, and stops every bridge
 * on shutdown. A definition naming a disabled ledger is skipped with an error log; the others still start.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BridgeBootstrap {

    private final BridgeProperties properties;
    private final ChainBridgeFactory factory;
    private final BridgeManager manager;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!properties.isEnabled() || properties.getDefinitions().isEmpty()) {
            log.info("No bridges configured");
            return;
        }
        int added = 0;
        for (BridgeProperties.Definition definition : properties.getDefinitions()) {
            try {
                BridgeSettings settings = definition.toSettings();
                List<ChainBridge> bridges = definition.isTwoWay()
                        ? factory.createTwoWay(settings)
                        : List.of(factory.create(settings));
                for (ChainBridge bridge : bridges) {
                    manager.addBridge(bridge);
                    added++;
                }
            } catch (IllegalArgumentException | BlockchainException e) {
                log.error("Skipping bridge {} -> {}: {}", definition.getSource(), definition.getTarget(), e.getMessage());
            }
        }
        if (properties.isAutoStart()) {
            int started = manager.startAllBridges();
            log.info("Bridges configured: {} added, {} started", added, started);
        } else {
            log.info("Bridges configured: {} added, auto-start disabled", added);
        }
    }

    @PreDestroy
    public void shutdown() {
        int stopped = manager.stopAllBridges();
        if (stopped > 0) {
            log.info("Stopped {} bridge(s) on shutdown", stopped);
        }
    }
}
