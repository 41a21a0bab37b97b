package com.tracechain.api.controller;

import com.tracechain.api.dto.BridgeActionResponse;
import com.tracechain.api.dto.CreateBridgeRequest;
import com.tracechain.api.dto.CreateBridgeResponse;
import com.tracechain.bridge.BridgeBatchResult;
import com.tracechain.bridge.BridgeManager;
import com.tracechain.bridge.BridgeSettings;
import com.tracechain.bridge.BridgeStatus;
import com.tracechain.bridge.BridgeVerification;
import com.tracechain.bridge.ChainBridge;
import com.tracechain.bridge.ChainBridgeFactory;
import com.tracechain.bridge.UnknownBridgeException;
import com.tracechain.domain.LedgerId;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;

/**
 * Bridge administration: create, start, stop, remove, status, manual run and relay verification. Calls that reach
 * a ledger run on the bounded elastic scheduler, off the event loop.
 */
@RestController
@RequestMapping("/api/v1/bridges")
@RequiredArgsConstructor
public class BridgeController {

    private final BridgeManager bridgeManager;
    private final ChainBridgeFactory bridgeFactory;

    @PostMapping
    public ResponseEntity<CreateBridgeResponse> create(@Valid @RequestBody CreateBridgeRequest request) {
        BridgeSettings settings = toSettings(request);
        List<ChainBridge> bridges = Boolean.TRUE.equals(request.twoWay())
                ? bridgeFactory.createTwoWay(settings)
                : List.of(bridgeFactory.create(settings));
        for (ChainBridge bridge : bridges) {
            if (bridgeManager.getBridge(bridge.getName()).isPresent()) {
                throw new IllegalArgumentException("Bridge already exists: " + bridge.getName());
            }
        }
        List<BridgeStatus> created = new ArrayList<>();
        for (ChainBridge bridge : bridges) {
            String name = bridgeManager.addBridge(bridge);
            if (Boolean.TRUE.equals(request.start())) {
                bridgeManager.startBridge(name);
            }
            created.add(status(name));
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(new CreateBridgeResponse(created));
    }

    @GetMapping
    public Collection<BridgeStatus> list() {
        return bridgeManager.getAllStatuses().values();
    }

    @GetMapping("/{name}")
    public BridgeStatus get(@PathVariable String name) {
        return status(name);
    }

    @PostMapping("/{name}/start")
    public BridgeActionResponse start(@PathVariable String name) {
        bridgeManager.requireBridge(name);
        boolean changed = bridgeManager.startBridge(name);
        return new BridgeActionResponse(name, changed, bridgeManager.isBridgeRunning(name));
    }

    @PostMapping("/{name}/stop")
    public BridgeActionResponse stop(@PathVariable String name) {
        bridgeManager.requireBridge(name);
        boolean changed = bridgeManager.stopBridge(name);
        return new BridgeActionResponse(name, changed, bridgeManager.isBridgeRunning(name));
    }

    @DeleteMapping("/{name}")
    public BridgeActionResponse remove(@PathVariable String name) {
        if (!bridgeManager.removeBridge(name)) {
            throw new UnknownBridgeException(name);
        }
        return new BridgeActionResponse(name, true, false);
    }

    /** Runs one cycle; waits for a cycle already in progress. */
    @PostMapping("/{name}/run-once")
    public Mono<BridgeBatchResult> runOnce(@PathVariable String name) {
        ChainBridge bridge = bridgeManager.requireBridge(name);
        return Mono.fromCallable(bridge::runOnce).subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/{name}/verify")
    public Mono<BridgeVerification> verify(@PathVariable String name,
                                           @RequestParam String bridgeId,
                                           @RequestParam String originalEventId) {
        return Mono.fromCallable(() -> bridgeManager.verifyBridgedEvent(name, bridgeId, originalEventId))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private BridgeStatus status(String name) {
        return bridgeManager.getBridgeStatus(name).orElseThrow(() -> new UnknownBridgeException(name));
    }

    private static BridgeSettings toSettings(CreateBridgeRequest request) {
        return new BridgeSettings(
                LedgerId.fromKey(request.source()),
                LedgerId.fromKey(request.target()),
                request.eventTypes() == null ? null : new HashSet<>(request.eventTypes()),
                request.confirmationBlocks() != null
                        ? request.confirmationBlocks() : BridgeSettings.DEFAULT_CONFIRMATION_BLOCKS,
                request.pollIntervalSeconds() != null
                        ? Duration.ofSeconds(request.pollIntervalSeconds()) : BridgeSettings.DEFAULT_POLL_INTERVAL,
                request.lookbackBlocks() != null ? request.lookbackBlocks() : BridgeSettings.DEFAULT_LOOKBACK_BLOCKS);
    }
}
