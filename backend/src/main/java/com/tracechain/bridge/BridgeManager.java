package com.tracechain.bridge;

import com.tracechain.config.AsyncConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Future;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Registry of named bridges and their workers. A started bridge runs {@link ChainBridge#runForever()} on the
 * bridge executor; it counts as running while the manager holds its worker. Starting a running bridge and
 * stopping a stopped one are no-ops that return false. Registry changes are serialised by one lock.
 */
@Component
@Slf4j
public class BridgeManager {

    private final AsyncTaskExecutor bridgeExecutor;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, ChainBridge> bridges = new LinkedHashMap<>();
    private final Map<String, Future<?>> workers = new LinkedHashMap<>();

    public BridgeManager(@Qualifier(AsyncConfig.BRIDGE_EXECUTOR) AsyncTaskExecutor bridgeExecutor) {
        this.bridgeExecutor = bridgeExecutor;
    }

    /**
     * @return the bridge name
     * @throws IllegalArgumentException when a bridge with the same name is registered
     */
    public String addBridge(ChainBridge bridge) {
        lock.lock();
        try {
            String name = bridge.getName();
            if (bridges.containsKey(name)) {
                throw new IllegalArgumentException("Bridge already exists: " + name);
            }
            bridges.put(name, bridge);
            log.info("Added bridge {}", name);
            return name;
        } finally {
            lock.unlock();
        }
    }

    /** Stops the bridge if needed. Returns false when no bridge has that name. */
    public boolean removeBridge(String name) {
        lock.lock();
        try {
            if (!bridges.containsKey(name)) {
                return false;
            }
            stopBridge(name);
            bridges.remove(name);
            log.info("Removed bridge {}", name);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns false when the bridge is unknown or already running.
     *
     * @throws IllegalStateException when the bridge executor has no free thread
     */
    public boolean startBridge(String name) {
        lock.lock();
        try {
            ChainBridge bridge = bridges.get(name);
            if (bridge == null) {
                log.warn("Cannot start unknown bridge {}", name);
                return false;
            }
            if (isLive(name)) {
                return false;
            }
            try {
                workers.put(name, bridgeExecutor.submit(bridge::runForever));
            } catch (TaskRejectedException e) {
                throw new IllegalStateException("No bridge worker available for " + name, e);
            }
            log.info("Started bridge {}", name);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /** Signals the bridge to stop and cancels its worker. Returns false when it is not running. */
    public boolean stopBridge(String name) {
        lock.lock();
        try {
            Future<?> worker = workers.remove(name);
            if (worker == null) {
                return false;
            }
            ChainBridge bridge = bridges.get(name);
            if (bridge != null) {
                bridge.stop();
            }
            worker.cancel(true);
            log.info("Stopped bridge {}", name);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean isBridgeRunning(String name) {
        lock.lock();
        try {
            return isLive(name);
        } finally {
            lock.unlock();
        }
    }

    public Optional<ChainBridge> getBridge(String name) {
        lock.lock();
        try {
            return Optional.ofNullable(bridges.get(name));
        } finally {
            lock.unlock();
        }
    }

    /**
     * @throws UnknownBridgeException when no bridge has that name
     */
    public ChainBridge requireBridge(String name) {
        return getBridge(name).orElseThrow(() -> new UnknownBridgeException(name));
    }

    public List<ChainBridge> getAllBridges() {
        lock.lock();
        try {
            return new ArrayList<>(bridges.values());
        } finally {
            lock.unlock();
        }
    }

    public Optional<BridgeStatus> getBridgeStatus(String name) {
        lock.lock();
        try {
            ChainBridge bridge = bridges.get(name);
            return bridge == null ? Optional.empty() : Optional.of(bridge.describe(isLive(name)));
        } finally {
            lock.unlock();
        }
    }

    public Map<String, BridgeStatus> getAllStatuses() {
        lock.lock();
        try {
            Map<String, BridgeStatus> statuses = new LinkedHashMap<>();
            bridges.forEach((name, bridge) -> statuses.put(name, bridge.describe(isLive(name))));
            return statuses;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Starts every stopped bridge. A bridge that finds no free worker is logged and skipped; the rest are still
     * started.
     *
     * @return number of bridges that were started by this call
     */
    public int startAllBridges() {
        lock.lock();
        try {
            int started = 0;
            for (String name : new ArrayList<>(bridges.keySet())) {
                try {
                    if (startBridge(name)) {
                        started++;
                    }
                } catch (IllegalStateException e) {
                    log.error("Could not start bridge {}: {}", name, e.getMessage());
                }
            }
            return started;
        } finally {
            lock.unlock();
        }
    }

    /** @return number of bridges that were stopped by this call */
    public int stopAllBridges() {
        lock.lock();
        try {
            int stopped = 0;
            for (String name : new ArrayList<>(workers.keySet())) {
                if (stopBridge(name)) {
                    stopped++;
                }
            }
            return stopped;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @throws UnknownBridgeException when no bridge has that name
     */
    public BridgeVerification verifyBridgedEvent(String name, String bridgeId, String originalEventId) {
        return requireBridge(name).verifyBridgedEvent(bridgeId, originalEventId);
    }

    // A worker that ended on its own (interrupted or rejected) no longer counts as running.
    private boolean isLive(String name) {
        Future<?> worker = workers.get(name);
        if (worker == null) {
            return false;
        }
        if (worker.isDone()) {
            workers.remove(name);
            return false;
        }
        return true;
    }
}
