package com.tracechain.oracle;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fetch → process → sleep polling loop with a start/stop lifecycle.
 *
 * <p>{@link #runForever()} blocks the calling thread until {@link #stop()} is called or the thread is interrupted.
 * A failed cycle is logged and followed by the normal sleep; the loop itself never dies on a cycle failure.
 * Cycles of one oracle never overlap: {@link #runOnce()} from another thread waits for the running cycle.
 *
 * @param <D> fetched data
 * @param <R> processing result
 */
@Slf4j
public abstract class Oracle<D, R> {

    private final String name;
    private final Duration interval;
    protected final Clock clock;

    private final ReentrantLock cycleLock = new ReentrantLock();
    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private volatile boolean running;
    private volatile CountDownLatch stopSignal = new CountDownLatch(0);
    private volatile Instant lastRun;
    private volatile R latestResult;
    private volatile String lastError;

    protected Oracle(String name, Duration interval, Clock clock) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Oracle name is required");
        }
        if (interval == null || interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("Oracle interval must be positive");
        }
        this.name = name;
        this.interval = interval;
        this.clock = clock;
    }

    protected abstract D fetchData();

    protected abstract R processData(D data);

    /**
     * One fetch + process cycle. Stores the result and the run timestamp.
     *
     * @throws RuntimeException whatever the fetch or process step threw, after it has been recorded
     */
    public R runOnce() {
        cycleLock.lock();
        try {
            D data = fetchData();
            R result = processData(data);
            latestResult = result;
            lastRun = clock.instant();
            lastError = null;
            consecutiveFailures.set(0);
            return result;
        } catch (RuntimeException e) {
            consecutiveFailures.incrementAndGet();
            lastError = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            throw e;
        } finally {
            cycleLock.unlock();
        }
    }

    /**
     * Runs cycles until stopped. Returns when {@link #stop()} is called or the thread is interrupted.
     *
     * <p>Every run owns its own stop signal. A run that ends after a newer run has started (a restart while the
     * old cycle was still in flight) leaves the running flag to the newer run.
     */
    public void runForever() {
        CountDownLatch signal;
        synchronized (this) {
            if (running) {
                log.warn("Oracle {} already running", name);
                return;
            }
            signal = new CountDownLatch(1);
            stopSignal = signal;
            running = true;
        }
        log.info("Oracle {} started (interval {}s)", name, interval.toSeconds());
        try {
            while (signal.getCount() > 0 && !Thread.currentThread().isInterrupted()) {
                try {
                    runOnce();
                } catch (RuntimeException e) {
                    log.error("Oracle {} cycle failed ({} in a row): {}", name, consecutiveFailures.get(), e.getMessage(), e);
                }
                if (signal.getCount() == 0) {
                    break;
                }
                if (signal.await(interval.toMillis(), TimeUnit.MILLISECONDS)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            synchronized (this) {
                if (stopSignal == signal) {
                    running = false;
                }
            }
            log.info("Oracle {} stopped", name);
        }
    }

    /**
     * Clears the running flag and wakes an in-flight sleep. The current cycle, if any, completes first.
     */
    public synchronized void stop() {
        running = false;
        stopSignal.countDown();
    }

    public boolean isRunning() {
        return running;
    }

    public String getName() {
        return name;
    }

    public Duration getInterval() {
        return interval;
    }

    public OracleStatus getStatus() {
        return new OracleStatus(name, running, lastRun, interval.toSeconds(), consecutiveFailures.get(), lastError);
    }

    /** Result of the last successful cycle, or null before the first one. */
    public R getLatestResult() {
        return latestResult;
    }
}
