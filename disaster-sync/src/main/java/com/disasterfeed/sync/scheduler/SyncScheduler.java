package com.disasterfeed.sync.scheduler;

import com.disasterfeed.sync.config.DisasterSyncProperties;
import com.disasterfeed.sync.metrics.SyncMetrics;
import com.disasterfeed.sync.model.CycleState;
import com.disasterfeed.sync.model.FailureKind;
import com.disasterfeed.sync.model.SyncRun;
import com.disasterfeed.sync.output.EventStore;
import com.disasterfeed.sync.service.SyncPipeline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives the sync pipeline forever on its own thread.
 *
 * IDLE -> FETCHING -> PARSING -> RECONCILING -> DIFFING -> WRITING -> SLEEPING -> IDLE ...
 *
 * A failed cycle jumps straight to SLEEPING; the next one starts one interval after the
 * previous one started. Failures are counted, and a streak exceeding
 * disaster-sync.scheduling.failure-threshold is reported through SyncMetrics, but the loop
 * never exits on its own. Only the application shutting down (stop()) ends it.
 *
 * On startup the store schema is ensured first. With fail-fast-on-startup=true a store that
 * cannot be reached aborts application start-up; otherwise we log and start cycling anyway.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SyncScheduler implements SmartLifecycle {

    private final SyncPipeline pipeline;
    private final EventStore eventStore;
    private final DisasterSyncProperties properties;
    private final SyncMetrics metrics;
    private final Sleeper sleeper;
    private final Clock clock;

    private final AtomicBoolean stopRequested = new AtomicBoolean();
    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private final AtomicLong cyclesCompleted = new AtomicLong();

    private volatile CycleState state = CycleState.IDLE;
    private volatile Instant lastCycleStartedAt;
    private volatile Instant nextCycleAt;
    private volatile SyncRun lastRun;
    private volatile Thread worker;

    // ── Lifecycle ────────────────────────────────────────────────────────────

    @Override
    public void start() {
        try {
            eventStore.ensureSchema();
        } catch (RuntimeException e) {
            metrics.schemaCheckFailed();
            if (properties.getScheduling().isFailFastOnStartup()) {
                throw new IllegalStateException("Spatial store unavailable at startup: " + e.getMessage(), e);
            }
            log.warn("Could not initialise store schema, cycles will retry: {}", e.getMessage());
        }

        stopRequested.set(false);
        Thread thread = new Thread(this::runLoop, "disaster-sync-loop");
        thread.setDaemon(false);
        worker = thread;
        thread.start();
        log.info("Disaster sync started, interval {}", properties.getScheduling().getInterval());
    }

    @Override
    public void stop() {
        requestStop();
        Thread thread = worker;
        if (thread == null) return;
        try {
            thread.join(properties.getScheduling().getShutdownTimeout().toMillis());
            if (thread.isAlive()) {
                log.warn("Sync loop still busy after {}, leaving it to finish in the background",
                        properties.getScheduling().getShutdownTimeout());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public boolean isRunning() {
        Thread thread = worker;
        return thread != null && thread.isAlive();
    }

    // ── Loop ─────────────────────────────────────────────────────────────────

    /** Body of the worker thread. Returns only after a stop request. */
    public void runLoop() {
        Duration interval = properties.getScheduling().getInterval();
        while (!stopRequested.get()) {
            Instant cycleStart = clock.instant();
            lastCycleStartedAt = cycleStart;

            SyncRun run = runOneCycle();
            afterCycle(run);

            if (stopRequested.get()) break;

            transition(CycleState.SLEEPING);
            nextCycleAt = cycleStart.plus(interval);
            Duration wait = Duration.between(clock.instant(), nextCycleAt);
            if (!wait.isNegative() && !wait.isZero()) {
                log.info("Next sync cycle at {}", nextCycleAt);
                try {
                    sleeper.sleep(wait);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
            if (!stopRequested.get()) {
                transition(CycleState.IDLE);
            }
        }
        transition(CycleState.STOPPED);
        log.info("Disaster sync loop stopped after {} cycles", cyclesCompleted.get());
    }

    private SyncRun runOneCycle() {
        transition(CycleState.IDLE);
        try {
            return pipeline.runCycle(stopRequested::get, this::transition);
        } catch (RuntimeException e) {
            // runCycle reports its own failures; this only guards the loop itself
            log.error("Sync cycle crashed: {}", e.getMessage(), e);
            return SyncRun.builder()
                    .runId(UUID.randomUUID().toString())
                    .startedAt(lastCycleStartedAt)
                    .completedAt(clock.instant())
                    .status("FAILED")
                    .failureKind(FailureKind.UNEXPECTED)
                    .errorMessage(e.toString())
                    .build();
        }
    }

    private void afterCycle(SyncRun run) {
        lastRun = run;
        cyclesCompleted.incrementAndGet();

        if (run.isSuccess()) {
            consecutiveFailures.set(0);
        } else if (!"CANCELLED".equals(run.getStatus())) {
            int streak = consecutiveFailures.incrementAndGet();
            int threshold = properties.getScheduling().getFailureThreshold();
            log.warn("Cycle {} failed ({}), {} consecutive failure(s)", run.getRunId(), run.getFailureKind(), streak);
            if (streak > threshold) {
                metrics.failureThresholdExceeded(streak, threshold, run);
            }
        }
        metrics.updateFailureStreak(consecutiveFailures.get());
    }

    private void transition(CycleState next) {
        if (state != next) {
            log.debug("Sync state {} -> {}", state, next);
            state = next;
        }
    }

    // ── Control ──────────────────────────────────────────────────────────────

    public void requestStop() {
        if (!stopRequested.getAndSet(true)) {
            log.info("Stop requested, finishing at the next checkpoint");
        }
        sleeper.wake();
    }

    /**
     * Start the next cycle now instead of waiting out the interval.
     *
     * @return false when a cycle is already running (or the loop has stopped)
     */
    public boolean triggerNow() {
        if (state != CycleState.SLEEPING) {
            return false;
        }
        log.info("Manual sync trigger, waking scheduler");
        sleeper.wake();
        return true;
    }

    public SyncStatus status() {
        return new SyncStatus(state, cyclesCompleted.get(), consecutiveFailures.get(),
                lastCycleStartedAt, nextCycleAt, lastRun);
    }

    public CycleState getState() {
        return state;
    }
}
