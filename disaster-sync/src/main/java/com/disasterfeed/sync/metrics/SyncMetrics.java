package com.disasterfeed.sync.metrics;

import com.disasterfeed.sync.model.FeedFormat;
import com.disasterfeed.sync.model.SyncResult;
import com.disasterfeed.sync.model.SyncRun;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Observability hook for the sync loop. Every warning, rejected record and failed cycle
 * passes through here so nothing is dropped without being counted.
 */
@Slf4j
@Component
public class SyncMetrics {

    private final MeterRegistry meterRegistry;
    private final AtomicInteger failureStreak = new AtomicInteger();
    private final Counter thresholdExceeded;
    private final Timer cycleTimer;
    private final Counter schemaCheckFailures;
    private final Counter runLogFailures;

    public SyncMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        Gauge.builder("disaster_sync.failure_streak", failureStreak, AtomicInteger::get)
                .description("Consecutive failed cycles")
                .register(meterRegistry);
        this.thresholdExceeded = Counter.builder("disaster_sync.failure_threshold.exceeded")
                .description("Cycles that ended with the failure streak exceeding the threshold")
                .register(meterRegistry);
        this.cycleTimer = Timer.builder("disaster_sync.cycle.duration")
                .description("Wall time of one fetch-to-write cycle")
                .register(meterRegistry);
        this.schemaCheckFailures = Counter.builder("disaster_sync.schema_check.failures")
                .description("Start-up schema checks that could not reach the store")
                .register(meterRegistry);
        this.runLogFailures = Counter.builder("disaster_sync.run_log.failures")
                .description("Cycle reports that could not be written to the runs table")
                .register(meterRegistry);
    }

    public void recordCycle(SyncRun run, Duration elapsed) {
        meterRegistry.counter("disaster_sync.cycles",
                "status", run.getStatus(),
                "kind", run.getFailureKind() != null ? run.getFailureKind().name() : "NONE").increment();
        cycleTimer.record(elapsed);
    }

    public void recordParseWarnings(FeedFormat format, int count) {
        if (count > 0) {
            meterRegistry.counter("disaster_sync.parse.warnings", "format", format.name()).increment(count);
        }
    }

    public void recordWrite(SyncResult result, int unchanged) {
        meterRegistry.counter("disaster_sync.events", "outcome", "inserted").increment(result.insertedCount());
        meterRegistry.counter("disaster_sync.events", "outcome", "updated").increment(result.updatedCount());
        meterRegistry.counter("disaster_sync.events", "outcome", "unchanged").increment(unchanged);
        meterRegistry.counter("disaster_sync.events", "outcome", "rejected").increment(result.failed().size());
    }

    public void schemaCheckFailed() {
        schemaCheckFailures.increment();
    }

    public void runLogWriteFailed() {
        runLogFailures.increment();
    }

    public void updateFailureStreak(int streak) {
        failureStreak.set(streak);
    }

    public void failureThresholdExceeded(int streak, int threshold, SyncRun lastRun) {
        thresholdExceeded.increment();
        log.error("Sync has failed {} cycles in a row (threshold {}); last failure {} at {}: {}",
                streak, threshold, lastRun.getFailureKind(), lastRun.getCompletedAt(), lastRun.getErrorMessage());
    }
}
