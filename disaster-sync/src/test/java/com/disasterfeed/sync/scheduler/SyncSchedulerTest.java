package com.disasterfeed.sync.scheduler;

import com.disasterfeed.sync.config.DisasterSyncProperties;
import com.disasterfeed.sync.metrics.SyncMetrics;
import com.disasterfeed.sync.model.CycleState;
import com.disasterfeed.sync.model.FailureKind;
import com.disasterfeed.sync.model.SyncRun;
import com.disasterfeed.sync.output.InMemoryEventStore;
import com.disasterfeed.sync.service.SyncPipeline;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SyncSchedulerTest {

    private static final Instant NOW = Instant.parse("2024-10-15T00:00:00Z");

    @Mock
    private SyncPipeline pipeline;

    private final InMemoryEventStore store = new InMemoryEventStore();
    private final DisasterSyncProperties properties = new DisasterSyncProperties();
    private final SyncMetrics metrics = mock(SyncMetrics.class);
    private ScriptedSleeper sleeper;
    private SyncScheduler scheduler;

    @BeforeEach
    void setUp() {
        properties.getScheduling().setInterval(Duration.ofHours(6));
        properties.getScheduling().setFailureThreshold(2);
        sleeper = new ScriptedSleeper();
        scheduler = new SyncScheduler(pipeline, store, properties, metrics, sleeper, Clock.fixed(NOW, ZoneOffset.UTC));
        sleeper.scheduler = scheduler;
    }

    @Test
    @DisplayName("sleeps one interval after each cycle and stops cleanly")
    void runLoop_sleepsBetweenCycles() {
        when(pipeline.runCycle(any(), any())).thenReturn(run("SUCCESS", null));
        sleeper.stopAfter = 3;

        scheduler.runLoop();

        verify(pipeline, times(3)).runCycle(any(), any());
        assertThat(sleeper.durations).containsOnly(Duration.ofHours(6)).hasSize(3);
        assertThat(sleeper.statesWhileSleeping).containsOnly(CycleState.SLEEPING);
        assertThat(scheduler.getState()).isEqualTo(CycleState.STOPPED);
        assertThat(scheduler.status().cyclesCompleted()).isEqualTo(3);
        assertThat(scheduler.status().nextCycleAt()).isEqualTo(NOW.plus(Duration.ofHours(6)));
    }

    @Test
    @DisplayName("a failed cycle does not stop the loop; the next success resets the streak")
    void runLoop_recoversAfterFailure() {
        when(pipeline.runCycle(any(), any()))
                .thenReturn(run("FAILED", FailureKind.FETCH), run("SUCCESS", null));
        sleeper.stopAfter = 2;

        scheduler.runLoop();

        verify(pipeline, times(2)).runCycle(any(), any());
        assertThat(scheduler.status().consecutiveFailures()).isZero();
        assertThat(scheduler.status().lastRun().isSuccess()).isTrue();
        verify(metrics).updateFailureStreak(1);
        verify(metrics).updateFailureStreak(0);
        verify(metrics, never()).failureThresholdExceeded(anyInt(), anyInt(), any());
    }

    @Test
    @DisplayName("a streak exceeding the failure threshold reports through metrics and keeps cycling")
    void runLoop_failureThreshold() {
        SyncRun failed = run("FAILED", FailureKind.STORAGE);
        when(pipeline.runCycle(any(), any())).thenReturn(failed);
        sleeper.stopAfter = 4;

        scheduler.runLoop();

        verify(metrics, never()).failureThresholdExceeded(2, 2, failed);
        verify(metrics).failureThresholdExceeded(3, 2, failed);
        verify(metrics).failureThresholdExceeded(4, 2, failed);
        assertThat(scheduler.status().consecutiveFailures()).isEqualTo(4);
    }

    @Test
    @DisplayName("a cancelled cycle ends the loop without counting as a failure")
    void runLoop_cancelled() {
        when(pipeline.runCycle(any(), any())).thenAnswer(inv -> {
            scheduler.requestStop();
            return run("CANCELLED", FailureKind.CANCELLED);
        });

        scheduler.runLoop();

        assertThat(sleeper.durations).isEmpty();
        assertThat(scheduler.status().consecutiveFailures()).isZero();
        assertThat(scheduler.getState()).isEqualTo(CycleState.STOPPED);
    }

    @Test
    @DisplayName("pipeline state changes are reflected in the scheduler state")
    void runLoop_forwardsStates() {
        List<CycleState> seen = new ArrayList<>();
        when(pipeline.runCycle(any(), any())).thenAnswer(inv -> {
            Consumer<CycleState> onState = inv.getArgument(1);
            onState.accept(CycleState.FETCHING);
            seen.add(scheduler.getState());
            onState.accept(CycleState.WRITING);
            seen.add(scheduler.getState());
            return run("SUCCESS", null);
        });
        sleeper.stopAfter = 1;

        scheduler.runLoop();

        assertThat(seen).containsExactly(CycleState.FETCHING, CycleState.WRITING);
    }

    @Test
    @DisplayName("a manual trigger is accepted only while sleeping")
    void triggerNow_onlyWhenSleeping() {
        when(pipeline.runCycle(any(), any())).thenReturn(run("SUCCESS", null));
        sleeper.stopAfter = 1;
        sleeper.triggerWhileSleeping = true;

        assertThat(scheduler.triggerNow()).isFalse();
        scheduler.runLoop();

        assertThat(sleeper.triggerAccepted).containsExactly(true);
        assertThat(scheduler.triggerNow()).isFalse();
    }

    @Test
    @DisplayName("with fail-fast on, an unreachable store aborts start-up")
    void start_failFast() {
        properties.getScheduling().setFailFastOnStartup(true);
        store.failSchema(new IllegalStateException("connection refused"));

        assertThatThrownBy(() -> scheduler.start())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("connection refused");
        assertThat(scheduler.isRunning()).isFalse();
        verify(metrics).schemaCheckFailed();
    }

    @Test
    @DisplayName("without fail-fast the loop starts anyway and stop() ends it")
    void start_tolerant() throws InterruptedException {
        store.failSchema(new IllegalStateException("connection refused"));
        when(pipeline.runCycle(any(), any())).thenReturn(run("SUCCESS", null));
        SyncScheduler live = new SyncScheduler(pipeline, store, properties, metrics, new MonitorSleeper(),
                Clock.fixed(NOW, ZoneOffset.UTC));

        live.start();
        long deadline = System.currentTimeMillis() + 5_000;
        while (live.getState() != CycleState.SLEEPING && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertThat(live.getState()).isEqualTo(CycleState.SLEEPING);
        live.stop();

        assertThat(store.schemaCalls()).isEqualTo(1);
        verify(metrics).schemaCheckFailed();
        assertThat(live.isRunning()).isFalse();
        assertThat(live.getState()).isEqualTo(CycleState.STOPPED);
    }

    private SyncRun run(String status, FailureKind kind) {
        return SyncRun.builder()
                .runId("00000000-0000-0000-0000-000000000001")
                .startedAt(NOW)
                .completedAt(NOW)
                .status(status)
                .failureKind(kind)
                .build();
    }

    /** Returns immediately, recording each requested sleep; requests a stop after a set number of sleeps. */
    private static class ScriptedSleeper implements Sleeper {

        SyncScheduler scheduler;
        int stopAfter = Integer.MAX_VALUE;
        boolean triggerWhileSleeping;
        final List<Duration> durations = new ArrayList<>();
        final List<CycleState> statesWhileSleeping = new ArrayList<>();
        final List<Boolean> triggerAccepted = new ArrayList<>();

        @Override
        public void sleep(Duration duration) {
            durations.add(duration);
            statesWhileSleeping.add(scheduler.getState());
            if (triggerWhileSleeping) {
                triggerAccepted.add(scheduler.triggerNow());
            }
            if (durations.size() >= stopAfter) {
                scheduler.requestStop();
            }
        }

        @Override
        public void wake() {
        }
    }
}
