package com.disasterfeed.sync.scheduler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class MonitorSleeperTest {

    private final MonitorSleeper sleeper = new MonitorSleeper();

    @Test
    @DisplayName("wake() ends a long sleep early")
    void wake_endsSleep() throws Exception {
        CountDownLatch done = new CountDownLatch(1);
        Thread sleeping = new Thread(() -> {
            try {
                sleeper.sleep(Duration.ofHours(1));
                done.countDown();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        sleeping.start();

        Thread.sleep(50);
        sleeper.wake();

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    @DisplayName("a wake before sleeping makes the next sleep return at once, only once")
    void wake_beforeSleep() throws Exception {
        sleeper.wake();

        long start = System.nanoTime();
        sleeper.sleep(Duration.ofHours(1));
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(1));

        start = System.nanoTime();
        sleeper.sleep(Duration.ofMillis(100));
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isGreaterThanOrEqualTo(Duration.ofMillis(90));
    }
}
