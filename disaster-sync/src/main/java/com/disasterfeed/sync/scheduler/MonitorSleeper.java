package com.disasterfeed.sync.scheduler;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

public class MonitorSleeper implements Sleeper {

    private final Object monitor = new Object();
    private boolean woken;

    @Override
    public void sleep(Duration duration) throws InterruptedException {
        long deadline = System.nanoTime() + duration.toNanos();
        synchronized (monitor) {
            try {
                while (!woken) {
                    long remaining = deadline - System.nanoTime();
                    if (remaining <= 0) break;
                    TimeUnit.NANOSECONDS.timedWait(monitor, remaining);
                }
            } finally {
                woken = false;
            }
        }
    }

    @Override
    public void wake() {
        synchronized (monitor) {
            woken = true;
            monitor.notifyAll();
        }
    }
}
