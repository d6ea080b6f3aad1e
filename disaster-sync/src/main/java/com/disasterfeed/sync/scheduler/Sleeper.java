package com.disasterfeed.sync.scheduler;

import java.time.Duration;

/**
 * Waits between cycles. Swappable so the loop can be driven without real time.
 */
public interface Sleeper {

    /** Block for up to {@code duration}; returns early once {@link #wake()} has been called. */
    void sleep(Duration duration) throws InterruptedException;

    /** Ends the current (or the next) sleep immediately. */
    void wake();
}
