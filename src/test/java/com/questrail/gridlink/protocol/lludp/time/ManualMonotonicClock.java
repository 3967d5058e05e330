package com.questrail.gridlink.protocol.lludp.time;

import com.questrail.gridlink.protocol.lludp.internal.time.MonotonicClock;

import java.time.Duration;

/**
 * Monotonic clock that only moves when a test moves it.
 *
 * <p>Tests run on one thread, so no synchronization. The origin defaults to 0;
 * a non-zero origin checks that nothing treats the raw reading as an age.</p>
 */
public final class ManualMonotonicClock implements MonotonicClock {

    private long now;

    public ManualMonotonicClock() {
        this(0L);
    }

    public ManualMonotonicClock(long originNanos) {
        this.now = originNanos;
    }

    @Override
    public long nowNanos() {
        return now;
    }

    public void advance(Duration delta) {
        advanceNanos(delta.toNanos());
    }

    public void advanceNanos(long deltaNanos) {
        if (deltaNanos < 0) {
            throw new IllegalArgumentException("clock cannot move backwards: " + deltaNanos);
        }
        now += deltaNanos;
    }

    public void advanceMillis(long millis) {
        advanceNanos(Duration.ofMillis(millis).toNanos());
    }
}
