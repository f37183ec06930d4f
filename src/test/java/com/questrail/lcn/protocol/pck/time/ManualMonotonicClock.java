package com.questrail.lcn.protocol.pck.time;

import com.questrail.lcn.protocol.pck.internal.time.MonotonicClock;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Monotonic clock that starts at zero and only moves when a test advances it.
 */
public final class ManualMonotonicClock implements MonotonicClock {

    private final AtomicLong nowNanos = new AtomicLong();

    @Override
    public long nowNanos() {
        return nowNanos.get();
    }

    /** Milliseconds since the clock was created. */
    public long elapsedMillis() {
        return Duration.ofNanos(nowNanos.get()).toMillis();
    }

    public void advance(Duration delta) {
        if (delta.isNegative()) {
            throw new IllegalArgumentException("Monotonic time cannot go back: " + delta);
        }
        nowNanos.addAndGet(delta.toNanos());
    }

    public void advanceMillis(long millis) {
        advance(Duration.ofMillis(millis));
    }
}
