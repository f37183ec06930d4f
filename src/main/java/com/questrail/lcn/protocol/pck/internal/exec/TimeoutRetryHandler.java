package com.questrail.lcn.protocol.pck.internal.exec;

import com.questrail.lcn.protocol.pck.internal.time.Cancellable;
import com.questrail.lcn.protocol.pck.internal.time.MonotonicClock;
import com.questrail.lcn.protocol.pck.internal.time.MonotonicScheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * TimeoutRetryHandler
 * =============================================================================
 * Re-armable retry loop used for every "send, wait, resend" cycle of the
 * client: segment scan, serial discovery, acknowledged commands and status
 * polling.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>{@link #activate()} arms the handler. The first callback runs at the
 *       next scheduling opportunity, then one per {@code timeout}.</li>
 *   <li>With {@code numTries = n >= 0} the callback is invoked {@code n} times
 *       with {@code failed = false} and once more with {@code failed = true}.
 *       The handler is then idle and can be activated again.</li>
 *   <li>A negative {@code numTries} retries forever.</li>
 *   <li>Activating an active handler does nothing.</li>
 *   <li>{@link #cancel()} disarms immediately and is idempotent. A callback
 *       may cancel its own handler.</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * <p>State is guarded by an internal lock; the callback is always invoked
 * outside of it so callbacks may take connection locks. Each activation
 * carries a generation number so ticks scheduled by an earlier activation are
 * ignored.</p>
 */
public final class TimeoutRetryHandler
{
    private static final Logger log = LoggerFactory.getLogger(TimeoutRetryHandler.class);

    /**
     * Invoked on every tick.
     */
    @FunctionalInterface
    public interface TimeoutCallback
    {
        /**
         * @param failed {@code true} on the final tick after all tries were used
         */
        void onTimeout(boolean failed);
    }

    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;

    private final Object lock = new Object();

    private int numTries;
    private Duration timeout;
    private TimeoutCallback callback;

    private boolean active;
    private int triesLeft;
    private long generation;
    private Cancellable pending;

    public TimeoutRetryHandler(MonotonicScheduler scheduler, MonotonicClock clock, int numTries, Duration timeout)
    {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.timeout = requireTimeout(timeout);
        this.numTries = numTries;
    }

    public void setTimeoutCallback(TimeoutCallback callback)
    {
        synchronized (lock) {
            this.callback = callback;
        }
    }

    /**
     * Replaces tries, timeout and callback, then activates. Ignored (including
     * the new settings) while the handler is active.
     */
    public void activate(int numTries, Duration timeout, TimeoutCallback callback)
    {
        synchronized (lock) {
            if (active) {
                return;
            }
            this.numTries = numTries;
            this.timeout = requireTimeout(timeout);
            this.callback = callback;
        }
        activate();
    }

    public void activate()
    {
        synchronized (lock) {
            if (active) {
                return;
            }
            active = true;
            triesLeft = numTries;
            long gen = ++generation;
            pending = scheduler.scheduleAtNanos(clock.nowNanos(), () -> tick(gen));
        }
    }

    public void cancel()
    {
        Cancellable toCancel;
        synchronized (lock) {
            active = false;
            generation++;
            toCancel = pending;
            pending = null;
        }
        if (toCancel != null) {
            toCancel.cancel();
        }
    }

    /**
     * Same as {@link #cancel()}; the next activation starts with a full set of
     * tries.
     */
    public void reset()
    {
        cancel();
    }

    public boolean isActive()
    {
        synchronized (lock) {
            return active;
        }
    }

    private void tick(long gen)
    {
        boolean failed;
        TimeoutCallback cb;

        synchronized (lock) {
            if (!active || gen != generation) {
                return;
            }
            if (numTries >= 0 && triesLeft <= 0) {
                failed = true;
                active = false;
                pending = null;
            } else {
                failed = false;
                if (triesLeft > 0) {
                    triesLeft--;
                }
                pending = scheduler.scheduleAfter(timeout, clock, () -> tick(gen));
            }
            cb = callback;
        }

        if (cb == null) {
            return;
        }
        try {
            cb.onTimeout(failed);
        } catch (RuntimeException e) {
            log.error("Timeout callback failed (failed={})", failed, e);
        }
    }

    private static Duration requireTimeout(Duration timeout)
    {
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be non-negative");
        }
        return timeout;
    }
}
