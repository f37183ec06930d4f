package com.questrail.lcn.protocol.pck.internal.time;

import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * ScheduledExecutorScheduler
 * =============================================================================
 * Production {@link MonotonicScheduler} backed by a
 * {@link ScheduledExecutorService}.
 *
 * <h2>Design</h2>
 * <p>Monotonic deadlines are converted into relative delays against the
 * supplied {@link MonotonicClock} at scheduling time. Deadlines in the past
 * run immediately.</p>
 *
 * <h2>Executor Ownership</h2>
 * <p>The executor is not owned by this class; {@code PckProductionRuntime}
 * shuts it down.</p>
 *
 * <h2>Shutdown</h2>
 * <p>Tasks submitted after the executor was shut down are dropped with a debug
 * log and a handle that reports nothing to cancel. Timers armed by late
 * transport callbacks during shutdown therefore never surface as errors.</p>
 */
public final class ScheduledExecutorScheduler implements MonotonicScheduler {

    private static final Logger log = LoggerFactory.getLogger(ScheduledExecutorScheduler.class);

    private final ScheduledExecutorService executor;
    private final MonotonicClock clock;

    /**
     * @param executor the underlying scheduled executor service
     * @param clock    the monotonic clock used for delay calculations
     */
    public ScheduledExecutorScheduler(ScheduledExecutorService executor, MonotonicClock clock) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Objects.requireNonNull(task, "task");

        long delayNanos = Math.max(0, deadlineNanos - clock.nowNanos());

        try {
            ScheduledFuture<?> future = executor.schedule(task, delayNanos, TimeUnit.NANOSECONDS);
            return new ScheduledFutureCancellable(future);
        } catch (RejectedExecutionException e) {
            log.debug("Scheduler is shut down; dropping task {}", task);
            return () -> false;
        }
    }

    /**
     * Adapter from {@link ScheduledFuture} to {@link Cancellable}.
     */
    private static final class ScheduledFutureCancellable implements Cancellable {
        private final ScheduledFuture<?> future;

        private ScheduledFutureCancellable(ScheduledFuture<?> future) {
            this.future = future;
        }

        @Override
        public boolean cancel() {
            // Never interrupt a running callback; it may hold a connection lock.
            return future.cancel(false);
        }
    }
}
