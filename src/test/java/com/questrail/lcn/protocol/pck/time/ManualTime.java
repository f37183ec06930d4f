package com.questrail.lcn.protocol.pck.time;

import java.time.Duration;

/**
 * A manual clock and the scheduler it drives, advanced together.
 */
public final class ManualTime {

    private final ManualMonotonicClock clock = new ManualMonotonicClock();
    private final DeterministicScheduler scheduler = new DeterministicScheduler(clock);

    public ManualMonotonicClock clock() {
        return clock;
    }

    public DeterministicScheduler scheduler() {
        return scheduler;
    }

    /** Runs what is due now. */
    public void runDue() {
        scheduler.runDueTasks();
    }

    /**
     * Advances in steps of one millisecond, running due tasks after each, so
     * tasks scheduled by earlier tasks fire at their own deadlines.
     */
    public void advanceMillis(long millis) {
        scheduler.runDueTasks();
        for (long i = 0; i < millis; i++) {
            clock.advanceMillis(1);
            scheduler.runDueTasks();
        }
    }

    /** Same as {@link #advanceMillis(long)} for timing-policy durations. */
    public void advance(Duration delta) {
        advanceMillis(delta.toMillis());
    }
}
