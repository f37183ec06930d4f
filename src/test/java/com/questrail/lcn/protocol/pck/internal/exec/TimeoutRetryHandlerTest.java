package com.questrail.lcn.protocol.pck.internal.exec;

import com.questrail.lcn.protocol.pck.time.DeterministicScheduler;
import com.questrail.lcn.protocol.pck.time.ManualMonotonicClock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TimeoutRetryHandlerTest {

    private static final Duration TIMEOUT = Duration.ofMillis(100);

    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private List<Boolean> calls;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        calls = new ArrayList<>();
    }

    private TimeoutRetryHandler handler(int numTries) {
        TimeoutRetryHandler handler = new TimeoutRetryHandler(scheduler, clock, numTries, TIMEOUT);
        handler.setTimeoutCallback(calls::add);
        return handler;
    }

    private void advance(long millis) {
        clock.advanceMillis(millis);
        scheduler.runDueTasks();
    }

    @Test
    void firstTickRunsImmediately() {
        TimeoutRetryHandler handler = handler(3);

        handler.activate();
        scheduler.runDueTasks();

        assertEquals(List.of(false), calls);
        assertTrue(handler.isActive());
    }

    @Test
    void finiteTriesEndWithOneFailedCallback() {
        TimeoutRetryHandler handler = handler(3);

        handler.activate();
        scheduler.runDueTasks();
        advance(100);
        advance(100);
        advance(100);

        assertEquals(List.of(false, false, false, true), calls);
        assertFalse(handler.isActive());

        advance(1000);
        assertEquals(4, calls.size(), "Idle handler must not tick");
    }

    @Test
    void zeroTriesFailsOnFirstTick() {
        TimeoutRetryHandler handler = handler(0);

        handler.activate();
        scheduler.runDueTasks();

        assertEquals(List.of(true), calls);
        assertFalse(handler.isActive());
    }

    @Test
    void negativeTriesRetryForever() {
        TimeoutRetryHandler handler = handler(-1);

        handler.activate();
        scheduler.runDueTasks();
        for (int i = 0; i < 50; i++) {
            advance(100);
        }

        assertEquals(51, calls.size());
        assertFalse(calls.contains(true));
        assertTrue(handler.isActive());
    }

    @Test
    void cancelStopsFurtherCallbacks() {
        TimeoutRetryHandler handler = handler(5);

        handler.activate();
        scheduler.runDueTasks();
        handler.cancel();
        advance(1000);

        assertEquals(List.of(false), calls);
        assertFalse(handler.isActive());
        handler.cancel();
    }

    @Test
    void activateWhileActiveIsIgnored() {
        TimeoutRetryHandler handler = handler(2);

        handler.activate();
        handler.activate();
        scheduler.runDueTasks();

        assertEquals(List.of(false), calls);
    }

    @Test
    void reactivationAfterCancelStartsFreshAndIgnoresStaleTicks() {
        TimeoutRetryHandler handler = handler(1);

        handler.activate();
        scheduler.runDueTasks();
        advance(50);
        handler.cancel();
        handler.activate();
        scheduler.runDueTasks();

        // The tick armed by the first activation is due at 100 ms; only the
        // second activation's tick at 150 ms may fire.
        advance(50);
        assertEquals(List.of(false, false), calls);

        advance(50);
        assertEquals(List.of(false, false, true), calls);
    }

    @Test
    void callbackMayCancelItsOwnHandler() {
        TimeoutRetryHandler handler = new TimeoutRetryHandler(scheduler, clock, -1, TIMEOUT);
        handler.setTimeoutCallback(failed -> {
            calls.add(failed);
            handler.cancel();
        });

        handler.activate();
        scheduler.runDueTasks();
        advance(500);

        assertEquals(List.of(false), calls);
        assertFalse(handler.isActive());
    }

    @Test
    void throwingCallbackDoesNotBreakTheLoop() {
        TimeoutRetryHandler handler = new TimeoutRetryHandler(scheduler, clock, 2, TIMEOUT);
        handler.setTimeoutCallback(failed -> {
            calls.add(failed);
            throw new IllegalStateException("boom");
        });

        handler.activate();
        scheduler.runDueTasks();
        advance(100);
        advance(100);

        assertEquals(List.of(false, false, true), calls);
    }

    @Test
    void activateWithNewSettingsReplacesThem() {
        TimeoutRetryHandler handler = handler(5);
        List<Boolean> other = new ArrayList<>();

        handler.activate(1, Duration.ofMillis(10), other::add);
        scheduler.runDueTasks();
        advance(10);

        assertEquals(List.of(false, true), other);
        assertTrue(calls.isEmpty());
    }

    @Test
    void negativeTimeoutIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new TimeoutRetryHandler(scheduler, clock, 1, Duration.ofMillis(-1)));
    }
}
