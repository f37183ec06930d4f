package com.questrail.lcn.protocol.pck.device;

import com.questrail.lcn.protocol.pck.internal.exec.TimeoutRetryHandler;
import com.questrail.lcn.protocol.pck.internal.time.MonotonicClock;
import com.questrail.lcn.protocol.pck.internal.time.MonotonicScheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * One endless retry handler per {@link StatusItem}. Every tick asks the
 * owner to send the item's status request; the handler interval is the
 * maximum accepted age of the value.
 */
final class StatusPollingBank
{
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final Function<StatusItem, Duration> intervalFor;
    private final Consumer<StatusItem> poller;

    private final Map<StatusItem, TimeoutRetryHandler> handlers = new HashMap<>();

    StatusPollingBank(MonotonicScheduler scheduler,
                      MonotonicClock clock,
                      Function<StatusItem, Duration> intervalFor,
                      Consumer<StatusItem> poller)
    {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.intervalFor = Objects.requireNonNull(intervalFor, "intervalFor");
        this.poller = Objects.requireNonNull(poller, "poller");
    }

    /**
     * Starts polling {@code item}. The interval is evaluated now, so callers
     * activate variables only once the firmware is known.
     */
    void activate(StatusItem item)
    {
        Duration interval = intervalFor.apply(item);
        TimeoutRetryHandler handler;
        synchronized (handlers) {
            handler = handlers.computeIfAbsent(item, i -> new TimeoutRetryHandler(scheduler, clock, -1, interval));
        }
        handler.activate(-1, interval, failed -> {
            if (!failed) {
                poller.accept(item);
            }
        });
    }

    void cancel(StatusItem item)
    {
        TimeoutRetryHandler handler;
        synchronized (handlers) {
            handler = handlers.get(item);
        }
        if (handler != null) {
            handler.cancel();
        }
    }

    void cancelAll()
    {
        List<TimeoutRetryHandler> all;
        synchronized (handlers) {
            all = new ArrayList<>(handlers.values());
        }
        for (TimeoutRetryHandler handler : all) {
            handler.cancel();
        }
    }

    boolean isActive(StatusItem item)
    {
        TimeoutRetryHandler handler;
        synchronized (handlers) {
            handler = handlers.get(item);
        }
        return handler != null && handler.isActive();
    }
}
