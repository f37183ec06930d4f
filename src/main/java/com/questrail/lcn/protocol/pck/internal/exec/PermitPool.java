package com.questrail.lcn.protocol.pck.internal.exec;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;

/**
 * Non-blocking counting semaphore bounding the number of status fetches in
 * flight.
 *
 * <p>{@link #acquire()} returns a future completing once a permit is held;
 * waiters are served in arrival order. Every completed acquire must be
 * matched by exactly one {@link #release()}. A waiter whose future was
 * cancelled is skipped and does not consume a permit.</p>
 */
public final class PermitPool
{
    private final int capacity;
    private final Deque<CompletableFuture<Void>> waiters = new ArrayDeque<>();
    private int available;

    public PermitPool(int capacity)
    {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.available = capacity;
    }

    public CompletableFuture<Void> acquire()
    {
        synchronized (waiters) {
            if (available > 0) {
                available--;
                return CompletableFuture.completedFuture(null);
            }
            CompletableFuture<Void> waiter = new CompletableFuture<>();
            waiters.addLast(waiter);
            return waiter;
        }
    }

    public void release()
    {
        CompletableFuture<Void> next = null;
        synchronized (waiters) {
            while (!waiters.isEmpty()) {
                CompletableFuture<Void> candidate = waiters.pollFirst();
                if (!candidate.isDone()) {
                    next = candidate;
                    break;
                }
            }
            if (next == null) {
                if (available < capacity) {
                    available++;
                }
                return;
            }
        }
        // The permit passes directly to the waiter. If it was cancelled in the
        // meantime, hand it on.
        if (!next.complete(null)) {
            release();
        }
    }

    public int available()
    {
        synchronized (waiters) {
            return available;
        }
    }

    public int capacity()
    {
        return capacity;
    }
}
