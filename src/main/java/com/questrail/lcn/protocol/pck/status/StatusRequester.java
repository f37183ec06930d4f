package com.questrail.lcn.protocol.pck.status;

import com.questrail.lcn.protocol.pck.internal.exec.PckTimingPolicy;
import com.questrail.lcn.protocol.pck.internal.exec.PermitPool;
import com.questrail.lcn.protocol.pck.internal.time.Cancellable;
import com.questrail.lcn.protocol.pck.internal.time.MonotonicClock;
import com.questrail.lcn.protocol.pck.internal.time.MonotonicScheduler;
import com.questrail.lcn.protocol.pck.model.LcnAddress;
import com.questrail.lcn.protocol.pck.model.input.ModInput;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * StatusRequester
 * =============================================================================
 * Deduplicating, caching request/response layer for module status.
 *
 * <h2>Request flow</h2>
 * <ol>
 *   <li>A cached entry with the same address and response type, whose
 *       parameters include the requested ones and whose age is acceptable, is
 *       reused. Pending entries always qualify; among several the newest
 *       wins. The caller waits at most {@code defaultTimeout} on it.</li>
 *   <li>Otherwise a new pending entry is recorded and a fetch starts once a
 *       permit of the parallel-request pool is free: send the command, wait
 *       {@code defaultTimeout}, resend, for up to {@code numTries}
 *       attempts. When all attempts pass unanswered the entry is discarded
 *       and every waiter receives an empty result.</li>
 * </ol>
 *
 * <h2>Correlation</h2>
 * A response resolves every pending entry whose address and type match and
 * whose parameters equal the response's
 * {@link ModInput#correlationFields() correlation fields}.
 *
 * <h2>Caller isolation</h2>
 * Each caller receives its own future. Cancelling it, or its local timeout,
 * never affects the shared fetch other callers may be waiting on.
 *
 * <h2>Ages</h2>
 * {@code maxAgeMillis == -1} accepts any completed entry; {@code 0} accepts
 * only pending ones (forces a fresh request otherwise).
 *
 * <h2>Threading</h2>
 * The cache is guarded by a single lock. Futures are completed outside it.
 */
public final class StatusRequester
{
    private static final Logger log = LoggerFactory.getLogger(StatusRequester.class);

    /** Accept a cached response of any age. */
    public static final long ANY_AGE = -1;

    /**
     * Sends a status request command to a device.
     */
    @FunctionalInterface
    public interface CommandSender
    {
        void send(LcnAddress address, boolean requiresAck, String body);
    }

    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final PckTimingPolicy timing;
    private final int numTries;
    private final PermitPool permits;
    private final CommandSender sender;

    private final Object lock = new Object();
    private final List<Entry> entries = new ArrayList<>();

    private Cancellable pruneTimer;
    private long pruneGeneration;

    public StatusRequester(MonotonicScheduler scheduler,
                           MonotonicClock clock,
                           PckTimingPolicy timing,
                           int numTries,
                           int maxParallelRequests,
                           CommandSender sender)
    {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.timing = Objects.requireNonNull(timing, "timing");
        this.sender = Objects.requireNonNull(sender, "sender");
        if (numTries < 0) {
            throw new IllegalArgumentException("numTries must be non-negative");
        }
        this.numTries = numTries;
        this.permits = new PermitPool(maxParallelRequests);
    }

    /**
     * Requests a status value.
     *
     * @param address      logical device address
     * @param responseType expected response record
     * @param command      request command body (without address header)
     * @param requiresAck  send the request with an acknowledge request
     * @param maxAgeMillis accepted age of a cached response; -1 any, 0 fresh
     * @param parameters   response fields that must match (see {@link ModInput#correlationFields()})
     * @return future completing with the response, or empty if none arrived
     */
    public <T extends ModInput> CompletableFuture<Optional<T>> request(LcnAddress address,
                                                                       Class<T> responseType,
                                                                       String command,
                                                                       boolean requiresAck,
                                                                       long maxAgeMillis,
                                                                       Map<String, Object> parameters)
    {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(responseType, "responseType");
        Objects.requireNonNull(command, "command");
        Map<String, Object> params = Map.copyOf(Objects.requireNonNull(parameters, "parameters"));

        Entry cached = null;
        Entry fresh = null;
        synchronized (lock) {
            List<Entry> candidates = matching(address, responseType, params, maxAgeMillis);
            if (!candidates.isEmpty()) {
                cached = candidates.get(0);
            } else {
                entries.removeIf(e -> e.sameKey(address, responseType, params));
                fresh = new Entry(address, responseType, params);
                entries.add(fresh);
            }
        }

        if (cached != null) {
            log.debug("Status request {} {} {} served from cache", address, responseType.getSimpleName(), params);
            return boundedCopy(cached, responseType);
        }

        CompletableFuture<Optional<T>> result = copy(fresh, responseType);
        Entry entry = fresh;
        permits.acquire().thenRun(() -> startFetch(entry, command, requiresAck));
        return result;
    }

    /**
     * Resolves pending requests answered by {@code input}. The input must carry
     * the logical source address.
     */
    public void onInput(ModInput input)
    {
        Objects.requireNonNull(input, "input");
        Map<String, Object> fields = input.correlationFields();
        List<Entry> resolved = new ArrayList<>();

        synchronized (lock) {
            long now = clock.nowNanos();
            for (Entry e : entries) {
                if (e.isPending()
                        && e.address.equals(input.source())
                        && e.type == input.getClass()
                        && parametersMatch(e.parameters, fields)) {
                    e.timestampNanos = now;
                    resolved.add(e);
                }
            }
        }

        for (Entry e : resolved) {
            e.response.complete(input);
        }
    }

    /**
     * Removes answered entries older than {@code maxResponseAge}.
     */
    public void prune()
    {
        List<Entry> removed = new ArrayList<>();
        synchronized (lock) {
            long now = clock.nowNanos();
            long maxAge = timing.maxResponseAge().toNanos();
            entries.removeIf(e -> {
                boolean stale = !e.isPending() && now - e.timestampNanos > maxAge;
                if (stale) {
                    removed.add(e);
                }
                return stale;
            });
        }
        for (Entry e : removed) {
            e.response.cancel(false);
        }
        if (!removed.isEmpty()) {
            log.debug("Pruned {} cached status responses", removed.size());
        }
    }

    /**
     * Resolves every outstanding request empty and clears the cache.
     */
    public void cancelAll()
    {
        List<Entry> all;
        synchronized (lock) {
            all = new ArrayList<>(entries);
            entries.clear();
        }
        for (Entry e : all) {
            e.response.cancel(false);
        }
    }

    /**
     * Starts pruning every {@code maxResponseAge}. Idempotent.
     */
    public void startPruning()
    {
        synchronized (lock) {
            if (pruneTimer != null) {
                return;
            }
            long gen = ++pruneGeneration;
            pruneTimer = scheduler.scheduleAfter(timing.maxResponseAge(), clock, () -> pruneTick(gen));
        }
    }

    public void stopPruning()
    {
        Cancellable timer;
        synchronized (lock) {
            timer = pruneTimer;
            pruneTimer = null;
            pruneGeneration++;
        }
        if (timer != null) {
            timer.cancel();
        }
    }

    /** Number of cached or pending entries. */
    public int size()
    {
        synchronized (lock) {
            return entries.size();
        }
    }

    private void pruneTick(long gen)
    {
        synchronized (lock) {
            if (gen != pruneGeneration) {
                return;
            }
        }
        prune();
        synchronized (lock) {
            if (gen == pruneGeneration) {
                pruneTimer = scheduler.scheduleAfter(timing.maxResponseAge(), clock, () -> pruneTick(gen));
            }
        }
    }

    private void startFetch(Entry entry, String command, boolean requiresAck)
    {
        entry.response.whenComplete((value, error) -> {
            Cancellable timer = entry.timer;
            if (timer != null) {
                timer.cancel();
            }
            permits.release();
        });
        if (entry.response.isDone()) {
            return;
        }
        if (numTries == 0) {
            giveUp(entry);
            return;
        }
        attempt(entry, command, requiresAck, 1);
    }

    private void attempt(Entry entry, String command, boolean requiresAck, int attemptNo)
    {
        if (entry.response.isDone()) {
            return;
        }
        try {
            sender.send(entry.address, requiresAck, command);
        } catch (RuntimeException e) {
            log.warn("Sending status request {} to {} failed", command, entry.address, e);
        }
        entry.timer = scheduler.scheduleAfter(timing.defaultTimeout(), clock, () -> {
            if (entry.response.isDone()) {
                return;
            }
            if (attemptNo < numTries) {
                log.debug("No response to {} from {}; retrying ({}/{})", command, entry.address, attemptNo + 1, numTries);
                attempt(entry, command, requiresAck, attemptNo + 1);
            } else {
                giveUp(entry);
            }
        });
    }

    private void giveUp(Entry entry)
    {
        log.debug("Status request to {} for {} failed after {} tries",
                entry.address, entry.type.getSimpleName(), numTries);
        synchronized (lock) {
            entries.remove(entry);
        }
        entry.response.cancel(false);
    }

    private List<Entry> matching(LcnAddress address,
                                 Class<? extends ModInput> type,
                                 Map<String, Object> params,
                                 long maxAgeMillis)
    {
        long now = clock.nowNanos();
        long maxAgeNanos = maxAgeMillis * 1_000_000L;
        List<Entry> result = new ArrayList<>();
        for (Entry e : entries) {
            if (e.type != type || !e.address.equals(address)) {
                continue;
            }
            if (!e.parameters.entrySet().containsAll(params.entrySet())) {
                continue;
            }
            if (e.isPending() || maxAgeMillis == ANY_AGE || now - e.timestampNanos < maxAgeNanos) {
                result.add(e);
            }
        }
        result.sort(Comparator.comparingLong((Entry e) -> e.timestampNanos).reversed());
        return result;
    }

    private static boolean parametersMatch(Map<String, Object> requested, Map<String, Object> fields)
    {
        for (Map.Entry<String, Object> p : requested.entrySet()) {
            if (!fields.containsKey(p.getKey()) || !Objects.equals(fields.get(p.getKey()), p.getValue())) {
                return false;
            }
        }
        return true;
    }

    private static <T extends ModInput> CompletableFuture<Optional<T>> copy(Entry entry, Class<T> type)
    {
        CompletableFuture<Optional<T>> copy = new CompletableFuture<>();
        entry.response.whenComplete((value, error) ->
                copy.complete(error == null ? Optional.of(type.cast(value)) : Optional.empty()));
        return copy;
    }

    private <T extends ModInput> CompletableFuture<Optional<T>> boundedCopy(Entry entry, Class<T> type)
    {
        CompletableFuture<Optional<T>> copy = new CompletableFuture<>();
        Cancellable timer = scheduler.scheduleAfter(timing.defaultTimeout(), clock,
                () -> copy.complete(Optional.empty()));
        entry.response.whenComplete((value, error) -> {
            timer.cancel();
            copy.complete(error == null ? Optional.of(type.cast(value)) : Optional.empty());
        });
        return copy;
    }

    /**
     * One cached or pending request. {@code timestampNanos} is -1 while
     * pending and guarded by the requester lock.
     */
    private static final class Entry
    {
        final LcnAddress address;
        final Class<? extends ModInput> type;
        final Map<String, Object> parameters;
        final CompletableFuture<ModInput> response = new CompletableFuture<>();

        long timestampNanos = -1;
        volatile Cancellable timer;

        Entry(LcnAddress address, Class<? extends ModInput> type, Map<String, Object> parameters)
        {
            this.address = address;
            this.type = type;
            this.parameters = parameters;
        }

        boolean isPending()
        {
            return timestampNanos == -1;
        }

        boolean sameKey(LcnAddress address, Class<? extends ModInput> type, Map<String, Object> parameters)
        {
            return this.address.equals(address) && this.type == type && this.parameters.equals(parameters);
        }
    }
}
