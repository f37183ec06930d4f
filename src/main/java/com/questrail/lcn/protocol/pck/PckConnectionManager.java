package com.questrail.lcn.protocol.pck;

import com.questrail.lcn.protocol.pck.codec.PckGenerator;
import com.questrail.lcn.protocol.pck.codec.PckInputParser;
import com.questrail.lcn.protocol.pck.config.PckConnectionConfig;
import com.questrail.lcn.protocol.pck.device.AddressConnection;
import com.questrail.lcn.protocol.pck.device.ConnectionContext;
import com.questrail.lcn.protocol.pck.device.GroupConnection;
import com.questrail.lcn.protocol.pck.device.ModuleConnection;
import com.questrail.lcn.protocol.pck.internal.exec.PckTimingPolicy;
import com.questrail.lcn.protocol.pck.internal.exec.TimeoutRetryHandler;
import com.questrail.lcn.protocol.pck.internal.time.Cancellable;
import com.questrail.lcn.protocol.pck.internal.time.MonotonicClock;
import com.questrail.lcn.protocol.pck.internal.time.MonotonicScheduler;
import com.questrail.lcn.protocol.pck.internal.time.WallClock;
import com.questrail.lcn.protocol.pck.model.LcnAddress;
import com.questrail.lcn.protocol.pck.model.LcnEvent;
import com.questrail.lcn.protocol.pck.model.input.HostInput;
import com.questrail.lcn.protocol.pck.model.input.ModAck;
import com.questrail.lcn.protocol.pck.model.input.ModInput;
import com.questrail.lcn.protocol.pck.model.input.ModSk;
import com.questrail.lcn.protocol.pck.model.input.ModSn;
import com.questrail.lcn.protocol.pck.model.input.PckInput;
import com.questrail.lcn.protocol.pck.model.input.Unknown;
import com.questrail.lcn.protocol.pck.observability.NullObservabilitySink;
import com.questrail.lcn.protocol.pck.observability.PckErrorEvent;
import com.questrail.lcn.protocol.pck.observability.PckObservabilitySink;
import com.questrail.lcn.protocol.pck.observability.PckStateTransitionEvent;
import com.questrail.lcn.protocol.pck.status.StatusRequester;
import com.questrail.lcn.protocol.pck.transport.LineEndpoint;
import com.questrail.lcn.protocol.pck.transport.LineEndpointListener;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * PckConnectionManager
 * =============================================================================
 * Owns one connection to a PCK gateway and everything that lives on it: the
 * login handshake, the bus state, the local segment id, the table of module
 * connections and the shared {@link StatusRequester}.
 *
 * <h2>Readiness</h2>
 * The connection is ready once three latches are set, in this order:
 * <ol>
 *   <li>{@link #socketConnected()}: the transport is up</li>
 *   <li>{@link #busConnected()}: the gateway reported a connected bus</li>
 *   <li>{@link #segmentScanCompleted()}: the local segment id is known, or
 *       the segment coupler scan gave up and assumed segment 0</li>
 * </ol>
 * Module inputs received before that are dropped; their physical addresses
 * cannot be translated yet.
 *
 * <h2>Disconnects</h2>
 * A bus disconnect or a lost socket discards every module connection with
 * its timers and resolves every outstanding status request empty. The bus
 * and segment latches are replaced by fresh ones. Nothing is retried
 * automatically; a lost socket needs a new {@link #connect()}.
 *
 * <h2>Threading</h2>
 * Transport callbacks, timer callbacks and callers may run concurrently.
 * Connection state is guarded by one lock, taken before any device
 * connection's lock. {@link #sendLine(String)} and
 * {@link #localSegmentId()} read volatile state only. Listeners, sinks and
 * futures are invoked outside the lock.
 */
public final class PckConnectionManager implements ConnectionContext, LineEndpointListener, AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(PckConnectionManager.class);

    /** Segment coupler scans go to group 3 on segment 3. */
    private static final LcnAddress SEGMENT_SCAN_TARGET = LcnAddress.group(3, 3);

    /** Module scans go to group 3 on each segment. */
    private static final int MODULE_SCAN_GROUP = 3;

    private final PckConnectionConfig config;
    private final LineEndpoint endpoint;
    private final PckInputParser parser;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final PckObservabilitySink observabilitySink;
    private final StatusRequester statusRequester;
    private final TimeoutRetryHandler segmentScanHandler;

    private final List<Consumer<PckInput>> inputListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<LcnEvent>> eventListeners = new CopyOnWriteArrayList<>();

    private final Object lock = new Object();

    // Guarded by lock.
    private PckConnectionState state = PckConnectionState.DISCONNECTED;
    private final Map<LcnAddress, ModuleConnection> modules = new HashMap<>();
    private final Set<Integer> segmentCouplerIds = new LinkedHashSet<>();
    private CompletableFuture<Void> connectFuture;
    private Cancellable connectDeadline;
    private long pingGeneration;
    private int pingCounter;
    private Cancellable pingTimer;
    private Cancellable pingTimeoutTimer;
    private ModuleScan moduleScan;

    private volatile int localSegmentId = -1;
    private volatile boolean transportUp;
    private volatile boolean lcnConnected;
    private volatile CompletableFuture<Void> socketConnected = new CompletableFuture<>();
    private volatile CompletableFuture<Void> busConnected = new CompletableFuture<>();
    private volatile CompletableFuture<Void> segmentScanCompleted = new CompletableFuture<>();

    public PckConnectionManager(PckConnectionConfig config,
                                LineEndpoint endpoint,
                                PckInputParser parser,
                                MonotonicScheduler scheduler,
                                MonotonicClock clock,
                                WallClock wallClock,
                                PckObservabilitySink observabilitySink)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);

        PckTimingPolicy timing = config.timingPolicy();
        this.statusRequester = new StatusRequester(scheduler, clock, timing,
                config.numTries(), config.maxParallelRequests(),
                (address, requiresAck, body) -> getAddressConnection(address).send(requiresAck, body));

        this.segmentScanHandler = new TimeoutRetryHandler(scheduler, clock,
                config.segmentScanTries(), timing.segmentScanTimeout());
        this.segmentScanHandler.setTimeoutCallback(this::onSegmentScanTimeout);

        this.endpoint.setListener(this);
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    /**
     * Connects with the configured connect timeout.
     */
    public CompletableFuture<Void> connect()
    {
        return connect(config.connectTimeout());
    }

    /**
     * Opens the transport and completes once the connection is ready.
     *
     * <p>The future fails with {@link PckAuthenticationException} or
     * {@link PckLicenseException} when the gateway rejects the login (the
     * transport is closed), with {@link PckConnectionFailedException} when the
     * transport goes down first, and with {@link PckConnectionTimeoutException}
     * when {@code deadline} passes. A timeout after a successful login whose
     * bus never came up is reported as {@link PckBusNotConnectedException};
     * the transport stays open in that case.</p>
     *
     * <p>Calling this while a connect is in progress, or after it succeeded,
     * returns the same future. Calling it on an open connection whose last
     * connect failed waits for readiness again without reopening the
     * transport.</p>
     */
    public CompletableFuture<Void> connect(Duration deadline)
    {
        Objects.requireNonNull(deadline, "deadline");
        CompletableFuture<Void> future;
        PckStateTransitionEvent transition;
        synchronized (lock) {
            if (state != PckConnectionState.DISCONNECTED) {
                if (connectFuture != null && !connectFuture.isCompletedExceptionally()) {
                    return connectFuture;
                }
                future = new CompletableFuture<>();
                connectFuture = future;
                if (isReady()) {
                    future.complete(null);
                } else {
                    connectDeadline = scheduler.scheduleAfter(deadline, clock, () -> onConnectDeadline(future));
                }
                return future;
            }
            future = new CompletableFuture<>();
            connectFuture = future;
            transition = transitionTo(PckConnectionState.SOCKET_CONNECTING, "connect");
            connectDeadline = scheduler.scheduleAfter(deadline, clock, () -> onConnectDeadline(future));
        }
        emit(transition);

        log.info("Connecting to PCK gateway {}:{}", config.host(), config.port());
        try {
            endpoint.start();
        } catch (RuntimeException e) {
            onTransportDown(e);
        }
        return future;
    }

    /**
     * Cancels every timer and request and closes the transport.
     */
    @Override
    public void close()
    {
        log.info("Closing connection to {}:{}", config.host(), config.port());
        endpoint.stop();
        // An endpoint that was never started does not report the close.
        onTransportDown(null);
    }

    // ---------------------------------------------------------------------
    // Latches and state
    // ---------------------------------------------------------------------

    public CompletableFuture<Void> socketConnected()
    {
        return socketConnected;
    }

    public CompletableFuture<Void> busConnected()
    {
        return busConnected;
    }

    @Override
    public CompletableFuture<Void> segmentScanCompleted()
    {
        return segmentScanCompleted;
    }

    public boolean isReady()
    {
        return socketConnected.isDone() && busConnected.isDone() && segmentScanCompleted.isDone();
    }

    public boolean isLcnConnected()
    {
        return lcnConnected;
    }

    public PckConnectionState state()
    {
        synchronized (lock) {
            return state;
        }
    }

    @Override
    public int localSegmentId()
    {
        return localSegmentId;
    }

    /** Segment ids reported by segment couplers since the connection opened. */
    public Set<Integer> segmentCouplerIds()
    {
        synchronized (lock) {
            return Collections.unmodifiableSet(new LinkedHashSet<>(segmentCouplerIds));
        }
    }

    @Override
    public MonotonicScheduler scheduler()
    {
        return scheduler;
    }

    @Override
    public MonotonicClock clock()
    {
        return clock;
    }

    @Override
    public PckConnectionConfig config()
    {
        return config;
    }

    @Override
    public StatusRequester statusRequester()
    {
        return statusRequester;
    }

    // ---------------------------------------------------------------------
    // Device connections
    // ---------------------------------------------------------------------

    /**
     * Returns the connection to a module, creating it on first use. Segment 0
     * is replaced by the local segment id once known. A new connection starts
     * serial discovery as soon as the segment scan completed.
     */
    public ModuleConnection getModuleConnection(LcnAddress address)
    {
        Objects.requireNonNull(address, "address");
        if (address.isGroup()) {
            throw new IllegalArgumentException("Not a module address: " + address);
        }

        ModuleConnection created;
        synchronized (lock) {
            LcnAddress key = resolveLocal(address);
            ModuleConnection existing = modules.get(key);
            if (existing != null) {
                return existing;
            }
            created = new ModuleConnection(this, key);
            modules.put(key, created);
        }
        log.debug("Created connection to {}", created.address());
        created.startSerialDiscovery();
        return created;
    }

    /**
     * Returns a new connection to a group. Group connections hold no state
     * and are not cached.
     */
    public GroupConnection getGroupConnection(LcnAddress address)
    {
        Objects.requireNonNull(address, "address");
        if (!address.isGroup()) {
            throw new IllegalArgumentException("Not a group address: " + address);
        }
        return new GroupConnection(this, resolveLocal(address));
    }

    public AddressConnection getAddressConnection(LcnAddress address)
    {
        Objects.requireNonNull(address, "address");
        return address.isGroup() ? getGroupConnection(address) : getModuleConnection(address);
    }

    /** Module connections currently in the table. */
    public List<ModuleConnection> moduleConnections()
    {
        synchronized (lock) {
            return new ArrayList<>(modules.values());
        }
    }

    private LcnAddress resolveLocal(LcnAddress address)
    {
        int local = localSegmentId;
        if (address.segmentId() == 0 && local != -1) {
            return address.withSegmentId(local);
        }
        return address;
    }

    // ---------------------------------------------------------------------
    // Sending
    // ---------------------------------------------------------------------

    /**
     * Writes one line to the bus. Dropped (returning {@code false}) while the
     * bus is not connected.
     */
    @Override
    public boolean sendLine(String line)
    {
        return sendCommand(line, false);
    }

    /**
     * Writes one line.
     *
     * @param line   complete PCK line without terminator
     * @param toHost the line is meant for the gateway itself and may be sent
     *               before the bus is connected
     * @return {@code false} if the line was dropped
     */
    public boolean sendCommand(String line, boolean toHost)
    {
        Objects.requireNonNull(line, "line");
        if (!transportUp) {
            log.debug("Transport down, dropping {}", line);
            return false;
        }
        if (!toHost && !lcnConnected) {
            log.debug("Bus not connected, dropping {}", line);
            return false;
        }
        log.debug("to gateway: {}", line);
        endpoint.send(line);
        return true;
    }

    public boolean sendCommand(String line)
    {
        return sendCommand(line, false);
    }

    // ---------------------------------------------------------------------
    // Module scan
    // ---------------------------------------------------------------------

    /**
     * Asks every module on every known segment to acknowledge an empty
     * command. Each round waits {@code moduleScanTimeout} after the last
     * module response before it ends; {@code numTries} rounds are sent.
     *
     * @return the modules that answered during the scan
     */
    public CompletableFuture<Set<LcnAddress>> scanModules()
    {
        ModuleScan scan;
        synchronized (lock) {
            if (moduleScan != null) {
                return moduleScan.result;
            }
            scan = new ModuleScan(config.numTries());
            moduleScan = scan;
        }
        log.info("Scanning for modules");
        nextModuleScanRound(scan);
        return scan.result;
    }

    private void nextModuleScanRound(ModuleScan scan)
    {
        List<Integer> segments;
        int local = localSegmentId;
        synchronized (lock) {
            if (moduleScan != scan) {
                return;
            }
            scan.roundsLeft--;
            scan.lastResponseNanos = clock.nowNanos();
            segments = segmentCouplerIds.isEmpty() ? List.of(0) : new ArrayList<>(segmentCouplerIds);
        }
        for (int segmentId : segments) {
            int target = segmentId == local ? 0 : segmentId;
            sendLine(PckGenerator.addressed(LcnAddress.group(target, MODULE_SCAN_GROUP), local, true,
                    PckGenerator.empty()));
        }
        scheduleModuleScanCheck(scan, config.timingPolicy().moduleScanTimeout().toNanos());
    }

    private void scheduleModuleScanCheck(ModuleScan scan, long delayNanos)
    {
        scheduler.scheduleAfter(Duration.ofNanos(delayNanos), clock, () -> onModuleScanCheck(scan));
    }

    private void onModuleScanCheck(ModuleScan scan)
    {
        long timeout = config.timingPolicy().moduleScanTimeout().toNanos();
        boolean nextRound;
        Set<LcnAddress> found;
        synchronized (lock) {
            if (moduleScan != scan) {
                return;
            }
            long quiet = clock.nowNanos() - scan.lastResponseNanos;
            if (quiet < timeout) {
                scheduleModuleScanCheck(scan, timeout - quiet);
                return;
            }
            nextRound = scan.roundsLeft > 0;
            found = nextRound ? null : finishModuleScan(scan);
        }
        if (nextRound) {
            nextModuleScanRound(scan);
        } else {
            log.info("Module scan found {} modules", found.size());
            scan.result.complete(found);
        }
    }

    // Guarded by lock.
    private Set<LcnAddress> finishModuleScan(ModuleScan scan)
    {
        moduleScan = null;
        return Collections.unmodifiableSet(new LinkedHashSet<>(scan.found));
    }

    // ---------------------------------------------------------------------
    // Listeners
    // ---------------------------------------------------------------------

    /**
     * Registers for every module input routed once the connection is ready.
     *
     * @return unregisters the listener
     */
    public Runnable registerInputListener(Consumer<PckInput> listener)
    {
        Objects.requireNonNull(listener, "listener");
        inputListeners.add(listener);
        return () -> inputListeners.remove(listener);
    }

    /**
     * @return unregisters the listener
     */
    public Runnable registerEventListener(Consumer<LcnEvent> listener)
    {
        Objects.requireNonNull(listener, "listener");
        eventListeners.add(listener);
        return () -> eventListeners.remove(listener);
    }

    // ---------------------------------------------------------------------
    // Transport callbacks
    // ---------------------------------------------------------------------

    @Override
    public void onTransportUp()
    {
        PckStateTransitionEvent transition;
        CompletableFuture<Void> latch;
        synchronized (lock) {
            transportUp = true;
            transition = transitionTo(PckConnectionState.SOCKET_CONNECTED, "transport up");
            latch = socketConnected;
        }
        log.info("Connected to {}:{}", config.host(), config.port());
        emit(transition);
        latch.complete(null);
        statusRequester.startPruning();
    }

    @Override
    public void onTransportDown(Throwable cause)
    {
        PckStateTransitionEvent transition;
        SessionReset reset;
        CompletableFuture<Void> pendingConnect;
        boolean wasUp;
        synchronized (lock) {
            if (state == PckConnectionState.DISCONNECTED) {
                return;
            }
            wasUp = transportUp;
            transportUp = false;
            reset = resetBus();
            socketConnected = new CompletableFuture<>();
            pendingConnect = takeConnectFuture();
            transition = transitionTo(PckConnectionState.DISCONNECTED, cause == null ? "transport closed" : "transport failed");
        }

        statusRequester.stopPruning();
        reset.run(statusRequester);
        emit(transition);

        if (cause != null) {
            log.warn("Connection to {}:{} lost", config.host(), config.port(), cause);
            observabilitySink.onError(new PckErrorEvent(wallClock.now(), "Transport failed", cause));
        }
        if (pendingConnect != null) {
            pendingConnect.completeExceptionally(new PckConnectionFailedException(
                    "Connection to " + config.host() + ":" + config.port() + " failed", cause));
        }
        if (wasUp) {
            fireEvent(LcnEvent.CONNECTION_LOST);
        }
    }

    @Override
    public void onLine(String line)
    {
        log.debug("from gateway: {}", line);
        List<PckInput> inputs;
        try {
            inputs = parser.parse(line);
        } catch (RuntimeException e) {
            log.error("Failed to parse {}", line, e);
            observabilitySink.onError(new PckErrorEvent(wallClock.now(), "Unparseable line: " + line, e));
            return;
        }
        for (PckInput input : inputs) {
            processInput(input);
        }
    }

    // ---------------------------------------------------------------------
    // Input handling
    // ---------------------------------------------------------------------

    void processInput(PckInput input)
    {
        if (input instanceof HostInput host) {
            processHostInput(host);
        } else if (input instanceof ModSk sk) {
            onSegmentReport(sk);
        } else if (input instanceof Unknown unknown) {
            log.debug("Ignoring unknown input {}", unknown.data());
        } else if (input instanceof ModInput mod) {
            routeModuleInput(mod);
        }
    }

    private void processHostInput(HostInput input)
    {
        if (input instanceof HostInput.AuthUsername) {
            emit(transition(PckConnectionState.AWAITING_USERNAME, "username prompt"));
            sendCommand(config.username(), true);
        } else if (input instanceof HostInput.AuthPassword) {
            emit(transition(PckConnectionState.AWAITING_PASSWORD, "password prompt"));
            sendCommand(config.password(), true);
        } else if (input instanceof HostInput.AuthOk) {
            log.info("Authenticated at {}:{}", config.host(), config.port());
            emit(transition(PckConnectionState.AUTHENTICATED, "auth ok"));
            sendCommand(PckGenerator.setDecMode(), true);
        } else if (input instanceof HostInput.AuthFailed) {
            failLogin(new PckAuthenticationException("Authentication failed for user " + config.username()));
        } else if (input instanceof HostInput.LicenseError) {
            failLogin(new PckLicenseException("Gateway has no license for another connection"));
        } else if (input instanceof HostInput.DecModeSet) {
            sendCommand(PckGenerator.setOperationMode(config.dimMode(), config.statusMode()), true);
        } else if (input instanceof HostInput.LcnConnState conn) {
            if (conn.connected()) {
                onBusConnected();
            } else {
                onBusDisconnected();
            }
        } else if (input instanceof HostInput.CommandError error) {
            log.warn("Gateway rejected a command: {}", error.message());
        } else if (input instanceof HostInput.Ping) {
            onPingReceived();
        }
    }

    private void failLogin(PckConnectionException error)
    {
        CompletableFuture<Void> pendingConnect;
        synchronized (lock) {
            pendingConnect = takeConnectFuture();
        }
        log.error("Login to {}:{} failed: {}", config.host(), config.port(), error.getMessage());
        observabilitySink.onError(new PckErrorEvent(wallClock.now(), error.getMessage(), error));
        if (pendingConnect != null) {
            pendingConnect.completeExceptionally(error);
        }
        endpoint.stop();
        onTransportDown(null);
    }

    private void routeModuleInput(ModInput input)
    {
        if (!isReady()) {
            log.debug("Not ready, dropping {}", input);
            return;
        }

        ModInput logical = input.withSource(input.source().physicalToLogical(localSegmentId));
        if (!logical.source().isGroup()) {
            if (input instanceof ModAck || input instanceof ModSn) {
                noteModuleScanResponse(logical.source());
            }
            getModuleConnection(logical.source()).processInput(logical);
        }

        for (Consumer<PckInput> listener : inputListeners) {
            try {
                listener.accept(logical);
            } catch (RuntimeException e) {
                log.error("Input listener failed on {}", logical, e);
                observabilitySink.onError(new PckErrorEvent(wallClock.now(), "Input listener failed", e));
            }
        }
    }

    private void noteModuleScanResponse(LcnAddress address)
    {
        synchronized (lock) {
            if (moduleScan != null) {
                moduleScan.found.add(address);
                moduleScan.lastResponseNanos = clock.nowNanos();
            }
        }
    }

    // ---------------------------------------------------------------------
    // Bus state
    // ---------------------------------------------------------------------

    private void onBusConnected()
    {
        List<PckStateTransitionEvent> transitions = new ArrayList<>();
        CompletableFuture<Void> latch;
        synchronized (lock) {
            if (lcnConnected) {
                log.debug("Bus already connected");
                return;
            }
            lcnConnected = true;
            transitions.add(transitionTo(PckConnectionState.BUS_CONNECTED, "bus connected"));
            transitions.add(transitionTo(PckConnectionState.SCANNING_SEGMENT, "segment scan"));
            latch = busConnected;
            startPinging();
        }
        log.info("Bus connected");
        transitions.forEach(this::emit);
        latch.complete(null);
        fireEvent(LcnEvent.BUS_CONNECTION_STATUS_CHANGED);
        fireEvent(LcnEvent.BUS_CONNECTED);
        segmentScanHandler.activate();
    }

    private void onBusDisconnected()
    {
        PckStateTransitionEvent transition;
        SessionReset reset;
        boolean wasConnected;
        synchronized (lock) {
            wasConnected = lcnConnected;
            reset = resetBus();
            transition = transitionTo(PckConnectionState.BUS_DISCONNECTED, "bus disconnected");
        }
        log.info("Bus disconnected");
        reset.run(statusRequester);
        emit(transition);
        if (wasConnected || transition != null) {
            fireEvent(LcnEvent.BUS_CONNECTION_STATUS_CHANGED);
            fireEvent(LcnEvent.BUS_DISCONNECTED);
        }
    }

    /**
     * Discards everything that depends on the bus. Guarded by lock; the
     * returned reset is run outside it.
     */
    private SessionReset resetBus()
    {
        lcnConnected = false;
        localSegmentId = -1;
        segmentScanHandler.cancel();
        stopPinging();

        List<ModuleConnection> dropped = new ArrayList<>(modules.values());
        modules.clear();

        if (busConnected.isDone()) {
            busConnected = new CompletableFuture<>();
        }
        if (segmentScanCompleted.isDone()) {
            segmentScanCompleted = new CompletableFuture<>();
        }

        Set<LcnAddress> scanResult = null;
        ModuleScan scan = moduleScan;
        if (scan != null) {
            scanResult = finishModuleScan(scan);
        }
        return new SessionReset(dropped, scan, scanResult);
    }

    // ---------------------------------------------------------------------
    // Segment scan
    // ---------------------------------------------------------------------

    private void onSegmentScanTimeout(boolean failed)
    {
        if (!failed) {
            sendLine(PckGenerator.addressed(SEGMENT_SCAN_TARGET, localSegmentId, false,
                    PckGenerator.segmentCouplerScan()));
            return;
        }
        log.info("No segment coupler found, assuming local segment 0");
        resolveLocalSegment(0);
    }

    private void onSegmentReport(ModSk input)
    {
        synchronized (lock) {
            segmentCouplerIds.add(input.reportedSegmentId());
        }
        if (input.source().segmentId() == 0) {
            log.info("Local segment is {}", input.reportedSegmentId());
            resolveLocalSegment(input.reportedSegmentId());
        }
    }

    private void resolveLocalSegment(int segmentId)
    {
        PckStateTransitionEvent transition;
        CompletableFuture<Void> latch;
        CompletableFuture<Void> pendingConnect = null;
        synchronized (lock) {
            if (!lcnConnected) {
                log.debug("Ignoring segment {} reported while the bus is down", segmentId);
                return;
            }
            int old = localSegmentId;
            localSegmentId = segmentId;
            rekeyModules(old, segmentId);
            transition = state == PckConnectionState.SCANNING_SEGMENT
                    ? transitionTo(PckConnectionState.READY, "segment scan completed")
                    : null;
            latch = segmentScanCompleted;
            if (socketConnected.isDone() && busConnected.isDone()) {
                pendingConnect = takeConnectFuture();
            }
        }
        segmentScanHandler.cancel();
        emit(transition);
        latch.complete(null);
        if (pendingConnect != null) {
            log.info("Connection to {}:{} ready", config.host(), config.port());
            pendingConnect.complete(null);
        }
    }

    /**
     * Moves connections created before the local segment was known (segment
     * 0, or the previous local id) to the resolved segment. Guarded by lock.
     */
    private void rekeyModules(int oldSegmentId, int newSegmentId)
    {
        List<ModuleConnection> moved = new ArrayList<>();
        modules.entrySet().removeIf(e -> {
            int seg = e.getKey().segmentId();
            boolean placeholder = seg == 0 || (oldSegmentId != -1 && seg == oldSegmentId);
            if (placeholder && seg != newSegmentId) {
                moved.add(e.getValue());
                return true;
            }
            return false;
        });
        for (ModuleConnection conn : moved) {
            LcnAddress key = conn.address().withSegmentId(newSegmentId);
            if (modules.containsKey(key)) {
                log.debug("Dropping duplicate connection to {}", key);
                conn.cancelAll();
                continue;
            }
            conn.rekey(key);
            modules.put(key, conn);
        }
    }

    // ---------------------------------------------------------------------
    // Keepalive
    // ---------------------------------------------------------------------

    // Guarded by lock.
    private void startPinging()
    {
        long gen = ++pingGeneration;
        pingTimer = scheduler.scheduleAtNanos(clock.nowNanos(), () -> pingTick(gen));
    }

    // Guarded by lock.
    private void stopPinging()
    {
        pingGeneration++;
        if (pingTimer != null) {
            pingTimer.cancel();
            pingTimer = null;
        }
        if (pingTimeoutTimer != null) {
            pingTimeoutTimer.cancel();
            pingTimeoutTimer = null;
        }
    }

    private void pingTick(long gen)
    {
        int counter;
        PckTimingPolicy timing = config.timingPolicy();
        synchronized (lock) {
            if (gen != pingGeneration) {
                return;
            }
            counter = pingCounter++;
            if (pingTimeoutTimer != null) {
                pingTimeoutTimer.cancel();
            }
            pingTimeoutTimer = scheduler.scheduleAfter(timing.pingTimeout(), clock, () -> onPingTimeout(gen));
            pingTimer = scheduler.scheduleAfter(timing.pingInterval(), clock, () -> pingTick(gen));
        }
        sendCommand(PckGenerator.ping(counter), true);
    }

    private void onPingTimeout(long gen)
    {
        synchronized (lock) {
            if (gen != pingGeneration || pingTimeoutTimer == null) {
                return;
            }
            pingTimeoutTimer = null;
        }
        log.warn("No ping reply from {}:{}", config.host(), config.port());
        fireEvent(LcnEvent.PING_TIMEOUT);
    }

    private void onPingReceived()
    {
        Cancellable timer;
        synchronized (lock) {
            timer = pingTimeoutTimer;
            pingTimeoutTimer = null;
        }
        if (timer != null) {
            timer.cancel();
        }
    }

    // ---------------------------------------------------------------------
    // Connect deadline
    // ---------------------------------------------------------------------

    private void onConnectDeadline(CompletableFuture<Void> future)
    {
        PckConnectionException error;
        boolean closeTransport;
        synchronized (lock) {
            if (connectFuture != future || future.isDone()) {
                return;
            }
            if (state.isAuthenticated() && !lcnConnected) {
                error = new PckBusNotConnectedException("Bus not connected at " + config.host() + ":" + config.port());
                closeTransport = false;
            } else {
                error = new PckConnectionTimeoutException("Connection to " + config.host() + ":" + config.port()
                        + " not ready in time (state " + state + ")");
                closeTransport = true;
            }
            takeConnectFuture();
        }
        log.warn(error.getMessage());
        future.completeExceptionally(error);
        if (closeTransport) {
            endpoint.stop();
            onTransportDown(null);
        }
    }

    /** Detaches the pending connect future and its deadline. Guarded by lock. */
    private CompletableFuture<Void> takeConnectFuture()
    {
        CompletableFuture<Void> pending = connectFuture;
        if (connectDeadline != null) {
            connectDeadline.cancel();
            connectDeadline = null;
        }
        if (pending == null || pending.isDone()) {
            return null;
        }
        return pending;
    }

    // ---------------------------------------------------------------------
    // Events
    // ---------------------------------------------------------------------

    private PckStateTransitionEvent transition(PckConnectionState newState, String trigger)
    {
        synchronized (lock) {
            return transitionTo(newState, trigger);
        }
    }

    // Guarded by lock. Returns null if the state did not change.
    private PckStateTransitionEvent transitionTo(PckConnectionState newState, String trigger)
    {
        PckConnectionState old = state;
        if (old == newState) {
            return null;
        }
        state = newState;
        return new PckStateTransitionEvent(wallClock.now(), old, newState, trigger);
    }

    private void emit(PckStateTransitionEvent transition)
    {
        if (transition == null) {
            return;
        }
        log.debug("State {} -> {} ({})", transition.oldState(), transition.newState(), transition.trigger());
        observabilitySink.onStateTransition(transition);
    }

    private void fireEvent(LcnEvent event)
    {
        log.debug("Event {}", event);
        observabilitySink.onLcnEvent(event);
        for (Consumer<LcnEvent> listener : eventListeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.error("Event listener failed on {}", event, e);
                observabilitySink.onError(new PckErrorEvent(wallClock.now(), "Event listener failed", e));
            }
        }
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    /**
     * Work left over from a reset that must run outside the manager lock.
     */
    private record SessionReset(List<ModuleConnection> dropped, ModuleScan scan, Set<LcnAddress> scanResult)
    {
        void run(StatusRequester requester)
        {
            for (ModuleConnection conn : dropped) {
                conn.cancelAll();
            }
            requester.cancelAll();
            if (scan != null) {
                scan.result.complete(scanResult);
            }
        }
    }

    private static final class ModuleScan
    {
        final CompletableFuture<Set<LcnAddress>> result = new CompletableFuture<>();
        final Set<LcnAddress> found = new LinkedHashSet<>();
        int roundsLeft;
        long lastResponseNanos;

        ModuleScan(int rounds)
        {
            this.roundsLeft = rounds;
        }
    }
}
