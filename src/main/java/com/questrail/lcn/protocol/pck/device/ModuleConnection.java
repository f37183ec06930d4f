package com.questrail.lcn.protocol.pck.device;

import com.questrail.lcn.protocol.pck.codec.PckGenerator;
import com.questrail.lcn.protocol.pck.config.PckConnectionConfig;
import com.questrail.lcn.protocol.pck.internal.exec.PckTimingPolicy;
import com.questrail.lcn.protocol.pck.internal.exec.TimeoutRetryHandler;
import com.questrail.lcn.protocol.pck.model.LcnAddress;
import com.questrail.lcn.protocol.pck.model.OutputPortStatusMode;
import com.questrail.lcn.protocol.pck.model.Var;
import com.questrail.lcn.protocol.pck.model.input.ModAck;
import com.questrail.lcn.protocol.pck.model.input.ModInput;
import com.questrail.lcn.protocol.pck.model.input.ModNameComment;
import com.questrail.lcn.protocol.pck.model.input.ModSn;
import com.questrail.lcn.protocol.pck.model.input.ModStatusBinSensors;
import com.questrail.lcn.protocol.pck.model.input.ModStatusGroups;
import com.questrail.lcn.protocol.pck.model.input.ModStatusKeyLocks;
import com.questrail.lcn.protocol.pck.model.input.ModStatusLedsAndLogicOps;
import com.questrail.lcn.protocol.pck.model.input.ModStatusOutput;
import com.questrail.lcn.protocol.pck.model.input.ModStatusOutputNative;
import com.questrail.lcn.protocol.pck.model.input.ModStatusRelays;
import com.questrail.lcn.protocol.pck.model.input.ModStatusVar;
import com.questrail.lcn.protocol.pck.status.StatusRequester;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * ModuleConnection
 * =============================================================================
 * Connection to one bus module.
 *
 * <h2>Acknowledged commands</h2>
 * Commands requesting an acknowledge are queued and sent strictly one at a
 * time in submission order. The head is (re)sent with an acknowledge header
 * on every tick of its retry handler until the module acknowledges it
 * (positively or not) or the tries run out; then the next command follows.
 *
 * <h2>Serial discovery</h2>
 * Once the segment scan completed, {@code SN} is requested until the module
 * answers. {@link #serialKnown()} completes with the answer; the firmware
 * age then selects variable encodings and polling intervals.
 *
 * <h2>Status polling</h2>
 * {@link #activateStatusPolling(StatusItem)} keeps an item fresh with
 * periodic status requests. Variables wait for the serial number.
 *
 * <h2>Typeless variable responses</h2>
 * Old firmware answers some variable requests without naming the variable.
 * At most one such request is outstanding; its answer is attributed to it.
 *
 * <h2>Locking</h2>
 * State is guarded by {@code this}. Lines are written outside the lock.
 */
public final class ModuleConnection extends AddressConnection
{
    private static final Logger log = LoggerFactory.getLogger(ModuleConnection.class);

    private final TimeoutRetryHandler serialHandler;
    private final TimeoutRetryHandler ackHandler;
    private final StatusPollingBank pollingBank;

    private final Deque<String> ackQueue = new ArrayDeque<>();
    private final CompletableFuture<SerialInfo> serialKnown = new CompletableFuture<>();

    private volatile SerialInfo serial;
    private Var lastRequestedTypelessVar = Var.UNKNOWN;
    private boolean cancelled;

    public ModuleConnection(ConnectionContext context, LcnAddress address)
    {
        super(context, address);
        if (address.isGroup()) {
            throw new IllegalArgumentException("Not a module address: " + address);
        }

        PckConnectionConfig config = context.config();
        PckTimingPolicy timing = config.timingPolicy();

        this.serialHandler = new TimeoutRetryHandler(context.scheduler(), context.clock(), -1, timing.defaultTimeout());
        this.serialHandler.setTimeoutCallback(this::onSerialTimeout);

        this.ackHandler = new TimeoutRetryHandler(context.scheduler(), context.clock(), config.numTries(), timing.defaultTimeout());
        this.ackHandler.setTimeoutCallback(this::onAckTimeout);

        this.pollingBank = new StatusPollingBank(context.scheduler(), context.clock(), this::pollInterval, this::poll);
    }

    @Override
    public boolean isGroup()
    {
        return false;
    }

    @Override
    public int softwareSerial()
    {
        SerialInfo s = serial;
        return s == null ? -1 : s.softwareSerial();
    }

    public Optional<SerialInfo> serial()
    {
        return Optional.ofNullable(serial);
    }

    /**
     * Completes with the module's serial information once it answered.
     * Cancelled by {@link #cancelAll()} if it never did.
     */
    public CompletableFuture<SerialInfo> serialKnown()
    {
        return serialKnown;
    }

    @Override
    protected boolean wantsAck()
    {
        return context.config().acknowledge();
    }

    @Override
    public void send(boolean requiresAck, String body)
    {
        if (requiresAck) {
            scheduleCommandWithAck(body);
        } else {
            sendImmediately(false, body);
        }
    }

    /**
     * Requests the serial number once the segment scan completed, unless it
     * is already known.
     */
    public void startSerialDiscovery()
    {
        context.segmentScanCompleted().thenRun(() -> {
            synchronized (this) {
                if (cancelled || serial != null) {
                    return;
                }
            }
            serialHandler.activate();
        });
    }

    // ---------------------------------------------------------------------
    // Input processing
    // ---------------------------------------------------------------------

    /**
     * Handles an input whose source is this module (logical address).
     */
    public void processInput(ModInput input)
    {
        ModInput routed = input;

        if (input instanceof ModAck) {
            onAck();
        } else if (input instanceof ModSn sn) {
            onSerial(sn);
        } else if (input instanceof ModStatusVar var && var.var() == Var.UNKNOWN) {
            routed = attributeTypeless(var);
        }

        context.statusRequester().onInput(routed);
        notifyInputListeners(routed);
    }

    private void onSerial(ModSn sn)
    {
        SerialInfo info = SerialInfo.from(sn);
        serial = info;
        serialHandler.cancel();
        if (serialKnown.complete(info)) {
            log.info("Module {} identified: serial {} firmware {} ({})",
                    address(), Long.toHexString(info.hardwareSerial()),
                    Integer.toHexString(info.softwareSerial()), info.hardwareType());
        }
    }

    private ModStatusVar attributeTypeless(ModStatusVar input)
    {
        synchronized (this) {
            if (lastRequestedTypelessVar == Var.UNKNOWN) {
                return input;
            }
            ModStatusVar attributed = input.withVar(lastRequestedTypelessVar);
            lastRequestedTypelessVar = Var.UNKNOWN;
            return attributed;
        }
    }

    synchronized Var lastRequestedTypelessVar()
    {
        return lastRequestedTypelessVar;
    }

    // ---------------------------------------------------------------------
    // Acknowledged commands
    // ---------------------------------------------------------------------

    private void scheduleCommandWithAck(String body)
    {
        synchronized (this) {
            ackQueue.addLast(body);
            tryProcessNextCommandWithAck();
        }
    }

    private void onAck()
    {
        synchronized (this) {
            if (!ackHandler.isActive()) {
                return;
            }
            ackQueue.pollFirst();
            ackHandler.cancel();
            tryProcessNextCommandWithAck();
        }
    }

    private void tryProcessNextCommandWithAck()
    {
        if (!ackQueue.isEmpty() && !ackHandler.isActive()) {
            ackHandler.activate();
        }
    }

    private void onAckTimeout(boolean failed)
    {
        String head;
        synchronized (this) {
            if (failed) {
                String dropped = ackQueue.pollFirst();
                log.warn("Module {} did not acknowledge {}; dropping it", address(), dropped);
                tryProcessNextCommandWithAck();
                return;
            }
            head = ackQueue.peekFirst();
        }
        if (head != null) {
            sendImmediately(true, head);
        }
    }

    /** Commands waiting for (or in) acknowledge, head first. */
    synchronized List<String> pendingCommandsWithAck()
    {
        return new ArrayList<>(ackQueue);
    }

    // ---------------------------------------------------------------------
    // Serial discovery
    // ---------------------------------------------------------------------

    private void onSerialTimeout(boolean failed)
    {
        if (!failed) {
            sendImmediately(false, PckGenerator.requestSerial());
        }
    }

    // ---------------------------------------------------------------------
    // Status polling
    // ---------------------------------------------------------------------

    /**
     * Starts periodic status requests for {@code item} once the segment scan
     * completed. Variables additionally wait for the serial number.
     */
    public void activateStatusPolling(StatusItem item)
    {
        context.segmentScanCompleted().thenRun(() -> {
            if (item instanceof StatusItem.Variable) {
                serialKnown.thenRun(() -> activateIfLive(item));
            } else {
                activateIfLive(item);
            }
        });
    }

    /**
     * Polls every item of the module; S0 counters only with {@code includeS0}.
     */
    public void activateAllStatusPolling(boolean includeS0)
    {
        for (StatusItem item : StatusItem.all(includeS0)) {
            activateStatusPolling(item);
        }
    }

    public void cancelStatusPolling(StatusItem item)
    {
        pollingBank.cancel(item);
    }

    public void cancelAllStatusPolling()
    {
        pollingBank.cancelAll();
    }

    public boolean isStatusPollingActive(StatusItem item)
    {
        return pollingBank.isActive(item);
    }

    private void activateIfLive(StatusItem item)
    {
        synchronized (this) {
            if (cancelled) {
                return;
            }
        }
        pollingBank.activate(item);
    }

    private Duration pollInterval(StatusItem item)
    {
        PckTimingPolicy timing = context.config().timingPolicy();
        if (item instanceof StatusItem.Variable v) {
            return v.var().isEventBased(softwareSerial())
                    ? timing.maxStatusEventBasedValueAge()
                    : timing.maxStatusPolledValueAge();
        }
        if (item instanceof StatusItem.LedsAndLogicOps || item instanceof StatusItem.KeyLocks) {
            return timing.maxStatusPolledValueAge();
        }
        return timing.maxStatusEventBasedValueAge();
    }

    private void poll(StatusItem item)
    {
        String body;
        if (item instanceof StatusItem.Output o) {
            body = PckGenerator.requestOutputStatus(o.outputId());
        } else if (item instanceof StatusItem.Relays) {
            body = PckGenerator.requestRelaysStatus();
        } else if (item instanceof StatusItem.BinarySensors) {
            body = PckGenerator.requestBinSensorsStatus();
        } else if (item instanceof StatusItem.LedsAndLogicOps) {
            body = PckGenerator.requestLedsAndLogicOps();
        } else if (item instanceof StatusItem.KeyLocks) {
            body = PckGenerator.requestKeyLockStatus();
        } else if (item instanceof StatusItem.Variable v) {
            body = variableRequest(v);
        } else {
            throw new IllegalStateException("Unhandled status item " + item);
        }

        if (body != null) {
            sendImmediately(false, body);
        }
    }

    /**
     * Builds the request for a variable poll, honouring the single
     * outstanding typeless request. Returns {@code null} to skip this tick.
     */
    private String variableRequest(StatusItem.Variable item)
    {
        Var var = item.var();
        int sw = softwareSerial();
        synchronized (this) {
            // A tick for the pending var means its request went unanswered.
            if (lastRequestedTypelessVar == var) {
                lastRequestedTypelessVar = Var.UNKNOWN;
            }

            boolean typed = var.hasTypeInResponse(sw);
            if (!typed && lastRequestedTypelessVar != Var.UNKNOWN) {
                return null;
            }

            String body;
            try {
                body = PckGenerator.requestVarStatus(var, sw);
            } catch (IllegalArgumentException e) {
                log.debug("Module {} cannot report {} (firmware {}); not polling it",
                        address(), var, Integer.toHexString(sw));
                pollingBank.cancel(item);
                return null;
            }
            if (!typed) {
                lastRequestedTypelessVar = var;
            }
            return body;
        }
    }

    // ---------------------------------------------------------------------
    // Status requests
    // ---------------------------------------------------------------------

    public CompletableFuture<Optional<SerialInfo>> requestSerial(long maxAgeMillis)
    {
        return requester()
                .request(address(), ModSn.class, PckGenerator.requestSerial(), false, maxAgeMillis, Map.of())
                .thenApply(sn -> sn.map(SerialInfo::from));
    }

    public CompletableFuture<Optional<String>> requestName(long maxAgeMillis)
    {
        return requestText('N', 2, 10, maxAgeMillis);
    }

    public CompletableFuture<Optional<String>> requestComment(long maxAgeMillis)
    {
        return requestText('K', 3, 12, maxAgeMillis);
    }

    public CompletableFuture<Optional<String>> requestOemText(long maxAgeMillis)
    {
        return requestText('O', 4, 12, maxAgeMillis);
    }

    public CompletableFuture<Optional<List<LcnAddress>>> requestStaticGroups(long maxAgeMillis)
    {
        return requestGroups(false, PckGenerator.requestGroupMembershipStatic(), maxAgeMillis);
    }

    public CompletableFuture<Optional<List<LcnAddress>>> requestDynamicGroups(long maxAgeMillis)
    {
        return requestGroups(true, PckGenerator.requestGroupMembershipDynamic(), maxAgeMillis);
    }

    /**
     * Output brightness in percent. Modules in native status mode report 200
     * steps, which are converted.
     */
    public CompletableFuture<Optional<Double>> requestOutputStatus(int outputId, long maxAgeMillis)
    {
        String body = PckGenerator.requestOutputStatus(outputId);
        Map<String, Object> params = Map.of("outputId", outputId);
        if (context.config().statusMode() == OutputPortStatusMode.NATIVE) {
            return requester()
                    .request(address(), ModStatusOutputNative.class, body, false, maxAgeMillis, params)
                    .thenApply(o -> o.map(s -> s.value() / 2.0));
        }
        return requester()
                .request(address(), ModStatusOutput.class, body, false, maxAgeMillis, params)
                .thenApply(o -> o.map(ModStatusOutput::percent));
    }

    public CompletableFuture<Optional<List<Boolean>>> requestRelays(long maxAgeMillis)
    {
        return requester()
                .request(address(), ModStatusRelays.class, PckGenerator.requestRelaysStatus(), false, maxAgeMillis, Map.of())
                .thenApply(o -> o.map(ModStatusRelays::states));
    }

    public CompletableFuture<Optional<List<Boolean>>> requestBinarySensors(long maxAgeMillis)
    {
        return requester()
                .request(address(), ModStatusBinSensors.class, PckGenerator.requestBinSensorsStatus(), false, maxAgeMillis, Map.of())
                .thenApply(o -> o.map(ModStatusBinSensors::states));
    }

    /**
     * Variable value in native units. Waits for the serial number, which
     * selects the request encoding; empty if the connection is cancelled
     * first.
     */
    public CompletableFuture<Optional<Integer>> requestVariable(Var var, long maxAgeMillis)
    {
        return serialKnown.handle((info, error) -> info).thenCompose(info -> {
            if (info == null) {
                return CompletableFuture.completedFuture(Optional.<Integer>empty());
            }
            int sw = info.softwareSerial();
            String body = PckGenerator.requestVarStatus(var, sw);
            if (!var.hasTypeInResponse(sw)) {
                synchronized (this) {
                    lastRequestedTypelessVar = var;
                }
            }
            return requester()
                    .request(address(), ModStatusVar.class, body, false, maxAgeMillis, Map.of("var", var))
                    .thenApply(o -> o.map(ModStatusVar::value));
        });
    }

    public CompletableFuture<Optional<ModStatusLedsAndLogicOps>> requestLedsAndLogicOps(long maxAgeMillis)
    {
        return requester()
                .request(address(), ModStatusLedsAndLogicOps.class, PckGenerator.requestLedsAndLogicOps(), false, maxAgeMillis, Map.of());
    }

    public CompletableFuture<Optional<List<List<Boolean>>>> requestKeyLocks(long maxAgeMillis)
    {
        return requester()
                .request(address(), ModStatusKeyLocks.class, PckGenerator.requestKeyLockStatus(), false, maxAgeMillis, Map.of())
                .thenApply(o -> o.map(ModStatusKeyLocks::states));
    }

    private CompletableFuture<Optional<List<LcnAddress>>> requestGroups(boolean dynamic, String body, long maxAgeMillis)
    {
        return requester()
                .request(address(), ModStatusGroups.class, body, false, maxAgeMillis, Map.of("dynamic", dynamic))
                .thenApply(o -> o.map(ModStatusGroups::groups));
    }

    /**
     * Requests all text blocks of one kind and joins them. Blocks are padded
     * to their fixed width before joining; the result is trimmed. Empty if
     * no block arrived.
     */
    private CompletableFuture<Optional<String>> requestText(char command, int blocks, int width, long maxAgeMillis)
    {
        List<CompletableFuture<Optional<ModNameComment>>> parts = new ArrayList<>();
        for (int blockId = 0; blockId < blocks; blockId++) {
            String body = switch (command) {
                case 'N' -> PckGenerator.requestName(blockId);
                case 'K' -> PckGenerator.requestComment(blockId);
                default -> PckGenerator.requestOemText(blockId);
            };
            parts.add(requester().request(address(), ModNameComment.class, body, false, maxAgeMillis,
                    Map.of("command", command, "blockId", blockId)));
        }

        return CompletableFuture.allOf(parts.toArray(new CompletableFuture<?>[0])).thenApply(ignored -> {
            StringBuilder text = new StringBuilder();
            boolean any = false;
            for (CompletableFuture<Optional<ModNameComment>> part : parts) {
                Optional<ModNameComment> block = part.join();
                if (block.isPresent()) {
                    any = true;
                    text.append(String.format(Locale.ROOT, "%-" + width + "s", block.get().text()));
                }
            }
            return any ? Optional.of(text.toString().strip()) : Optional.<String>empty();
        });
    }

    private StatusRequester requester()
    {
        return context.statusRequester();
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    /**
     * Cancels serial discovery, polling and the acknowledge queue. The
     * connection stays usable for commands that need no acknowledge.
     */
    @Override
    public void cancelAll()
    {
        synchronized (this) {
            cancelled = true;
            ackQueue.clear();
            lastRequestedTypelessVar = Var.UNKNOWN;
        }
        serialHandler.cancel();
        ackHandler.cancel();
        pollingBank.cancelAll();
        serialKnown.cancel(false);
    }
}
