package com.questrail.lcn.protocol.pck.device;

import com.questrail.lcn.protocol.pck.codec.PckGenerator;
import com.questrail.lcn.protocol.pck.model.BeepSound;
import com.questrail.lcn.protocol.pck.model.DelayUnit;
import com.questrail.lcn.protocol.pck.model.KeyLockStateModifier;
import com.questrail.lcn.protocol.pck.model.LcnAddress;
import com.questrail.lcn.protocol.pck.model.LedStatus;
import com.questrail.lcn.protocol.pck.model.MotorReverseTime;
import com.questrail.lcn.protocol.pck.model.MotorStateModifier;
import com.questrail.lcn.protocol.pck.model.RelVarRef;
import com.questrail.lcn.protocol.pck.model.RelayStateModifier;
import com.questrail.lcn.protocol.pck.model.SendKeyCommand;
import com.questrail.lcn.protocol.pck.model.Var;
import com.questrail.lcn.protocol.pck.model.input.ModInput;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * AddressConnection
 * =============================================================================
 * Command surface of one bus address (module or group).
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>Every command is built through {@link PckGenerator}; invalid
 *       arguments throw {@link IllegalArgumentException} before anything is
 *       sent.</li>
 *   <li>Commands go out through {@link #send(boolean, String)} with an
 *       acknowledge request if {@link #wantsAck()}.</li>
 *   <li>Firmware-dependent encodings use {@link #softwareSerial()}.</li>
 * </ul>
 */
public abstract class AddressConnection
{
    private static final Logger log = LoggerFactory.getLogger(AddressConnection.class);

    /** Bytes per dynamic text part. */
    static final int DYN_TEXT_PART_BYTES = 12;

    /** Parts per dynamic text row. */
    static final int DYN_TEXT_PARTS = 5;

    protected final ConnectionContext context;

    private volatile LcnAddress address;

    private final List<Consumer<ModInput>> inputListeners = new CopyOnWriteArrayList<>();

    protected AddressConnection(ConnectionContext context, LcnAddress address)
    {
        this.context = Objects.requireNonNull(context, "context");
        this.address = Objects.requireNonNull(address, "address");
    }

    public LcnAddress address()
    {
        return address;
    }

    /**
     * Moves this connection to its resolved logical address once the local
     * segment id is known. Called by the connection manager that owns the
     * device table.
     */
    public void rekey(LcnAddress newAddress)
    {
        this.address = Objects.requireNonNull(newAddress, "newAddress");
    }

    public abstract boolean isGroup();

    /** Firmware age used to select encodings; -1 while unknown. */
    public abstract int softwareSerial();

    /** Whether commands request an acknowledge. */
    protected abstract boolean wantsAck();

    /**
     * Sends a command body to this address.
     *
     * @param requiresAck request an acknowledge from the module
     * @param body        command without address header
     */
    public abstract void send(boolean requiresAck, String body);

    /**
     * Cancels every timer this connection owns.
     */
    public abstract void cancelAll();

    /**
     * Writes header plus body immediately, bypassing any queue.
     */
    protected boolean sendImmediately(boolean requiresAck, String body)
    {
        return context.sendLine(PckGenerator.addressed(address, context.localSegmentId(), requiresAck, body));
    }

    public Runnable registerInputListener(Consumer<ModInput> listener)
    {
        Objects.requireNonNull(listener, "listener");
        inputListeners.add(listener);
        return () -> inputListeners.remove(listener);
    }

    protected void notifyInputListeners(ModInput input)
    {
        for (Consumer<ModInput> listener : inputListeners) {
            try {
                listener.accept(input);
            } catch (RuntimeException e) {
                log.error("Input listener of {} failed on {}", address, input, e);
            }
        }
    }

    // ---------------------------------------------------------------------
    // Outputs
    // ---------------------------------------------------------------------

    public void dimOutput(int outputId, double percent, int ramp)
    {
        send(wantsAck(), PckGenerator.dimOutput(outputId, percent, ramp));
    }

    public void dimAllOutputs(double percent, int ramp)
    {
        send(wantsAck(), PckGenerator.dimAllOutputs(percent, ramp, softwareSerial()));
    }

    public void relOutput(int outputId, double percent)
    {
        send(wantsAck(), PckGenerator.relOutput(outputId, percent));
    }

    public void toggleOutput(int outputId, int ramp)
    {
        send(wantsAck(), PckGenerator.toggleOutput(outputId, ramp));
    }

    public void toggleAllOutputs(int ramp)
    {
        send(wantsAck(), PckGenerator.toggleAllOutputs(ramp));
    }

    // ---------------------------------------------------------------------
    // Relays and motors
    // ---------------------------------------------------------------------

    public void controlRelays(List<RelayStateModifier> states)
    {
        send(wantsAck(), PckGenerator.controlRelays(states));
    }

    public void controlRelaysTimer(long timeMillis, List<RelayStateModifier> states)
    {
        send(wantsAck(), PckGenerator.controlRelaysTimer(timeMillis, states));
    }

    public void controlMotorsRelays(List<MotorStateModifier> states)
    {
        send(wantsAck(), PckGenerator.controlMotorsRelays(states));
    }

    public void controlMotorsOutputs(MotorStateModifier state, MotorReverseTime reverseTime)
    {
        send(wantsAck(), PckGenerator.controlMotorsOutputs(state, reverseTime));
    }

    // ---------------------------------------------------------------------
    // Scenes
    // ---------------------------------------------------------------------

    /**
     * Selects the scene register, then activates the scene on the given
     * outputs and relays. Either set may be empty.
     */
    public void activateScene(int registerId, int sceneId, Set<Integer> outputIds, Set<Integer> relayIds, Integer ramp)
    {
        String register = PckGenerator.changeSceneRegister(registerId);
        String outputs = outputIds.isEmpty() ? null : PckGenerator.activateSceneOutput(sceneId, outputIds, ramp);
        String relays = relayIds.isEmpty() ? null : PckGenerator.activateSceneRelay(sceneId, relayIds);

        send(wantsAck(), register);
        if (outputs != null) {
            send(wantsAck(), outputs);
        }
        if (relays != null) {
            send(wantsAck(), relays);
        }
    }

    /**
     * Selects the scene register, then stores the current states of the
     * given outputs and relays into the scene.
     */
    public void storeScene(int registerId, int sceneId, Set<Integer> outputIds, Set<Integer> relayIds, Integer ramp)
    {
        String register = PckGenerator.changeSceneRegister(registerId);
        String outputs = outputIds.isEmpty() ? null : PckGenerator.storeSceneOutput(sceneId, outputIds, ramp);
        String relays = relayIds.isEmpty() ? null : PckGenerator.storeSceneRelay(sceneId, relayIds);

        send(wantsAck(), register);
        if (outputs != null) {
            send(wantsAck(), outputs);
        }
        if (relays != null) {
            send(wantsAck(), relays);
        }
    }

    public void storeSceneOutputsDirect(int registerId, int sceneId, List<Double> percents, List<Integer> ramps)
    {
        send(wantsAck(), PckGenerator.storeSceneOutputsDirect(registerId, sceneId, percents, ramps));
    }

    public void changeSceneRegister(int registerId)
    {
        send(wantsAck(), PckGenerator.changeSceneRegister(registerId));
    }

    // ---------------------------------------------------------------------
    // Variables
    // ---------------------------------------------------------------------

    /**
     * Sets a variable to an absolute native value. Plain variables have no
     * absolute command: group 4 receives a status update, everything else a
     * reset followed by a relative change.
     */
    public void varAbs(Var var, int value)
    {
        sendAll(varAbsCommands(var, value, softwareSerial()));
    }

    public void varReset(Var var)
    {
        send(wantsAck(), PckGenerator.varReset(var, softwareSerial()));
    }

    public void varRel(Var var, RelVarRef ref, int value)
    {
        send(wantsAck(), PckGenerator.varRel(var, ref, value, softwareSerial()));
    }

    public void updateStatusVar(Var var, int value)
    {
        send(wantsAck(), PckGenerator.updateStatusVar(var, value));
    }

    public void lockRegulator(int regId, boolean lock)
    {
        send(wantsAck(), PckGenerator.lockRegulator(regId, lock));
    }

    protected List<String> varAbsCommands(Var var, int value, int softwareSerial)
    {
        Objects.requireNonNull(var, "var");
        if (var.toVarId() != -1) {
            if (isGroup() && address.entityId() == 4) {
                return List.of(PckGenerator.updateStatusVar(var, value));
            }
            return List.of(
                    PckGenerator.varReset(var, softwareSerial),
                    PckGenerator.varRel(var, RelVarRef.CURRENT, value, softwareSerial));
        }
        return List.of(PckGenerator.varAbs(var, value));
    }

    protected void sendAll(List<String> bodies)
    {
        for (String body : bodies) {
            send(wantsAck(), body);
        }
    }

    // ---------------------------------------------------------------------
    // LEDs and keys
    // ---------------------------------------------------------------------

    public void controlLed(int ledId, LedStatus state)
    {
        send(wantsAck(), PckGenerator.controlLed(ledId, state));
    }

    public void sendKeys(List<SendKeyCommand> commands, List<Boolean> keys)
    {
        send(wantsAck(), PckGenerator.sendKeys(commands, keys));
    }

    public void sendKeysHitDeferred(int tableId, int time, DelayUnit unit, List<Boolean> keys)
    {
        send(wantsAck(), PckGenerator.sendKeysHitDeferred(tableId, time, unit, keys));
    }

    public void lockKeys(int tableId, List<KeyLockStateModifier> states)
    {
        send(wantsAck(), PckGenerator.lockKeys(tableId, states));
    }

    public void lockKeysTabATemporary(int time, DelayUnit unit, List<Boolean> keys)
    {
        send(wantsAck(), PckGenerator.lockKeysTabATemporary(time, unit, keys));
    }

    // ---------------------------------------------------------------------
    // Misc
    // ---------------------------------------------------------------------

    /**
     * Sends a text row to a display peripheral. The text is split into up
     * to five parts of twelve UTF-8 bytes; empty parts are not sent.
     */
    public void dynText(int rowId, String text)
    {
        List<String> bodies = new ArrayList<>();
        List<String> parts = splitDynText(text);
        for (int partId = 0; partId < parts.size(); partId++) {
            bodies.add(PckGenerator.dynTextPart(rowId, partId, parts.get(partId)));
        }
        sendAll(bodies);
    }

    public void beep(BeepSound sound, int count)
    {
        send(wantsAck(), PckGenerator.beep(sound, count));
    }

    /**
     * Sends an arbitrary command body.
     */
    public void pck(String body)
    {
        Objects.requireNonNull(body, "body");
        send(wantsAck(), body);
    }

    /**
     * Splits {@code text} into chunks of at most twelve UTF-8 bytes without
     * breaking a code point.
     *
     * @throws IllegalArgumentException if more than five parts are needed
     */
    static List<String> splitDynText(String text)
    {
        Objects.requireNonNull(text, "text");
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int currentBytes = 0;

        int i = 0;
        while (i < text.length()) {
            int cp = text.codePointAt(i);
            String ch = new String(Character.toChars(cp));
            int bytes = ch.getBytes(StandardCharsets.UTF_8).length;
            if (currentBytes + bytes > DYN_TEXT_PART_BYTES) {
                parts.add(current.toString());
                current.setLength(0);
                currentBytes = 0;
            }
            current.append(ch);
            currentBytes += bytes;
            i += Character.charCount(cp);
        }
        if (currentBytes > 0) {
            parts.add(current.toString());
        }

        if (parts.size() > DYN_TEXT_PARTS) {
            throw new IllegalArgumentException("Text exceeds " + DYN_TEXT_PARTS + " parts of "
                    + DYN_TEXT_PART_BYTES + " bytes: " + text);
        }
        return parts;
    }

    @Override
    public String toString()
    {
        return getClass().getSimpleName() + "[" + address + "]";
    }
}
