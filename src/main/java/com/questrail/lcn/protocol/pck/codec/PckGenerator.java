package com.questrail.lcn.protocol.pck.codec;

import com.questrail.lcn.protocol.pck.model.BeepSound;
import com.questrail.lcn.protocol.pck.model.DelayUnit;
import com.questrail.lcn.protocol.pck.model.KeyLockStateModifier;
import com.questrail.lcn.protocol.pck.model.LcnAddress;
import com.questrail.lcn.protocol.pck.model.LedStatus;
import com.questrail.lcn.protocol.pck.model.MotorReverseTime;
import com.questrail.lcn.protocol.pck.model.MotorStateModifier;
import com.questrail.lcn.protocol.pck.model.OutputPortDimMode;
import com.questrail.lcn.protocol.pck.model.OutputPortStatusMode;
import com.questrail.lcn.protocol.pck.model.RelVarRef;
import com.questrail.lcn.protocol.pck.model.RelayStateModifier;
import com.questrail.lcn.protocol.pck.model.SendKeyCommand;
import com.questrail.lcn.protocol.pck.model.Var;

import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * PckGenerator
 * =============================================================================
 * Builds outbound PCK command strings.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>Every method is pure and returns the command <em>without</em> the line
 *       terminator; the transport appends {@link #TERMINATION}.</li>
 *   <li>Module-addressed commands return the body only. Prefix it with
 *       {@link #addressHeader(LcnAddress, int, boolean)}.</li>
 *   <li>Numeric fields are zero-padded to their fixed width.</li>
 *   <li>Invalid arguments (ids out of range, wrong list sizes, variables the
 *       target firmware cannot express) are rejected with
 *       {@link IllegalArgumentException} before anything is sent.</li>
 * </ul>
 *
 * <h2>Dimming resolution</h2>
 * Percent values are doubled and rounded half-to-even. An even result is sent
 * with the legacy percent command (all gateway versions); an odd result needs
 * the native 200-step command.
 *
 * <h2>Ramps</h2>
 * Ramp arguments are already-converted ramp values (0..250). Use
 * {@link PckTimeConversions#timeToRampValue(long)} to convert durations.
 */
public final class PckGenerator
{
    /** Line terminator of the PCK protocol, both directions. */
    public static final String TERMINATION = "\n";

    /** Firmware age from which "dim all outputs" supports 200 steps and ramps. */
    public static final int DIM_ALL_HIGH_RES_FIRMWARE = 0x180501;

    private static final String TABLE_NAMES = "ABCD";

    private PckGenerator() {}

    // ---------------------------------------------------------------------
    // Connection scoped
    // ---------------------------------------------------------------------

    /**
     * Keepalive. The gateway closes idle connections after ten minutes.
     */
    public static String ping(int counter) {
        return "^ping" + counter;
    }

    /** Switches the gateway into decimal mode. */
    public static String setDecMode() {
        return "!CHD";
    }

    public static String setOperationMode(OutputPortDimMode dimMode, OutputPortStatusMode statusMode) {
        Objects.requireNonNull(dimMode, "dimMode");
        Objects.requireNonNull(statusMode, "statusMode");
        return "!OM"
                + (dimMode == OutputPortDimMode.STEPS200 ? '1' : '0')
                + (statusMode == OutputPortStatusMode.PERCENT ? 'P' : 'N');
    }

    /**
     * {@code >} + {@code G|M} + physical segment (3) + id (3) + {@code !|.}.
     */
    public static String addressHeader(LcnAddress address, int localSegmentId, boolean wantsAck) {
        Objects.requireNonNull(address, "address");
        return String.format(Locale.ROOT, ">%s%03d%03d%s",
                address.isGroup() ? "G" : "M",
                address.getPhysicalSegmentId(localSegmentId),
                address.entityId(),
                wantsAck ? "!" : ".");
    }

    /** Header plus body, ready to be written as one line. */
    public static String addressed(LcnAddress address, int localSegmentId, boolean wantsAck, String body) {
        return addressHeader(address, localSegmentId, wantsAck) + body;
    }

    // ---------------------------------------------------------------------
    // Information requests
    // ---------------------------------------------------------------------

    /** Segment coupler scan, sent to group 3 of segment 3 (broadcast). */
    public static String segmentCouplerScan() {
        return "SK";
    }

    public static String requestSerial() {
        return "SN";
    }

    public static String requestName(int blockId) {
        checkRange(blockId, 0, 1, "blockId");
        return "NMN" + (blockId + 1);
    }

    public static String requestComment(int blockId) {
        checkRange(blockId, 0, 2, "blockId");
        return "NMK" + (blockId + 1);
    }

    public static String requestOemText(int blockId) {
        checkRange(blockId, 0, 3, "blockId");
        return "NMO" + (blockId + 1);
    }

    public static String requestGroupMembershipStatic() {
        return "GP";
    }

    public static String requestGroupMembershipDynamic() {
        return "GD";
    }

    /**
     * Empty command. Combined with an acknowledge request it discovers
     * modules and verifies group memberships.
     */
    public static String empty() {
        return "LEER";
    }

    // ---------------------------------------------------------------------
    // Outputs
    // ---------------------------------------------------------------------

    public static String requestOutputStatus(int outputId) {
        checkRange(outputId, 0, 3, "outputId");
        return "SMA" + (outputId + 1);
    }

    public static String dimOutput(int outputId, double percent, int ramp) {
        checkRange(outputId, 0, 3, "outputId");
        int n = doubledPercent(percent);
        if (n % 2 == 0) {
            return String.format(Locale.ROOT, "A%dDI%03d%03d", outputId + 1, n / 2, ramp);
        }
        return String.format(Locale.ROOT, "O%dDI%03d%03d", outputId + 1, n, ramp);
    }

    /**
     * Dims all outputs. Since firmware {@code 0x180501} with 200 steps and
     * ramp; before that only all-off, all-on (with ramp) or a percent value
     * without ramp.
     */
    public static String dimAllOutputs(double percent, int ramp, int softwareSerial) {
        int n = doubledPercent(percent);
        if (softwareSerial >= DIM_ALL_HIGH_RES_FIRMWARE) {
            return String.format(Locale.ROOT, "OY%03d%03d%03d%03d%03d", n, n, n, n, ramp);
        }
        if (n == 0) {
            return String.format(Locale.ROOT, "AA%03d", ramp);
        }
        if (n == 200) {
            return String.format(Locale.ROOT, "AE%03d", ramp);
        }
        return String.format(Locale.ROOT, "AH%03d", n / 2);
    }

    /**
     * Relative change of an output; negative percent values dim down.
     */
    public static String relOutput(int outputId, double percent) {
        checkRange(outputId, 0, 3, "outputId");
        int n = doubledPercent(percent);
        String direction = percent >= 0 ? "AD" : "SB";
        if (n % 2 == 0) {
            return String.format(Locale.ROOT, "A%d%s%03d", outputId + 1, direction, Math.abs(n / 2));
        }
        return String.format(Locale.ROOT, "O%d%s%03d", outputId + 1, direction, Math.abs(n));
    }

    public static String toggleOutput(int outputId, int ramp) {
        checkRange(outputId, 0, 3, "outputId");
        return String.format(Locale.ROOT, "A%dTA%03d", outputId + 1, ramp);
    }

    public static String toggleAllOutputs(int ramp) {
        return String.format(Locale.ROOT, "AU%03d", ramp);
    }

    // ---------------------------------------------------------------------
    // Relays and motors
    // ---------------------------------------------------------------------

    public static String requestRelaysStatus() {
        return "SMR";
    }

    public static String controlRelays(List<RelayStateModifier> states) {
        checkSize(states, 8, "states");
        StringBuilder sb = new StringBuilder("R8");
        for (RelayStateModifier state : states) {
            sb.append(state.code());
        }
        return sb.toString();
    }

    /**
     * Switches relays for a limited time. Only {@code ON} and {@code OFF}
     * are allowed.
     */
    public static String controlRelaysTimer(long timeMillis, List<RelayStateModifier> states) {
        checkSize(states, 8, "states");
        StringBuilder sb = new StringBuilder(String.format(Locale.ROOT, "R8T%03d", PckTimeConversions.timeToNativeValue(timeMillis)));
        for (RelayStateModifier state : states) {
            if (state != RelayStateModifier.ON && state != RelayStateModifier.OFF) {
                throw new IllegalArgumentException("Relay timer accepts only ON and OFF: " + state);
            }
            sb.append(state.code());
        }
        return sb.toString();
    }

    /**
     * Motors on relay pairs: first relay switches power, second the
     * direction.
     */
    public static String controlMotorsRelays(List<MotorStateModifier> states) {
        checkSize(states, 4, "states");
        StringBuilder sb = new StringBuilder("R8");
        for (MotorStateModifier state : states) {
            sb.append(switch (state) {
                case UP -> "10";
                case DOWN -> "11";
                case STOP -> "0-";
                case TOGGLEONOFF -> "U-";
                case TOGGLEDIR -> "-U";
                case CYCLE -> "UU";
                case NOCHANGE -> "--";
            });
        }
        return sb.toString();
    }

    /**
     * Motor on outputs 1 and 2. {@code reverseTime} may be {@code null}
     * (70ms).
     */
    public static String controlMotorsOutputs(MotorStateModifier state, MotorReverseTime reverseTime) {
        Objects.requireNonNull(state, "state");
        MotorReverseTime rt = reverseTime == null ? MotorReverseTime.RT70 : reverseTime;
        int[] params;
        switch (state) {
            case UP -> params = switch (rt) {
                case RT70 -> new int[] {0x01, 0xE4, 0x00};
                case RT600 -> new int[] {0x04, 0xC8, 0x08};
                case RT1200 -> new int[] {0x04, 0xC8, 0x0B};
            };
            case DOWN -> params = switch (rt) {
                case RT70 -> new int[] {0x01, 0x00, 0xE4};
                case RT600 -> new int[] {0x05, 0xC8, 0x08};
                case RT1200 -> new int[] {0x05, 0xC8, 0x0B};
            };
            case STOP -> {
                return "AY000000";
            }
            case CYCLE -> {
                return "JE";
            }
            default -> throw new IllegalArgumentException("Motor state not supported by output ports: " + state);
        }
        return String.format(Locale.ROOT, "X2%03d%03d%03d", params[0], params[1], params[2]);
    }

    // ---------------------------------------------------------------------
    // Binary sensors
    // ---------------------------------------------------------------------

    public static String requestBinSensorsStatus() {
        return "SMB";
    }

    // ---------------------------------------------------------------------
    // Variables
    // ---------------------------------------------------------------------

    /**
     * Sets a regulator set-point to an absolute native value. Variables and
     * thresholds cannot be set absolutely.
     */
    public static String varAbs(Var var, int value) {
        Objects.requireNonNull(var, "var");
        int setPointId = var.toSetPointId();
        if (setPointId == -1) {
            throw new IllegalArgumentException("Absolute value not supported for " + var);
        }
        int offset = value - 1000;
        int byte1 = (setPointId << 6) | 0x20 | ((offset >> 8) & 0x0F);
        int byte2 = offset & 0xFF;
        return String.format(Locale.ROOT, "X2%03d%03d%03d", 30, byte1, byte2);
    }

    /**
     * Updates a variable status on behalf of the gateway (group 4 only).
     */
    public static String updateStatusVar(Var var, int value) {
        Objects.requireNonNull(var, "var");
        int varId = var.toVarId();
        if (varId == -1) {
            throw new IllegalArgumentException("Status update not supported for " + var);
        }
        return String.format(Locale.ROOT, "X2%03d%03d%03d", varId | 0x40, (value >> 8) & 0xFF, value & 0xFF);
    }

    public static String varReset(Var var, int softwareSerial) {
        Objects.requireNonNull(var, "var");
        int varId = var.toVarId();
        if (varId != -1) {
            if (softwareSerial >= Var.UNIFIED_VAR_FIRMWARE) {
                return String.format(Locale.ROOT, "Z-%03d%04d", varId + 1, 4090);
            }
            if (varId == 0) {
                return "ZS30000";
            }
            throw new IllegalArgumentException(var + " cannot be reset on firmware " + Integer.toHexString(softwareSerial));
        }

        int setPointId = var.toSetPointId();
        if (setPointId != -1) {
            int byte1 = (setPointId << 6) | 0x20;
            return String.format(Locale.ROOT, "X2%03d%03d%03d", 30, byte1, 0);
        }
        throw new IllegalArgumentException("Reset not supported for " + var);
    }

    /**
     * Relative change of a variable, set-point or threshold. {@code value}
     * may be negative.
     */
    public static String varRel(Var var, RelVarRef ref, int value, int softwareSerial) {
        Objects.requireNonNull(var, "var");
        Objects.requireNonNull(ref, "ref");

        int varId = var.toVarId();
        if (varId != -1) {
            if (varId == 0) {
                // Variable 1 keeps the old command; it works on every module.
                return "Z" + (value >= 0 ? 'A' : 'S') + Math.abs(value);
            }
            return String.format(Locale.ROOT, "Z%c%03d%d", value >= 0 ? '+' : '-', varId + 1, Math.abs(value));
        }

        int setPointId = var.toSetPointId();
        if (setPointId != -1) {
            return "RE"
                    + (setPointId == 0 ? 'A' : 'B')
                    + 'S'
                    + (ref == RelVarRef.CURRENT ? 'A' : 'P')
                    + (value >= 0 ? '+' : '-')
                    + Math.abs(value);
        }

        int registerId = var.toThrsRegisterId();
        int thrsId = var.toThrsId();
        if (registerId != -1 && thrsId != -1) {
            String prefix = String.format(Locale.ROOT, "SS%c%04d%c",
                    ref == RelVarRef.CURRENT ? 'R' : 'E',
                    Math.abs(value),
                    value >= 0 ? 'A' : 'S');
            if (softwareSerial >= Var.UNIFIED_VAR_FIRMWARE) {
                return prefix + "R" + (registerId + 1) + (thrsId + 1);
            }
            if (registerId == 0) {
                StringBuilder sb = new StringBuilder(prefix);
                for (int i = 0; i < 5; i++) {
                    sb.append(i == thrsId ? '1' : '0');
                }
                return sb.toString();
            }
            throw new IllegalArgumentException(var + " cannot be changed on firmware " + Integer.toHexString(softwareSerial));
        }
        throw new IllegalArgumentException("Relative change not supported for " + var);
    }

    public static String requestVarStatus(Var var, int softwareSerial) {
        Objects.requireNonNull(var, "var");
        if (softwareSerial >= Var.UNIFIED_VAR_FIRMWARE) {
            int varId = var.toVarId();
            if (varId != -1) {
                return String.format(Locale.ROOT, "MWT%03d", varId + 1);
            }
            int setPointId = var.toSetPointId();
            if (setPointId != -1) {
                return String.format(Locale.ROOT, "MWS%03d", setPointId + 1);
            }
            int registerId = var.toThrsRegisterId();
            if (registerId != -1) {
                // Whole register
                return String.format(Locale.ROOT, "SE%03d", registerId + 1);
            }
            int s0Id = var.toS0Id();
            if (s0Id != -1) {
                return String.format(Locale.ROOT, "MWC%03d", s0Id + 1);
            }
            throw new IllegalArgumentException("Status request not supported for " + var);
        }

        return switch (var) {
            case VAR1 -> "MWV";
            case VAR2 -> "MWTA";
            case VAR3 -> "MWTB";
            case R1VARSETPOINT -> "MWSA";
            case R2VARSETPOINT -> "MWSB";
            case THRS1, THRS2, THRS3, THRS4, THRS5 -> "SL1";
            default -> throw new IllegalArgumentException(
                    var + " cannot be requested on firmware " + Integer.toHexString(softwareSerial));
        };
    }

    public static String lockRegulator(int regId, boolean lock) {
        checkRange(regId, 0, 1, "regId");
        return "RE" + (regId == 0 ? 'A' : 'B') + 'X' + (lock ? 'S' : 'A');
    }

    // ---------------------------------------------------------------------
    // LEDs and logic operations
    // ---------------------------------------------------------------------

    public static String requestLedsAndLogicOps() {
        return "SMT";
    }

    public static String controlLed(int ledId, LedStatus state) {
        checkRange(ledId, 0, 11, "ledId");
        Objects.requireNonNull(state, "state");
        return String.format(Locale.ROOT, "LA%03d%c", ledId + 1, state.code());
    }

    // ---------------------------------------------------------------------
    // Keys
    // ---------------------------------------------------------------------

    /**
     * Sends keys. {@code commands} holds one action per table A..D; table D
     * is omitted when it is {@link SendKeyCommand#DONTSEND}, which keeps the
     * command compatible with older modules.
     */
    public static String sendKeys(List<SendKeyCommand> commands, List<Boolean> keys) {
        checkSize(commands, 4, "commands");
        checkSize(keys, 8, "keys");
        StringBuilder sb = new StringBuilder("TS");
        for (int i = 0; i < commands.size(); i++) {
            SendKeyCommand cmd = commands.get(i);
            if (i == 3 && cmd == SendKeyCommand.DONTSEND) {
                break;
            }
            sb.append(cmd.code());
        }
        appendBits(sb, keys);
        return sb.toString();
    }

    public static String sendKeysHitDeferred(int tableId, int time, DelayUnit unit, List<Boolean> keys) {
        checkRange(tableId, 0, 3, "tableId");
        checkSize(keys, 8, "keys");
        checkDelay(time, unit);
        StringBuilder sb = new StringBuilder(String.format(Locale.ROOT, "TV%c%03d%c", TABLE_NAMES.charAt(tableId), time, unit.code()));
        appendBits(sb, keys);
        return sb.toString();
    }

    /** Always requests tables A..D. */
    public static String requestKeyLockStatus() {
        return "STX";
    }

    public static String lockKeys(int tableId, List<KeyLockStateModifier> states) {
        checkRange(tableId, 0, 3, "tableId");
        checkSize(states, 8, "states");
        StringBuilder sb = new StringBuilder("TX").append(TABLE_NAMES.charAt(tableId));
        for (KeyLockStateModifier state : states) {
            sb.append(state.code());
        }
        return sb.toString();
    }

    /**
     * Locks keys of table A for a limited time. The hardware has no temporary
     * lock for tables B..D.
     */
    public static String lockKeysTabATemporary(int time, DelayUnit unit, List<Boolean> keys) {
        checkSize(keys, 8, "keys");
        checkDelay(time, unit);
        StringBuilder sb = new StringBuilder(String.format(Locale.ROOT, "TXZA%03d%c", time, unit.code()));
        appendBits(sb, keys);
        return sb.toString();
    }

    // ---------------------------------------------------------------------
    // Dynamic text
    // ---------------------------------------------------------------------

    /**
     * One part of a dynamic text row (display peripherals support 4 rows of
     * up to 5 parts). The text of a part must not exceed 12 UTF-8 bytes.
     */
    public static String dynTextPart(int rowId, int partId, String text) {
        checkRange(rowId, 0, 3, "rowId");
        checkRange(partId, 0, 4, "partId");
        Objects.requireNonNull(text, "text");
        if (text.getBytes(StandardCharsets.UTF_8).length > 12) {
            throw new IllegalArgumentException("Text part exceeds 12 bytes: " + text);
        }
        return "GTDT" + (rowId + 1) + (partId + 1) + text;
    }

    // ---------------------------------------------------------------------
    // Scenes
    // ---------------------------------------------------------------------

    public static String changeSceneRegister(int registerId) {
        checkRange(registerId, 0, 9, "registerId");
        return String.format(Locale.ROOT, "SZW%03d", registerId);
    }

    public static String storeSceneOutputsDirect(int registerId, int sceneId, List<Double> percents, List<Integer> ramps) {
        checkRange(sceneId, 0, 9, "sceneId");
        Objects.requireNonNull(percents, "percents");
        Objects.requireNonNull(ramps, "ramps");
        if (percents.size() != 2 && percents.size() != 4) {
            throw new IllegalArgumentException("Need 2 or 4 output percent values");
        }
        if (ramps.size() != percents.size()) {
            throw new IllegalArgumentException("Need as many ramp values as output percent values");
        }
        StringBuilder sb = new StringBuilder(String.format(Locale.ROOT, "SZD%03d%03d", registerId, sceneId));
        for (int i = 0; i < percents.size(); i++) {
            sb.append(String.format(Locale.ROOT, "%03d%03d", (int) (percents.get(i) * 2), ramps.get(i)));
        }
        return sb.toString();
    }

    /**
     * Activates a scene on the given outputs (zero-based). Outputs 3 and 4
     * can only be addressed together. {@code ramp} may be {@code null}.
     */
    public static String activateSceneOutput(int sceneId, Set<Integer> outputIds, Integer ramp) {
        return sceneOutput('A', sceneId, outputIds, ramp);
    }

    public static String storeSceneOutput(int sceneId, Set<Integer> outputIds, Integer ramp) {
        return sceneOutput('S', sceneId, outputIds, ramp);
    }

    public static String activateSceneRelay(int sceneId, Set<Integer> relayIds) {
        return sceneRelay('A', sceneId, relayIds);
    }

    public static String storeSceneRelay(int sceneId, Set<Integer> relayIds) {
        return sceneRelay('S', sceneId, relayIds);
    }

    public static String requestStatusScene(int registerId, int sceneId) {
        checkRange(registerId, 0, 9, "registerId");
        checkRange(sceneId, 0, 9, "sceneId");
        return String.format(Locale.ROOT, "SZR%03d%03d", registerId, sceneId);
    }

    private static String sceneOutput(char action, int sceneId, Set<Integer> outputIds, Integer ramp) {
        checkRange(sceneId, 0, 9, "sceneId");
        if (outputIds == null || outputIds.isEmpty()) {
            throw new IllegalArgumentException("No output given");
        }
        int mask = 0;
        for (int id : outputIds) {
            checkRange(id, 0, 3, "outputId");
        }
        if (outputIds.contains(0)) {
            mask += 1;
        }
        if (outputIds.contains(1)) {
            mask += 2;
        }
        if (outputIds.contains(2) || outputIds.contains(3)) {
            mask += 4;
        }
        String pck = String.format(Locale.ROOT, "SZ%c%d%03d", action, mask, sceneId);
        return ramp == null ? pck : pck + String.format(Locale.ROOT, "%03d", ramp);
    }

    private static String sceneRelay(char action, int sceneId, Set<Integer> relayIds) {
        checkRange(sceneId, 0, 9, "sceneId");
        if (relayIds == null || relayIds.isEmpty()) {
            throw new IllegalArgumentException("No relay given");
        }
        char[] mask = "00000000".toCharArray();
        for (int id : relayIds) {
            checkRange(id, 0, 7, "relayId");
            mask[id] = '1';
        }
        return String.format(Locale.ROOT, "SZ%c0%03d%s", action, sceneId, new String(mask));
    }

    // ---------------------------------------------------------------------
    // Misc
    // ---------------------------------------------------------------------

    public static String beep(BeepSound sound, int count) {
        Objects.requireNonNull(sound, "sound");
        checkRange(count, 1, 15, "count");
        return String.format(Locale.ROOT, "PI%c%03d", sound.code(), count);
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    /** {@code percent * 2} rounded half-to-even. */
    static int doubledPercent(double percent) {
        return (int) Math.rint(percent * 2);
    }

    private static void checkRange(int value, int min, int max, String name) {
        if (value < min || value > max) {
            throw new IllegalArgumentException(name + " must be in range " + min + ".." + max + " (was " + value + ")");
        }
    }

    private static void checkSize(Collection<?> values, int size, String name) {
        Objects.requireNonNull(values, name);
        if (values.size() != size) {
            throw new IllegalArgumentException(name + " must have " + size + " entries (had " + values.size() + ")");
        }
    }

    private static void checkDelay(int time, DelayUnit unit) {
        Objects.requireNonNull(unit, "unit");
        if (time < 1 || time > unit.maxValue()) {
            throw new IllegalArgumentException("time must be in range 1.." + unit.maxValue() + " for " + unit);
        }
    }

    private static void appendBits(StringBuilder sb, List<Boolean> bits) {
        for (Boolean bit : bits) {
            sb.append(Boolean.TRUE.equals(bit) ? '1' : '0');
        }
    }
}
