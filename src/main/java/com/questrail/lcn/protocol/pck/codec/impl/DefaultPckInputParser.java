package com.questrail.lcn.protocol.pck.codec.impl;

import com.questrail.lcn.protocol.pck.codec.PckInputParser;
import com.questrail.lcn.protocol.pck.model.AccessControlPeriphery;
import com.questrail.lcn.protocol.pck.model.BatteryStatus;
import com.questrail.lcn.protocol.pck.model.HardwareType;
import com.questrail.lcn.protocol.pck.model.KeyAction;
import com.questrail.lcn.protocol.pck.model.LcnAddress;
import com.questrail.lcn.protocol.pck.model.LedStatus;
import com.questrail.lcn.protocol.pck.model.LogicOpStatus;
import com.questrail.lcn.protocol.pck.model.SendKeyCommand;
import com.questrail.lcn.protocol.pck.model.Var;
import com.questrail.lcn.protocol.pck.model.input.HostInput;
import com.questrail.lcn.protocol.pck.model.input.ModAck;
import com.questrail.lcn.protocol.pck.model.input.ModNameComment;
import com.questrail.lcn.protocol.pck.model.input.ModSendCommandHost;
import com.questrail.lcn.protocol.pck.model.input.ModSendKeysHost;
import com.questrail.lcn.protocol.pck.model.input.ModSk;
import com.questrail.lcn.protocol.pck.model.input.ModSn;
import com.questrail.lcn.protocol.pck.model.input.ModStatusAccessControl;
import com.questrail.lcn.protocol.pck.model.input.ModStatusBinSensors;
import com.questrail.lcn.protocol.pck.model.input.ModStatusGroups;
import com.questrail.lcn.protocol.pck.model.input.ModStatusKeyLocks;
import com.questrail.lcn.protocol.pck.model.input.ModStatusLedsAndLogicOps;
import com.questrail.lcn.protocol.pck.model.input.ModStatusOutput;
import com.questrail.lcn.protocol.pck.model.input.ModStatusOutputNative;
import com.questrail.lcn.protocol.pck.model.input.ModStatusRelays;
import com.questrail.lcn.protocol.pck.model.input.ModStatusSceneOutputs;
import com.questrail.lcn.protocol.pck.model.input.ModStatusVar;
import com.questrail.lcn.protocol.pck.model.input.PckInput;
import com.questrail.lcn.protocol.pck.model.input.Unknown;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * DefaultPckInputParser
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link PckInputParser}.
 *
 * <p>The parser holds a fixed, ordered list of shape matchers. Each matcher
 * either recognizes the line and returns its inputs, or returns {@code null}.
 * The first matcher that recognizes the line wins; later matchers are not
 * consulted. The last matcher accepts every line as
 * {@link Unknown}.</p>
 *
 * <p>Most shapes decode to exactly one input. The five-value threshold
 * register report decodes to five variable inputs.</p>
 *
 * <p>Instances are stateless and thread-safe.</p>
 */
public final class DefaultPckInputParser implements PckInputParser
{
    @FunctionalInterface
    private interface ShapeMatcher {
        List<PckInput> tryParse(String line);
    }

    private final List<ShapeMatcher> matchers = List.of(
            DefaultPckInputParser::hostLiteral,
            DefaultPckInputParser::ping,
            DefaultPckInputParser::commandError,
            DefaultPckInputParser::ack,
            DefaultPckInputParser::segmentInfo,
            DefaultPckInputParser::serial,
            DefaultPckInputParser::nameComment,
            DefaultPckInputParser::groups,
            DefaultPckInputParser::outputPercent,
            DefaultPckInputParser::outputNative,
            DefaultPckInputParser::relays,
            DefaultPckInputParser::binSensors,
            DefaultPckInputParser::variable,
            DefaultPckInputParser::ledsAndLogicOps,
            DefaultPckInputParser::keyLocks,
            DefaultPckInputParser::sceneOutputs,
            DefaultPckInputParser::sendCommandHost,
            DefaultPckInputParser::sendKeysHost,
            DefaultPckInputParser::accessControl
    );

    @Override
    public List<PckInput> parse(String line)
    {
        Objects.requireNonNull(line, "line");

        try {
            for (ShapeMatcher m : matchers) {
                List<PckInput> result = m.tryParse(line);
                if (result != null) {
                    return result;
                }
            }
        } catch (IllegalArgumentException e) {
            // Structurally matched but carried an out-of-range id or value.
            return List.of(new Unknown(line));
        }
        return List.of(new Unknown(line));
    }

    // ---------------------------------------------------------------------
    // Gateway lines
    // ---------------------------------------------------------------------

    private static List<PckInput> hostLiteral(String line)
    {
        HostInput input = switch (line) {
            case PckPatterns.AUTH_USERNAME -> new HostInput.AuthUsername();
            case PckPatterns.AUTH_PASSWORD -> new HostInput.AuthPassword();
            case PckPatterns.AUTH_OK -> new HostInput.AuthOk();
            case PckPatterns.AUTH_FAILED -> new HostInput.AuthFailed();
            case PckPatterns.LCNCONNSTATE_CONNECTED -> new HostInput.LcnConnState(true);
            case PckPatterns.LCNCONNSTATE_DISCONNECTED -> new HostInput.LcnConnState(false);
            case PckPatterns.LICENSE_ERROR -> new HostInput.LicenseError();
            case PckPatterns.DEC_MODE_SET -> new HostInput.DecModeSet();
            default -> null;
        };
        return input == null ? null : List.of(input);
    }

    private static List<PckInput> ping(String line)
    {
        Matcher m = match(PckPatterns.PING, line);
        if (m == null) {
            return null;
        }
        String count = m.group(1);
        return List.of(new HostInput.Ping(count.isEmpty() ? -1 : Integer.parseInt(count)));
    }

    private static List<PckInput> commandError(String line)
    {
        Matcher m = match(PckPatterns.COMMAND_ERROR, line);
        if (m == null) {
            return null;
        }
        return List.of(new HostInput.CommandError(m.group("message")));
    }

    // ---------------------------------------------------------------------
    // Module information
    // ---------------------------------------------------------------------

    private static List<PckInput> ack(String line)
    {
        Matcher m = match(PckPatterns.ACK_POS, line);
        if (m != null) {
            return List.of(new ModAck(module(m), ModAck.POSITIVE));
        }
        m = match(PckPatterns.ACK_NEG, line);
        if (m != null) {
            return List.of(new ModAck(module(m), Integer.parseInt(m.group(3))));
        }
        return null;
    }

    private static List<PckInput> segmentInfo(String line)
    {
        Matcher m = match(PckPatterns.SK_RESPONSE, line);
        if (m == null) {
            return null;
        }
        return List.of(new ModSk(module(m), Integer.parseInt(m.group(3))));
    }

    private static List<PckInput> serial(String line)
    {
        Matcher m = match(PckPatterns.SN, line);
        if (m == null) {
            return null;
        }
        long hardwareSerial = Long.parseLong(m.group(3), 16);
        int manu = parseHexOr(m.group(4), 0xFF);
        int softwareSerial = Integer.parseInt(m.group(5), 16);
        HardwareType type = HardwareType.fromId(Integer.parseInt(m.group(6)));
        return List.of(new ModSn(module(m), hardwareSerial, manu, softwareSerial, type));
    }

    private static List<PckInput> nameComment(String line)
    {
        Matcher m = match(PckPatterns.NAME_COMMENT, line);
        if (m == null) {
            return null;
        }
        char command = m.group(3).charAt(0);
        int blockId = Integer.parseInt(m.group(4)) - 1;
        return List.of(new ModNameComment(module(m), command, blockId, m.group(5)));
    }

    private static List<PckInput> groups(String line)
    {
        Matcher m = match(PckPatterns.STATUS_GROUPS, line);
        if (m == null) {
            return null;
        }
        LcnAddress source = module(m);
        boolean dynamic = "D".equals(m.group(3));
        int maxGroups = Integer.parseInt(m.group(4));
        List<LcnAddress> groups = new ArrayList<>();
        for (int value : triplets(m.group(5))) {
            groups.add(LcnAddress.group(source.segmentId(), value));
        }
        return List.of(new ModStatusGroups(source, dynamic, maxGroups, groups));
    }

    // ---------------------------------------------------------------------
    // Outputs, relays, binary sensors
    // ---------------------------------------------------------------------

    private static List<PckInput> outputPercent(String line)
    {
        Matcher m = match(PckPatterns.STATUS_OUTPUT_PERCENT, line);
        if (m == null) {
            return null;
        }
        int outputId = Integer.parseInt(m.group(3)) - 1;
        return List.of(new ModStatusOutput(module(m), outputId, Double.parseDouble(m.group(4))));
    }

    private static List<PckInput> outputNative(String line)
    {
        Matcher m = match(PckPatterns.STATUS_OUTPUT_NATIVE, line);
        if (m == null) {
            return null;
        }
        int outputId = Integer.parseInt(m.group(3)) - 1;
        return List.of(new ModStatusOutputNative(module(m), outputId, Integer.parseInt(m.group(4))));
    }

    private static List<PckInput> relays(String line)
    {
        Matcher m = match(PckPatterns.STATUS_RELAYS, line);
        if (m == null) {
            return null;
        }
        return List.of(new ModStatusRelays(module(m), bits(Integer.parseInt(m.group(3)))));
    }

    private static List<PckInput> binSensors(String line)
    {
        Matcher m = match(PckPatterns.STATUS_BINSENSORS, line);
        if (m == null) {
            return null;
        }
        return List.of(new ModStatusBinSensors(module(m), bits(Integer.parseInt(m.group(3)))));
    }

    // ---------------------------------------------------------------------
    // Variables
    // ---------------------------------------------------------------------

    private static List<PckInput> variable(String line)
    {
        Matcher m = match(PckPatterns.STATUS_VAR, line);
        if (m != null) {
            Var var = Var.varIdToVar(Integer.parseInt(m.group(3)) - 1);
            return List.of(new ModStatusVar(module(m), var, Integer.parseInt(m.group(4))));
        }

        m = match(PckPatterns.STATUS_SETVAR, line);
        if (m != null) {
            Var var = Var.setPointIdToVar(Integer.parseInt(m.group(3)) - 1);
            return List.of(new ModStatusVar(module(m), var, Integer.parseInt(m.group(4))));
        }

        m = match(PckPatterns.STATUS_THRS, line);
        if (m != null) {
            Var var = Var.thrsIdToVar(Integer.parseInt(m.group(3)) - 1, Integer.parseInt(m.group(4)) - 1);
            return List.of(new ModStatusVar(module(m), var, Integer.parseInt(m.group(5))));
        }

        m = match(PckPatterns.STATUS_S0INPUT, line);
        if (m != null) {
            Var var = Var.s0IdToVar(Integer.parseInt(m.group(3)) - 1);
            return List.of(new ModStatusVar(module(m), var, Integer.parseInt(m.group(4))));
        }

        m = match(PckPatterns.VAR_GENERIC, line);
        if (m != null) {
            return List.of(new ModStatusVar(module(m), Var.UNKNOWN, Integer.parseInt(m.group(3))));
        }

        m = match(PckPatterns.THRS5, line);
        if (m != null) {
            LcnAddress source = module(m);
            List<PckInput> result = new ArrayList<>(5);
            for (int thrsId = 0; thrsId < 5; thrsId++) {
                Var var = Var.thrsIdToVar(0, thrsId);
                result.add(new ModStatusVar(source, var, Integer.parseInt(m.group(3 + thrsId))));
            }
            return List.copyOf(result);
        }
        return null;
    }

    // ---------------------------------------------------------------------
    // LEDs, key locks, scenes
    // ---------------------------------------------------------------------

    private static List<PckInput> ledsAndLogicOps(String line)
    {
        Matcher m = match(PckPatterns.STATUS_LEDSANDLOGICOPS, line);
        if (m == null) {
            return null;
        }
        List<LedStatus> leds = new ArrayList<>(12);
        for (char c : m.group(3).toCharArray()) {
            leds.add(LedStatus.fromCode(c));
        }
        List<LogicOpStatus> logicOps = new ArrayList<>(4);
        for (char c : m.group(4).toCharArray()) {
            logicOps.add(LogicOpStatus.fromCode(c));
        }
        return List.of(new ModStatusLedsAndLogicOps(module(m), leds, logicOps));
    }

    private static List<PckInput> keyLocks(String line)
    {
        Matcher m = match(PckPatterns.STATUS_KEYLOCKS, line);
        if (m == null) {
            return null;
        }
        List<List<Boolean>> tables = new ArrayList<>(4);
        for (int i = 0; i < 4; i++) {
            String table = m.group(3 + i);
            if (table != null) {
                tables.add(bits(Integer.parseInt(table)));
            }
        }
        return List.of(new ModStatusKeyLocks(module(m), tables));
    }

    private static List<PckInput> sceneOutputs(String line)
    {
        Matcher m = match(PckPatterns.STATUS_SCENE_OUTPUTS, line);
        if (m == null) {
            return null;
        }
        int sceneId = Integer.parseInt(m.group(3));
        List<Integer> pairs = triplets(m.group(4));
        List<Integer> values = new ArrayList<>(4);
        List<Integer> ramps = new ArrayList<>(4);
        for (int i = 0; i < pairs.size(); i += 2) {
            values.add(pairs.get(i));
            ramps.add(pairs.get(i + 1));
        }
        return List.of(new ModStatusSceneOutputs(module(m), sceneId, values, ramps));
    }

    // ---------------------------------------------------------------------
    // Host-bound commands
    // ---------------------------------------------------------------------

    private static List<PckInput> sendCommandHost(String line)
    {
        Matcher m = match(PckPatterns.SEND_COMMAND_HOST, line);
        if (m == null) {
            return null;
        }
        List<Integer> parameters = new ArrayList<>(triplets(m.group(3)));
        if (m.group(4) != null) {
            parameters.addAll(triplets(m.group(4)));
            if (m.group(5) != null) {
                parameters.addAll(triplets(m.group(5)));
            }
        }
        return List.of(new ModSendCommandHost(module(m), parameters));
    }

    private static List<PckInput> sendKeysHost(String line)
    {
        Matcher m = match(PckPatterns.SEND_KEYS_HOST, line);
        if (m == null) {
            return null;
        }
        int actionsValue = Integer.parseInt(m.group(3));
        List<SendKeyCommand> actions = new ArrayList<>(3);
        for (int table = 0; table < 3; table++) {
            int code = (actionsValue >> (2 * table)) & 0x03;
            actions.add(switch (code) {
                case 1 -> SendKeyCommand.HIT;
                case 2 -> SendKeyCommand.MAKE;
                case 3 -> SendKeyCommand.BREAK;
                default -> SendKeyCommand.DONTSEND;
            });
        }
        return List.of(new ModSendKeysHost(module(m), actions, bits(Integer.parseInt(m.group(4)))));
    }

    // ---------------------------------------------------------------------
    // Access control
    // ---------------------------------------------------------------------

    private static List<PckInput> accessControl(String line)
    {
        Matcher m = match(PckPatterns.STATUS_TRANSMITTER, line);
        if (m != null) {
            int level = Integer.parseInt(m.group(6));
            int key = Integer.parseInt(m.group(7)) - 1;
            int actionValue = Integer.parseInt(m.group(8));
            KeyAction action = switch (actionValue % 10) {
                case 1 -> KeyAction.HIT;
                case 2 -> KeyAction.MAKE;
                case 3 -> KeyAction.BREAK;
                default -> null;
            };
            BatteryStatus battery = actionValue / 10 == 0 ? BatteryStatus.FULL : BatteryStatus.WEAK;
            return List.of(new ModStatusAccessControl(
                    module(m), AccessControlPeriphery.TRANSMITTER, accessCode(m), level, key, action, battery));
        }

        List<PckInput> codeOnly = codeOnly(PckPatterns.STATUS_TRANSPONDER, AccessControlPeriphery.TRANSPONDER, line);
        if (codeOnly == null) {
            codeOnly = codeOnly(PckPatterns.STATUS_FINGERPRINT, AccessControlPeriphery.FINGERPRINT, line);
        }
        if (codeOnly == null) {
            codeOnly = codeOnly(PckPatterns.STATUS_CODELOCK, AccessControlPeriphery.CODELOCK, line);
        }
        return codeOnly;
    }

    private static List<PckInput> codeOnly(Pattern pattern, AccessControlPeriphery periphery, String line)
    {
        Matcher m = match(pattern, line);
        if (m == null) {
            return null;
        }
        return List.of(ModStatusAccessControl.codeOnly(module(m), periphery, accessCode(m)));
    }

    private static String accessCode(Matcher m)
    {
        return String.format(Locale.ROOT, "%02x%02x%02x",
                Integer.parseInt(m.group(3)),
                Integer.parseInt(m.group(4)),
                Integer.parseInt(m.group(5)));
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private static Matcher match(Pattern pattern, String line)
    {
        Matcher m = pattern.matcher(line);
        return m.lookingAt() ? m : null;
    }

    /** Source address from the first two groups (segment, module). */
    private static LcnAddress module(Matcher m)
    {
        return LcnAddress.module(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)));
    }

    /**
     * Expands a 0..255 value into 8 booleans, bit 0 first.
     */
    static List<Boolean> bits(int value)
    {
        List<Boolean> result = new ArrayList<>(8);
        for (int i = 0; i < 8; i++) {
            result.add((value & (1 << i)) != 0);
        }
        return result;
    }

    private static List<Integer> triplets(String digits)
    {
        List<Integer> result = new ArrayList<>(digits.length() / 3);
        for (int i = 0; i + 3 <= digits.length(); i += 3) {
            result.add(Integer.parseInt(digits.substring(i, i + 3)));
        }
        return result;
    }

    private static int parseHexOr(String text, int fallback)
    {
        try {
            return Integer.parseInt(text, 16);
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
