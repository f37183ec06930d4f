package com.questrail.lcn.protocol.pck.device;

import com.questrail.lcn.protocol.pck.codec.PckGenerator;
import com.questrail.lcn.protocol.pck.model.LcnAddress;
import com.questrail.lcn.protocol.pck.model.RelVarRef;
import com.questrail.lcn.protocol.pck.model.Var;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Commands to a group of modules.
 *
 * <p>Group members are assumed to run firmware {@code 0x170206} or newer. For
 * the variables older modules know as well (TVAR, R1VAR, R2VAR, set-points
 * and, for relative changes, thresholds 1..5) the legacy encoding is sent in
 * addition, so older members follow too.</p>
 *
 * <p>Groups never acknowledge and are not cached by the connection
 * manager.</p>
 */
public final class GroupConnection extends AddressConnection
{
    private static final Logger log = LoggerFactory.getLogger(GroupConnection.class);

    /** Firmware assumed for group members. */
    public static final int ASSUMED_SOFTWARE_SERIAL = Var.UNIFIED_VAR_FIRMWARE;

    private static final int LEGACY_SOFTWARE_SERIAL = Var.UNIFIED_VAR_FIRMWARE - 1;

    private static final Set<Var> LEGACY_VARS = EnumSet.of(
            Var.VAR1, Var.VAR2, Var.VAR3, Var.R1VARSETPOINT, Var.R2VARSETPOINT);

    private static final Set<Var> LEGACY_REL_VARS = EnumSet.of(
            Var.VAR1, Var.VAR2, Var.VAR3, Var.R1VARSETPOINT, Var.R2VARSETPOINT,
            Var.THRS1, Var.THRS2, Var.THRS3, Var.THRS4, Var.THRS5);

    public GroupConnection(ConnectionContext context, LcnAddress address)
    {
        super(context, address);
        if (!address.isGroup()) {
            throw new IllegalArgumentException("Not a group address: " + address);
        }
    }

    @Override
    public boolean isGroup()
    {
        return true;
    }

    @Override
    public int softwareSerial()
    {
        return ASSUMED_SOFTWARE_SERIAL;
    }

    @Override
    protected boolean wantsAck()
    {
        return false;
    }

    @Override
    public void send(boolean requiresAck, String body)
    {
        sendImmediately(false, body);
    }

    @Override
    public void cancelAll()
    {
        // no timers
    }

    @Override
    public void varAbs(Var var, int value)
    {
        List<String> bodies = new ArrayList<>(varAbsCommands(var, value, ASSUMED_SOFTWARE_SERIAL));
        if (LEGACY_VARS.contains(var)) {
            addDistinct(bodies, legacy(var, () -> varAbsCommands(var, value, LEGACY_SOFTWARE_SERIAL)));
        }
        sendAll(bodies);
    }

    @Override
    public void varReset(Var var)
    {
        List<String> bodies = new ArrayList<>();
        bodies.add(PckGenerator.varReset(var, ASSUMED_SOFTWARE_SERIAL));
        if (LEGACY_VARS.contains(var)) {
            addDistinct(bodies, legacy(var, () -> List.of(PckGenerator.varReset(var, LEGACY_SOFTWARE_SERIAL))));
        }
        sendAll(bodies);
    }

    @Override
    public void varRel(Var var, RelVarRef ref, int value)
    {
        List<String> bodies = new ArrayList<>();
        bodies.add(PckGenerator.varRel(var, ref, value, ASSUMED_SOFTWARE_SERIAL));
        if (LEGACY_REL_VARS.contains(var)) {
            addDistinct(bodies, legacy(var, () -> List.of(PckGenerator.varRel(var, ref, value, LEGACY_SOFTWARE_SERIAL))));
        }
        sendAll(bodies);
    }

    /**
     * Legacy encoding, or nothing if old firmware has no command for it (for
     * example resetting R1VAR).
     */
    private static List<String> legacy(Var var, Supplier<List<String>> commands)
    {
        try {
            return commands.get();
        } catch (IllegalArgumentException e) {
            log.debug("No legacy command for {}: {}", var, e.getMessage());
            return List.of();
        }
    }

    private static void addDistinct(List<String> bodies, List<String> legacy)
    {
        // Set-point commands are identical in both encodings.
        if (!legacy.isEmpty() && !bodies.equals(legacy)) {
            bodies.addAll(legacy);
        }
    }
}
