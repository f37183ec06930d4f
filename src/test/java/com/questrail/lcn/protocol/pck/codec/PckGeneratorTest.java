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
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class PckGeneratorTest
{
    private static final int OLD_FW = 0x160000;
    private static final int NEW_FW = Var.UNIFIED_VAR_FIRMWARE;

    private static final List<Boolean> FIRST_KEY = List.of(true, false, false, false, false, false, false, false);

    @Test
    void connectionScopedCommands()
    {
        assertEquals("^ping3", PckGenerator.ping(3));
        assertEquals("!CHD", PckGenerator.setDecMode());
        assertEquals("!OM1P", PckGenerator.setOperationMode(OutputPortDimMode.STEPS200, OutputPortStatusMode.PERCENT));
        assertEquals("!OM0N", PckGenerator.setOperationMode(OutputPortDimMode.STEPS50, OutputPortStatusMode.NATIVE));
    }

    @Test
    void addressHeaderUsesPhysicalSegment()
    {
        assertEquals(">M000007!", PckGenerator.addressHeader(LcnAddress.module(0, 7), 5, true));
        assertEquals(">M000007.", PckGenerator.addressHeader(LcnAddress.module(5, 7), 5, false));
        assertEquals(">M008007.", PckGenerator.addressHeader(LcnAddress.module(8, 7), 5, false));
        assertEquals(">G003003.SK", PckGenerator.addressed(LcnAddress.group(3, 3), 0, false,
                PckGenerator.segmentCouplerScan()));
    }

    @Test
    void informationRequests()
    {
        assertEquals("SN", PckGenerator.requestSerial());
        assertEquals("NMN2", PckGenerator.requestName(1));
        assertEquals("NMK3", PckGenerator.requestComment(2));
        assertEquals("NMO4", PckGenerator.requestOemText(3));
        assertEquals("GP", PckGenerator.requestGroupMembershipStatic());
        assertEquals("GD", PckGenerator.requestGroupMembershipDynamic());
        assertEquals("LEER", PckGenerator.empty());

        assertThrows(IllegalArgumentException.class, () -> PckGenerator.requestName(2));
        assertThrows(IllegalArgumentException.class, () -> PckGenerator.requestOemText(-1));
    }

    // ---------------------------------------------------------------------
    // Outputs
    // ---------------------------------------------------------------------

    @Test
    void dimOutputPicksLegacyOrNativeCommand()
    {
        assertEquals("A1DI050123", PckGenerator.dimOutput(0, 50.0, 123));
        assertEquals("O1DI101123", PckGenerator.dimOutput(0, 50.5, 123));
        assertEquals("A4DI100000", PckGenerator.dimOutput(3, 100.0, 0));
        assertThrows(IllegalArgumentException.class, () -> PckGenerator.dimOutput(4, 10.0, 0));
    }

    @Test
    void dimmingRoundsHalfToEven()
    {
        assertEquals("A1DI000000", PckGenerator.dimOutput(0, 0.25, 0));
        assertEquals("A1DI001000", PckGenerator.dimOutput(0, 0.75, 0));
    }

    @Test
    void dimAllOutputsDependsOnFirmware()
    {
        assertEquals("OY100100100100005", PckGenerator.dimAllOutputs(50.0, 5, PckGenerator.DIM_ALL_HIGH_RES_FIRMWARE));
        assertEquals("AA005", PckGenerator.dimAllOutputs(0.0, 5, OLD_FW));
        assertEquals("AE005", PckGenerator.dimAllOutputs(100.0, 5, OLD_FW));
        assertEquals("AH050", PckGenerator.dimAllOutputs(50.0, 5, OLD_FW));
    }

    @Test
    void relativeOutputChange()
    {
        assertEquals("A1AD010", PckGenerator.relOutput(0, 10.0));
        assertEquals("O2SB021", PckGenerator.relOutput(1, -10.5));
        assertEquals("A3TA007", PckGenerator.toggleOutput(2, 7));
        assertEquals("AU007", PckGenerator.toggleAllOutputs(7));
        assertEquals("SMA2", PckGenerator.requestOutputStatus(1));
    }

    // ---------------------------------------------------------------------
    // Relays and motors
    // ---------------------------------------------------------------------

    @Test
    void relayCommands()
    {
        List<RelayStateModifier> states = List.of(
                RelayStateModifier.ON, RelayStateModifier.OFF, RelayStateModifier.TOGGLE, RelayStateModifier.NOCHANGE,
                RelayStateModifier.ON, RelayStateModifier.OFF, RelayStateModifier.TOGGLE, RelayStateModifier.NOCHANGE);
        assertEquals("R810U-10U-", PckGenerator.controlRelays(states));
        assertEquals("SMR", PckGenerator.requestRelaysStatus());

        assertThrows(IllegalArgumentException.class,
                () -> PckGenerator.controlRelays(List.of(RelayStateModifier.ON)));
    }

    @Test
    void relayTimerAcceptsOnlyOnAndOff()
    {
        List<RelayStateModifier> onOff = List.of(
                RelayStateModifier.ON, RelayStateModifier.OFF, RelayStateModifier.ON, RelayStateModifier.OFF,
                RelayStateModifier.ON, RelayStateModifier.OFF, RelayStateModifier.ON, RelayStateModifier.OFF);
        assertEquals("R8T16010101010", PckGenerator.controlRelaysTimer(30_000, onOff));

        List<RelayStateModifier> withToggle = Collections.nCopies(8, RelayStateModifier.TOGGLE);
        assertThrows(IllegalArgumentException.class, () -> PckGenerator.controlRelaysTimer(1000, withToggle));
    }

    @Test
    void motorsOnRelays()
    {
        assertEquals("R810110---", PckGenerator.controlMotorsRelays(List.of(
                MotorStateModifier.UP, MotorStateModifier.DOWN, MotorStateModifier.STOP, MotorStateModifier.NOCHANGE)));
    }

    @Test
    void motorsOnOutputs()
    {
        assertEquals("X2001228000", PckGenerator.controlMotorsOutputs(MotorStateModifier.UP, null));
        assertEquals("X2005200008", PckGenerator.controlMotorsOutputs(MotorStateModifier.DOWN, MotorReverseTime.RT600));
        assertEquals("AY000000", PckGenerator.controlMotorsOutputs(MotorStateModifier.STOP, null));
        assertEquals("JE", PckGenerator.controlMotorsOutputs(MotorStateModifier.CYCLE, null));
        assertThrows(IllegalArgumentException.class,
                () -> PckGenerator.controlMotorsOutputs(MotorStateModifier.TOGGLEDIR, null));
    }

    // ---------------------------------------------------------------------
    // Variables
    // ---------------------------------------------------------------------

    @Test
    void absoluteSetPoint()
    {
        assertEquals("X2030032200", PckGenerator.varAbs(Var.R1VARSETPOINT, 1200));
        assertEquals("X2030111156", PckGenerator.varAbs(Var.R2VARSETPOINT, 900));
        assertThrows(IllegalArgumentException.class, () -> PckGenerator.varAbs(Var.VAR1, 10));
    }

    @Test
    void updateStatusVar()
    {
        assertEquals("X2065001044", PckGenerator.updateStatusVar(Var.VAR2, 300));
        assertThrows(IllegalArgumentException.class, () -> PckGenerator.updateStatusVar(Var.THRS1, 1));
    }

    @Test
    void varResetBranchesOnFirmware()
    {
        assertEquals("Z-0014090", PckGenerator.varReset(Var.VAR1, NEW_FW));
        assertEquals("ZS30000", PckGenerator.varReset(Var.VAR1, OLD_FW));
        assertEquals("X2030096000", PckGenerator.varReset(Var.R2VARSETPOINT, OLD_FW));
        assertThrows(IllegalArgumentException.class, () -> PckGenerator.varReset(Var.VAR2, OLD_FW));
        assertThrows(IllegalArgumentException.class, () -> PckGenerator.varReset(Var.THRS1, NEW_FW));
    }

    @Test
    void varRelCoversVariablesSetPointsAndThresholds()
    {
        assertEquals("ZA10", PckGenerator.varRel(Var.VAR1, RelVarRef.CURRENT, 10, OLD_FW));
        assertEquals("ZS10", PckGenerator.varRel(Var.VAR1, RelVarRef.CURRENT, -10, OLD_FW));
        assertEquals("Z-0057", PckGenerator.varRel(Var.VAR5, RelVarRef.CURRENT, -7, NEW_FW));
        assertEquals("REASP+5", PckGenerator.varRel(Var.R1VARSETPOINT, RelVarRef.PROG, 5, NEW_FW));
        assertEquals("SSR0100AR23", PckGenerator.varRel(Var.THRS2_3, RelVarRef.CURRENT, 100, NEW_FW));
        assertEquals("SSE0005S00100", PckGenerator.varRel(Var.THRS3, RelVarRef.PROG, -5, OLD_FW));

        assertThrows(IllegalArgumentException.class,
                () -> PckGenerator.varRel(Var.THRS2_1, RelVarRef.CURRENT, 1, OLD_FW));
        assertThrows(IllegalArgumentException.class,
                () -> PckGenerator.varRel(Var.S0INPUT1, RelVarRef.CURRENT, 1, NEW_FW));
    }

    @Test
    void varStatusRequestOnUnifiedFirmware()
    {
        assertEquals("MWT003", PckGenerator.requestVarStatus(Var.VAR3, NEW_FW));
        assertEquals("MWS002", PckGenerator.requestVarStatus(Var.R2VARSETPOINT, NEW_FW));
        assertEquals("SE003", PckGenerator.requestVarStatus(Var.THRS3_2, NEW_FW));
        assertEquals("MWC001", PckGenerator.requestVarStatus(Var.S0INPUT1, NEW_FW));
        assertThrows(IllegalArgumentException.class, () -> PckGenerator.requestVarStatus(Var.UNKNOWN, NEW_FW));
    }

    @Test
    void varStatusRequestOnLegacyFirmware()
    {
        assertEquals("MWV", PckGenerator.requestVarStatus(Var.VAR1, OLD_FW));
        assertEquals("MWTA", PckGenerator.requestVarStatus(Var.VAR2, OLD_FW));
        assertEquals("MWSB", PckGenerator.requestVarStatus(Var.R2VARSETPOINT, OLD_FW));
        assertEquals("SL1", PckGenerator.requestVarStatus(Var.THRS4, OLD_FW));
        assertThrows(IllegalArgumentException.class, () -> PckGenerator.requestVarStatus(Var.VAR4, OLD_FW));
    }

    @Test
    void lockRegulator()
    {
        assertEquals("REBXS", PckGenerator.lockRegulator(1, true));
        assertEquals("REAXA", PckGenerator.lockRegulator(0, false));
    }

    // ---------------------------------------------------------------------
    // LEDs, keys
    // ---------------------------------------------------------------------

    @Test
    void ledCommands()
    {
        assertEquals("LA001B", PckGenerator.controlLed(0, LedStatus.BLINK));
        assertEquals("SMT", PckGenerator.requestLedsAndLogicOps());
        assertThrows(IllegalArgumentException.class, () -> PckGenerator.controlLed(12, LedStatus.ON));
    }

    @Test
    void sendKeysOmitsTableDWhenNotSent()
    {
        assertEquals("TSK-L10000000", PckGenerator.sendKeys(List.of(
                SendKeyCommand.HIT, SendKeyCommand.DONTSEND, SendKeyCommand.MAKE, SendKeyCommand.DONTSEND), FIRST_KEY));
        assertEquals("TSK-LO10000000", PckGenerator.sendKeys(List.of(
                SendKeyCommand.HIT, SendKeyCommand.DONTSEND, SendKeyCommand.MAKE, SendKeyCommand.BREAK), FIRST_KEY));
    }

    @Test
    void deferredKeysAndTemporaryLocks()
    {
        assertEquals("TVB005S10000000", PckGenerator.sendKeysHitDeferred(1, 5, DelayUnit.SECONDS, FIRST_KEY));
        assertEquals("TXZA010M10000000", PckGenerator.lockKeysTabATemporary(10, DelayUnit.MINUTES, FIRST_KEY));

        assertThrows(IllegalArgumentException.class,
                () -> PckGenerator.sendKeysHitDeferred(0, 61, DelayUnit.SECONDS, FIRST_KEY));
        assertThrows(IllegalArgumentException.class,
                () -> PckGenerator.lockKeysTabATemporary(0, DelayUnit.HOURS, FIRST_KEY));
    }

    @Test
    void lockKeys()
    {
        List<KeyLockStateModifier> states = List.of(
                KeyLockStateModifier.ON, KeyLockStateModifier.OFF, KeyLockStateModifier.TOGGLE, KeyLockStateModifier.NOCHANGE,
                KeyLockStateModifier.NOCHANGE, KeyLockStateModifier.NOCHANGE, KeyLockStateModifier.NOCHANGE, KeyLockStateModifier.NOCHANGE);
        assertEquals("TXC10U-----", PckGenerator.lockKeys(2, states));
        assertEquals("STX", PckGenerator.requestKeyLockStatus());
    }

    // ---------------------------------------------------------------------
    // Dynamic text, scenes, misc
    // ---------------------------------------------------------------------

    @Test
    void dynTextPartIsLimitedToTwelveBytes()
    {
        assertEquals("GTDT11hello", PckGenerator.dynTextPart(0, 0, "hello"));
        assertEquals("GTDT45ääääää", PckGenerator.dynTextPart(3, 4, "ääääää"));

        assertThrows(IllegalArgumentException.class, () -> PckGenerator.dynTextPart(0, 0, "thirteen char"));
        assertThrows(IllegalArgumentException.class,
                () -> PckGenerator.dynTextPart(0, 0, "äääääää"));
        assertThrows(IllegalArgumentException.class, () -> PckGenerator.dynTextPart(4, 0, "x"));
    }

    @Test
    void sceneCommands()
    {
        assertEquals("SZW003", PckGenerator.changeSceneRegister(3));
        assertEquals("SZD000001100000200010",
                PckGenerator.storeSceneOutputsDirect(0, 1, List.of(50.0, 100.0), List.of(0, 10)));
        assertEquals("SZA5002005", PckGenerator.activateSceneOutput(2, Set.of(0, 3), 5));
        assertEquals("SZS3002", PckGenerator.storeSceneOutput(2, Set.of(0, 1), null));
        assertEquals("SZA000110000001", PckGenerator.activateSceneRelay(1, Set.of(0, 7)));
        assertEquals("SZR001002", PckGenerator.requestStatusScene(1, 2));

        assertThrows(IllegalArgumentException.class, () -> PckGenerator.activateSceneOutput(1, Set.of(), null));
        assertThrows(IllegalArgumentException.class,
                () -> PckGenerator.storeSceneOutputsDirect(0, 1, List.of(50.0), List.of(0)));
    }

    @Test
    void beep()
    {
        assertEquals("PIS003", PckGenerator.beep(BeepSound.SPECIAL, 3));
        assertThrows(IllegalArgumentException.class, () -> PckGenerator.beep(BeepSound.NORMAL, 16));
    }

    @Test
    void numericFieldsUseAsciiDigitsRegardlessOfDefaultLocale()
    {
        Locale saved = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("ar-EG"));
        try {
            assertEquals("A1DI050123", PckGenerator.dimOutput(0, 50.0, 123));
            assertEquals(">M000010!", PckGenerator.addressHeader(LcnAddress.module(0, 10), 7, true));
            assertEquals("OY100100100100005", PckGenerator.dimAllOutputs(50.0, 5, PckGenerator.DIM_ALL_HIGH_RES_FIRMWARE));
            assertEquals("Z-0014090", PckGenerator.varReset(Var.VAR1, NEW_FW));
            assertEquals("M000007", LcnAddress.module(0, 7).toString());
        } finally {
            Locale.setDefault(saved);
        }
    }
}
