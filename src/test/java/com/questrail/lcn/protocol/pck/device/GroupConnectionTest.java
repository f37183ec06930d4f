package com.questrail.lcn.protocol.pck.device;

import com.questrail.lcn.protocol.pck.PckConnectionFixture;
import com.questrail.lcn.protocol.pck.model.LcnAddress;
import com.questrail.lcn.protocol.pck.model.RelVarRef;
import com.questrail.lcn.protocol.pck.model.RelayStateModifier;
import com.questrail.lcn.protocol.pck.model.Var;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class GroupConnectionTest
{
    private PckConnectionFixture fx;
    private GroupConnection group;

    @BeforeEach
    void setUp()
    {
        fx = new PckConnectionFixture();
        fx.ready(7);
        group = fx.manager.getGroupConnection(LcnAddress.group(0, 5));
    }

    @Test
    void groupsAreNotCachedAndUseLogicalAddress()
    {
        assertEquals(LcnAddress.group(7, 5), group.address());
        assertNotSame(group, fx.manager.getGroupConnection(LcnAddress.group(7, 5)));
        assertThrows(IllegalArgumentException.class, () -> new GroupConnection(fx.manager, LcnAddress.module(7, 5)));
    }

    @Test
    void commandsAreNeverAcknowledged()
    {
        group.controlRelays(Collections.nCopies(8, RelayStateModifier.OFF));

        assertEquals(List.of(">G000005.R800000000"), fx.busLines());
    }

    @Test
    void varAbsSendsUnifiedAndLegacyEncodings()
    {
        group.varAbs(Var.VAR1, 100);

        assertEquals(List.of(
                ">G000005.Z-0014090", ">G000005.ZA100",
                ">G000005.ZS30000", ">G000005.ZA100"), fx.busLines());
    }

    @Test
    void identicalLegacyEncodingIsNotRepeated()
    {
        group.varRel(Var.R1VARSETPOINT, RelVarRef.CURRENT, 5);
        group.varReset(Var.R2VARSETPOINT);

        assertEquals(List.of(">G000005.REASA+5", ">G000005.X2030096000"), fx.busLines());
    }

    @Test
    void missingLegacyEncodingIsSkipped()
    {
        group.varReset(Var.VAR2);

        assertEquals(List.of(">G000005.Z-0024090"), fx.busLines());
    }

    @Test
    void thresholdsGetLegacyRelativeChange()
    {
        group.varRel(Var.THRS2, RelVarRef.PROG, 3);

        assertEquals(List.of(">G000005.SSE0003AR12", ">G000005.SSE0003A01000"), fx.busLines());
    }

    @Test
    void varAbsOnGroupFourUpdatesStatus()
    {
        GroupConnection four = fx.manager.getGroupConnection(LcnAddress.group(0, 4));

        four.varAbs(Var.VAR3, 50);

        assertEquals(List.of(">G000004.X2066000050"), fx.busLines());
    }

    @Test
    void nothingIsSentWhileBusIsDown()
    {
        fx.endpoint.inject("$io:#LCN:disconnected");
        fx.endpoint.clear();

        group.beep(com.questrail.lcn.protocol.pck.model.BeepSound.NORMAL, 1);

        assertTrue(fx.busLines().isEmpty());
    }
}
