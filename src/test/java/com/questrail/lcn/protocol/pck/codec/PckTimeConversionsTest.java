package com.questrail.lcn.protocol.pck.codec;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class PckTimeConversionsTest
{
    @Test
    void rampValuesFollowTableBelowSixSeconds()
    {
        assertEquals(0, PckTimeConversions.timeToRampValue(0));
        assertEquals(3, PckTimeConversions.timeToRampValue(999));
        assertEquals(4, PckTimeConversions.timeToRampValue(1000));
        assertEquals(9, PckTimeConversions.timeToRampValue(5999));
    }

    @Test
    void rampValuesAreTwoSecondStepsAboveSixSeconds()
    {
        assertEquals(10, PckTimeConversions.timeToRampValue(6000));
        assertEquals(12, PckTimeConversions.timeToRampValue(10_000));
        assertEquals(250, PckTimeConversions.timeToRampValue(1_000_000));
    }

    @Test
    void rampValueToTime()
    {
        assertEquals(1000, PckTimeConversions.rampValueToTime(4));
        assertEquals(6000, PckTimeConversions.rampValueToTime(10));
        assertEquals(486_000, PckTimeConversions.rampValueToTime(250));
        assertThrows(IllegalArgumentException.class, () -> PckTimeConversions.rampValueToTime(251));
    }

    @Test
    void nativeValueBounds()
    {
        assertEquals(0, PckTimeConversions.timeToNativeValue(0));
        assertEquals(255, PckTimeConversions.timeToNativeValue(240_960));
        assertEquals(160, PckTimeConversions.timeToNativeValue(30_000));
        assertEquals(240_960, PckTimeConversions.nativeValueToTime(255));
        assertEquals(0, PckTimeConversions.nativeValueToTime(0));

        assertThrows(IllegalArgumentException.class, () -> PckTimeConversions.timeToNativeValue(240_961));
        assertThrows(IllegalArgumentException.class, () -> PckTimeConversions.timeToNativeValue(-1));
        assertThrows(IllegalArgumentException.class, () -> PckTimeConversions.nativeValueToTime(256));
    }
}
