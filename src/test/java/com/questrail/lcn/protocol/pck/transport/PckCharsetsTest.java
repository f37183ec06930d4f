package com.questrail.lcn.protocol.pck.transport;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

final class PckCharsetsTest
{
    @Test
    void decodesUtf8()
    {
        byte[] bytes = "=M000010.N1Küche".getBytes(StandardCharsets.UTF_8);
        assertEquals("=M000010.N1Küche", PckCharsets.decode(bytes));
    }

    @Test
    void recoversInvalidUtf8WithFallbackCodePage()
    {
        // 0xFC is u-umlaut in windows-1250 and never valid on its own in UTF-8.
        byte[] bytes = {'K', (byte) 0xFC, 'c', 'h', 'e'};
        assertEquals("Küche", PckCharsets.decode(bytes));
    }

    @Test
    void encodesUtf8()
    {
        assertArrayEquals(new byte[] {'K', (byte) 0xC3, (byte) 0xBC}, PckCharsets.encode("Kü"));
    }
}
