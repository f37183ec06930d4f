package com.questrail.lcn.protocol.pck.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Text encoding of PCK lines.
 *
 * <p>The gateway speaks UTF-8. Bus text relayed from some visualization
 * software arrives in windows-1250 instead; such lines are recovered with
 * that code page and reported at warn level.</p>
 */
public final class PckCharsets
{
    private static final Logger log = LoggerFactory.getLogger(PckCharsets.class);

    public static final Charset FALLBACK = Charset.forName("windows-1250");

    private PckCharsets() {}

    public static String decode(byte[] bytes)
    {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return decoder.decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException e) {
            String recovered = new String(bytes, FALLBACK);
            log.warn("Incorrect PCK encoding detected; recovered using {}: {}", FALLBACK.name(), recovered);
            return recovered;
        }
    }

    public static byte[] encode(String line)
    {
        return line.getBytes(StandardCharsets.UTF_8);
    }
}
