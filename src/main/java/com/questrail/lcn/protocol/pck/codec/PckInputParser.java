package com.questrail.lcn.protocol.pck.codec;

import com.questrail.lcn.protocol.pck.model.input.PckInput;

import java.util.List;

/**
 * PckInputParser
 * -----------------------------------------------------------------------------
 * Line-level decoder for inbound PCK text.
 *
 * <p>The parser is invoked with exactly one line, already stripped of its
 * terminator by the transport. It is responsible only for recognizing the
 * message shape and extracting typed fields.</p>
 *
 * <p>The parser is <strong>not</strong> responsible for:</p>
 * <ul>
 *   <li>Translating physical into logical addresses</li>
 *   <li>Correlating responses with requests</li>
 *   <li>Reacting to login prompts or bus state</li>
 * </ul>
 *
 * <p>Unrecognized lines are not failures: they decode to
 * {@link com.questrail.lcn.protocol.pck.model.input.Unknown}.</p>
 */
public interface PckInputParser
{
    /**
     * Decode one inbound line.
     *
     * @param line line text without terminator
     * @return one or more inputs; never empty
     */
    List<PckInput> parse(String line);
}
