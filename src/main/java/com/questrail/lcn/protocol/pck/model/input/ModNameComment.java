package com.questrail.lcn.protocol.pck.model.input;

import com.questrail.lcn.protocol.pck.model.LcnAddress;

import java.util.Map;
import java.util.Objects;

/**
 * One 12-character block of a module's name ({@code N}), comment ({@code K})
 * or OEM text ({@code O}). {@code blockId} is zero-based.
 */
public record ModNameComment(LcnAddress source, char command, int blockId, String text)
        implements ModInput {

    public ModNameComment {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(text, "text");
    }

    @Override
    public ModNameComment withSource(LcnAddress source) {
        return new ModNameComment(source, command, blockId, text);
    }

    @Override
    public Map<String, Object> correlationFields() {
        return Map.of("command", command, "blockId", blockId);
    }
}
