package com.questrail.lcn.protocol.pck.model.input;

import com.questrail.lcn.protocol.pck.model.LcnAddress;

import java.util.Objects;

/**
 * Acknowledge of a command. {@code code == -1} is positive, any other value is
 * the module's error code.
 */
public record ModAck(LcnAddress source, int code) implements ModInput {

    public static final int POSITIVE = -1;

    public ModAck {
        Objects.requireNonNull(source, "source");
    }

    public boolean isPositive() {
        return code == POSITIVE;
    }

    @Override
    public ModAck withSource(LcnAddress source) {
        return new ModAck(source, code);
    }
}
