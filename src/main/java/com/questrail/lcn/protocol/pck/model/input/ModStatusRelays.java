package com.questrail.lcn.protocol.pck.model.input;

import com.questrail.lcn.protocol.pck.model.LcnAddress;

import java.util.List;
import java.util.Objects;

/**
 * Relay states, relay 1 first.
 */
public record ModStatusRelays(LcnAddress source, List<Boolean> states) implements ModInput {
    public ModStatusRelays {
        Objects.requireNonNull(source, "source");
        states = List.copyOf(states);
    }

    @Override
    public ModStatusRelays withSource(LcnAddress source) {
        return new ModStatusRelays(source, states);
    }
}
