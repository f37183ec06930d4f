package com.questrail.lcn.protocol.pck.model.input;

import com.questrail.lcn.protocol.pck.model.LcnAddress;

import java.util.List;
import java.util.Objects;

/**
 * Binary sensor states, sensor 1 first.
 */
public record ModStatusBinSensors(LcnAddress source, List<Boolean> states) implements ModInput {
    public ModStatusBinSensors {
        Objects.requireNonNull(source, "source");
        states = List.copyOf(states);
    }

    @Override
    public ModStatusBinSensors withSource(LcnAddress source) {
        return new ModStatusBinSensors(source, states);
    }
}
